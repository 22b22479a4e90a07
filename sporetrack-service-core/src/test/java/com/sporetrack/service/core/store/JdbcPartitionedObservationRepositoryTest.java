package com.sporetrack.service.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sporetrack.core.model.Observation;
import com.sporetrack.service.core.store.PartitionedObservationRepository.UpsertResult;
import com.sporetrack.service.core.testing.Observations;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcPartitionedObservationRepositoryTest {

    private final NamedParameterJdbcTemplate jdbc = Mockito.mock(NamedParameterJdbcTemplate.class);
    private final JdbcOperations ddl = Mockito.mock(JdbcOperations.class);
    private final JdbcPartitionedObservationRepository repository = new JdbcPartitionedObservationRepository(jdbc);
    private final Observation replica = Observations.growth(
            UUID.randomUUID(), UUID.randomUUID(), "P001", 1, Instant.parse("2025-02-01T10:00:00Z"), 4.0);

    @Test
    void segmentTablesAreNamedAfterTheirId() {
        assertThat(JdbcPartitionedObservationRepository.segmentTable(0)).isEqualTo("observations_partitioned_default");
        assertThat(JdbcPartitionedObservationRepository.segmentTable(17)).isEqualTo("observations_partitioned_s17");
        assertThatThrownBy(() -> JdbcPartitionedObservationRepository.segmentTable(-3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void upsertUpdatesBeforeInserting() {
        Mockito.when(jdbc.update(ArgumentMatchers.startsWith("update"), ArgumentMatchers.any(SqlParameterSource.class)))
                .thenReturn(1);

        assertThat(repository.upsert(5, replica)).isEqualTo(UpsertResult.UPDATED);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        Mockito.verify(jdbc).update(sql.capture(), ArgumentMatchers.any(SqlParameterSource.class));
        assertThat(sql.getValue()).contains("segment_id = :segment_id").doesNotContain("observed_at =");
    }

    @Test
    void upsertInsertsNewIdentity() {
        Mockito.when(jdbc.update(ArgumentMatchers.startsWith("update"), ArgumentMatchers.any(SqlParameterSource.class)))
                .thenReturn(0);
        Mockito.when(jdbc.update(ArgumentMatchers.startsWith("insert"), ArgumentMatchers.any(SqlParameterSource.class)))
                .thenReturn(1);

        assertThat(repository.upsert(5, replica)).isEqualTo(UpsertResult.INSERTED);
    }

    @Test
    void upsertRetriesUpdateAfterLosingInsertRace() {
        Mockito.when(jdbc.update(ArgumentMatchers.startsWith("update"), ArgumentMatchers.any(SqlParameterSource.class)))
                .thenReturn(0, 1);
        Mockito.when(jdbc.update(ArgumentMatchers.startsWith("insert"), ArgumentMatchers.any(SqlParameterSource.class)))
                .thenReturn(0);

        assertThat(repository.upsert(5, replica)).isEqualTo(UpsertResult.UPDATED);
        Mockito.verify(jdbc, Mockito.times(2))
                .update(ArgumentMatchers.startsWith("update"), ArgumentMatchers.any(SqlParameterSource.class));
    }

    @Test
    void concurrentProvisioningCountsAsSuccess() {
        Mockito.when(jdbc.getJdbcOperations()).thenReturn(ddl);
        Mockito.doThrow(new BadSqlGrammarException(
                        "create", "CREATE TABLE", new SQLException("relation \"observations_partitioned_s4\" already exists")))
                .when(ddl)
                .execute(ArgumentMatchers.anyString());

        repository.provisionSegment(4);

        Mockito.verify(ddl)
                .execute("CREATE TABLE IF NOT EXISTS observations_partitioned_s4 PARTITION OF observations_partitioned"
                        + " FOR VALUES IN (4)");
    }

    @Test
    void otherProvisioningErrorsPropagate() {
        Mockito.when(jdbc.getJdbcOperations()).thenReturn(ddl);
        Mockito.doThrow(new BadSqlGrammarException("create", "CREATE TABLE", new SQLException("permission denied")))
                .when(ddl)
                .execute(ArgumentMatchers.anyString());

        assertThatThrownBy(() -> repository.provisionSegment(4)).isInstanceOf(BadSqlGrammarException.class);
    }

    @Test
    void defaultSegmentIsNeverDropped() {
        assertThatThrownBy(() -> repository.dropSegmentIfEmpty(0)).isInstanceOf(IllegalArgumentException.class);
        Mockito.verifyNoInteractions(jdbc);
    }

    @Test
    void segmentThatReceivedRowsIsReattachedInsteadOfDropped() {
        stubAttachedSegment(4, 1L);

        assertThat(repository.dropSegmentIfEmpty(4)).isFalse();

        Mockito.verify(ddl)
                .execute("ALTER TABLE observations_partitioned DETACH PARTITION observations_partitioned_s4 CONCURRENTLY");
        Mockito.verify(ddl)
                .execute("ALTER TABLE observations_partitioned ATTACH PARTITION observations_partitioned_s4"
                        + " FOR VALUES IN (4)");
        Mockito.verify(ddl, Mockito.never()).execute(ArgumentMatchers.startsWith("DROP TABLE"));
    }

    @Test
    void emptySegmentIsDetachedThenDropped() {
        stubAttachedSegment(4, 0L);

        assertThat(repository.dropSegmentIfEmpty(4)).isTrue();

        InOrder order = Mockito.inOrder(ddl);
        order.verify(ddl).execute(ArgumentMatchers.contains("DETACH PARTITION observations_partitioned_s4"));
        order.verify(ddl).queryForObject("SELECT count(*) FROM observations_partitioned_s4", Long.class);
        order.verify(ddl).execute("DROP TABLE observations_partitioned_s4");
    }

    private void stubAttachedSegment(long segmentId, long rowsAfterDetach) {
        String table = JdbcPartitionedObservationRepository.segmentTable(segmentId);
        Mockito.when(jdbc.getJdbcOperations()).thenReturn(ddl);
        Mockito.when(ddl.queryForObject(
                        ArgumentMatchers.startsWith("SELECT to_regclass"),
                        ArgumentMatchers.eq(Boolean.class),
                        ArgumentMatchers.<Object>any()))
                .thenReturn(Boolean.TRUE);
        Mockito.when(ddl.queryForObject(
                        ArgumentMatchers.contains("pg_inherits"),
                        ArgumentMatchers.eq(Boolean.class),
                        ArgumentMatchers.<Object>any(),
                        ArgumentMatchers.<Object>any()))
                .thenReturn(Boolean.TRUE);
        Mockito.when(ddl.queryForObject("SELECT count(*) FROM " + table, Long.class))
                .thenReturn(rowsAfterDetach);
    }

    @Test
    void emptySegmentListShortCircuitsSeriesRead() {
        assertThat(repository.findSeriesPage(
                        replica.tenantId(), replica.programId(), "P001", List.of(), null, 10))
                .isEmpty();
        Mockito.verifyNoInteractions(jdbc);
    }
}
