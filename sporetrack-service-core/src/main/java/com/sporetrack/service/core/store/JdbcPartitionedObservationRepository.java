package com.sporetrack.service.core.store;

import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SegmentHandle;
import com.sporetrack.core.model.SeriesCursor;
import com.sporetrack.core.model.SeriesSummary;
import com.sporetrack.core.model.SyncState;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPartitionedObservationRepository implements PartitionedObservationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPartitionedObservationRepository.class);

    static final String PARENT_TABLE = "observations_partitioned";

    // Replicas are stored as the state they converge to.
    private static final RowMapper<Observation> MAPPER = ObservationColumns.rowMapper(false, SyncState.IN_SYNC);

    private static final String UPDATE_SQL = "update " + PARENT_TABLE + " set segment_id = :segment_id, "
            + ObservationColumns.MUTABLE_ASSIGNMENTS
            + " where observation_id = :observation_id and program_id = :program_id";

    private static final String INSERT_SQL = "insert into " + PARENT_TABLE + "(segment_id, "
            + ObservationColumns.SHARED + ") values (:segment_id, " + ObservationColumns.SHARED_PARAMS
            + ") on conflict do nothing";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcPartitionedObservationRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    static String segmentTable(long segmentId) {
        if (segmentId == SegmentHandle.DEFAULT_SEGMENT_ID) {
            return PARENT_TABLE + "_default";
        }
        if (segmentId < 0) {
            throw new IllegalArgumentException("Invalid segment id: " + segmentId);
        }
        return PARENT_TABLE + "_s" + segmentId;
    }

    @Override
    public void provisionSegment(long segmentId) {
        String table = segmentTable(segmentId);
        String sql = String.format(
                "CREATE TABLE IF NOT EXISTS %s PARTITION OF %s FOR VALUES IN (%d)", table, PARENT_TABLE, segmentId);
        try {
            if (log.isDebugEnabled()) log.debug("Ensuring segment table: {}", table);
            ddl().execute(sql);
        } catch (DataAccessException ex) {
            if (isAlreadyProvisioned(ex)) {
                log.debug("Segment table {} provisioned concurrently", table);
                return;
            }
            throw ex;
        }
    }

    @Override
    public boolean dropSegmentIfEmpty(long segmentId) {
        if (segmentId == SegmentHandle.DEFAULT_SEGMENT_ID) {
            throw new IllegalArgumentException("The default segment is never dropped");
        }
        String table = segmentTable(segmentId);
        Boolean exists = ddl().queryForObject("SELECT to_regclass(?) IS NOT NULL", Boolean.class, table);
        if (!Boolean.TRUE.equals(exists)) {
            return true;
        }
        if (isAttached(table)) {
            // CONCURRENTLY waits out every transaction that can still write the segment; it must run outside a
            // transaction and keeps sibling segments unblocked.
            ddl().execute(String.format("ALTER TABLE %s DETACH PARTITION %s CONCURRENTLY", PARENT_TABLE, table));
        }
        try {
            Long remaining = ddl().queryForObject("SELECT count(*) FROM " + table, Long.class);
            if (remaining != null && remaining > 0) {
                attach(table, segmentId);
                log.info("Segment table {} received {} rows while retiring; re-attached", table, remaining);
                return false;
            }
            ddl().execute("DROP TABLE " + table);
        } catch (DataAccessException ex) {
            try {
                if (!isAttached(table)) {
                    attach(table, segmentId);
                }
            } catch (DataAccessException reattach) {
                ex.addSuppressed(reattach);
            }
            throw ex;
        }
        log.info("Dropped segment table {}", table);
        return true;
    }

    private boolean isAttached(String table) {
        Boolean attached = ddl().queryForObject(
                """
                SELECT EXISTS (
                  SELECT 1 FROM pg_inherits i
                  JOIN pg_class c ON c.oid = i.inhrelid
                  JOIN pg_class p ON p.oid = i.inhparent
                  WHERE p.relname = ? AND c.relname = ?)
                """,
                Boolean.class,
                PARENT_TABLE,
                table);
        return Boolean.TRUE.equals(attached);
    }

    private void attach(String table, long segmentId) {
        ddl().execute(String.format(
                "ALTER TABLE %s ATTACH PARTITION %s FOR VALUES IN (%d)", PARENT_TABLE, table, segmentId));
    }

    @Override
    public UpsertResult upsert(long segmentId, Observation replica) {
        MapSqlParameterSource params = ObservationColumns.params(replica).addValue("segment_id", segmentId);
        if (jdbc.update(UPDATE_SQL, params) > 0) {
            return UpsertResult.UPDATED;
        }
        if (jdbc.update(INSERT_SQL, params) > 0) {
            return UpsertResult.INSERTED;
        }
        // Lost an insert race for the same identity; the row exists now.
        jdbc.update(UPDATE_SQL, params);
        return UpsertResult.UPDATED;
    }

    @Override
    public boolean delete(UUID observationId, UUID programId) {
        return jdbc.update(
                        "delete from " + PARENT_TABLE
                                + " where observation_id = :observation_id and program_id = :program_id",
                        new MapSqlParameterSource()
                                .addValue("observation_id", observationId)
                                .addValue("program_id", programId))
                > 0;
    }

    @Override
    public Optional<PartitionedRow> find(UUID observationId, UUID programId) {
        return jdbc
                .query(
                        "select * from " + PARENT_TABLE
                                + " where observation_id = :observation_id and program_id = :program_id",
                        new MapSqlParameterSource()
                                .addValue("observation_id", observationId)
                                .addValue("program_id", programId),
                        (rs, rowNum) -> new PartitionedRow(rs.getLong("segment_id"), MAPPER.mapRow(rs, rowNum)))
                .stream()
                .findFirst();
    }

    @Override
    public List<Observation> findSeriesPage(
            UUID tenantId,
            UUID programId,
            String seriesCode,
            Collection<Long> segmentIds,
            SeriesCursor after,
            int limit) {
        if (segmentIds.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenant_id", tenantId)
                .addValue("program_id", programId)
                .addValue("series_code", seriesCode)
                .addValue("segment_ids", segmentIds)
                .addValue("limit", limit);
        String cursorFilter = "";
        if (after != null) {
            cursorFilter = " and (phase_day, observation_id) > (:after_day, :after_id)";
            params.addValue("after_day", after.phaseDay()).addValue("after_id", after.observationId());
        }
        return jdbc.query(
                """
                select * from %s
                where segment_id in (:segment_ids)
                  and tenant_id = :tenant_id and program_id = :program_id and series_code = :series_code%s
                order by phase_day, observation_id
                limit :limit
                """
                        .formatted(PARENT_TABLE, cursorFilter),
                params,
                MAPPER);
    }

    @Override
    public List<SeriesSummary> listSeries(UUID tenantId) {
        return jdbc.query(
                """
                select program_id, series_code, min(reading_kind) as reading_kind,
                       count(*) as observation_count, max(phase_day) as last_phase_day
                from %s
                where tenant_id = :tenant_id
                group by program_id, series_code
                order by program_id, series_code
                """
                        .formatted(PARENT_TABLE),
                new MapSqlParameterSource("tenant_id", tenantId),
                (rs, rowNum) -> new SeriesSummary(
                        (UUID) rs.getObject("program_id"),
                        rs.getString("series_code"),
                        ReadingKind.valueOf(rs.getString("reading_kind")),
                        rs.getLong("observation_count"),
                        rs.getInt("last_phase_day")));
    }

    @Override
    public long countRows(long segmentId) {
        Long count = jdbc.queryForObject(
                "select count(*) from " + PARENT_TABLE + " where segment_id = :segment_id",
                new MapSqlParameterSource("segment_id", segmentId),
                Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public List<RoutingKey> routingKeysIn(long segmentId) {
        return jdbc.query(
                "select distinct tenant_id, program_id from " + PARENT_TABLE + " where segment_id = :segment_id",
                new MapSqlParameterSource("segment_id", segmentId),
                (rs, rowNum) -> new RoutingKey((UUID) rs.getObject("tenant_id"), (UUID) rs.getObject("program_id")));
    }

    @Override
    public int reassign(RoutingKey key, long fromSegment, long toSegment, int limit) {
        return jdbc.update(
                """
                update %1$s set segment_id = :to_segment
                where segment_id = :from_segment
                  and (observation_id, program_id) in (
                    select observation_id, program_id from %1$s
                    where segment_id = :from_segment and tenant_id = :tenant_id and program_id = :program_id
                    limit :limit)
                """
                        .formatted(PARENT_TABLE),
                new MapSqlParameterSource()
                        .addValue("to_segment", toSegment)
                        .addValue("from_segment", fromSegment)
                        .addValue("tenant_id", key.tenantId())
                        .addValue("program_id", key.programId())
                        .addValue("limit", limit));
    }

    @Override
    public void analyze(long segmentId) {
        ddl().execute("ANALYZE " + segmentTable(segmentId));
    }

    private JdbcOperations ddl() {
        return jdbc.getJdbcOperations();
    }

    private static boolean isAlreadyProvisioned(DataAccessException ex) {
        String message = ex.getMostSpecificCause().getMessage();
        return message != null && (message.contains("already exists") || message.contains("would overlap partition"));
    }
}
