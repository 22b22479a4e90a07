package com.sporetrack.service.core.store;

import com.sporetrack.core.model.DerivationStatus;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.SyncState;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcCanonicalObservationRepository implements CanonicalObservationRepository {

    private static final RowMapper<Observation> MAPPER = ObservationColumns.rowMapper(true, null);

    private static final String INSERT_SQL = "insert into observations(" + ObservationColumns.SHARED
            + ", sync_state) values (" + ObservationColumns.SHARED_PARAMS + ", :sync_state)";

    private static final String UPDATE_SQL = "update observations set " + ObservationColumns.MUTABLE_ASSIGNMENTS
            + ", sync_state = :sync_state where observation_id = :observation_id and tenant_id = :tenant_id";

    private static final String SERIES_FILTER =
            "tenant_id = :tenant_id and program_id = :program_id and series_code = :series_code";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcCanonicalObservationRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void insert(Observation observation) {
        jdbc.update(INSERT_SQL, ObservationColumns.params(observation));
    }

    @Override
    public void update(Observation observation) {
        jdbc.update(UPDATE_SQL, ObservationColumns.params(observation));
    }

    @Override
    public boolean delete(UUID tenantId, UUID observationId) {
        return jdbc.update(
                        "delete from observations where observation_id = :observation_id and tenant_id = :tenant_id",
                        new MapSqlParameterSource()
                                .addValue("observation_id", observationId)
                                .addValue("tenant_id", tenantId))
                > 0;
    }

    @Override
    public Optional<Observation> findById(UUID tenantId, UUID observationId) {
        return jdbc
                .query(
                        "select * from observations where observation_id = :observation_id and tenant_id = :tenant_id",
                        new MapSqlParameterSource()
                                .addValue("observation_id", observationId)
                                .addValue("tenant_id", tenantId),
                        MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Observation> findByPhaseDay(UUID tenantId, UUID programId, String seriesCode, int phaseDay) {
        return jdbc
                .query(
                        """
                        select * from observations
                        where %s and phase_day = :phase_day
                        order by observed_at desc, observation_id desc
                        limit 1
                        """
                                .formatted(SERIES_FILTER),
                        series(tenantId, programId, seriesCode).addValue("phase_day", phaseDay),
                        MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Instant> findSeriesStart(UUID tenantId, UUID programId, String seriesCode, Instant atOrBefore) {
        Timestamp start = jdbc.queryForObject(
                "select min(observed_at) from observations where " + SERIES_FILTER + " and observed_at <= :at",
                series(tenantId, programId, seriesCode).addValue("at", Timestamp.from(atOrBefore)),
                Timestamp.class);
        return Optional.ofNullable(start).map(Timestamp::toInstant);
    }

    @Override
    public List<Observation> findSeries(UUID tenantId, UUID programId, String seriesCode) {
        return jdbc.query(
                "select * from observations where " + SERIES_FILTER
                        + " order by phase_day, observed_at, observation_id",
                series(tenantId, programId, seriesCode),
                MAPPER);
    }

    @Override
    public List<Observation> findAfter(CanonicalPosition after, int limit) {
        if (after == null) {
            return jdbc.query(
                    "select * from observations order by observed_at, observation_id limit :limit",
                    new MapSqlParameterSource("limit", limit),
                    MAPPER);
        }
        return jdbc.query(
                """
                select * from observations
                where (observed_at, observation_id) > (:observed_at, :observation_id)
                order by observed_at, observation_id
                limit :limit
                """,
                new MapSqlParameterSource()
                        .addValue("observed_at", Timestamp.from(after.observedAt()))
                        .addValue("observation_id", after.observationId())
                        .addValue("limit", limit),
                MAPPER);
    }

    @Override
    public List<Observation> findReprocessable(int limit) {
        return jdbc.query(
                """
                select * from observations
                where derivation_status = :status and raw_reading is not null
                order by observed_at, observation_id
                limit :limit
                """,
                new MapSqlParameterSource()
                        .addValue("status", DerivationStatus.PENDING_REPROCESSING.name())
                        .addValue("limit", limit),
                MAPPER);
    }

    @Override
    public List<Observation> findBySyncState(SyncState state, int limit) {
        return jdbc.query(
                "select * from observations where sync_state = :state order by observed_at limit :limit",
                new MapSqlParameterSource().addValue("state", state.name()).addValue("limit", limit),
                MAPPER);
    }

    @Override
    public long countBySyncState(SyncState state) {
        Long count = jdbc.queryForObject(
                "select count(*) from observations where sync_state = :state",
                new MapSqlParameterSource("state", state.name()),
                Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public void updateSyncState(UUID observationId, SyncState state) {
        jdbc.update(
                "update observations set sync_state = :state where observation_id = :observation_id",
                new MapSqlParameterSource().addValue("state", state.name()).addValue("observation_id", observationId));
    }

    @Override
    public void lockSeries(UUID tenantId, UUID programId, String seriesCode) {
        jdbc.queryForObject(
                "select 1 from (select pg_advisory_xact_lock(:lock_key)) l",
                new MapSqlParameterSource("lock_key", seriesLockKey(tenantId, programId, seriesCode)),
                Integer.class);
    }

    static long seriesLockKey(UUID tenantId, UUID programId, String seriesCode) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(
                    (tenantId + "|" + programId + "|" + seriesCode).getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash).getLong();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("Unable to compute series lock key", ex);
        }
    }

    private static MapSqlParameterSource series(UUID tenantId, UUID programId, String seriesCode) {
        return new MapSqlParameterSource()
                .addValue("tenant_id", tenantId)
                .addValue("program_id", programId)
                .addValue("series_code", seriesCode);
    }
}
