package com.sporetrack.service.core.partition;

import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SegmentDescriptor;
import com.sporetrack.core.model.SegmentStatus;
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
public class JdbcSegmentRegistryRepository implements SegmentRegistryRepository {

    private static final RowMapper<SegmentDescriptor> MAPPER = (rs, rowNum) -> {
        Timestamp analyzed = rs.getTimestamp("analyzed_at");
        return new SegmentDescriptor(
                rs.getLong("segment_id"),
                (UUID) rs.getObject("tenant_id"),
                (UUID) rs.getObject("program_id"),
                false,
                SegmentStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getLong("row_count_watermark"),
                analyzed != null ? analyzed.toInstant() : null);
    };

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcSegmentRegistryRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<SegmentDescriptor> findByKey(RoutingKey key) {
        return jdbc
                .query(
                        "select * from segment_registry where tenant_id = :tenant_id and program_id = :program_id",
                        new MapSqlParameterSource()
                                .addValue("tenant_id", key.tenantId())
                                .addValue("program_id", key.programId()),
                        MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<SegmentDescriptor> findById(long segmentId) {
        return jdbc
                .query(
                        "select * from segment_registry where segment_id = :segment_id",
                        new MapSqlParameterSource("segment_id", segmentId),
                        MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public SegmentDescriptor insert(RoutingKey key, Instant createdAt) {
        return jdbc.queryForObject(
                """
                insert into segment_registry(tenant_id, program_id, status, created_at, row_count_watermark)
                values (:tenant_id, :program_id, :status, :created_at, 0)
                returning *
                """,
                new MapSqlParameterSource()
                        .addValue("tenant_id", key.tenantId())
                        .addValue("program_id", key.programId())
                        .addValue("status", SegmentStatus.PROVISIONING.name())
                        .addValue("created_at", Timestamp.from(createdAt)),
                MAPPER);
    }

    @Override
    public boolean updateStatus(long segmentId, SegmentStatus expected, SegmentStatus next) {
        return jdbc.update(
                        "update segment_registry set status = :next where segment_id = :segment_id and status = :expected",
                        new MapSqlParameterSource()
                                .addValue("next", next.name())
                                .addValue("segment_id", segmentId)
                                .addValue("expected", expected.name()))
                > 0;
    }

    @Override
    public void updateWatermark(long segmentId, long rowCount, Instant analyzedAt) {
        jdbc.update(
                """
                update segment_registry
                set row_count_watermark = :row_count, analyzed_at = :analyzed_at
                where segment_id = :segment_id
                """,
                new MapSqlParameterSource()
                        .addValue("row_count", rowCount)
                        .addValue("analyzed_at", Timestamp.from(analyzedAt))
                        .addValue("segment_id", segmentId));
    }

    @Override
    public List<SegmentDescriptor> listByTenant(UUID tenantId) {
        return jdbc.query(
                "select * from segment_registry where tenant_id = :tenant_id order by segment_id",
                new MapSqlParameterSource("tenant_id", tenantId),
                MAPPER);
    }

    @Override
    public List<SegmentDescriptor> listAll() {
        return jdbc.query("select * from segment_registry order by segment_id", MAPPER);
    }

    @Override
    public boolean delete(long segmentId) {
        return jdbc.update(
                        "delete from segment_registry where segment_id = :segment_id",
                        new MapSqlParameterSource("segment_id", segmentId))
                > 0;
    }
}
