package com.sporetrack.service.core.store;

import com.sporetrack.core.model.DerivationStatus;
import com.sporetrack.core.model.DerivedMetrics;
import com.sporetrack.core.model.GrowthTrend;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.StageCategory;
import com.sporetrack.core.model.SyncState;
import com.sporetrack.core.model.TrendCategory;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/** Column mapping shared by the canonical and the partitioned observation tables. */
final class ObservationColumns {

    /** Columns both tables carry, in insert order. */
    static final String SHARED =
            """
            observation_id, tenant_id, program_id, site_id, submission_id, series_code, reading_kind, phase_day,
            observed_at, raw_reading, stage_category, progression, velocity, growth_trend, flow_rate, momentum,
            trend_category, forecasted_exhaustion_at, derivation_status, revision, updated_at""";

    static final String SHARED_PARAMS =
            """
            :observation_id, :tenant_id, :program_id, :site_id, :submission_id, :series_code, :reading_kind, :phase_day,
            :observed_at, :raw_reading, :stage_category, :progression, :velocity, :growth_trend, :flow_rate, :momentum,
            :trend_category, :forecasted_exhaustion_at, :derivation_status, :revision, :updated_at""";

    /** Mutable columns. observed_at and the identity columns are never rewritten. */
    static final String MUTABLE_ASSIGNMENTS =
            """
            site_id = :site_id,
            submission_id = :submission_id,
            raw_reading = :raw_reading,
            stage_category = :stage_category,
            progression = :progression,
            velocity = :velocity,
            growth_trend = :growth_trend,
            flow_rate = :flow_rate,
            momentum = :momentum,
            trend_category = :trend_category,
            forecasted_exhaustion_at = :forecasted_exhaustion_at,
            derivation_status = :derivation_status,
            revision = :revision,
            updated_at = :updated_at""";

    private ObservationColumns() {}

    static MapSqlParameterSource params(Observation o) {
        DerivedMetrics d = o.derived();
        return new MapSqlParameterSource()
                .addValue("observation_id", o.observationId())
                .addValue("tenant_id", o.tenantId())
                .addValue("program_id", o.programId())
                .addValue("site_id", o.siteId())
                .addValue("submission_id", o.submissionId())
                .addValue("series_code", o.seriesCode())
                .addValue("reading_kind", o.readingKind().name())
                .addValue("phase_day", o.phaseDay())
                .addValue("observed_at", Timestamp.from(o.observedAt()), Types.TIMESTAMP)
                .addValue("raw_reading", o.rawReading(), Types.DOUBLE)
                .addValue("stage_category", d.stage().map(Enum::name).orElse(null), Types.VARCHAR)
                .addValue("progression", boxed(d.progression()), Types.DOUBLE)
                .addValue("velocity", boxed(d.velocity()), Types.DOUBLE)
                .addValue("growth_trend", d.growthTrend().map(Enum::name).orElse(null), Types.VARCHAR)
                .addValue("flow_rate", boxed(d.flowRate()), Types.DOUBLE)
                .addValue("momentum", boxed(d.momentum()), Types.DOUBLE)
                .addValue("trend_category", d.trend().map(Enum::name).orElse(null), Types.VARCHAR)
                .addValue(
                        "forecasted_exhaustion_at",
                        d.forecastedExhaustionAt().map(Timestamp::from).orElse(null),
                        Types.TIMESTAMP)
                .addValue("derivation_status", o.derivationStatus().name())
                .addValue("sync_state", o.syncState().name())
                .addValue("revision", o.revision())
                .addValue("updated_at", o.updatedAt() != null ? Timestamp.from(o.updatedAt()) : null, Types.TIMESTAMP);
    }

    /** Maps a row; tables without a sync_state column read as {@code defaultSyncState}. */
    static RowMapper<Observation> rowMapper(boolean hasSyncState, SyncState defaultSyncState) {
        return (rs, rowNum) -> map(rs, hasSyncState ? SyncState.valueOf(rs.getString("sync_state")) : defaultSyncState);
    }

    private static Observation map(ResultSet rs, SyncState syncState) throws SQLException {
        DerivedMetrics derived = new DerivedMetrics(
                Optional.ofNullable(rs.getString("stage_category")).map(StageCategory::valueOf),
                optionalDouble(rs, "progression"),
                optionalDouble(rs, "velocity"),
                Optional.ofNullable(rs.getString("growth_trend")).map(GrowthTrend::valueOf),
                optionalDouble(rs, "flow_rate"),
                optionalDouble(rs, "momentum"),
                Optional.ofNullable(rs.getString("trend_category")).map(TrendCategory::valueOf),
                Optional.ofNullable(instant(rs, "forecasted_exhaustion_at")));
        double raw = rs.getDouble("raw_reading");
        Double rawReading = rs.wasNull() ? null : raw;
        return Observation.builder()
                .observationId((UUID) rs.getObject("observation_id"))
                .tenantId((UUID) rs.getObject("tenant_id"))
                .programId((UUID) rs.getObject("program_id"))
                .siteId((UUID) rs.getObject("site_id"))
                .submissionId((UUID) rs.getObject("submission_id"))
                .seriesCode(rs.getString("series_code"))
                .readingKind(ReadingKind.valueOf(rs.getString("reading_kind")))
                .phaseDay(rs.getInt("phase_day"))
                .observedAt(instant(rs, "observed_at"))
                .rawReading(rawReading)
                .derived(derived)
                .derivationStatus(DerivationStatus.valueOf(rs.getString("derivation_status")))
                .syncState(syncState)
                .revision(rs.getLong("revision"))
                .updatedAt(instant(rs, "updated_at"))
                .build();
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static OptionalDouble optionalDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
