package com.sporetrack.service.core.sync;

import com.sporetrack.core.model.Observation;
import com.sporetrack.service.core.impl.JsonUtil;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class JdbcSyncFailureQueue implements SyncFailureQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcSyncFailureQueue.class);
    private static final String INSERT_SQL =
            """
        insert into sync_failures(
              id, observation_id, tenant_id, program_id, attempts, error, payload, failed_at
        ) values (
              :id, :observation_id, :tenant_id, :program_id, :attempts, :error, cast(:payload as jsonb), :failed_at
        )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcSyncFailureQueue(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public void publish(Observation observation, int attempts, String detail) {
        try {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("id", UUID.randomUUID())
                    .addValue("observation_id", observation.observationId())
                    .addValue("tenant_id", observation.tenantId())
                    .addValue("program_id", observation.programId())
                    .addValue("attempts", attempts)
                    .addValue("error", detail)
                    .addValue("payload", JsonUtil.toJson(observation), Types.VARCHAR)
                    .addValue("failed_at", Timestamp.from(Instant.now(clock)));
            jdbc.update(INSERT_SQL, params);
        } catch (DataAccessException ex) {
            log.error("Failed to record sync failure for observation {}", observation.observationId(), ex);
        }
    }
}
