package com.sporetrack.service.core.sync;

import com.sporetrack.service.core.store.CanonicalPosition;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcSyncCheckpointRepository implements SyncCheckpointRepository {

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcSyncCheckpointRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public Optional<CanonicalPosition> load(String name) {
        return jdbc
                .query(
                        "select observed_at, observation_id from sync_checkpoints where name = :name",
                        new MapSqlParameterSource("name", name),
                        (rs, rowNum) -> new CanonicalPosition(
                                rs.getTimestamp("observed_at").toInstant(), (UUID) rs.getObject("observation_id")))
                .stream()
                .findFirst();
    }

    @Override
    public void save(String name, CanonicalPosition position) {
        jdbc.update(
                """
                insert into sync_checkpoints(name, observed_at, observation_id, updated_at)
                values (:name, :observed_at, :observation_id, :updated_at)
                on conflict (name) do update
                  set observed_at = excluded.observed_at,
                      observation_id = excluded.observation_id,
                      updated_at = excluded.updated_at
                """,
                new MapSqlParameterSource()
                        .addValue("name", name)
                        .addValue("observed_at", Timestamp.from(position.observedAt()))
                        .addValue("observation_id", position.observationId())
                        .addValue("updated_at", Timestamp.from(Instant.now(clock))));
    }

    @Override
    public void clear(String name) {
        jdbc.update("delete from sync_checkpoints where name = :name", new MapSqlParameterSource("name", name));
    }
}
