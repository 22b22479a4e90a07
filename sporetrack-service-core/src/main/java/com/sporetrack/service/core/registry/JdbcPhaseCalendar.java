package com.sporetrack.service.core.registry;

import com.sporetrack.service.core.config.SporetrackProperties;
import java.sql.Date;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.OptionalInt;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPhaseCalendar implements PhaseCalendar {

    private final JdbcTemplate jdbc;
    private final ZoneId zone;

    public JdbcPhaseCalendar(JdbcTemplate jdbc, SporetrackProperties properties) {
        this.jdbc = jdbc;
        this.zone = ZoneId.of(properties.getPipeline().getZone());
    }

    @Override
    public OptionalInt phaseDay(UUID programId, Instant capturedAt) {
        LocalDate captureDate = capturedAt.atZone(zone).toLocalDate();
        return jdbc
                .query(
                        """
                        SELECT start_date
                        FROM program_phases
                        WHERE program_id = ?
                          AND start_date <= ?
                          AND (end_date IS NULL OR end_date >= ?)
                        ORDER BY start_date DESC
                        LIMIT 1
                        """,
                        (rs, rowNum) -> rs.getDate("start_date").toLocalDate(),
                        programId,
                        Date.valueOf(captureDate),
                        Date.valueOf(captureDate))
                .stream()
                .findFirst()
                .map(start -> OptionalInt.of(PhaseCalendar.dayOfPhase(start, captureDate)))
                .orElse(OptionalInt.empty());
    }
}
