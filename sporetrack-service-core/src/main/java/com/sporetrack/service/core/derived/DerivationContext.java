package com.sporetrack.service.core.derived;

import com.sporetrack.core.model.Observation;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Everything a derived computation may look at.
 *
 * @param current the observation being finalized
 * @param predecessor the latest observation of the same series whose phase day is exactly
 *     {@code current.phaseDay() - 1}; empty on phase day 1 or when there is none
 * @param seriesStartAt capture time of the first observation ever recorded for the series (at or before current)
 * @param zone zone used for calendar-day arithmetic
 */
public record DerivationContext(
        Observation current, Optional<Observation> predecessor, Optional<Instant> seriesStartAt, ZoneId zone) {

    public DerivationContext {
        predecessor = current.phaseDay() <= 1 ? Optional.empty() : predecessor;
    }

    /** Calendar days between two instants in {@link #zone()}; negative when {@code to} is before {@code from}. */
    public long calendarDaysBetween(Instant from, Instant to) {
        return ChronoUnit.DAYS.between(from.atZone(zone).toLocalDate(), to.atZone(zone).toLocalDate());
    }
}
