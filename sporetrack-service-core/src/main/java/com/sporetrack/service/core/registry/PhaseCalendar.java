package com.sporetrack.service.core.registry;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.OptionalInt;
import java.util.UUID;

/** Resolves the 1-based day of the program's active treatment phase for a capture time. */
public interface PhaseCalendar {

    OptionalInt phaseDay(UUID programId, Instant capturedAt);

    static int dayOfPhase(LocalDate phaseStart, LocalDate captureDate) {
        long days = ChronoUnit.DAYS.between(phaseStart, captureDate) + 1;
        return (int) Math.max(1, days);
    }
}
