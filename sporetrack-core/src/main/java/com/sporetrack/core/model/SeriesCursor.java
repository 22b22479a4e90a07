package com.sporetrack.core.model;

import java.util.Objects;
import java.util.UUID;

/** Restart position inside a series: the last (phaseDay, observationId) already consumed. */
public record SeriesCursor(int phaseDay, UUID observationId) {

    public SeriesCursor {
        Objects.requireNonNull(observationId, "observationId");
    }

    public static SeriesCursor after(Observation observation) {
        return new SeriesCursor(observation.phaseDay(), observation.observationId());
    }

    /** Parses the {@code <phaseDay>:<observationId>} form produced by {@link #toString()}. */
    public static SeriesCursor parse(String value) {
        int sep = value == null ? -1 : value.indexOf(':');
        if (sep <= 0) {
            throw new IllegalArgumentException("Invalid series cursor: " + value);
        }
        try {
            return new SeriesCursor(
                    Integer.parseInt(value.substring(0, sep)), UUID.fromString(value.substring(sep + 1)));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid series cursor: " + value, ex);
        }
    }

    public boolean isBefore(Observation observation) {
        if (phaseDay != observation.phaseDay()) {
            return phaseDay < observation.phaseDay();
        }
        return observationId.toString().compareTo(observation.observationId().toString()) < 0;
    }

    @Override
    public String toString() {
        return phaseDay + ":" + observationId;
    }
}
