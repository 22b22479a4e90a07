package com.sporetrack.service.core.store;

import com.sporetrack.core.model.Observation;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Total order over the canonical store: capture time, then observation id as tie-breaker. */
public record CanonicalPosition(Instant observedAt, UUID observationId) implements Comparable<CanonicalPosition> {

    public CanonicalPosition {
        Objects.requireNonNull(observedAt, "observedAt");
        Objects.requireNonNull(observationId, "observationId");
    }

    public static CanonicalPosition of(Observation observation) {
        return new CanonicalPosition(observation.observedAt(), observation.observationId());
    }

    @Override
    public int compareTo(CanonicalPosition other) {
        int byTime = observedAt.compareTo(other.observedAt);
        // String order matches the unsigned byte order the database uses for uuid.
        return byTime != 0 ? byTime : observationId.toString().compareTo(other.observationId.toString());
    }
}
