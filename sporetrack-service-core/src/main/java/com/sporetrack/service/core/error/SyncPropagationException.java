package com.sporetrack.service.core.error;

import java.util.UUID;

/** Replication into the partitioned store failed after every retry. */
public class SyncPropagationException extends SporetrackException {

    private final UUID observationId;
    private final int attempts;

    public SyncPropagationException(UUID observationId, int attempts, Throwable cause) {
        super("Propagation of observation " + observationId + " failed after " + attempts + " attempts", cause);
        this.observationId = observationId;
        this.attempts = attempts;
    }

    public UUID getObservationId() {
        return observationId;
    }

    public int getAttempts() {
        return attempts;
    }
}
