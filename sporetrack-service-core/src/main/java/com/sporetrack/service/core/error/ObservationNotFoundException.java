package com.sporetrack.service.core.error;

import java.util.UUID;

public class ObservationNotFoundException extends SporetrackException {

    public ObservationNotFoundException(UUID observationId) {
        super("Observation " + observationId + " not found");
    }
}
