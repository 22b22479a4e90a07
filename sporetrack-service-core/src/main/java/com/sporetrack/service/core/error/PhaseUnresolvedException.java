package com.sporetrack.service.core.error;

import java.time.Instant;
import java.util.UUID;

/** No phase of the program covers the capture time and the submission carried no phase day. */
public class PhaseUnresolvedException extends SporetrackException {

    public PhaseUnresolvedException(UUID programId, Instant capturedAt) {
        super("No active phase for program " + programId + " at " + capturedAt);
    }
}
