package com.sporetrack.service.core.sync;

import com.sporetrack.core.model.Observation;

/**
 * Operational sink for observations whose replica could not be written after all retries.
 * Entries are the alert trail; the canonical row itself carries the OUT_OF_SYNC flag.
 */
public interface SyncFailureQueue {
    void publish(Observation observation, int attempts, String detail);
}
