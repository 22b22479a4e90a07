package com.sporetrack.service.core.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sporetrack.service.core.store.CanonicalPosition;
import java.time.Duration;
import java.time.Instant;

/** Monitoring snapshot of the replication between the canonical and the partitioned store. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncStatus(
        CanonicalPosition resyncCheckpoint,
        long pendingCount,
        long outOfSyncCount,
        Duration lastPropagationLag,
        Instant lastPropagatedAt) {}
