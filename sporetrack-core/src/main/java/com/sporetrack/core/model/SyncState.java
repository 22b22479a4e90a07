package com.sporetrack.core.model;

/** Replication state of a canonical row relative to the partitioned read store. */
public enum SyncState {
    PENDING,
    IN_SYNC,
    OUT_OF_SYNC
}
