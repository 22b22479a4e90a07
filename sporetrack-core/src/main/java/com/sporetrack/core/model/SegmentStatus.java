package com.sporetrack.core.model;

public enum SegmentStatus {
    /** Registered, physical storage not confirmed yet. Never routed to. */
    PROVISIONING,
    ACTIVE,
    /** Picked for removal by maintenance; routing ignores it. */
    RETIRING
}
