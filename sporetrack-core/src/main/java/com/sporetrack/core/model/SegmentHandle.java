package com.sporetrack.core.model;

/**
 * Opaque reference to a physical partition segment. Segment {@code 0} is the catch-all default segment
 * and has no routing key.
 */
public record SegmentHandle(long segmentId, RoutingKey routingKey) {

    public static final long DEFAULT_SEGMENT_ID = 0L;
    public static final SegmentHandle DEFAULT = new SegmentHandle(DEFAULT_SEGMENT_ID, null);

    public boolean isDefault() {
        return segmentId == DEFAULT_SEGMENT_ID;
    }
}
