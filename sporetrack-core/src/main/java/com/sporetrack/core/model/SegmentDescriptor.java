package com.sporetrack.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SegmentDescriptor(
        long segmentId,
        UUID tenantId,
        UUID programId,
        boolean defaultSegment,
        SegmentStatus status,
        Instant createdAt,
        long rowCountWatermark,
        Instant analyzedAt) {

    /** Descriptor for a routing key that has no dedicated segment yet and therefore lands in the default one. */
    public static SegmentDescriptor defaultFor(RoutingKey key) {
        return new SegmentDescriptor(
                SegmentHandle.DEFAULT_SEGMENT_ID,
                key.tenantId(),
                key.programId(),
                true,
                SegmentStatus.ACTIVE,
                null,
                0L,
                null);
    }
}
