package com.sporetrack.service.core.partition;

import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SegmentDescriptor;
import com.sporetrack.core.model.SegmentStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Indirection table from routing key to opaque segment id. */
public interface SegmentRegistryRepository {

    Optional<SegmentDescriptor> findByKey(RoutingKey key);

    Optional<SegmentDescriptor> findById(long segmentId);

    /**
     * Registers a new segment in {@link SegmentStatus#PROVISIONING}.
     *
     * @throws org.springframework.dao.DuplicateKeyException when the key is already registered
     */
    SegmentDescriptor insert(RoutingKey key, Instant createdAt);

    /** Compare-and-set of the status; returns false when the current status is not {@code expected}. */
    boolean updateStatus(long segmentId, SegmentStatus expected, SegmentStatus next);

    void updateWatermark(long segmentId, long rowCount, Instant analyzedAt);

    List<SegmentDescriptor> listByTenant(UUID tenantId);

    List<SegmentDescriptor> listAll();

    boolean delete(long segmentId);
}
