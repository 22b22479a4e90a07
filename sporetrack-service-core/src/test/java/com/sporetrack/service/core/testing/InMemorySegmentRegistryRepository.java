package com.sporetrack.service.core.testing;

import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SegmentDescriptor;
import com.sporetrack.core.model.SegmentStatus;
import com.sporetrack.service.core.partition.SegmentRegistryRepository;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.dao.DuplicateKeyException;

public class InMemorySegmentRegistryRepository implements SegmentRegistryRepository {

    private final Map<Long, SegmentDescriptor> segments = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final AtomicInteger duplicateInserts = new AtomicInteger();

    @Override
    public synchronized Optional<SegmentDescriptor> findByKey(RoutingKey key) {
        return segments.values().stream()
                .filter(d -> d.tenantId().equals(key.tenantId()) && d.programId().equals(key.programId()))
                .findFirst();
    }

    @Override
    public synchronized Optional<SegmentDescriptor> findById(long segmentId) {
        return Optional.ofNullable(segments.get(segmentId));
    }

    @Override
    public synchronized SegmentDescriptor insert(RoutingKey key, Instant createdAt) {
        if (findByKey(key).isPresent()) {
            duplicateInserts.incrementAndGet();
            throw new DuplicateKeyException("segment_registry_tenant_id_program_id_key");
        }
        SegmentDescriptor descriptor = new SegmentDescriptor(
                ids.incrementAndGet(),
                key.tenantId(),
                key.programId(),
                false,
                SegmentStatus.PROVISIONING,
                createdAt,
                0L,
                null);
        segments.put(descriptor.segmentId(), descriptor);
        return descriptor;
    }

    @Override
    public synchronized boolean updateStatus(long segmentId, SegmentStatus expected, SegmentStatus next) {
        SegmentDescriptor d = segments.get(segmentId);
        if (d == null || d.status() != expected) {
            return false;
        }
        segments.put(
                segmentId,
                new SegmentDescriptor(
                        d.segmentId(),
                        d.tenantId(),
                        d.programId(),
                        false,
                        next,
                        d.createdAt(),
                        d.rowCountWatermark(),
                        d.analyzedAt()));
        return true;
    }

    @Override
    public synchronized void updateWatermark(long segmentId, long rowCount, Instant analyzedAt) {
        SegmentDescriptor d = segments.get(segmentId);
        if (d != null) {
            segments.put(
                    segmentId,
                    new SegmentDescriptor(
                            d.segmentId(),
                            d.tenantId(),
                            d.programId(),
                            false,
                            d.status(),
                            d.createdAt(),
                            rowCount,
                            analyzedAt));
        }
    }

    @Override
    public synchronized List<SegmentDescriptor> listByTenant(UUID tenantId) {
        return segments.values().stream()
                .filter(d -> d.tenantId().equals(tenantId))
                .sorted(Comparator.comparingLong(SegmentDescriptor::segmentId))
                .toList();
    }

    @Override
    public synchronized List<SegmentDescriptor> listAll() {
        return List.copyOf(segments.values());
    }

    @Override
    public synchronized boolean delete(long segmentId) {
        return segments.remove(segmentId) != null;
    }

    public int duplicateInserts() {
        return duplicateInserts.get();
    }
}
