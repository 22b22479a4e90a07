package com.sporetrack.service.core.partition;

import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SegmentDescriptor;
import com.sporetrack.core.model.SegmentHandle;
import com.sporetrack.core.model.SegmentStatus;
import com.sporetrack.core.model.TenantContext;
import com.sporetrack.service.core.store.PartitionedObservationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Owns the routing key to segment mapping. Dedicated segments are created lazily and idempotently; until one is
 * ACTIVE its rows land in the default segment and the reconciler moves them later.
 */
@Service
public class PartitionManager {

    private static final Logger log = LoggerFactory.getLogger(PartitionManager.class);

    private final SegmentRegistryRepository registry;
    private final PartitionedObservationRepository partitions;
    private final Executor provisioningExecutor;
    private final Clock clock;

    /** ACTIVE segments only. */
    private final Map<RoutingKey, SegmentHandle> arena = new ConcurrentHashMap<>();

    /** One in-flight provisioning per key; completed outside any map operation. */
    private final Map<RoutingKey, CompletableFuture<SegmentHandle>> inFlight = new ConcurrentHashMap<>();

    private final Set<RoutingKey> provisioningRequested = ConcurrentHashMap.newKeySet();

    @Autowired
    public PartitionManager(
            SegmentRegistryRepository registry,
            PartitionedObservationRepository partitions,
            SegmentProvisioningExecutor provisioningExecutor,
            Clock clock) {
        this(registry, partitions, (Executor) provisioningExecutor, clock);
    }

    public PartitionManager(
            SegmentRegistryRepository registry,
            PartitionedObservationRepository partitions,
            Executor provisioningExecutor,
            Clock clock) {
        this.registry = registry;
        this.partitions = partitions;
        this.provisioningExecutor = provisioningExecutor;
        this.clock = clock;
    }

    /**
     * Returns the dedicated segment of {@code key}, creating it if needed. Concurrent callers converge on one
     * segment: a lost registry insert or an already existing table counts as success. Returns the default segment
     * while the key's previous segment is being retired.
     */
    public SegmentHandle ensureSegment(RoutingKey key) {
        SegmentHandle cached = arena.get(key);
        if (cached != null) {
            return cached;
        }
        CompletableFuture<SegmentHandle> mine = new CompletableFuture<>();
        CompletableFuture<SegmentHandle> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            return await(running);
        }
        try {
            SegmentHandle handle = provision(key);
            if (handle != null) {
                SegmentHandle raced = arena.putIfAbsent(key, handle);
                handle = raced != null ? raced : handle;
            }
            SegmentHandle result = handle != null ? handle : SegmentHandle.DEFAULT;
            mine.complete(result);
            return result;
        } catch (RuntimeException ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /** Non-blocking routing: the dedicated segment when ACTIVE, otherwise the default one plus a provisioning request. */
    public SegmentHandle route(RoutingKey key) {
        SegmentHandle cached = arena.get(key);
        if (cached != null) {
            return cached;
        }
        Optional<SegmentDescriptor> registered = registry.findByKey(key);
        if (registered.isPresent() && registered.get().status() == SegmentStatus.ACTIVE) {
            SegmentHandle handle = new SegmentHandle(registered.get().segmentId(), key);
            arena.putIfAbsent(key, handle);
            return handle;
        }
        requestProvisioning(key);
        return SegmentHandle.DEFAULT;
    }

    /** Queues {@link #ensureSegment} on the provisioning executor at most once per key at a time. */
    public void requestProvisioning(RoutingKey key) {
        if (!provisioningRequested.add(key)) {
            return;
        }
        try {
            provisioningExecutor.execute(() -> {
                try {
                    ensureSegment(key);
                } catch (RuntimeException ex) {
                    log.error("Provisioning segment for program {} failed", key.programId(), ex);
                } finally {
                    provisioningRequested.remove(key);
                }
            });
        } catch (RejectedExecutionException ex) {
            provisioningRequested.remove(key);
            log.warn("Provisioning for program {} deferred: {}", key.programId(), ex.getMessage());
        }
    }

    /** Eager creation when a program is registered with the store. */
    public SegmentHandle onProgramRegistered(TenantContext ctx, UUID programId) {
        SegmentHandle handle = ensureSegment(new RoutingKey(ctx.tenantId(), programId));
        log.info("Program {} registered for tenant {} on segment {}", programId, ctx.tenantId(), handle.segmentId());
        return handle;
    }

    public List<SegmentDescriptor> listSegments(TenantContext ctx) {
        return registry.listByTenant(ctx.tenantId());
    }

    public List<SegmentDescriptor> listAllSegments() {
        return registry.listAll();
    }

    /** The segment currently serving the program: its dedicated one when ACTIVE, otherwise the default. */
    public SegmentDescriptor describe(TenantContext ctx, UUID programId) {
        RoutingKey key = new RoutingKey(ctx.tenantId(), programId);
        return registry.findByKey(key)
                .filter(d -> d.status() == SegmentStatus.ACTIVE)
                .orElseGet(() -> SegmentDescriptor.defaultFor(key));
    }

    /**
     * Segments a read for {@code key} must cover: the default segment (rows not reconciled yet) and the dedicated
     * one when present. Never touches other keys' segments.
     */
    public List<Long> readSegments(RoutingKey key) {
        List<Long> ids = new ArrayList<>(2);
        ids.add(SegmentHandle.DEFAULT_SEGMENT_ID);
        SegmentHandle handle = arena.get(key);
        if (handle != null) {
            ids.add(handle.segmentId());
        } else {
            registry.findByKey(key)
                    .filter(d -> d.status() != SegmentStatus.PROVISIONING)
                    .ifPresent(d -> ids.add(d.segmentId()));
        }
        return ids;
    }

    /**
     * Drops dedicated segments created before {@code now - olderThan} that hold no rows. A segment is first marked
     * RETIRING and evicted so new writes fall back to the default segment. The storage layer then detaches it and
     * only drops it when nothing was committed in between; otherwise the segment goes back to ACTIVE.
     */
    public int dropEmptySegments(Duration olderThan) {
        Instant cutoff = Instant.now(clock).minus(olderThan);
        int dropped = 0;
        for (SegmentDescriptor segment : registry.listAll()) {
            if (segment.status() != SegmentStatus.ACTIVE || segment.createdAt().isAfter(cutoff)) {
                continue;
            }
            if (partitions.countRows(segment.segmentId()) > 0) {
                continue;
            }
            if (!registry.updateStatus(segment.segmentId(), SegmentStatus.ACTIVE, SegmentStatus.RETIRING)) {
                continue;
            }
            if (retire(segment)) {
                dropped++;
            }
        }
        return dropped;
    }

    private boolean retire(SegmentDescriptor segment) {
        RoutingKey key = new RoutingKey(segment.tenantId(), segment.programId());
        arena.remove(key);
        boolean dropped = false;
        try {
            dropped = partitions.dropSegmentIfEmpty(segment.segmentId());
        } finally {
            if (dropped) {
                registry.delete(segment.segmentId());
                arena.remove(key);
                log.info("Dropped empty segment {} of program {}", segment.segmentId(), segment.programId());
            } else {
                registry.updateStatus(segment.segmentId(), SegmentStatus.RETIRING, SegmentStatus.ACTIVE);
                log.info("Segment {} of program {} kept", segment.segmentId(), segment.programId());
            }
        }
        return dropped;
    }

    /** Refreshes planner statistics and the row-count watermark of every segment, the default one included. */
    public int analyzeSegments() {
        Instant now = Instant.now(clock);
        partitions.analyze(SegmentHandle.DEFAULT_SEGMENT_ID);
        int analyzed = 1;
        for (SegmentDescriptor segment : registry.listAll()) {
            if (segment.status() != SegmentStatus.ACTIVE) {
                continue;
            }
            partitions.analyze(segment.segmentId());
            registry.updateWatermark(segment.segmentId(), partitions.countRows(segment.segmentId()), now);
            analyzed++;
        }
        log.info("Analyzed {} segments", analyzed);
        return analyzed;
    }

    private SegmentHandle provision(RoutingKey key) {
        SegmentDescriptor segment = registry.findByKey(key).orElseGet(() -> register(key));
        if (segment.status() == SegmentStatus.RETIRING) {
            log.info("Segment {} of program {} is retiring; routing to default", segment.segmentId(), key.programId());
            return null;
        }
        if (segment.status() == SegmentStatus.PROVISIONING) {
            partitions.provisionSegment(segment.segmentId());
            if (registry.updateStatus(segment.segmentId(), SegmentStatus.PROVISIONING, SegmentStatus.ACTIVE)) {
                log.info("Segment {} for program {} is active", segment.segmentId(), key.programId());
            }
        }
        return new SegmentHandle(segment.segmentId(), key);
    }

    private static SegmentHandle await(CompletableFuture<SegmentHandle> running) {
        try {
            return running.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    private SegmentDescriptor register(RoutingKey key) {
        try {
            return registry.insert(key, Instant.now(clock));
        } catch (DuplicateKeyException race) {
            log.debug("Segment for program {} registered concurrently", key.programId());
            return registry.findByKey(key)
                    .orElseThrow(() -> new IllegalStateException("Segment for " + key + " vanished after race"));
        }
    }
}
