package com.sporetrack.service.core.sync;

import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.SegmentHandle;
import com.sporetrack.core.model.SyncState;
import com.sporetrack.service.core.config.SporetrackProperties;
import com.sporetrack.service.core.error.SyncPropagationException;
import com.sporetrack.service.core.partition.PartitionManager;
import com.sporetrack.service.core.store.CanonicalObservationRepository;
import com.sporetrack.service.core.store.CanonicalPosition;
import com.sporetrack.service.core.store.PartitionedObservationRepository;
import com.sporetrack.service.core.store.PartitionedObservationRepository.UpsertResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Replicates finalized canonical rows into the partitioned store. Every attempt runs in its own savepoint so a
 * failed replica write never rolls back the canonical write; exhausted retries flag the row OUT_OF_SYNC and raise
 * an alert instead of dropping it.
 */
@Service
public class ObservationSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(ObservationSynchronizer.class);

    private final CanonicalObservationRepository canonical;
    private final PartitionedObservationRepository partitions;
    private final PartitionManager partitionManager;
    private final SyncFailureQueue failureQueue;
    private final TransactionOperations observationTx;
    private final TransactionOperations attemptTx;
    private final SporetrackProperties properties;
    private final Clock clock;

    private final AtomicReference<Duration> lastLag = new AtomicReference<>();
    private final AtomicReference<Instant> lastPropagatedAt = new AtomicReference<>();

    public ObservationSynchronizer(
            CanonicalObservationRepository canonical,
            PartitionedObservationRepository partitions,
            PartitionManager partitionManager,
            SyncFailureQueue failureQueue,
            TransactionOperations observationTx,
            @Qualifier("syncAttemptTxTemplate") TransactionOperations attemptTx,
            SporetrackProperties properties,
            Clock clock) {
        this.canonical = canonical;
        this.partitions = partitions;
        this.partitionManager = partitionManager;
        this.failureQueue = failureQueue;
        this.observationTx = observationTx;
        this.attemptTx = attemptTx;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Upserts the replica of a finalized observation and records the outcome on the canonical row.
     * Replaying the same observation leaves the replica unchanged.
     *
     * @return {@link SyncState#IN_SYNC} or {@link SyncState#OUT_OF_SYNC}
     */
    public SyncState propagate(Observation observation) {
        SyncState state = replicate(observation);
        if (state == SyncState.IN_SYNC) {
            recordLag(observation);
        }
        return state;
    }

    /** Removes the replica. Failure after all retries aborts the surrounding delete. */
    public void propagateDelete(Observation deleted) {
        withRetry(deleted.observationId(), "delete", () -> {
            attemptTx.executeWithoutResult(
                    status -> partitions.delete(deleted.observationId(), deleted.programId()));
            return Boolean.TRUE;
        });
        log.debug("Replica of observation {} deleted", deleted.observationId());
    }

    /**
     * Re-propagates the current canonical state of one observation under its series lock, so a concurrent writer
     * cannot be overtaken by a stale copy. Returns false when the row no longer exists.
     */
    public boolean repropagate(UUID tenantId, UUID observationId) {
        Boolean done = observationTx.execute(status -> canonical
                .findById(tenantId, observationId)
                .map(current -> {
                    canonical.lockSeries(current.tenantId(), current.programId(), current.seriesCode());
                    Observation locked =
                            canonical.findById(tenantId, observationId).orElse(current);
                    return replicate(locked) == SyncState.IN_SYNC;
                })
                .orElse(Boolean.FALSE));
        return Boolean.TRUE.equals(done);
    }

    /** Retries rows flagged OUT_OF_SYNC; returns how many converged. */
    public int retryOutOfSync(int limit) {
        List<Observation> stale = canonical.findBySyncState(SyncState.OUT_OF_SYNC, limit);
        int recovered = 0;
        for (Observation observation : stale) {
            if (repropagate(observation.tenantId(), observation.observationId())) {
                recovered++;
            }
        }
        if (!stale.isEmpty()) {
            log.info("Out-of-sync retry recovered {}/{} observations", recovered, stale.size());
        }
        return recovered;
    }

    public SyncStatus status(CanonicalPosition resyncCheckpoint) {
        return new SyncStatus(
                resyncCheckpoint,
                canonical.countBySyncState(SyncState.PENDING),
                canonical.countBySyncState(SyncState.OUT_OF_SYNC),
                lastLag.get(),
                lastPropagatedAt.get());
    }

    private SyncState replicate(Observation observation) {
        Observation replica = observation.withSyncState(SyncState.IN_SYNC);
        try {
            UpsertResult result = withRetry(observation.observationId(), "upsert", () -> {
                SegmentHandle target = partitionManager.route(observation.routingKey());
                return attemptTx.execute(status -> partitions.upsert(target.segmentId(), replica));
            });
            if (observation.syncState() != SyncState.IN_SYNC) {
                canonical.updateSyncState(observation.observationId(), SyncState.IN_SYNC);
            }
            log.debug("Observation {} replicated ({})", observation.observationId(), result);
            return SyncState.IN_SYNC;
        } catch (SyncPropagationException ex) {
            markOutOfSync(observation, ex);
            return SyncState.OUT_OF_SYNC;
        }
    }

    private void markOutOfSync(Observation observation, SyncPropagationException ex) {
        canonical.updateSyncState(observation.observationId(), SyncState.OUT_OF_SYNC);
        failureQueue.publish(
                observation, ex.getAttempts(), ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage());
        log.error(
                "ALERT observation {} of program {} is OUT_OF_SYNC after {} attempts",
                observation.observationId(),
                observation.programId(),
                ex.getAttempts(),
                ex);
    }

    private <T> T withRetry(UUID observationId, String operation, Supplier<T> attempt) {
        SporetrackProperties.Sync sync = properties.getSync();
        int maxAttempts = Math.max(1, sync.getMaxAttempts());
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return attempt.get();
            } catch (DataAccessException ex) {
                if (attempts >= maxAttempts) {
                    throw new SyncPropagationException(observationId, attempts, ex);
                }
                long backoffMs = backoffMillis(attempts, sync);
                log.warn(
                        "Replica {} of observation {} failed. Retrying attempt {}/{} after {} ms",
                        operation,
                        observationId,
                        attempts + 1,
                        maxAttempts,
                        backoffMs);
                sleep(backoffMs, observationId, attempts, ex);
            }
        }
    }

    static long backoffMillis(int attempt, SporetrackProperties.Sync sync) {
        long initial = sync.getInitialBackoff().toMillis();
        if (initial <= 0) {
            return 0L;
        }
        long base = initial << Math.min(attempt - 1, 16); // capped exponential
        long jitter = ThreadLocalRandom.current().nextLong(base, base * 2);
        return Math.min(jitter, sync.getMaxBackoff().toMillis());
    }

    private static void sleep(long millis, UUID observationId, int attempts, DataAccessException cause) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SyncPropagationException(observationId, attempts, cause);
        }
    }

    private void recordLag(Observation observation) {
        Instant now = Instant.now(clock);
        Instant writtenAt = observation.updatedAt() != null ? observation.updatedAt() : observation.observedAt();
        Duration lag = Duration.between(writtenAt, now);
        lastLag.set(lag);
        lastPropagatedAt.set(now);
        if (lag.compareTo(properties.getSync().getLagWarningThreshold()) > 0) {
            log.warn(
                    "Propagation lag {} ms for observation {} exceeds threshold",
                    lag.toMillis(),
                    observation.observationId());
        }
    }
}
