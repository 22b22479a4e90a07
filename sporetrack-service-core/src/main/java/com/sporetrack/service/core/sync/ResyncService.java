package com.sporetrack.service.core.sync;

import com.sporetrack.core.model.Observation;
import com.sporetrack.service.core.config.SporetrackProperties;
import com.sporetrack.service.core.store.CanonicalObservationRepository;
import com.sporetrack.service.core.store.CanonicalPosition;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the partitioned store from the canonical one in capture-time order. Progress is checkpointed after every
 * batch so an interrupted run resumes behind the last replicated row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResyncService {

    static final String CHECKPOINT = "full-resync";

    /** Smallest UUID; positions built from a bare instant start before every row captured at that instant. */
    private static final UUID MIN_ID = new UUID(0L, 0L);

    private final CanonicalObservationRepository canonical;
    private final ObservationSynchronizer synchronizer;
    private final SyncCheckpointRepository checkpoints;
    private final SporetrackProperties properties;

    private final AtomicBoolean running = new AtomicBoolean();

    /** Continues from the stored checkpoint, or starts over when {@code fromScratch}. */
    public ResyncReport resync(boolean fromScratch) {
        if (fromScratch) {
            checkpoints.clear(CHECKPOINT);
        }
        return run(checkpoints.load(CHECKPOINT).orElse(null));
    }

    /** Starts at an arbitrary capture time, replacing the stored checkpoint. */
    public ResyncReport resyncFrom(Instant observedAtOffset) {
        return run(new CanonicalPosition(observedAtOffset, MIN_ID));
    }

    public SyncStatus status() {
        return synchronizer.status(checkpoints.load(CHECKPOINT).orElse(null));
    }

    private ResyncReport run(CanonicalPosition start) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A resync is already running");
        }
        try {
            int batchSize = properties.getSync().getResyncBatchSize();
            CanonicalPosition position = start;
            long replicated = 0;
            long failed = 0;
            log.info("Resync starting after {}", position != null ? position : "the beginning");
            while (true) {
                List<Observation> batch = canonical.findAfter(position, batchSize);
                if (batch.isEmpty()) {
                    break;
                }
                for (Observation observation : batch) {
                    if (synchronizer.repropagate(observation.tenantId(), observation.observationId())) {
                        replicated++;
                    } else {
                        failed++;
                    }
                }
                position = CanonicalPosition.of(batch.get(batch.size() - 1));
                checkpoints.save(CHECKPOINT, position);
                log.info("Resync checkpoint {} (replicated={}, failed={})", position, replicated, failed);
                if (batch.size() < batchSize) {
                    break;
                }
            }
            log.info("Resync finished replicated={} failed={}", replicated, failed);
            return new ResyncReport(replicated, failed, position);
        } finally {
            running.set(false);
        }
    }

    public record ResyncReport(long replicated, long failed, CanonicalPosition checkpoint) {}
}
