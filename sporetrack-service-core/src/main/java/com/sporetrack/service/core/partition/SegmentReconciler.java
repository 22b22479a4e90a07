package com.sporetrack.service.core.partition;

import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SegmentHandle;
import com.sporetrack.service.core.config.SporetrackProperties;
import com.sporetrack.service.core.store.PartitionedObservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Moves rows parked in the default segment into their dedicated segment once it is ACTIVE. */
@Component
@Slf4j
@RequiredArgsConstructor
public class SegmentReconciler {

    private final PartitionManager partitionManager;
    private final PartitionedObservationRepository partitions;
    private final SporetrackProperties properties;

    /** Returns the number of rows moved out of the default segment. */
    public long reconcile() {
        int batchSize = properties.getPartitions().getReconcileBatchSize();
        long moved = 0;
        for (RoutingKey key : partitions.routingKeysIn(SegmentHandle.DEFAULT_SEGMENT_ID)) {
            SegmentHandle target = partitionManager.route(key);
            if (target.isDefault()) {
                log.debug("Program {} still waits for its segment", key.programId());
                continue;
            }
            long movedForKey = 0;
            int batch;
            do {
                batch = partitions.reassign(key, SegmentHandle.DEFAULT_SEGMENT_ID, target.segmentId(), batchSize);
                movedForKey += batch;
            } while (batch == batchSize);
            if (movedForKey > 0) {
                log.info(
                        "Reconciled {} rows of program {} into segment {}",
                        movedForKey,
                        key.programId(),
                        target.segmentId());
            }
            moved += movedForKey;
        }
        return moved;
    }
}
