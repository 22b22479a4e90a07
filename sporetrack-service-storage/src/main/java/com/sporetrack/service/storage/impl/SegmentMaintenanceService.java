package com.sporetrack.service.storage.impl;

import com.sporetrack.core.model.SegmentHandle;
import com.sporetrack.service.core.config.SporetrackProperties;
import com.sporetrack.service.core.partition.PartitionManager;
import com.sporetrack.service.core.partition.SegmentReconciler;
import com.sporetrack.service.core.spi.ObservationIngestService;
import com.sporetrack.service.core.store.PartitionedObservationRepository;
import com.sporetrack.service.core.sync.ObservationSynchronizer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Out-of-band upkeep of the partitioned store. None of these jobs runs inside a writer's transaction, and the
 * DDL they issue (detach, drop, analyze) does not take locks that block foreground reads or writes.
 */
@Service
public class SegmentMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(SegmentMaintenanceService.class);

    private final PartitionManager partitionManager;
    private final SegmentReconciler reconciler;
    private final PartitionedObservationRepository partitions;
    private final ObservationIngestService ingestService;
    private final ObservationSynchronizer synchronizer;
    private final SporetrackProperties properties;
    private final boolean enabled;
    private final int sweepLimit;

    public SegmentMaintenanceService(
            PartitionManager partitionManager,
            SegmentReconciler reconciler,
            PartitionedObservationRepository partitions,
            ObservationIngestService ingestService,
            ObservationSynchronizer synchronizer,
            SporetrackProperties properties,
            @Value("${sporetrack.maintenance.enabled:true}") boolean enabled,
            @Value("${sporetrack.maintenance.sweep-limit:500}") int sweepLimit) {
        this.partitionManager = partitionManager;
        this.reconciler = reconciler;
        this.partitions = partitions;
        this.ingestService = ingestService;
        this.synchronizer = synchronizer;
        this.properties = properties;
        this.enabled = enabled;
        this.sweepLimit = sweepLimit;
    }

    /** The default segment must exist before the first write is routed to it. */
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        log.info("Ensuring default segment at startup...");
        partitions.provisionSegment(SegmentHandle.DEFAULT_SEGMENT_ID);
    }

    @Scheduled(fixedDelayString = "${sporetrack.maintenance.reconcile-delay:PT1M}")
    public void reconcile() {
        if (!enabled) {
            return;
        }
        long moved = reconciler.reconcile();
        if (log.isDebugEnabled()) {
            log.debug("Reconcile pass moved {} rows out of the default segment", moved);
        }
    }

    @Scheduled(cron = "${sporetrack.maintenance.analyze-cron:0 30 1 * * *}", zone = "UTC")
    public void analyze() {
        if (!enabled) {
            return;
        }
        partitionManager.analyzeSegments();
    }

    @Scheduled(cron = "${sporetrack.maintenance.cleanup-cron:0 0 3 * * *}", zone = "UTC")
    public void dropEmptySegments() {
        if (!enabled) {
            return;
        }
        Duration retention = properties.getPartitions().getRetention();
        int dropped = partitionManager.dropEmptySegments(retention);
        log.info("Segment cleanup dropped {} empty segments older than {}", dropped, retention);
    }

    @Scheduled(fixedDelayString = "${sporetrack.maintenance.reprocess-delay:PT5M}")
    public void reprocessPending() {
        if (!enabled) {
            return;
        }
        ingestService.reprocessPending(sweepLimit);
    }

    @Scheduled(fixedDelayString = "${sporetrack.maintenance.sync-retry-delay:PT1M}")
    public void retryOutOfSync() {
        if (!enabled) {
            return;
        }
        synchronizer.retryOutOfSync(sweepLimit);
    }
}
