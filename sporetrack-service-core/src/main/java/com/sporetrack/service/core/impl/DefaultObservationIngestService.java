package com.sporetrack.service.core.impl;

import com.sporetrack.core.model.DerivationStatus;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.SeriesKey;
import com.sporetrack.core.model.SeriesTemplate;
import com.sporetrack.core.model.SubmissionResult;
import com.sporetrack.core.model.SyncState;
import com.sporetrack.core.model.TenantContext;
import com.sporetrack.service.core.config.SporetrackProperties;
import com.sporetrack.service.core.derived.DerivationContext;
import com.sporetrack.service.core.derived.DerivationOutcome;
import com.sporetrack.service.core.derived.DerivedMetricPipeline;
import com.sporetrack.service.core.error.ObservationNotFoundException;
import com.sporetrack.service.core.error.PhaseUnresolvedException;
import com.sporetrack.service.core.registry.PhaseCalendar;
import com.sporetrack.service.core.series.SeriesKeyResolver;
import com.sporetrack.service.core.spi.ObservationIngestService;
import com.sporetrack.service.core.store.CanonicalObservationRepository;
import com.sporetrack.service.core.sync.ObservationSynchronizer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Resolves, appends, derives and propagates one observation inside a single transaction, holding the series lock
 * so that predecessor lookups and successor re-derivation see a stable series.
 */
@Service
public class DefaultObservationIngestService implements ObservationIngestService {

    private static final Logger log = LoggerFactory.getLogger(DefaultObservationIngestService.class);

    private final SeriesKeyResolver seriesKeyResolver;
    private final PhaseCalendar phaseCalendar;
    private final CanonicalObservationRepository canonical;
    private final DerivedMetricPipeline pipeline;
    private final ObservationSynchronizer synchronizer;
    private final TransactionOperations observationTx;
    private final Clock clock;
    private final ZoneId zone;

    public DefaultObservationIngestService(
            SeriesKeyResolver seriesKeyResolver,
            PhaseCalendar phaseCalendar,
            CanonicalObservationRepository canonical,
            DerivedMetricPipeline pipeline,
            ObservationSynchronizer synchronizer,
            TransactionOperations observationTx,
            SporetrackProperties properties,
            Clock clock) {
        this.seriesKeyResolver = seriesKeyResolver;
        this.phaseCalendar = phaseCalendar;
        this.canonical = canonical;
        this.pipeline = pipeline;
        this.synchronizer = synchronizer;
        this.observationTx = observationTx;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getPipeline().getZone());
    }

    @Override
    public SubmissionResult submit(TenantContext ctx, SeriesTemplate template, Double rawReading, Instant capturedAt) {
        if (capturedAt == null) {
            throw new IllegalArgumentException("capturedAt is required");
        }
        if (template.readingKind() == null) {
            throw new IllegalArgumentException("readingKind is required");
        }
        checkReading(rawReading);
        SeriesKey key = seriesKeyResolver.resolve(ctx, template);
        int phaseDay = resolvePhaseDay(template, capturedAt);

        return observationTx.execute(status -> {
            canonical.lockSeries(key.tenantId(), key.programId(), key.seriesCode());
            boolean newSeriesStart = canonical
                    .findSeriesStart(key.tenantId(), key.programId(), key.seriesCode(), capturedAt)
                    .isEmpty();

            Observation draft = Observation.builder()
                    .observationId(UUID.randomUUID())
                    .tenantId(key.tenantId())
                    .programId(key.programId())
                    .siteId(key.siteId())
                    .submissionId(template.submissionId())
                    .seriesCode(key.seriesCode())
                    .readingKind(template.readingKind())
                    .phaseDay(phaseDay)
                    .observedAt(capturedAt)
                    .rawReading(rawReading)
                    .syncState(SyncState.PENDING)
                    .revision(1L)
                    .updatedAt(Instant.now(clock))
                    .build();
            Observation finalized = derive(draft);
            canonical.insert(finalized);
            SyncState syncState = synchronizer.propagate(finalized);
            rederiveDependents(finalized, newSeriesStart);

            log.info(
                    "Accepted observation {} series={} program={} phaseDay={} status={} sync={}",
                    finalized.observationId(),
                    finalized.seriesCode(),
                    finalized.programId(),
                    phaseDay,
                    finalized.derivationStatus(),
                    syncState);
            return new SubmissionResult(finalized.observationId(), finalized.derivationStatus(), syncState);
        });
    }

    @Override
    public SubmissionResult amend(TenantContext ctx, UUID observationId, Double rawReading) {
        checkReading(rawReading);
        return observationTx.execute(status -> {
            Observation existing = lockAndLoad(ctx, observationId);
            Observation amended = derive(existing.toBuilder()
                    .rawReading(rawReading)
                    .revision(existing.revision() + 1)
                    .syncState(SyncState.PENDING)
                    .updatedAt(Instant.now(clock))
                    .build());
            canonical.update(amended);
            SyncState syncState = synchronizer.propagate(amended);
            rederiveDependents(amended, false);
            log.info("Amended observation {} to revision {}", observationId, amended.revision());
            return new SubmissionResult(observationId, amended.derivationStatus(), syncState);
        });
    }

    @Override
    public void delete(TenantContext ctx, UUID observationId) {
        observationTx.executeWithoutResult(status -> {
            Observation existing = lockAndLoad(ctx, observationId);
            boolean wasSeriesStart = canonical
                    .findSeriesStart(
                            existing.tenantId(), existing.programId(), existing.seriesCode(), existing.observedAt())
                    .map(start -> start.equals(existing.observedAt()))
                    .orElse(false);
            canonical.delete(existing.tenantId(), observationId);
            synchronizer.propagateDelete(existing);
            rederiveDependents(existing, wasSeriesStart);
            log.info("Deleted observation {} of series {}", observationId, existing.seriesCode());
        });
    }

    @Override
    public int reprocessPending(int limit) {
        int recomputed = 0;
        for (Observation pending : canonical.findReprocessable(limit)) {
            Boolean done = observationTx.execute(status -> {
                canonical.lockSeries(pending.tenantId(), pending.programId(), pending.seriesCode());
                Optional<Observation> current = canonical.findById(pending.tenantId(), pending.observationId());
                if (current.isEmpty()) {
                    return Boolean.FALSE;
                }
                Observation rederived = rederive(current.get());
                if (rederived == null || rederived.derivationStatus() != DerivationStatus.COMPUTED) {
                    return Boolean.FALSE;
                }
                rederiveDependents(rederived, false);
                return Boolean.TRUE;
            });
            if (Boolean.TRUE.equals(done)) {
                recomputed++;
            }
        }
        if (recomputed > 0) {
            log.info("Reprocessed {} pending observations", recomputed);
        }
        return recomputed;
    }

    private Observation lockAndLoad(TenantContext ctx, UUID observationId) {
        Observation found = canonical
                .findById(ctx.tenantId(), observationId)
                .orElseThrow(() -> new ObservationNotFoundException(observationId));
        canonical.lockSeries(found.tenantId(), found.programId(), found.seriesCode());
        // re-read under the lock; a concurrent writer may have changed or removed it
        return canonical
                .findById(ctx.tenantId(), observationId)
                .orElseThrow(() -> new ObservationNotFoundException(observationId));
    }

    private Observation derive(Observation observation) {
        Optional<Observation> predecessor = observation.phaseDay() > 1
                ? canonical.findByPhaseDay(
                        observation.tenantId(),
                        observation.programId(),
                        observation.seriesCode(),
                        observation.phaseDay() - 1)
                        .filter(previous -> previous.readingKind() == observation.readingKind())
                : Optional.empty();
        Instant seriesStart = canonical
                .findSeriesStart(
                        observation.tenantId(),
                        observation.programId(),
                        observation.seriesCode(),
                        observation.observedAt())
                .filter(start -> start.isBefore(observation.observedAt()))
                .orElse(observation.observedAt());
        DerivationOutcome outcome =
                pipeline.derive(new DerivationContext(observation, predecessor, Optional.of(seriesStart), zone));
        return observation.withDerived(outcome.metrics(), outcome.status());
    }

    /**
     * Re-derives the observation on the next phase day and, when the series start moved, every later row of a
     * depletion series (their flow rate counts days from the start).
     */
    private void rederiveDependents(Observation changed, boolean seriesStartMoved) {
        if (seriesStartMoved && changed.readingKind() == ReadingKind.LINEAR_DEPLETION) {
            List<Observation> series =
                    canonical.findSeries(changed.tenantId(), changed.programId(), changed.seriesCode());
            for (Observation row : series) {
                // phase order: each row sees its already re-derived predecessor
                if (!row.observationId().equals(changed.observationId())) {
                    rederive(row);
                }
            }
            return;
        }
        canonical
                .findByPhaseDay(changed.tenantId(), changed.programId(), changed.seriesCode(), changed.phaseDay() + 1)
                .ifPresent(this::rederive);
    }

    /** Recomputes and stores derived fields of an existing row; returns null when nothing changed. */
    private Observation rederive(Observation row) {
        Observation recomputed = derive(row);
        if (recomputed.derived().equals(row.derived())
                && recomputed.derivationStatus() == row.derivationStatus()) {
            return null;
        }
        Observation updated = recomputed.toBuilder()
                .syncState(SyncState.PENDING)
                .updatedAt(Instant.now(clock))
                .build();
        canonical.update(updated);
        synchronizer.propagate(updated);
        log.debug("Re-derived observation {} phaseDay={}", updated.observationId(), updated.phaseDay());
        return updated;
    }

    private int resolvePhaseDay(SeriesTemplate template, Instant capturedAt) {
        if (template.phaseDay() != null) {
            if (template.phaseDay() < 1) {
                throw new IllegalArgumentException("phaseDay must be >= 1 but was " + template.phaseDay());
            }
            return template.phaseDay();
        }
        return phaseCalendar
                .phaseDay(template.programId(), capturedAt)
                .orElseThrow(() -> new PhaseUnresolvedException(template.programId(), capturedAt));
    }

    private static void checkReading(Double rawReading) {
        if (rawReading != null && !Double.isFinite(rawReading)) {
            throw new IllegalArgumentException("rawReading must be a finite number");
        }
    }
}
