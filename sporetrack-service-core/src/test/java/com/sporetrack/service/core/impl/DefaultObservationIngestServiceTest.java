package com.sporetrack.service.core.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.sporetrack.core.model.DerivationStatus;
import com.sporetrack.core.model.DerivedMetrics;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.RoutingKey;
import com.sporetrack.core.model.SegmentHandle;
import com.sporetrack.core.model.SegmentStatus;
import com.sporetrack.core.model.SeriesTemplate;
import com.sporetrack.core.model.StageCategory;
import com.sporetrack.core.model.SubmissionResult;
import com.sporetrack.core.model.SyncState;
import com.sporetrack.core.model.TenantContext;
import com.sporetrack.core.model.TrendCategory;
import com.sporetrack.service.core.error.MissingTenantException;
import com.sporetrack.service.core.error.ObservationNotFoundException;
import com.sporetrack.service.core.error.PhaseUnresolvedException;
import com.sporetrack.service.core.error.SyncPropagationException;
import com.sporetrack.service.core.registry.PhaseCalendar;
import com.sporetrack.service.core.registry.SiteRecord;
import com.sporetrack.service.core.registry.SiteRegistry;
import com.sporetrack.service.core.testing.StoreFixture;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

class DefaultObservationIngestServiceTest {

    private static final Instant DAY_ONE = Instant.parse("2025-04-01T09:00:00Z");

    private final StoreFixture store = new StoreFixture();
    private final SiteRegistry sites = Mockito.mock(SiteRegistry.class);
    private final PhaseCalendar phases = Mockito.mock(PhaseCalendar.class);
    private final DefaultObservationIngestService ingest = store.ingest(sites, phases);

    private final UUID tenant = UUID.randomUUID();
    private final UUID program = UUID.randomUUID();
    private final UUID site = UUID.randomUUID();
    private final TenantContext ctx = new TenantContext(tenant, "field-tech");

    @BeforeEach
    void registerSite() {
        Mockito.when(sites.findSite(site)).thenReturn(Optional.of(new SiteRecord(site, tenant, program)));
        Mockito.when(phases.phaseDay(ArgumentMatchers.any(), ArgumentMatchers.any()))
                .thenReturn(OptionalInt.empty());
    }

    @Test
    void firstSubmissionOfNewProgramIsStoredReplicatedAndGetsSegment() {
        SubmissionResult result = ingest.submit(ctx, growth("P001", 1), 0.0, DAY_ONE);

        assertThat(result.derivationStatus()).isEqualTo(DerivationStatus.COMPUTED);
        assertThat(result.syncState()).isEqualTo(SyncState.IN_SYNC);
        Observation stored = store.canonical.get(result.observationId());
        assertThat(stored.observedAt()).isEqualTo(DAY_ONE);
        assertThat(stored.revision()).isEqualTo(1);
        assertThat(stored.derived().stage()).contains(StageCategory.NONE);
        assertThat(store.partitions.find(result.observationId(), program)).isPresent();
        assertThat(store.canonical.lockedSeries()).contains(tenant + "|" + program + "|P001");

        // first write parks in the default segment; the dedicated one is ready right after
        assertThat(store.registry.findByKey(new RoutingKey(tenant, program)))
                .hasValueSatisfying(d -> assertThat(d.status()).isEqualTo(SegmentStatus.ACTIVE));
        store.reconciler().reconcile();
        assertThat(store.partitions.find(result.observationId(), program).orElseThrow().segmentId())
                .isNotEqualTo(SegmentHandle.DEFAULT_SEGMENT_ID);
    }

    @Test
    void growthSeriesDerivesAgainstPreviousPhaseDay() {
        ingest.submit(ctx, growth("P001", 1), 0.0, DAY_ONE);
        SubmissionResult second = ingest.submit(ctx, growth("P001", 2), 20.0, DAY_ONE.plus(Duration.ofDays(1)));

        Observation stored = store.canonical.get(second.observationId());
        assertThat(stored.derived().stage()).contains(StageCategory.MODERATE);
        assertThat(stored.derived().progression().getAsDouble()).isEqualTo(20.0);
        assertThat(stored.derived().velocity().getAsDouble()).isEqualTo(20.0);
    }

    @Test
    void siteWithoutTenantRejectsWithoutWriting() {
        UUID orphan = UUID.randomUUID();
        Mockito.when(sites.findSite(orphan)).thenReturn(Optional.of(new SiteRecord(orphan, null, program)));
        SeriesTemplate template = new SeriesTemplate(orphan, program, null, "P001", ReadingKind.GROWTH_INDEX, 1);

        assertThatThrownBy(() -> ingest.submit(ctx, template, 3.0, DAY_ONE))
                .isInstanceOf(MissingTenantException.class);
        assertThat(store.canonical.size()).isZero();
        assertThat(store.partitions.size()).isZero();
    }

    @Test
    void phaseDayComesFromCalendarWhenNotSubmitted() {
        Mockito.when(phases.phaseDay(program, DAY_ONE)).thenReturn(OptionalInt.of(4));

        SubmissionResult result = ingest.submit(ctx, growth("P001", null), 7.0, DAY_ONE);

        assertThat(store.canonical.get(result.observationId()).phaseDay()).isEqualTo(4);
    }

    @Test
    void unresolvablePhaseDayIsRejected() {
        assertThatThrownBy(() -> ingest.submit(ctx, growth("P001", null), 7.0, DAY_ONE))
                .isInstanceOf(PhaseUnresolvedException.class);
        assertThatThrownBy(() -> ingest.submit(ctx, growth("P001", 0), 7.0, DAY_ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.canonical.size()).isZero();
    }

    @Test
    void nonFiniteReadingIsRejected() {
        assertThatThrownBy(() -> ingest.submit(ctx, growth("P001", 1), Double.NaN, DAY_ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ingest.submit(ctx, growth("P001", 1), 1.0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingReadingStaysPendingUntilAmended() {
        SubmissionResult first = ingest.submit(ctx, growth("P001", 1), null, DAY_ONE);
        SubmissionResult second = ingest.submit(ctx, growth("P001", 2), 12.0, DAY_ONE.plus(Duration.ofDays(1)));

        assertThat(first.derivationStatus()).isEqualTo(DerivationStatus.PENDING_REPROCESSING);
        assertThat(store.partitions.find(first.observationId(), program)).isPresent();
        // predecessor without a reading counts as absent
        assertThat(store.canonical.get(second.observationId()).derived().progression().getAsDouble())
                .isZero();

        SubmissionResult amended = ingest.amend(ctx, first.observationId(), 4.0);

        assertThat(amended.derivationStatus()).isEqualTo(DerivationStatus.COMPUTED);
        assertThat(store.canonical.get(first.observationId()).revision()).isEqualTo(2);
        assertThat(store.canonical.get(second.observationId()).derived().progression().getAsDouble())
                .isEqualTo(8.0);
        assertThat(store.partitions.find(second.observationId(), program).orElseThrow().observation().derived()
                        .progression()
                        .getAsDouble())
                .isEqualTo(8.0);
    }

    @Test
    void amendRederivesSuccessorMomentum() {
        SubmissionResult first = ingest.submit(ctx, depletion("G001", 1), 14.5, DAY_ONE);
        SubmissionResult second = ingest.submit(ctx, depletion("G001", 2), 13.5, DAY_ONE.plus(Duration.ofDays(1)));
        Observation before = store.canonical.get(second.observationId());
        assertThat(before.derived().flowRate().getAsDouble()).isCloseTo(0.75, within(1e-9));
        assertThat(before.derived().momentum().getAsDouble()).isCloseTo(0.25, within(1e-9));
        assertThat(before.derived().trend()).contains(TrendCategory.MODERATE_ACCELERATION);

        ingest.amend(ctx, first.observationId(), 14.0);

        Observation after = store.canonical.get(second.observationId());
        assertThat(after.derived().flowRate().getAsDouble()).isCloseTo(0.75, within(1e-9));
        assertThat(after.derived().momentum().getAsDouble()).isCloseTo(-0.25, within(1e-9));
        assertThat(after.derived().trend()).contains(TrendCategory.MODERATE_DECELERATION);
        assertThat(after.observedAt()).isEqualTo(before.observedAt());
    }

    @Test
    void lateEarlierObservationRestartsDepletionSeries() {
        SubmissionResult second = ingest.submit(ctx, depletion("G002", 2), 13.5, DAY_ONE.plus(Duration.ofDays(1)));
        assertThat(store.canonical.get(second.observationId()).derived().flowRate().getAsDouble())
                .isCloseTo(1.5, within(1e-9));

        ingest.submit(ctx, depletion("G002", 1), 14.5, DAY_ONE);

        Observation rederived = store.canonical.get(second.observationId());
        assertThat(rederived.derived().flowRate().getAsDouble()).isCloseTo(0.75, within(1e-9));
        assertThat(rederived.derived().momentum().getAsDouble()).isCloseTo(0.25, within(1e-9));
        assertThat(store.partitions.find(second.observationId(), program).orElseThrow().observation().derived()
                        .flowRate()
                        .getAsDouble())
                .isCloseTo(0.75, within(1e-9));
    }

    @Test
    void deletingSeriesStartRederivesRemainingRows() {
        SubmissionResult first = ingest.submit(ctx, depletion("G003", 1), 14.5, DAY_ONE);
        SubmissionResult second = ingest.submit(ctx, depletion("G003", 2), 13.5, DAY_ONE.plus(Duration.ofDays(1)));
        SubmissionResult third = ingest.submit(ctx, depletion("G003", 3), 12.0, DAY_ONE.plus(Duration.ofDays(2)));

        ingest.delete(ctx, first.observationId());

        assertThat(store.canonical.get(first.observationId())).isNull();
        assertThat(store.partitions.find(first.observationId(), program)).isEmpty();
        Observation day2 = store.canonical.get(second.observationId());
        Observation day3 = store.canonical.get(third.observationId());
        assertThat(day2.derived().flowRate().getAsDouble()).isCloseTo(1.5, within(1e-9));
        assertThat(day2.derived().momentum().getAsDouble()).isZero();
        assertThat(day3.derived().flowRate().getAsDouble()).isCloseTo(1.5, within(1e-9));
        assertThat(day3.derived().trend()).contains(TrendCategory.STABLE);
    }

    @Test
    void otherTenantCannotAmendOrDelete() {
        SubmissionResult result = ingest.submit(ctx, growth("P001", 1), 3.0, DAY_ONE);
        TenantContext intruder = TenantContext.of(UUID.randomUUID());

        assertThatThrownBy(() -> ingest.amend(intruder, result.observationId(), 9.0))
                .isInstanceOf(ObservationNotFoundException.class);
        assertThatThrownBy(() -> ingest.delete(intruder, result.observationId()))
                .isInstanceOf(ObservationNotFoundException.class);
        assertThat(store.canonical.get(result.observationId()).rawReading()).isEqualTo(3.0);
    }

    @Test
    void replicaFailureKeepsCanonicalWriteAndFlagsOutOfSync() {
        store.partitions.failNextWrites(3);

        SubmissionResult result = ingest.submit(ctx, growth("P001", 1), 3.0, DAY_ONE);

        assertThat(result.syncState()).isEqualTo(SyncState.OUT_OF_SYNC);
        assertThat(store.canonical.get(result.observationId()).syncState()).isEqualTo(SyncState.OUT_OF_SYNC);
        assertThat(store.failures.entries()).hasSize(1);
    }

    @Test
    void deleteFailsWhenReplicaCannotBeRemoved() {
        SubmissionResult result = ingest.submit(ctx, growth("P001", 1), 3.0, DAY_ONE);
        store.partitions.failNextWrites(3);

        assertThatThrownBy(() -> ingest.delete(ctx, result.observationId()))
                .isInstanceOf(SyncPropagationException.class);
    }

    @Test
    void reprocessPendingComputesRowsThatHaveReadings() {
        SubmissionResult result = ingest.submit(ctx, growth("P001", 1), 30.0, DAY_ONE);
        Observation stored = store.canonical.get(result.observationId());
        store.canonical.update(stored.withDerived(
                DerivedMetrics.pending(ReadingKind.GROWTH_INDEX),
                DerivationStatus.PENDING_REPROCESSING));

        int reprocessed = ingest.reprocessPending(10);

        assertThat(reprocessed).isEqualTo(1);
        Observation after = store.canonical.get(result.observationId());
        assertThat(after.derivationStatus()).isEqualTo(DerivationStatus.COMPUTED);
        assertThat(after.derived().stage()).contains(StageCategory.MODERATELY_HIGH);
        assertThat(ingest.reprocessPending(10)).isZero();
    }

    private SeriesTemplate growth(String series, Integer phaseDay) {
        return new SeriesTemplate(site, program, UUID.randomUUID(), series, ReadingKind.GROWTH_INDEX, phaseDay);
    }

    private SeriesTemplate depletion(String series, Integer phaseDay) {
        return new SeriesTemplate(site, program, UUID.randomUUID(), series, ReadingKind.LINEAR_DEPLETION, phaseDay);
    }
}
