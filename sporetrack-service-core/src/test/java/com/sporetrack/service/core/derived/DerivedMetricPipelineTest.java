package com.sporetrack.service.core.derived;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sporetrack.core.model.DerivationStatus;
import com.sporetrack.core.model.DerivedMetrics;
import com.sporetrack.core.model.GrowthTrend;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.StageCategory;
import com.sporetrack.core.model.TrendCategory;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

class DerivedMetricPipelineTest {

    private static final Offset<Double> EPS = Offset.offset(1e-9);
    private static final UUID TENANT = UUID.randomUUID();
    private static final UUID PROGRAM = UUID.randomUUID();
    private static final Instant DAY_ZERO = Instant.parse("2025-04-01T09:00:00Z");

    private final DerivedMetricPipeline pipeline = new DerivedMetricPipeline(
            List.of(new GrowthDerivedComputation(), new DepletionDerivedComputation(15.0, 1.0714)));

    @Test
    void depletionSeriesComputesFlowMomentumAndTrend() {
        Observation first = observation("G001", ReadingKind.LINEAR_DEPLETION, 1, DAY_ZERO, 14.5);
        DerivationOutcome firstOutcome = pipeline.derive(context(first, null, DAY_ZERO));
        Observation firstFinal = first.withDerived(firstOutcome.metrics(), firstOutcome.status());

        assertThat(firstOutcome.status()).isEqualTo(DerivationStatus.COMPUTED);
        assertThat(firstOutcome.metrics().flowRate().getAsDouble()).isCloseTo(0.5, EPS);
        assertThat(firstOutcome.metrics().momentum().getAsDouble()).isZero();

        Instant dayOne = DAY_ZERO.plus(1, ChronoUnit.DAYS);
        Observation second = observation("G001", ReadingKind.LINEAR_DEPLETION, 2, dayOne, 13.5);
        DerivedMetrics metrics = pipeline.derive(context(second, firstFinal, DAY_ZERO)).metrics();

        assertThat(metrics.flowRate().getAsDouble()).isCloseTo(0.75, EPS);
        assertThat(metrics.momentum().getAsDouble()).isCloseTo(0.25, EPS);
        assertThat(metrics.trend()).contains(TrendCategory.MODERATE_ACCELERATION);
        assertThat(metrics.stage()).isEmpty();
        assertThat(metrics.growthTrend()).isEmpty();
    }

    @Test
    void growthSeriesComputesStageProgressionAndVelocity() {
        Observation first = observation("P001", ReadingKind.GROWTH_INDEX, 1, DAY_ZERO, 0.0);
        DerivedMetrics firstMetrics = pipeline.derive(context(first, null, DAY_ZERO)).metrics();

        assertThat(firstMetrics.stage()).contains(StageCategory.NONE);
        assertThat(firstMetrics.progression().getAsDouble()).isZero();
        assertThat(firstMetrics.velocity().getAsDouble()).isZero();

        Observation firstFinal = first.withDerived(firstMetrics, DerivationStatus.COMPUTED);
        Observation second =
                observation("P001", ReadingKind.GROWTH_INDEX, 2, DAY_ZERO.plus(1, ChronoUnit.DAYS), 20.0);
        DerivedMetrics metrics = pipeline.derive(context(second, firstFinal, DAY_ZERO)).metrics();

        assertThat(metrics.stage()).contains(StageCategory.MODERATE);
        assertThat(metrics.progression().getAsDouble()).isCloseTo(20.0, EPS);
        assertThat(metrics.velocity().getAsDouble()).isCloseTo(20.0, EPS);
        assertThat(metrics.growthTrend()).contains(GrowthTrend.RAPID_GROWTH);
        assertThat(metrics.flowRate()).isEmpty();
    }

    @Test
    void progressionOnFirstPhaseDayIsAlwaysZero() {
        Observation earlier = observation("P002", ReadingKind.GROWTH_INDEX, 1, DAY_ZERO, 5.0)
                .withDerived(DerivedMetrics.undefined(), DerivationStatus.COMPUTED);
        for (double reading : new double[] {0.0, 3.5, 42.0, 1000.0}) {
            Observation first = observation("P002", ReadingKind.GROWTH_INDEX, 1, DAY_ZERO, reading);
            // a same-series row handed in as predecessor is ignored on phase day 1
            DerivedMetrics metrics = pipeline.derive(context(first, earlier, DAY_ZERO)).metrics();
            assertThat(metrics.progression().getAsDouble()).isZero();
            assertThat(metrics.velocity().getAsDouble()).isCloseTo(reading, EPS);
        }
    }

    @Test
    void velocityDividesByElapsedCalendarDays() {
        Observation previous = observation("P003", ReadingKind.GROWTH_INDEX, 3, DAY_ZERO, 10.0);
        Observation current =
                observation("P003", ReadingKind.GROWTH_INDEX, 4, DAY_ZERO.plus(4, ChronoUnit.DAYS), 30.0);

        DerivedMetrics metrics = pipeline.derive(context(current, previous, DAY_ZERO)).metrics();

        assertThat(metrics.progression().getAsDouble()).isCloseTo(20.0, EPS);
        assertThat(metrics.velocity().getAsDouble()).isCloseTo(5.0, EPS);
        assertThat(metrics.growthTrend()).contains(GrowthTrend.STRONG_GROWTH);
    }

    @Test
    void missingReadingSkipsWithPendingPlaceholder() {
        Observation growth = observation("P004", ReadingKind.GROWTH_INDEX, 2, DAY_ZERO, null);
        DerivationOutcome outcome = pipeline.derive(context(growth, null, DAY_ZERO));

        assertThat(outcome.isSkipped()).isTrue();
        assertThat(outcome.status()).isEqualTo(DerivationStatus.PENDING_REPROCESSING);
        assertThat(outcome.skipReason()).contains("raw reading");
        assertThat(outcome.metrics().growthTrend()).contains(GrowthTrend.INSUFFICIENT_DATA);
        assertThat(outcome.metrics().progression()).isEmpty();

        Observation depletion = observation("G004", ReadingKind.LINEAR_DEPLETION, 2, DAY_ZERO, null);
        DerivedMetrics placeholder = pipeline.derive(context(depletion, null, DAY_ZERO)).metrics();
        assertThat(placeholder.trend()).contains(TrendCategory.INSUFFICIENT_DATA);
        assertThat(placeholder.flowRate()).isEmpty();
        assertThat(placeholder.forecastedExhaustionAt()).isEmpty();
    }

    @Test
    void predecessorWithoutReadingCountsAsAbsent() {
        Observation previous = observation("P005", ReadingKind.GROWTH_INDEX, 1, DAY_ZERO, null);
        Observation current =
                observation("P005", ReadingKind.GROWTH_INDEX, 2, DAY_ZERO.plus(1, ChronoUnit.DAYS), 12.0);

        DerivedMetrics metrics = pipeline.derive(context(current, previous, DAY_ZERO)).metrics();

        assertThat(metrics.progression().getAsDouble()).isZero();
        assertThat(metrics.velocity().getAsDouble()).isCloseTo(12.0, EPS);
    }

    @Test
    void momentumIsZeroWhenPredecessorFlowUndefined() {
        Observation previous = observation("G006", ReadingKind.LINEAR_DEPLETION, 1, DAY_ZERO, null)
                .withDerived(DerivedMetrics.pending(ReadingKind.LINEAR_DEPLETION), DerivationStatus.PENDING_REPROCESSING);
        Observation current =
                observation("G006", ReadingKind.LINEAR_DEPLETION, 2, DAY_ZERO.plus(1, ChronoUnit.DAYS), 12.0);

        DerivedMetrics metrics = pipeline.derive(context(current, previous, DAY_ZERO)).metrics();

        assertThat(metrics.momentum().getAsDouble()).isZero();
        assertThat(metrics.trend()).contains(TrendCategory.STABLE);
    }

    @Test
    void duplicateComputationsAreRejected() {
        assertThatThrownBy(() -> new DerivedMetricPipeline(
                        List.of(new GrowthDerivedComputation(), new GrowthDerivedComputation())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GROWTH_INDEX");
    }

    private static DerivationContext context(Observation current, Observation predecessor, Instant seriesStart) {
        return new DerivationContext(
                current, Optional.ofNullable(predecessor), Optional.of(seriesStart), ZoneOffset.UTC);
    }

    private static Observation observation(
            String series, ReadingKind kind, int phaseDay, Instant observedAt, Double reading) {
        return Observation.builder()
                .observationId(UUID.randomUUID())
                .tenantId(TENANT)
                .programId(PROGRAM)
                .seriesCode(series)
                .readingKind(kind)
                .phaseDay(phaseDay)
                .observedAt(observedAt)
                .rawReading(reading)
                .build();
    }
}
