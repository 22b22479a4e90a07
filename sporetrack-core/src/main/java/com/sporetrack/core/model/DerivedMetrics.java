package com.sporetrack.core.model;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Derived fields of an observation. Every field is explicitly optional: an empty value means
 * "undefined", never a silently propagated null. Growth series populate stage/progression/velocity/growthTrend,
 * depletion series populate flowRate/momentum/trend/forecastedExhaustionAt.
 */
public record DerivedMetrics(
        Optional<StageCategory> stage,
        OptionalDouble progression,
        OptionalDouble velocity,
        Optional<GrowthTrend> growthTrend,
        OptionalDouble flowRate,
        OptionalDouble momentum,
        Optional<TrendCategory> trend,
        Optional<Instant> forecastedExhaustionAt) {

    private static final DerivedMetrics UNDEFINED = new DerivedMetrics(
            Optional.empty(),
            OptionalDouble.empty(),
            OptionalDouble.empty(),
            Optional.empty(),
            OptionalDouble.empty(),
            OptionalDouble.empty(),
            Optional.empty(),
            Optional.empty());

    public static DerivedMetrics undefined() {
        return UNDEFINED;
    }

    /** Placeholder stored while an observation waits for reprocessing. Only the trend reports the gap. */
    public static DerivedMetrics pending(ReadingKind kind) {
        if (kind == ReadingKind.LINEAR_DEPLETION) {
            return UNDEFINED.withTrend(TrendCategory.INSUFFICIENT_DATA);
        }
        return growth(null, OptionalDouble.empty(), OptionalDouble.empty(), GrowthTrend.INSUFFICIENT_DATA);
    }

    public static DerivedMetrics growth(
            StageCategory stage, OptionalDouble progression, OptionalDouble velocity, GrowthTrend growthTrend) {
        return new DerivedMetrics(
                Optional.ofNullable(stage),
                progression,
                velocity,
                Optional.ofNullable(growthTrend),
                OptionalDouble.empty(),
                OptionalDouble.empty(),
                Optional.empty(),
                Optional.empty());
    }

    public static DerivedMetrics depletion(
            OptionalDouble flowRate, OptionalDouble momentum, TrendCategory trend, Optional<Instant> forecast) {
        return new DerivedMetrics(
                Optional.empty(),
                OptionalDouble.empty(),
                OptionalDouble.empty(),
                Optional.empty(),
                flowRate,
                momentum,
                Optional.ofNullable(trend),
                forecast);
    }

    private DerivedMetrics withTrend(TrendCategory value) {
        return new DerivedMetrics(
                stage, progression, velocity, growthTrend, flowRate, momentum, Optional.of(value), forecastedExhaustionAt);
    }
}
