package com.sporetrack.core.model;

import java.util.OptionalDouble;

/** Growth-series trend bucketed from growth velocity (index points per day). */
public enum GrowthTrend {
    RAPID_GROWTH,
    STRONG_GROWTH,
    MODERATE_GROWTH,
    STABLE_GROWTH,
    STAGNANT,
    MODERATE_DECLINE,
    SIGNIFICANT_DECLINE,
    INSUFFICIENT_DATA;

    public static GrowthTrend of(OptionalDouble velocity) {
        if (velocity == null || velocity.isEmpty() || Double.isNaN(velocity.getAsDouble())) {
            return INSUFFICIENT_DATA;
        }
        double v = velocity.getAsDouble();
        if (v > 5.0) return RAPID_GROWTH;
        if (v > 2.0) return STRONG_GROWTH;
        if (v > 0.5) return MODERATE_GROWTH;
        if (v > 0.0) return STABLE_GROWTH;
        if (v == 0.0) return STAGNANT;
        if (v > -2.0) return MODERATE_DECLINE;
        return SIGNIFICANT_DECLINE;
    }
}
