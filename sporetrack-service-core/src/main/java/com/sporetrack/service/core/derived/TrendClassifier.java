package com.sporetrack.service.core.derived;

import com.sporetrack.core.model.TrendCategory;
import java.util.OptionalDouble;

/**
 * Classifies depletion momentum against the benchmark rate. Rules are evaluated in a fixed order and the first
 * match wins, so every input maps to exactly one category.
 */
public final class TrendClassifier {

    private final double benchmarkRate;

    public TrendClassifier(double benchmarkRate) {
        if (!(benchmarkRate > 0)) {
            throw new IllegalArgumentException("benchmarkRate must be positive");
        }
        this.benchmarkRate = benchmarkRate;
    }

    public TrendCategory classify(OptionalDouble momentum, OptionalDouble flowRate) {
        if (momentum.isEmpty() || flowRate.isEmpty()) {
            return TrendCategory.INSUFFICIENT_DATA;
        }
        double m = momentum.getAsDouble();
        double ratio = flowRate.getAsDouble() / benchmarkRate;
        if (Double.isNaN(m) || Double.isNaN(ratio)) {
            return TrendCategory.INSUFFICIENT_DATA;
        }
        if (m > 0.5 && ratio > 1.5) return TrendCategory.CRITICAL_ACCELERATION;
        if (m > 0.5 && ratio > 1.0) return TrendCategory.HIGH_ACCELERATION;
        if (m > 0.1) return TrendCategory.MODERATE_ACCELERATION;
        if (m >= -0.1) return TrendCategory.STABLE;
        if (m > -0.5) return TrendCategory.MODERATE_DECELERATION;
        if (m > -1.0 || ratio < 0.5) return TrendCategory.HIGH_DECELERATION;
        return TrendCategory.CRITICAL_DECELERATION;
    }
}
