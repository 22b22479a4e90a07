package com.sporetrack.core.model;

/**
 * Ordered growth stages bucketed from a growth index.
 *
 * <p>Each bucket starts at its lower bound (inclusive) and runs up to the next bucket's lower bound.
 * {@link #HAZARDOUS} ends at 85 inclusive; {@link #OVERRUN} is everything above 85.
 */
public enum StageCategory {
    NONE("None", Double.NEGATIVE_INFINITY),
    TRACE("Trace", 1),
    VERY_LOW("Very Low", 6),
    LOW("Low", 11),
    MODERATE("Moderate", 16),
    MODERATELY_HIGH("Moderately High", 26),
    HIGH("High", 36),
    VERY_HIGH("Very High", 51),
    HAZARDOUS("Hazardous", 75),
    OVERRUN("TNTC Overrun", 85);

    private static final double OVERRUN_THRESHOLD = 85.0;

    private final String label;
    private final double lowerBound;

    StageCategory(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    public String label() {
        return label;
    }

    public double lowerBound() {
        return lowerBound;
    }

    /** Total mapping: null, NaN and anything below 1 map to {@link #NONE}. */
    public static StageCategory of(Double reading) {
        if (reading == null || reading.isNaN() || reading < TRACE.lowerBound) {
            return NONE;
        }
        double r = reading;
        if (r > OVERRUN_THRESHOLD) {
            return OVERRUN;
        }
        StageCategory[] stages = values();
        for (int i = HAZARDOUS.ordinal(); i > NONE.ordinal(); i--) {
            if (r >= stages[i].lowerBound) {
                return stages[i];
            }
        }
        return NONE;
    }
}
