package com.sporetrack.core.model;

/** Depletion trend, ordered from fastest acceleration to fastest deceleration. */
public enum TrendCategory {
    CRITICAL_ACCELERATION,
    HIGH_ACCELERATION,
    MODERATE_ACCELERATION,
    STABLE,
    MODERATE_DECELERATION,
    HIGH_DECELERATION,
    CRITICAL_DECELERATION,
    INSUFFICIENT_DATA
}
