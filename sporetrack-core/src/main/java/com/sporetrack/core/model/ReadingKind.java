package com.sporetrack.core.model;

/** The single raw measurement an observation carries, which also selects its derived computation. */
public enum ReadingKind {
    /** Petri-dish growth index, in [0, ∞). */
    GROWTH_INDEX,
    /** Gasifier linear reading of remaining material, in [0, max material]. */
    LINEAR_DEPLETION
}
