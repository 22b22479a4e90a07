package com.sporetrack.core.model;

public enum DerivationStatus {
    COMPUTED,
    /** The pipeline was skipped (missing raw reading); derived fields are undefined until reprocessed. */
    PENDING_REPROCESSING
}
