package com.sporetrack.service.core.derived;

import com.sporetrack.core.model.DerivedMetrics;
import com.sporetrack.core.model.ReadingKind;

/**
 * Pure derivation of one reading kind's fields. Implementations may assume the current raw reading is present;
 * the pipeline handles the missing-reading case before dispatching.
 */
public interface DerivedComputation {

    ReadingKind kind();

    DerivedMetrics compute(DerivationContext context);
}
