package com.sporetrack.service.core.derived;

import com.sporetrack.core.model.DerivationStatus;
import com.sporetrack.core.model.DerivedMetrics;
import java.util.Objects;

/** Either a full set of derived fields or the "computation skipped" signal with its reason. */
public final class DerivationOutcome {

    private final DerivedMetrics metrics;
    private final String skipReason;

    private DerivationOutcome(DerivedMetrics metrics, String skipReason) {
        this.metrics = metrics;
        this.skipReason = skipReason;
    }

    public static DerivationOutcome computed(DerivedMetrics metrics) {
        return new DerivationOutcome(Objects.requireNonNull(metrics, "metrics"), null);
    }

    public static DerivationOutcome skipped(DerivedMetrics placeholder, String reason) {
        return new DerivationOutcome(placeholder, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public String skipReason() {
        return skipReason;
    }

    public DerivedMetrics metrics() {
        return metrics;
    }

    public DerivationStatus status() {
        return isSkipped() ? DerivationStatus.PENDING_REPROCESSING : DerivationStatus.COMPUTED;
    }
}
