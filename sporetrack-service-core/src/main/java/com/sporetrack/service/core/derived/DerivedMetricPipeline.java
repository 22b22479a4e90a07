package com.sporetrack.service.core.derived;

import com.sporetrack.core.model.DerivedMetrics;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.ReadingKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the derived computation for an observation's reading kind in one pass. Invoked by the write path inside
 * the observation's transaction, never from storage internals.
 */
@Component
public class DerivedMetricPipeline {

    private static final Logger log = LoggerFactory.getLogger(DerivedMetricPipeline.class);

    private final Map<ReadingKind, DerivedComputation> computations = new EnumMap<>(ReadingKind.class);

    public DerivedMetricPipeline(List<DerivedComputation> computations) {
        for (DerivedComputation computation : computations) {
            DerivedComputation previous = this.computations.put(computation.kind(), computation);
            if (previous != null) {
                throw new IllegalStateException("Duplicate derived computation for " + computation.kind());
            }
        }
    }

    public DerivationOutcome derive(DerivationContext context) {
        Observation current = context.current();
        if (current.rawReading() == null || current.rawReading().isNaN()) {
            return skip(current, "raw reading missing");
        }
        DerivedComputation computation = computations.get(current.readingKind());
        if (computation == null) {
            return skip(current, "no computation registered for " + current.readingKind());
        }
        DerivedMetrics metrics = computation.compute(context);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Derived fields for observation {} series={} phaseDay={}: {}",
                    current.observationId(),
                    current.seriesCode(),
                    current.phaseDay(),
                    metrics);
        }
        return DerivationOutcome.computed(metrics);
    }

    private DerivationOutcome skip(Observation current, String reason) {
        log.warn(
                "Derived computation skipped for observation {} (series={}, program={}): {}",
                current.observationId(),
                current.seriesCode(),
                current.programId(),
                reason);
        return DerivationOutcome.skipped(DerivedMetrics.pending(current.readingKind()), reason);
    }
}
