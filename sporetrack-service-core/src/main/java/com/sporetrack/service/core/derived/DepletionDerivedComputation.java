package com.sporetrack.service.core.derived;

import com.sporetrack.core.model.DerivedMetrics;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.TrendCategory;
import com.sporetrack.service.core.config.SporetrackProperties;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Depletion series: flow rate, momentum, trend and forecasted exhaustion. */
@Component
public class DepletionDerivedComputation implements DerivedComputation {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final double maxMaterial;
    private final TrendClassifier trendClassifier;

    @Autowired
    public DepletionDerivedComputation(SporetrackProperties properties) {
        this(properties.getPipeline().getMaxMaterial(), properties.getPipeline().getBenchmarkRate());
    }

    public DepletionDerivedComputation(double maxMaterial, double benchmarkRate) {
        this.maxMaterial = maxMaterial;
        this.trendClassifier = new TrendClassifier(benchmarkRate);
    }

    @Override
    public ReadingKind kind() {
        return ReadingKind.LINEAR_DEPLETION;
    }

    @Override
    public DerivedMetrics compute(DerivationContext context) {
        Observation current = context.current();
        double reading = current.rawReading();

        Instant start = context.seriesStartAt()
                .filter(s -> !s.isAfter(current.observedAt()))
                .orElse(current.observedAt());
        long daysSinceStart = Math.max(1L, context.calendarDaysBetween(start, current.observedAt()) + 1);
        double flowRate = (maxMaterial - reading) / daysSinceStart;

        OptionalDouble momentum = OptionalDouble.of(context.predecessor()
                .map(p -> p.derived().flowRate())
                .filter(OptionalDouble::isPresent)
                .map(previous -> flowRate - previous.getAsDouble())
                .orElse(0.0));

        OptionalDouble flow = OptionalDouble.of(flowRate);
        TrendCategory trend = trendClassifier.classify(momentum, flow);
        return DerivedMetrics.depletion(flow, momentum, trend, forecastExhaustion(current, reading, flowRate));
    }

    /** Remaining material over the current rate, added to capture time. Undefined for a non-positive rate. */
    Optional<Instant> forecastExhaustion(Observation current, double reading, double flowRate) {
        if (!(flowRate > 0) || Double.isNaN(reading)) {
            return Optional.empty();
        }
        double days = Math.max(0.0, reading) / flowRate;
        double millis = days * MILLIS_PER_DAY;
        if (!Double.isFinite(millis) || millis > Long.MAX_VALUE) {
            return Optional.empty();
        }
        try {
            return Optional.of(current.observedAt().plusMillis(Math.round(millis)));
        } catch (DateTimeException | ArithmeticException ex) {
            return Optional.empty();
        }
    }
}
