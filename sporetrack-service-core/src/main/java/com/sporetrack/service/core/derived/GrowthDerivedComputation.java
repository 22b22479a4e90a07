package com.sporetrack.service.core.derived;

import com.sporetrack.core.model.DerivedMetrics;
import com.sporetrack.core.model.GrowthTrend;
import com.sporetrack.core.model.Observation;
import com.sporetrack.core.model.ReadingKind;
import com.sporetrack.core.model.StageCategory;
import java.util.Optional;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/** Growth-index series: stage, progression, velocity and growth trend. */
@Component
public class GrowthDerivedComputation implements DerivedComputation {

    @Override
    public ReadingKind kind() {
        return ReadingKind.GROWTH_INDEX;
    }

    @Override
    public DerivedMetrics compute(DerivationContext context) {
        Observation current = context.current();
        double reading = current.rawReading();
        StageCategory stage = StageCategory.of(reading);

        Optional<Observation> predecessor =
                context.predecessor().filter(p -> p.rawReading() != null);

        double progression;
        double velocity;
        if (predecessor.isPresent()) {
            Observation previous = predecessor.get();
            progression = reading - previous.rawReading();
            long elapsed = context.calendarDaysBetween(previous.observedAt(), current.observedAt());
            velocity = progression / Math.max(1L, elapsed);
        } else {
            // baseline: no delta, velocity is the reading over one day
            progression = 0.0;
            velocity = reading;
        }
        OptionalDouble velocityValue = OptionalDouble.of(velocity);
        return DerivedMetrics.growth(
                stage, OptionalDouble.of(progression), velocityValue, GrowthTrend.of(velocityValue));
    }
}
