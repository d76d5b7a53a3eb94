package com.sensorstats.aggregate;

import com.sensorstats.model.AggregateResult;
import com.sensorstats.model.SensorReading;
import org.springframework.stereotype.Component;

/**
 * Reduces a set of readings to an {@link AggregateResult}.
 *
 * <p>Only readings with a present value are counted. Pure: no side effects, and the
 * same input always produces the same result.
 */
@Component
public class StatsAggregator {

    public AggregateResult aggregate(Iterable<SensorReading> readings) {
        RunningStats stats = new RunningStats();
        for (SensorReading reading : readings) {
            if (reading.hasValue()) {
                stats.update(reading.value());
            }
        }
        return stats.snapshot();
    }
}
