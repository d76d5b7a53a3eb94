package com.sensorstats.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable, normalized sensor reading.
 *
 * @param timestamp UTC-anchored instant of the reading
 * @param location  Canonical location (trimmed, lower-cased, possibly empty)
 * @param sensor    Canonical sensor type (trimmed, lower-cased, possibly empty)
 * @param value     Numeric reading, or {@code null} when the source value was missing or not a number
 */
public record SensorReading(Instant timestamp, String location, String sensor, Double value) {

    public SensorReading {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(sensor, "sensor");
        if (value != null && !Double.isFinite(value)) {
            throw new IllegalArgumentException("Value must be finite when present");
        }
    }

    /**
     * Whether this reading takes part in aggregation.
     */
    public boolean hasValue() {
        return value != null;
    }
}
