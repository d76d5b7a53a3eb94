package com.sensorstats.store;

import com.sensorstats.model.SensorReading;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Immutable snapshot of the loaded readings, in source order.
 *
 * @param readings     Normalized readings
 * @param sourceMarker Last-modified marker of the source at load time, or -1 if unknown
 * @param loadedAt     When the snapshot was built
 * @param droppedRows  Rows skipped because their timestamp could not be parsed
 */
public record Dataset(List<SensorReading> readings, long sourceMarker, Instant loadedAt, int droppedRows) {

    public Dataset {
        readings = List.copyOf(readings);
        if (droppedRows < 0) throw new IllegalArgumentException("Dropped rows must be non-negative");
    }

    public int size() {
        return readings.size();
    }

    public long readingsWithValue() {
        return readings.stream().filter(SensorReading::hasValue).count();
    }

    public List<String> distinctLocations() {
        return distinct(SensorReading::location);
    }

    public List<String> distinctSensors() {
        return distinct(SensorReading::sensor);
    }

    private List<String> distinct(Function<SensorReading, String> field) {
        return readings.stream()
                .map(field)
                .filter(s -> !s.isEmpty())
                .distinct()
                .sorted()
                .toList();
    }
}
