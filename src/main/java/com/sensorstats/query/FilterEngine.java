package com.sensorstats.query;

import com.sensorstats.model.QueryFilter;
import com.sensorstats.model.SensorReading;
import com.sensorstats.store.Dataset;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Selects the readings of a dataset that satisfy every supplied criterion of a {@link QueryFilter}.
 * Absent criteria are skipped; time bounds are both inclusive.
 */
@Component
public class FilterEngine {

    /**
     * @return unmodifiable list of matching readings, in dataset order
     */
    public List<SensorReading> apply(Dataset dataset, QueryFilter filter) {
        return dataset.readings().stream()
                .filter(predicateFor(filter))
                .toList();
    }

    static Predicate<SensorReading> predicateFor(QueryFilter filter) {
        Predicate<SensorReading> predicate = reading -> true;
        if (filter.location() != null) {
            predicate = predicate.and(reading -> filter.location().equals(reading.location()));
        }
        if (filter.sensor() != null) {
            predicate = predicate.and(reading -> filter.sensor().equals(reading.sensor()));
        }
        if (filter.start() != null) {
            predicate = predicate.and(reading -> !reading.timestamp().isBefore(filter.start()));
        }
        if (filter.end() != null) {
            predicate = predicate.and(reading -> !reading.timestamp().isAfter(filter.end()));
        }
        return predicate;
    }
}
