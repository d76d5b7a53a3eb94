package com.sensorstats.aggregate;

import com.sensorstats.model.AggregateResult;

/**
 * Mutable accumulator for count/sum/min/max.
 *
 * Not thread-safe; each aggregation owns its own instance.
 */
class RunningStats {

    private long count;
    private double sum;
    private double mean;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    void update(double value) {
        count++;
        sum += value;
        // stays finite for finite inputs, unlike the sum
        mean += value / count - mean / count;
        if (value < min) min = value;
        if (value > max) max = value;
    }

    /**
     * Produce an immutable snapshot of the current state.
     */
    AggregateResult snapshot() {
        if (count == 0) {
            return AggregateResult.empty();
        }
        double raw = Double.isFinite(sum) ? sum / count : mean;
        // rounding can push the mean just outside [min, max]
        double avg = Math.min(max, Math.max(min, raw));
        return new AggregateResult(count, avg, min, max);
    }
}
