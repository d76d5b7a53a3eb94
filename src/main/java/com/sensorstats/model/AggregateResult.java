package com.sensorstats.model;

/**
 * Summary of the present values in a set of readings.
 *
 * <p>{@code avg}, {@code min} and {@code max} are {@code null} exactly when {@code count} is zero,
 * so "no data" is never confused with a value of zero.
 *
 * @param count Number of readings with a present value
 * @param avg   Arithmetic mean
 * @param min   Smallest value
 * @param max   Largest value
 */
public record AggregateResult(long count, Double avg, Double min, Double max) {

    private static final AggregateResult EMPTY = new AggregateResult(0, null, null, null);

    public AggregateResult {
        if (count < 0) throw new IllegalArgumentException("Count must be non-negative");
        boolean absent = avg == null && min == null && max == null;
        boolean present = avg != null && min != null && max != null;
        if (count == 0 && !absent) throw new IllegalArgumentException("Empty result must not carry avg/min/max");
        if (count > 0 && !present) throw new IllegalArgumentException("Non-empty result must carry avg/min/max");
        if (count > 0 && (min > avg || avg > max)) throw new IllegalArgumentException("Expected min <= avg <= max");
    }

    public static AggregateResult empty() {
        return EMPTY;
    }
}
