package com.sensorstats.model;

import java.time.Instant;

/**
 * Normalized query criteria. A {@code null} field means "no restriction".
 * Record equality is filter equivalence and is the basis of the cache key.
 *
 * @param location Canonical location, or null
 * @param sensor   Canonical sensor type, or null
 * @param start    Inclusive lower bound, or null
 * @param end      Inclusive upper bound, or null
 */
public record QueryFilter(String location, String sensor, Instant start, Instant end) {

    private static final QueryFilter UNRESTRICTED = new QueryFilter(null, null, null, null);

    public static QueryFilter unrestricted() {
        return UNRESTRICTED;
    }
}
