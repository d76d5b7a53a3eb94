package com.sensorstats.controller;

import com.sensorstats.model.AggregateResult;

/**
 * Response body of {@code GET /stats}.
 *
 * <pre>
 * {
 *   "stats": { "count": 2, "avg": 15.0, "min": 10.0, "max": 20.0 }
 * }
 * </pre>
 *
 * {@code avg}, {@code min} and {@code max} serialize as {@code null} when nothing matched.
 */
public record StatsResponse(AggregateResult stats) {
}
