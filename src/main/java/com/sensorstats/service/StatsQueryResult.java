package com.sensorstats.service;

import com.sensorstats.model.AggregateResult;

/**
 * @param stats    Aggregate for the query
 * @param cacheHit True when served from the result cache
 */
public record StatsQueryResult(AggregateResult stats, boolean cacheHit) {
}
