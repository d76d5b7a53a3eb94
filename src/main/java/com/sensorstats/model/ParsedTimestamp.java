package com.sensorstats.model;

import java.time.Instant;

/**
 * Result of parsing a timestamp string.
 *
 * @param instant  Parsed instant; date-only inputs resolve to the start of that day
 * @param dateOnly True when the input carried no time-of-day component
 */
public record ParsedTimestamp(Instant instant, boolean dateOnly) {
}
