package com.sensorstats.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sensorstats.model.FieldNormalizer;
import com.sensorstats.model.ParsedTimestamp;
import com.sensorstats.model.QueryFilter;
import com.sensorstats.model.TimestampParser;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns raw query parameters into a normalized {@link QueryFilter} and derives its {@link CacheKey}.
 *
 * <p>Normalization per field:
 * <ul>
 *   <li>location, sensor: {@link FieldNormalizer#canonicalOrNull(String)}</li>
 *   <li>start: parsed instant; a bare date means the start of that day</li>
 *   <li>end: parsed instant; a bare date means the last instant of that day</li>
 * </ul>
 * Blank date parameters are absent. Textually different but equivalent inputs
 * ({@code "  Lab-1 "} vs {@code "lab-1"}, {@code 2025-01-03} vs {@code 2025-01-03T00:00:00Z}) yield equal keys.
 */
@Component
public class CacheKeyBuilder {

    static final String START_PARAM = "start_date";
    static final String END_PARAM = "end_date";

    private final TimestampParser timestampParser;
    private final ObjectMapper canonicalMapper = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public CacheKeyBuilder(TimestampParser timestampParser) {
        this.timestampParser = timestampParser;
    }

    /**
     * @throws InvalidDateException if a non-blank start or end cannot be parsed
     */
    public QueryFilter buildFilter(String rawLocation, String rawSensor, String rawStart, String rawEnd) {
        Instant start = null;
        ParsedTimestamp parsedStart = parseBound(START_PARAM, rawStart);
        if (parsedStart != null) {
            start = parsedStart.instant();
        }

        Instant end = null;
        ParsedTimestamp parsedEnd = parseBound(END_PARAM, rawEnd);
        if (parsedEnd != null) {
            end = parsedEnd.dateOnly() ? timestampParser.endOfDay(parsedEnd.instant()) : parsedEnd.instant();
        }

        return new QueryFilter(
                FieldNormalizer.canonicalOrNull(rawLocation),
                FieldNormalizer.canonicalOrNull(rawSensor),
                start,
                end);
    }

    /**
     * SHA-256 over {@link #canonicalForm(QueryFilter)}.
     */
    public CacheKey keyFor(QueryFilter filter) {
        byte[] payload = canonicalForm(filter).getBytes(StandardCharsets.UTF_8);
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(payload);
            return new CacheKey(HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * JSON object with the four filter fields in sorted order, explicit nulls,
     * and instants in ISO-8601 UTC form.
     */
    String canonicalForm(QueryFilter filter) {
        Map<String, String> canonical = new TreeMap<>();
        canonical.put("location", filter.location());
        canonical.put("sensor", filter.sensor());
        canonical.put("start", filter.start() == null ? null : filter.start().toString());
        canonical.put("end", filter.end() == null ? null : filter.end().toString());
        try {
            return canonicalMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + filter, e);
        }
    }

    private ParsedTimestamp parseBound(String parameter, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return timestampParser.parse(raw);
        } catch (DateTimeParseException e) {
            throw new InvalidDateException(parameter, raw, e);
        }
    }
}
