package com.sensorstats.model;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;

/**
 * Parses ISO-8601 style timestamps into UTC-anchored instants.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code 2025-01-05}</li>
 *   <li>{@code 2025-01-05T10:15}, {@code 2025-01-05T10:15:30.250} (a single space may replace the {@code T})</li>
 *   <li>any of the date-time forms followed by an offset: {@code Z}, {@code +02:00}, {@code +0200}, {@code +02}</li>
 * </ul>
 * Values without an offset are interpreted in the configured dataset zone.
 *
 * <p>The same instance parses dataset timestamps and query bounds, so both sides of a
 * range comparison share one time representation.
 */
@Component
public class TimestampParser {

    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HH:MM:ss", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH", "Z")
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private final ZoneId zone;

    public TimestampParser(@Value("${sensorstats.dataset.zone:UTC}") ZoneId zone) {
        this.zone = zone;
    }

    /**
     * @throws DateTimeParseException if the text matches none of the accepted shapes
     */
    public ParsedTimestamp parse(String text) {
        if (text == null) {
            throw new DateTimeParseException("Timestamp is missing", "", 0);
        }
        String candidate = text.trim();
        if (candidate.length() > 10 && candidate.charAt(10) == ' ') {
            candidate = candidate.substring(0, 10) + 'T' + candidate.substring(11).trim();
        }

        TemporalAccessor parsed = FORMATTER.parseBest(candidate,
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);

        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return new ParsedTimestamp(offsetDateTime.toInstant(), false);
        }
        if (parsed instanceof LocalDateTime localDateTime) {
            return new ParsedTimestamp(localDateTime.atZone(zone).toInstant(), false);
        }
        return new ParsedTimestamp(((LocalDate) parsed).atStartOfDay(zone).toInstant(), true);
    }

    /**
     * Last instant of the calendar day containing {@code dayStart}, in the dataset zone.
     */
    public Instant endOfDay(Instant dayStart) {
        LocalDate day = dayStart.atZone(zone).toLocalDate();
        return day.plusDays(1).atStartOfDay(zone).toInstant().minusNanos(1);
    }

    public ZoneId getZone() {
        return zone;
    }
}
