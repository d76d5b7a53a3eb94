package com.sensorstats.store;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.sensorstats.model.FieldNormalizer;
import com.sensorstats.model.SensorReading;
import com.sensorstats.model.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads a CSV source into a normalized {@link Dataset}.
 *
 * <p>The header row is required and must name a {@code timestamp} and a {@code value} column
 * (matched after trimming, case-insensitively). {@code location} and {@code sensor} are optional
 * and default to the empty string.
 *
 * <p>Per-row problems never fail the load:
 * <ul>
 *   <li>an unparseable timestamp drops the row</li>
 *   <li>an unparseable, NaN or infinite value keeps the row with no value</li>
 * </ul>
 */
@Component
public class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    static final String TIMESTAMP = "timestamp";
    static final String VALUE = "value";
    static final String LOCATION = "location";
    static final String SENSOR = "sensor";

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final CsvMapper mapper = new CsvMapper();
    private final TimestampParser timestampParser;

    public DatasetLoader(TimestampParser timestampParser) {
        this.timestampParser = timestampParser;
    }

    /**
     * Load and normalize every row of the source.
     *
     * @throws DataLoadException if the source is missing, unreadable, empty or lacks required columns
     */
    public Dataset load(Resource source) {
        if (!source.exists()) {
            throw new DataLoadException("Dataset not found: " + source.getDescription());
        }
        long marker = lastModified(source);

        try (Reader reader = new InputStreamReader(source.getInputStream(), StandardCharsets.UTF_8);
             MappingIterator<String[]> rows = mapper.readerFor(String[].class)
                     .with(CsvParser.Feature.WRAP_AS_ARRAY)
                     .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                     .readValues(reader)) {

            if (!rows.hasNextValue()) {
                throw new DataLoadException("Dataset has no header row: " + source.getDescription());
            }
            Map<String, Integer> columns = columnIndex(rows.nextValue());
            requireColumn(columns, TIMESTAMP, source);
            requireColumn(columns, VALUE, source);

            int timestampColumn = columns.get(TIMESTAMP);
            int valueColumn = columns.get(VALUE);
            int locationColumn = columns.getOrDefault(LOCATION, -1);
            int sensorColumn = columns.getOrDefault(SENSOR, -1);

            List<SensorReading> readings = new ArrayList<>();
            int dropped = 0;
            int line = 1;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                line++;

                String rawTimestamp = cell(row, timestampColumn);
                Instant timestamp;
                try {
                    timestamp = timestampParser.parse(rawTimestamp).instant();
                } catch (DateTimeParseException e) {
                    dropped++;
                    log.debug("Dropping row {}: unparseable timestamp '{}'", line, rawTimestamp);
                    continue;
                }

                readings.add(new SensorReading(
                        timestamp,
                        FieldNormalizer.canonical(cell(row, locationColumn)),
                        FieldNormalizer.canonical(cell(row, sensorColumn)),
                        parseValue(cell(row, valueColumn))));
            }

            if (dropped > 0) {
                log.warn("Dropped {} rows with unparseable timestamps from {}", dropped, source.getDescription());
            }
            Dataset dataset = new Dataset(readings, marker, Instant.now(), dropped);
            log.info("Loaded {} readings ({} with values) from {}",
                    dataset.size(), dataset.readingsWithValue(), source.getDescription());
            return dataset;
        } catch (IOException e) {
            throw new DataLoadException("Failed to read dataset " + source.getDescription() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Last-modified marker of the source, or -1 if the resource cannot report one.
     */
    public long lastModified(Resource source) {
        try {
            return source.lastModified();
        } catch (IOException e) {
            log.debug("No last-modified marker for {}: {}", source.getDescription(), e.getMessage());
            return -1L;
        }
    }

    /**
     * Parse a plain decimal cell ({@code 12}, {@code -0.5}, {@code 1e3}). Anything else, including
     * Java literal forms such as {@code 10f} or {@code 0x1p3}, and values overflowing to infinity,
     * counts as missing.
     */
    static Double parseValue(String raw) {
        if (raw == null) return null;
        String candidate = raw.trim();
        if (!DECIMAL.matcher(candidate).matches()) return null;
        double value = Double.parseDouble(candidate);
        return Double.isFinite(value) ? value : null;
    }

    private static Map<String, Integer> columnIndex(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            if (header[i] == null) continue;
            String name = header[i];
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }

    private static void requireColumn(Map<String, Integer> columns, String name, Resource source) {
        if (!columns.containsKey(name)) {
            throw new DataLoadException("Dataset " + source.getDescription() + " is missing required column '" + name + "'");
        }
    }

    private static String cell(String[] row, int column) {
        if (column < 0 || column >= row.length) return null;
        return row[column];
    }
}
