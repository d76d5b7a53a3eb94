package com.sensorstats.store;

import com.sensorstats.model.SensorReading;
import com.sensorstats.model.TimestampParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DatasetLoader")
class DatasetLoaderTest {

    @TempDir
    Path dir;

    private DatasetLoader loader;

    @BeforeEach
    void setUp() {
        loader = new DatasetLoader(new TimestampParser(ZoneOffset.UTC));
    }

    private FileSystemResource csv(String content) throws IOException {
        Path file = dir.resolve("readings.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return new FileSystemResource(file);
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Location and sensor are trimmed and lower-cased; timestamps become UTC instants")
        void normalizesRows() throws IOException {
            Dataset dataset = loader.load(csv("""
                    timestamp,location,sensor,value
                    2025-01-05T10:00:00+02:00,  Lab-1 ,TEMP,21.5
                    """));

            assertThat(dataset.readings()).containsExactly(
                    new SensorReading(Instant.parse("2025-01-05T08:00:00Z"), "lab-1", "temp", 21.5));
        }

        @Test
        @DisplayName("Header names are matched after trimming, case-insensitively")
        void headerIsTrimmed() throws IOException {
            Dataset dataset = loader.load(csv("""
                     Timestamp , VALUE ,Location
                    2025-01-01,3,A
                    """));

            assertThat(dataset.readings()).hasSize(1);
            assertThat(dataset.readings().get(0).location()).isEqualTo("a");
            assertThat(dataset.readings().get(0).value()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("A leading UTF-8 byte-order mark does not hide the first column")
        void byteOrderMark() throws IOException {
            Dataset dataset = loader.load(csv("\uFEFFtimestamp,location,sensor,value\n2025-01-01,A,temp,10\n"));

            assertThat(dataset.readings()).containsExactly(
                    new SensorReading(Instant.parse("2025-01-01T00:00:00Z"), "a", "temp", 10.0));
        }

        @Test
        @DisplayName("Missing location and sensor columns default to empty strings")
        void optionalColumnsDefault() throws IOException {
            Dataset dataset = loader.load(csv("""
                    value,timestamp
                    7,2025-01-01
                    """));

            SensorReading reading = dataset.readings().get(0);
            assertThat(reading.location()).isEmpty();
            assertThat(reading.sensor()).isEmpty();
            assertThat(reading.value()).isEqualTo(7.0);
        }

        @Test
        @DisplayName("Short rows default missing cells")
        void shortRows() throws IOException {
            Dataset dataset = loader.load(csv("""
                    timestamp,value,location,sensor
                    2025-01-01,4
                    """));

            assertThat(dataset.readings()).hasSize(1);
            assertThat(dataset.readings().get(0).location()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Per-row tolerance")
    class Tolerance {

        @Test
        @DisplayName("Non-numeric, NaN and infinite values are retained without a value")
        void invalidValuesRetained() throws IOException {
            Dataset dataset = loader.load(csv("""
                    timestamp,value
                    2025-01-01,abc
                    2025-01-02,
                    2025-01-03,NaN
                    2025-01-04,Infinity
                    2025-01-05,1.5
                    """));

            assertThat(dataset.size()).isEqualTo(5);
            assertThat(dataset.readingsWithValue()).isEqualTo(1);
            assertThat(dataset.readings().get(0).hasValue()).isFalse();
        }

        @Test
        @DisplayName("Java literal forms are not numbers; plain decimals and exponents are")
        void javaLiteralsRejected() {
            assertThat(DatasetLoader.parseValue("10f")).isNull();
            assertThat(DatasetLoader.parseValue("10D")).isNull();
            assertThat(DatasetLoader.parseValue("0x1p3")).isNull();
            assertThat(DatasetLoader.parseValue("1_000")).isNull();
            assertThat(DatasetLoader.parseValue("1e999")).isNull();

            assertThat(DatasetLoader.parseValue(" -12.5 ")).isEqualTo(-12.5);
            assertThat(DatasetLoader.parseValue("+3")).isEqualTo(3.0);
            assertThat(DatasetLoader.parseValue(".5")).isEqualTo(0.5);
            assertThat(DatasetLoader.parseValue("7.")).isEqualTo(7.0);
            assertThat(DatasetLoader.parseValue("1.5E2")).isEqualTo(150.0);
        }

        @Test
        @DisplayName("Rows with unparseable timestamps are dropped and counted")
        void badTimestampsDropped() throws IOException {
            Dataset dataset = loader.load(csv("""
                    timestamp,value
                    yesterday,1
                    2025-01-02,2
                    ,3
                    """));

            assertThat(dataset.size()).isEqualTo(1);
            assertThat(dataset.droppedRows()).isEqualTo(2);
        }

        @Test
        @DisplayName("Blank lines are skipped")
        void blankLines() throws IOException {
            Dataset dataset = loader.load(csv("timestamp,value\n\n2025-01-02,2\n\n"));
            assertThat(dataset.size()).isEqualTo(1);
            assertThat(dataset.droppedRows()).isZero();
        }
    }

    @Nested
    @DisplayName("Load failures")
    class Failures {

        @Test
        @DisplayName("Missing source fails with DataLoadException")
        void missingSource() {
            FileSystemResource missing = new FileSystemResource(dir.resolve("absent.csv"));
            assertThatThrownBy(() -> loader.load(missing))
                    .isInstanceOf(DataLoadException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("Missing timestamp column fails")
        void missingTimestampColumn() throws IOException {
            FileSystemResource source = csv("location,value\nA,1\n");
            assertThatThrownBy(() -> loader.load(source))
                    .isInstanceOf(DataLoadException.class)
                    .hasMessageContaining("'timestamp'");
        }

        @Test
        @DisplayName("Missing value column fails")
        void missingValueColumn() throws IOException {
            FileSystemResource source = csv("timestamp,location\n2025-01-01,A\n");
            assertThatThrownBy(() -> loader.load(source))
                    .isInstanceOf(DataLoadException.class)
                    .hasMessageContaining("'value'");
        }

        @Test
        @DisplayName("Empty source fails")
        void emptySource() throws IOException {
            FileSystemResource source = csv("");
            assertThatThrownBy(() -> loader.load(source))
                    .isInstanceOf(DataLoadException.class)
                    .hasMessageContaining("no header");
        }
    }

    @Test
    @DisplayName("Header-only source loads an empty dataset")
    void headerOnly() throws IOException {
        Dataset dataset = loader.load(csv("timestamp,value\n"));
        assertThat(dataset.size()).isZero();
    }

    @Test
    @DisplayName("The source's last-modified marker is recorded, or -1 when unavailable")
    void sourceMarker() throws IOException {
        FileSystemResource source = csv("timestamp,value\n2025-01-01,1\n");
        assertThat(loader.load(source).sourceMarker()).isEqualTo(Files.getLastModifiedTime(source.getFile().toPath()).toMillis());

        ByteArrayResource inMemory = new ByteArrayResource("timestamp,value\n2025-01-01,1\n".getBytes(StandardCharsets.UTF_8));
        assertThat(loader.load(inMemory).sourceMarker()).isEqualTo(-1L);
    }
}
