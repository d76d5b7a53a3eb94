package com.sensorstats.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FieldNormalizer")
class FieldNormalizerTest {

    @Test
    @DisplayName("canonical trims and lower-cases; null becomes empty")
    void canonical() {
        assertThat(FieldNormalizer.canonical("  Lab-1 ")).isEqualTo("lab-1");
        assertThat(FieldNormalizer.canonical("TEMP")).isEqualTo("temp");
        assertThat(FieldNormalizer.canonical(null)).isEmpty();
    }

    @Test
    @DisplayName("canonicalOrNull treats blank as absent")
    void canonicalOrNull() {
        assertThat(FieldNormalizer.canonicalOrNull("   ")).isNull();
        assertThat(FieldNormalizer.canonicalOrNull(null)).isNull();
        assertThat(FieldNormalizer.canonicalOrNull(" A ")).isEqualTo("a");
    }
}
