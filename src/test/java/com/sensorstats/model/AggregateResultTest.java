package com.sensorstats.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AggregateResult")
class AggregateResultTest {

    @Test
    @DisplayName("empty result has count 0 and no avg/min/max")
    void empty() {
        AggregateResult empty = AggregateResult.empty();
        assertThat(empty.count()).isZero();
        assertThat(empty.avg()).isNull();
        assertThat(empty.min()).isNull();
        assertThat(empty.max()).isNull();
    }

    @Test
    @DisplayName("Throws if count is zero but values are present")
    void throwsOnZeroCountWithValues() {
        assertThatThrownBy(() -> new AggregateResult(0, 0.0, 0.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Throws if count is positive but a value is missing")
    void throwsOnMissingValue() {
        assertThatThrownBy(() -> new AggregateResult(1, 1.0, null, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Throws if avg lies outside [min, max]")
    void throwsOnAvgOutOfRange() {
        assertThatThrownBy(() -> new AggregateResult(2, 30.0, 10.0, 20.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
