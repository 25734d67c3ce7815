package com.cellsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfidenceScale}.
 */
class ConfidenceScaleTest {

    @Test
    @DisplayName("Should interpolate between floor and ceiling")
    void shouldInterpolate() {
        assertThat(ConfidenceScale.linear(0.0, 0.10, 75, 95)).isEqualTo(75.0);
        assertThat(ConfidenceScale.linear(0.05, 0.10, 75, 95)).isEqualTo(85.0);
        assertThat(ConfidenceScale.linear(0.25, 0.10, 75, 95)).isEqualTo(95.0);
    }

    @Test
    @DisplayName("Should treat negative deviation as zero")
    void shouldClampNegativeDeviation() {
        assertThat(ConfidenceScale.linear(-1.0, 0.10, 60, 100)).isEqualTo(60.0);
    }

    @Test
    @DisplayName("Should round to one decimal")
    void shouldRound() {
        assertThat(ConfidenceScale.linear(1.0 / 3.0, 1.0, 0, 100)).isEqualTo(33.3);
    }

    @Test
    @DisplayName("Should reject a non-positive saturation or inverted bounds")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> ConfidenceScale.linear(0.1, 0.0, 75, 95))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("saturation");
        assertThatThrownBy(() -> ConfidenceScale.linear(0.1, 1.0, 95, 75))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("floor");
    }
}
