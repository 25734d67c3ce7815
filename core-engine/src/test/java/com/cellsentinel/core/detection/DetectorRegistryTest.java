package com.cellsentinel.core.detection;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.rules.TheoreticalCapacityDetector;
import com.cellsentinel.core.model.FlagType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorRegistry}.
 */
class DetectorRegistryTest {

    @Test
    @DisplayName("Should create one detector per flag type in declaration order")
    void shouldCreateStandardDetectors() {
        List<CellDetector> detectors = DetectorRegistry.standardDetectors(DetectorThresholds.defaults());

        assertThat(detectors).hasSize(FlagType.values().length);
        assertThat(detectors).extracting(CellDetector::getFlagType).containsExactly(FlagType.values());
        assertThat(detectors.get(0).getName()).isEqualTo("rapid_capacity_fade");
    }

    @Test
    @DisplayName("Should return an unmodifiable list")
    void shouldReturnUnmodifiableList() {
        List<CellDetector> detectors = DetectorRegistry.standardDetectors(DetectorThresholds.defaults());
        assertThatThrownBy(() -> detectors.remove(0)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should create the detector matching a flag type")
    void shouldCreateByType() {
        CellDetector detector = DetectorRegistry.create(
                FlagType.EXCEEDS_THEORETICAL_CAPACITY, DetectorThresholds.defaults());

        assertThat(detector).isInstanceOf(TheoreticalCapacityDetector.class);
        assertThat(detector.getName()).isEqualTo("theoretical_capacity_violation");
    }

    @Test
    @DisplayName("Should refuse invalid thresholds")
    void shouldRejectInvalidThresholds() {
        DetectorThresholds thresholds = DetectorThresholds.defaults();
        thresholds.setRapidFadeRetention(1.5);

        assertThatThrownBy(() -> DetectorRegistry.standardDetectors(thresholds))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("rapidFadeRetention");
    }

    @Test
    @DisplayName("Should throw on null arguments")
    void shouldThrowOnNull() {
        assertThatThrownBy(() -> DetectorRegistry.create(null, DetectorThresholds.defaults()))
                .isInstanceOf(NullPointerException.class);
    }
}
