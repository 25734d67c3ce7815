package com.cellsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdsLoader} and {@link DetectorThresholds}.
 */
class ThresholdsLoaderTest {

    @Test
    @DisplayName("Should override only the keys present in the YAML")
    void shouldLoadOverridesFromClasspath() {
        DetectorThresholds thresholds = ThresholdsLoader.fromClasspath("test-thresholds.yml");

        assertThat(thresholds.getRapidFadeRetention()).isEqualTo(0.85);
        assertThat(thresholds.getTheoreticalCapacity()).isEqualTo(372.0);
        assertThat(thresholds.getRapidFadeCycle()).isEqualTo(10);
        assertThat(thresholds.getImpossibleEfficiency()).isEqualTo(1.05);
    }

    @Test
    @DisplayName("Should ship a default resource equal to the built-in defaults")
    void shouldLoadDefaultResource() {
        DetectorThresholds fromResource = ThresholdsLoader.fromClasspath(ThresholdsLoader.DEFAULT_RESOURCE);
        DetectorThresholds defaults = DetectorThresholds.defaults();

        assertThat(fromResource.getLowCeMean()).isEqualTo(defaults.getLowCeMean());
        assertThat(fromResource.getTerminationMinPoints()).isEqualTo(defaults.getTerminationMinPoints());
        assertThat(fromResource.getOutlierCriticalZScore()).isEqualTo(defaults.getOutlierCriticalZScore());
        assertThat(fromResource.getZeroFraction()).isEqualTo(defaults.getZeroFraction());
    }

    @Test
    @DisplayName("Should report every violation of an invalid configuration")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> ThresholdsLoader.fromClasspath("invalid-thresholds.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid DetectorThresholds")
                .hasMessageContaining("lowCeCriticalMean must be <= lowCeMean")
                .hasMessageContaining("missingFraction");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> ThresholdsLoader.fromClasspath("duplicate-thresholds.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("thresholds.yml");
        Files.writeString(file, "failureCycleWindow: 80\n");

        assertThat(ThresholdsLoader.fromFile(file.toString()).getFailureCycleWindow()).isEqualTo(80);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThat(ThresholdsLoader.fromFile(file.toString()).getMissingFraction()).isEqualTo(0.20);
    }

    @Test
    @DisplayName("Should throw when the file or resource does not exist")
    void shouldThrowForMissingSources() {
        assertThatThrownBy(() -> ThresholdsLoader.fromFile("/no/such/thresholds.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> ThresholdsLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should fail instead of falling back when the configured path is missing")
    void shouldFailForMissingConfiguredPath() {
        assertThatThrownBy(() -> ThresholdsLoader.load("/no/such/thresholds.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should fall back to the default resource when no path is configured")
    void shouldUseDefaultResourceWithoutConfiguredPath() {
        assertThat(ThresholdsLoader.load(" ").getLowCeMean())
                .isEqualTo(DetectorThresholds.defaults().getLowCeMean());
    }
}
