package com.cellsentinel.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RunnerConfig}.
 */
class RunnerConfigTest {

    @Test
    @DisplayName("Should apply defaults for everything but the input path")
    void shouldApplyDefaults() {
        RunnerConfig config = new RunnerConfig.Builder().inputPath("in.json").build();

        assertThat(config.getInputPath()).isEqualTo("in.json");
        assertThat(config.getOutputPath()).isEqualTo(RunnerConfig.DEFAULT_OUTPUT_PATH);
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.hasThresholdsPath()).isFalse();
    }

    @Test
    @DisplayName("Should let command-line arguments choose the files")
    void shouldUseArguments() {
        RunnerConfig config = RunnerConfig.fromEnvironment(new String[] {"a.json", "b.json"});

        assertThat(config.getInputPath()).isEqualTo("a.json");
        assertThat(config.getOutputPath()).isEqualTo("b.json");
    }

    @Test
    @DisplayName("Should require an input path")
    void shouldRequireInput() {
        assertThatThrownBy(() -> new RunnerConfig.Builder().inputPath(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inputPath");
    }

    @Test
    @DisplayName("Should reject a parallelism below 1")
    void shouldRejectParallelism() {
        assertThatThrownBy(() -> new RunnerConfig.Builder().inputPath("in.json").parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }

    @Test
    @DisplayName("Should treat a null thresholds path as absent")
    void shouldNormaliseThresholdsPath() {
        RunnerConfig config = new RunnerConfig.Builder().inputPath("in.json").thresholdsPath(null).build();
        assertThat(config.getThresholdsPath()).isEmpty();
        assertThat(config.toString()).contains("in.json");
    }
}
