package com.cellsentinel.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end test of {@link CellFlagsJob#run(RunnerConfig)}.
 */
class CellFlagsJobTest {

    @Test
    @DisplayName("Should read, flag and write an experiment")
    void shouldRunEndToEnd(@TempDir Path dir) throws Exception {
        Path input = RunnerTestSupport.copySample(dir);
        Path output = dir.resolve("out/flags.json");
        RunnerConfig config = new RunnerConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .parallelism(3)
                .build();

        FlagReportDocument report = CellFlagsJob.run(config);

        assertThat(report.getSummary().getTotalFlags()).isEqualTo(2);
        assertThat(report.getSummary().getCellsEvaluated()).isEqualTo(3);
        assertThat(output).exists();
        assertThat(new ObjectMapper().readTree(Files.readString(output)).get("experimentId").asText())
                .isEqualTo("EXP-7");
    }

    @Test
    @DisplayName("Should apply a thresholds file when one is configured")
    void shouldUseThresholdsFile(@TempDir Path dir) throws Exception {
        Path input = RunnerTestSupport.copySample(dir);
        Path thresholds = dir.resolve("thresholds.yml");
        Files.writeString(thresholds, "impossibleEfficiency: 1.20\n");
        RunnerConfig config = new RunnerConfig.Builder()
                .inputPath(input.toString())
                .outputPath(dir.resolve("flags.json").toString())
                .thresholdsPath(thresholds.toString())
                .build();

        FlagReportDocument report = CellFlagsJob.run(config);

        assertThat(report.getSummary().getTotalFlags()).isEqualTo(1);
        assertThat(report.getSummary().getByType()).containsOnlyKeys("poor_first_cycle_efficiency");
    }
}
