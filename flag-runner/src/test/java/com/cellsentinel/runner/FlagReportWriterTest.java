package com.cellsentinel.runner;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.FlagAggregator;
import com.cellsentinel.core.model.FlagSet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FlagReportWriter} and the output document shape.
 */
class FlagReportWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private FlagReportDocument document;

    @BeforeEach
    void setUp() throws IOException {
        Experiment experiment = RunnerTestSupport.readSample();
        Map<String, FlagSet> flags = FlagAggregator.withStandardDetectors(DetectorThresholds.defaults())
                .aggregateAll(experiment.getCells());
        document = FlagReportDocument.of(experiment.getExperimentId(), flags);
    }

    @Test
    @DisplayName("Should write the summary and per-cell flags")
    void shouldWriteReport() throws IOException {
        JsonNode root = mapper.readTree(new FlagReportWriter().writeAsString(document));

        assertThat(root.get("experimentId").asText()).isEqualTo("EXP-7");
        assertThat(root.get("summary").get("totalFlags").asInt()).isEqualTo(2);
        assertThat(root.get("summary").get("cellsWithFlags").asInt()).isEqualTo(2);
        assertThat(root.get("summary").get("bySeverity").get("CRITICAL").asInt()).isEqualTo(1);
        assertThat(root.get("summary").get("byType").get("impossible_efficiency").asInt()).isEqualTo(1);

        JsonNode c2 = root.get("cells").get(1);
        assertThat(c2.get("cellId").asText()).isEqualTo("C2");
        assertThat(c2.get("label").asText()).isEqualTo("1 Critical");
        assertThat(c2.get("counts").get("CRITICAL").asInt()).isEqualTo(1);

        JsonNode flag = c2.get("flags").get(0);
        assertThat(flag.get("type").asText()).isEqualTo("impossible_efficiency");
        assertThat(flag.get("severity").asText()).isEqualTo("CRITICAL");
        assertThat(flag.get("category").asText()).isEqualTo("ELECTROCHEMISTRY");
        assertThat(flag.get("confidence").asDouble()).isEqualTo(99.0);
        assertThat(flag.get("firstCycle").asInt()).isEqualTo(2);
        assertThat(flag.get("lastCycle").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should write timestamps as ISO-8601 text and omit absent fields")
    void shouldUseIsoTimestamps() throws IOException {
        JsonNode root = mapper.readTree(new FlagReportWriter().writeAsString(document));

        assertThat(root.get("generatedAt").isTextual()).isTrue();
        assertThat(root.get("generatedAt").asText()).contains("T").endsWith("Z");
        assertThat(root.get("cells").get(0).get("flags")).isEmpty();
        assertThat(root.get("cells").get(0).get("label").asText()).isEmpty();
    }

    @Test
    @DisplayName("Should create parent directories when writing to a file")
    void shouldWriteFile(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("reports/flags.json");

        new FlagReportWriter().write(document, out);

        assertThat(out).exists();
        assertThat(mapper.readTree(Files.readString(out)).get("cells")).hasSize(3);
    }
}
