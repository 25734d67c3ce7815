package com.cellsentinel.runner;

import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.InvalidSeriesException;
import com.cellsentinel.core.model.ProjectKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExperimentReader}.
 */
class ExperimentReaderTest {

    private final ExperimentReader reader = new ExperimentReader();

    @Test
    @DisplayName("Should read every cell in input order, ignoring unknown properties")
    void shouldReadSample() throws IOException {
        Experiment experiment = RunnerTestSupport.readSample();

        assertThat(experiment.getExperimentId()).isEqualTo("EXP-7");
        assertThat(experiment.getCells()).extracting(CellSeries::getCellIdentifier)
                .containsExactly("C1", "C2", "C3");

        CellSeries c1 = experiment.getCells().get(0);
        assertThat(c1.getLoadingMg()).contains(12.1);
        assertThat(c1.size()).isEqualTo(3);
        assertThat(c1.getRecords().get(0).getChargeCapacityMah()).isEmpty();
        assertThat(experiment.getCells().get(2).getProjectKind()).isEqualTo(ProjectKind.ANODE);
    }

    @Test
    @DisplayName("Should fail on malformed JSON")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> reader.read(json("{\"cells\": [")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed experiment document");
    }

    @Test
    @DisplayName("Should reject the whole experiment when one series is invalid")
    void shouldRejectInvalidSeries() {
        String doc = "{\"experimentId\":\"E\",\"cells\":[{\"cellId\":\"C1\",\"cycles\":["
                + "{\"cycle\":2,\"coulombicEfficiency\":0.9},{\"cycle\":1,\"coulombicEfficiency\":0.9}]}]}";

        assertThatThrownBy(() -> reader.read(json(doc)))
                .isInstanceOf(InvalidSeriesException.class)
                .hasMessageContaining("C1");
    }

    @Test
    @DisplayName("Should reject an unknown project kind")
    void shouldRejectUnknownProjectKind() {
        String doc = "{\"cells\":[{\"cellId\":\"C1\",\"projectKind\":\"separator\",\"cycles\":[]}]}";

        assertThatThrownBy(() -> reader.read(json(doc)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("separator");
    }

    @Test
    @DisplayName("Should reject a null cell entry as malformed")
    void shouldRejectNullCell() {
        assertThatThrownBy(() -> reader.read(json("{\"cells\":[null]}")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("null entry in cells");
    }

    @Test
    @DisplayName("Should reject a null cycle entry as malformed")
    void shouldRejectNullCycle() {
        String doc = "{\"cells\":[{\"cellId\":\"C1\",\"cycles\":[null]}]}";

        assertThatThrownBy(() -> reader.read(json(doc)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("null cycle entry")
                .hasMessageContaining("C1");
    }

    @Test
    @DisplayName("Should reject a fractional cycle number instead of truncating it")
    void shouldRejectFractionalCycle() {
        String doc = "{\"cells\":[{\"cellId\":\"C1\",\"cycles\":["
                + "{\"cycle\":1.7,\"coulombicEfficiency\":0.9},{\"cycle\":2,\"coulombicEfficiency\":0.9}]}]}";

        assertThatThrownBy(() -> reader.read(json(doc)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed experiment document");
    }

    @Test
    @DisplayName("Should read an out-of-range number as an absent value")
    void shouldTreatOverflowingNumberAsAbsent() {
        String doc = "{\"cells\":[{\"cellId\":\"C1\",\"cycles\":["
                + "{\"cycle\":1,\"coulombicEfficiency\":1e400}]}]}";

        CellSeries series = reader.read(json(doc)).getCells().get(0);

        assertThat(series.getRecords().get(0).getCoulombicEfficiency()).isEmpty();
    }

    @Test
    @DisplayName("Should throw when the input file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> reader.read(Path.of("/no/such/experiment.json")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
