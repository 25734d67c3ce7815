package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.model.FlagType;
import com.cellsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.cellsentinel.core.CellSeriesFixtures.capacities;
import static com.cellsentinel.core.CellSeriesFixtures.context;
import static com.cellsentinel.core.CellSeriesFixtures.linearFade;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IncompleteDatasetDetector}.
 */
class IncompleteDatasetDetectorTest {

    private IncompleteDatasetDetector detector;

    @BeforeEach
    void setUp() {
        detector = new IncompleteDatasetDetector(DetectorThresholds.defaults());
    }

    @Test
    @DisplayName("Should flag a healthy cell stopped after 10 cycles")
    void shouldFlagShortHealthyRun() {
        assertThat(detector.evaluate(context(linearFade("c1", 10, 0.005))))
                .singleElement().satisfies(f -> {
                    assertThat(f.getType()).isEqualTo(FlagType.INCOMPLETE_DATASET);
                    assertThat(f.getSeverity()).isEqualTo(Severity.INFO);
                    assertThat(f.getConfidence()).isEqualTo(70.0);
                    assertThat(f.getMetricValue()).contains(10.0);
                });
    }

    @Test
    @DisplayName("Should NOT fire once 30 cycles are recorded")
    void shouldNotFireOnLongRun() {
        assertThat(detector.evaluate(context(linearFade("c1", 30, 0.001)))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when the final retention is at or below 80%")
    void shouldNotFireOnDegradedCell() {
        assertThat(detector.evaluate(context(capacities("c1", 100, 95, 90, 85, 80, 75)))).isEmpty();
    }

    @Test
    @DisplayName("Should stay silent with fewer than five points")
    void shouldAbstainOnTinySeries() {
        assertThat(detector.evaluate(context(capacities("c1", 100, 99, 98, 97)))).isEmpty();
    }
}
