package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.detection.DetectionContext;
import com.cellsentinel.core.detection.SiblingPopulation;
import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cellsentinel.core.CellSeriesFixtures.capacities;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalousFirstDischargeDetector}.
 */
class AnomalousFirstDischargeDetectorTest {

    private static final SiblingPopulation POPULATION =
            SiblingPopulation.ofValues(List.of(100.0, 102.0, 98.0, 101.0, 400.0));

    private AnomalousFirstDischargeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalousFirstDischargeDetector(DetectorThresholds.defaults());
    }

    @Test
    @DisplayName("Should flag the 400 cell as Critical against its siblings")
    void shouldFlagExtremeOutlier() {
        List<Flag> flags = detector.evaluate(DetectionContext.of(capacities("c5", 400), POPULATION));

        assertThat(flags).singleElement().satisfies(f -> {
            assertThat(f.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(f.getConfidence()).isEqualTo(95.0);
            assertThat(f.getMetricValue().orElseThrow()).isGreaterThan(200.0);
            assertThat(f.getMessage()).contains("higher");
        });
    }

    @Test
    @DisplayName("Should NOT flag the cells close to each other")
    void shouldNotFlagRegularCells() {
        for (double value : new double[] {100, 102, 98, 101}) {
            assertThat(detector.evaluate(DetectionContext.of(capacities("c", value), POPULATION))).isEmpty();
        }
    }

    @Test
    @DisplayName("Should warn for a z-score between 3 and 4")
    void shouldWarnOnModerateOutlier() {
        SiblingPopulation population = SiblingPopulation.ofValues(List.of(100.0, 102.0, 98.0, 101.0, 105.43));

        assertThat(detector.evaluate(DetectionContext.of(capacities("c5", 105.43), population)))
                .singleElement().satisfies(f -> {
                    assertThat(f.getSeverity()).isEqualTo(Severity.WARNING);
                    assertThat(f.getConfidence()).isBetween(80.0, 85.0);
                });
    }

    @Test
    @DisplayName("Should stay silent with fewer than three cells")
    void shouldAbstainOnSmallPopulation() {
        SiblingPopulation pair = SiblingPopulation.ofValues(List.of(100.0, 400.0));
        assertThat(detector.evaluate(DetectionContext.of(capacities("c2", 400), pair))).isEmpty();
    }

    @Test
    @DisplayName("Should stay silent when the siblings have no spread")
    void shouldAbstainOnZeroSpread() {
        SiblingPopulation flat = SiblingPopulation.ofValues(List.of(100.0, 100.0, 100.0, 150.0));
        assertThat(detector.evaluate(DetectionContext.of(capacities("c4", 150), flat))).isEmpty();
    }

    @Test
    @DisplayName("Should stay silent without sibling context")
    void shouldAbstainWithoutPopulation() {
        assertThat(detector.evaluate(DetectionContext.of(capacities("c5", 400)))).isEmpty();
    }
}
