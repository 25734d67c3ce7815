package com.cellsentinel.core.detection.rules;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.CycleRecord;
import com.cellsentinel.core.model.FlagType;
import com.cellsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.cellsentinel.core.CellSeriesFixtures.capacities;
import static com.cellsentinel.core.CellSeriesFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TheoreticalCapacityDetector}.
 */
class TheoreticalCapacityDetectorTest {

    private TheoreticalCapacityDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TheoreticalCapacityDetector(DetectorThresholds.defaults());
    }

    @Test
    @DisplayName("Should warn when specific capacity exceeds 450 mAh/g")
    void shouldFireAboveTheoretical() {
        assertThat(detector.evaluate(context(capacities("c1", 460, 455, 440))))
                .singleElement().satisfies(f -> {
                    assertThat(f.getType()).isEqualTo(FlagType.EXCEEDS_THEORETICAL_CAPACITY);
                    assertThat(f.getSeverity()).isEqualTo(Severity.WARNING);
                    assertThat(f.getConfidence()).isEqualTo(80.0);
                    assertThat(f.getMetricValue()).contains(460.0);
                });
    }

    @Test
    @DisplayName("Should NOT fire at exactly 450 mAh/g")
    void shouldNotFireAtLimit() {
        assertThat(detector.evaluate(context(capacities("c1", 450, 449)))).isEmpty();
    }

    @Test
    @DisplayName("Should ignore absolute capacities")
    void shouldIgnoreAbsoluteCapacity() {
        CellSeries series = CellSeries.builder("c1")
                .addRecord(CycleRecord.builder(1).dischargeCapacityMah(1000.0).build())
                .build();
        assertThat(detector.evaluate(context(series))).isEmpty();
    }
}
