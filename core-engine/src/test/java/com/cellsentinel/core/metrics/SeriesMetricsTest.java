package com.cellsentinel.core.metrics;

import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.CycleColumn;
import com.cellsentinel.core.model.CycleRecord;
import com.cellsentinel.core.model.ProjectKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cellsentinel.core.CellSeriesFixtures.capacities;
import static com.cellsentinel.core.CellSeriesFixtures.efficiencies;
import static com.cellsentinel.core.CellSeriesFixtures.linearFade;
import static com.cellsentinel.core.CellSeriesFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeriesMetrics} and {@link CellMetrics}.
 */
class SeriesMetricsTest {

    @Test
    @DisplayName("Should compute retention against the first valid cycle")
    void shouldComputeRetention() {
        CellSeries series = CellSeries.builder("c1")
                .addRecord(record(1, 0.0, 0.9))
                .addRecord(record(2, 200.0, 0.9))
                .addRecord(record(3, 150.0, 0.9))
                .build();

        assertThat(SeriesMetrics.retention(series, 1)).isEmpty();
        assertThat(SeriesMetrics.retention(series, 2)).contains(1.0);
        assertThat(SeriesMetrics.retention(series, 3)).contains(0.75);
    }

    @Test
    @DisplayName("Should fall back to absolute discharge when no specific capacity exists")
    void shouldFallBackToAbsoluteDischarge() {
        CellSeries series = CellSeries.builder("c1")
                .addRecord(CycleRecord.builder(1).dischargeCapacityMah(2.0).build())
                .addRecord(CycleRecord.builder(2).dischargeCapacityMah(1.5).build())
                .build();

        assertThat(SeriesMetrics.capacityColumn(series)).isEqualTo(CycleColumn.DISCHARGE_CAPACITY);
        assertThat(SeriesMetrics.retention(series, 2)).contains(0.75);
    }

    @Test
    @DisplayName("Should take the largest of the first three capacities as first discharge")
    void shouldComputeFirstDischarge() {
        assertThat(SeriesMetrics.firstDischarge(capacities("c1", 180, 195, 190, 250))).contains(195.0);
        assertThat(SeriesMetrics.firstDischarge(CellSeries.builder("c1").build())).isEmpty();
    }

    @Test
    @DisplayName("Should compute CE statistics over the stable window only")
    void shouldComputeStableEfficiency() {
        CellSeries series = efficiencies("c1", 0.5, 0.6, 0.7, 0.8, 0.98, 0.99, 1.00);

        assertThat(SeriesMetrics.stableEfficiencies(series)).containsExactly(0.98, 0.99, 1.00);
        assertThat(SeriesMetrics.ceMean(series).orElseThrow()).isCloseTo(0.99, within(1e-9));
        assertThat(SeriesMetrics.ceStd(series).orElseThrow()).isCloseTo(0.01, within(1e-9));
    }

    @Test
    @DisplayName("Should compute anode efficiency as charge over discharge")
    void shouldComputeAnodeEfficiency() {
        CycleRecord r = CycleRecord.builder(1)
                .chargeCapacityMah(0.9)
                .dischargeCapacityMah(1.0)
                .coulombicEfficiency(0.5)
                .build();

        assertThat(SeriesMetrics.effectiveEfficiency(ProjectKind.ANODE, r).orElseThrow())
                .isCloseTo(0.9, within(1e-12));
        assertThat(SeriesMetrics.effectiveEfficiency(ProjectKind.CATHODE, r)).contains(0.5);
    }

    @Test
    @DisplayName("Should report the fade rate as the negated slope of retention")
    void shouldComputeDegradationRate() {
        CellMetrics metrics = CellMetrics.of(linearFade("c1", 30, 0.002));

        assertThat(SeriesMetrics.degradationRate(metrics.getRetention()).orElseThrow())
                .isCloseTo(0.002, within(1e-9));
        assertThat(SeriesMetrics.degradationRate(List.of(new CyclePoint(1, 1.0)))).isEmpty();
    }

    @Test
    @DisplayName("Should use the population std dev for z-scores and abstain on small or flat populations")
    void shouldComputeZScore() {
        assertThat(SeriesMetrics.zScore(4.0, List.of(1.0, 2.0, 3.0)).orElseThrow())
                .isCloseTo(2.0 / Math.sqrt(2.0 / 3.0), within(1e-9));
        assertThat(SeriesMetrics.zScore(4.0, List.of(1.0, 2.0))).isEmpty();
        assertThat(SeriesMetrics.zScore(4.0, List.of(1.0, 1.0, 1.0))).isEmpty();
    }

    @Test
    @DisplayName("Should measure the missing fraction of a column")
    void shouldComputeMissingFraction() {
        CellSeries series = CellSeries.builder("c1")
                .addRecord(record(1, 200.0, null))
                .addRecord(record(2, null, null))
                .addRecord(record(3, 198.0, 0.99))
                .addRecord(record(4, 197.0, null))
                .build();

        assertThat(SeriesMetrics.missingFraction(series, CycleColumn.SPECIFIC_DISCHARGE_CAPACITY)).isEqualTo(0.25);
        assertThat(SeriesMetrics.missingFraction(series, CycleColumn.COULOMBIC_EFFICIENCY)).isEqualTo(0.75);
        assertThat(SeriesMetrics.missingFraction(CellSeries.builder("c2").build(),
                CycleColumn.COULOMBIC_EFFICIENCY)).isZero();
    }
}
