package com.cellsentinel.core.detection;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.Flag;
import com.cellsentinel.core.model.FlagSet;
import com.cellsentinel.core.model.FlagType;
import com.cellsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.cellsentinel.core.CellSeriesFixtures.capacities;
import static com.cellsentinel.core.CellSeriesFixtures.endOfLife;
import static com.cellsentinel.core.CellSeriesFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FlagAggregator}.
 */
class FlagAggregatorTest {

    private FlagAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = FlagAggregator.withStandardDetectors(DetectorThresholds.defaults());
    }

    @Test
    @DisplayName("Should raise nothing for a cell that ages normally to end of life")
    void shouldNotFlagHealthyCell() {
        assertThat(aggregator.aggregate(endOfLife("c1")).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should raise nothing for a two-point series")
    void shouldStaySilentOnTwoPoints() {
        assertThat(aggregator.aggregate(capacities("c1", 200, 199)).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should combine several detectors in severity then confidence order")
    void shouldOrderCombinedFlags() {
        FlagSet flags = aggregator.aggregate(failingCell());

        assertThat(flags.getFlags()).extracting(Flag::getType).containsExactly(
                FlagType.IMPOSSIBLE_EFFICIENCY,
                FlagType.CELL_FAILURE,
                FlagType.RAPID_CAPACITY_FADE,
                FlagType.POOR_FIRST_CYCLE_EFFICIENCY);
        assertThat(flags.getSummary().compactLabel()).isEqualTo("3 Critical, 1 Warning");
        assertMonotonic(flags.getFlags());
    }

    @Test
    @DisplayName("Should be deterministic and idempotent")
    void shouldBeDeterministic() {
        CellSeries series = failingCell();
        FlagSet first = aggregator.aggregate(series);
        FlagSet second = aggregator.aggregate(series);

        assertThat(second).isEqualTo(first);
        assertThat(FlagSet.of("c1", first.getFlags())).isEqualTo(first);
    }

    @Test
    @DisplayName("Should keep other detectors running when one throws")
    void shouldIsolateFailingDetector() {
        List<CellDetector> detectors = new ArrayList<>();
        detectors.add(new ExplodingDetector());
        detectors.addAll(DetectorRegistry.standardDetectors(DetectorThresholds.defaults()));
        FlagAggregator guarded = new FlagAggregator(detectors);

        assertThat(guarded.aggregate(failingCell())).isEqualTo(aggregator.aggregate(failingCell()));
    }

    @Test
    @DisplayName("Should compare every cell of an experiment with its siblings")
    void shouldAggregateExperiment() {
        List<CellSeries> experiment = List.of(
                capacities("c1", 100), capacities("c2", 102), capacities("c3", 98),
                capacities("c4", 101), capacities("c5", 400));

        Map<String, FlagSet> flags = aggregator.aggregateAll(experiment);

        assertThat(flags).containsOnlyKeys("c1", "c2", "c3", "c4", "c5");
        assertThat(flags.keySet()).containsExactly("c1", "c2", "c3", "c4", "c5");
        assertThat(flags.get("c5").contains(FlagType.ANOMALOUS_FIRST_DISCHARGE)).isTrue();
        assertThat(flags.get("c5").ofType(FlagType.ANOMALOUS_FIRST_DISCHARGE).get(0).getSeverity())
                .isEqualTo(Severity.CRITICAL);
        for (String id : List.of("c1", "c2", "c3", "c4")) {
            assertThat(flags.get(id).contains(FlagType.ANOMALOUS_FIRST_DISCHARGE)).isFalse();
        }
    }

    @Test
    @DisplayName("Should reject duplicate cell identifiers")
    void shouldRejectDuplicateCells() {
        assertThatThrownBy(() -> aggregator.aggregateAll(List.of(capacities("c1", 100), capacities("c1", 101))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("c1");
    }

    @Test
    @DisplayName("Should reject an empty detector list")
    void shouldRejectEmptyDetectors() {
        assertThatThrownBy(() -> new FlagAggregator(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Eight cycles: early collapse, one impossible efficiency and a poor first cycle. */
    private static CellSeries failingCell() {
        double[] capacity = {100, 60, 55, 50, 48, 47, 46, 45};
        CellSeries.Builder b = CellSeries.builder("c1");
        for (int i = 0; i < capacity.length; i++) {
            double ce = i == 0 ? 0.5 : i == 1 ? 1.10 : 0.99;
            b.addRecord(record(i + 1, capacity[i], ce));
        }
        return b.build();
    }

    private static void assertMonotonic(List<Flag> flags) {
        for (int i = 1; i < flags.size(); i++) {
            Flag prev = flags.get(i - 1);
            Flag next = flags.get(i);
            assertThat(prev.getSeverity().rank()).isLessThanOrEqualTo(next.getSeverity().rank());
            if (prev.getSeverity() == next.getSeverity()) {
                assertThat(prev.getConfidence()).isGreaterThanOrEqualTo(next.getConfidence());
            }
        }
    }

    private static final class ExplodingDetector implements CellDetector {

        @Override
        public List<Flag> evaluate(DetectionContext context) {
            throw new IllegalStateException("boom");
        }

        @Override
        public FlagType getFlagType() {
            return FlagType.MISSING_DATA;
        }
    }
}
