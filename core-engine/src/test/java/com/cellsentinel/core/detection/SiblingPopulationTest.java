package com.cellsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.cellsentinel.core.CellSeriesFixtures.capacities;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SiblingPopulation}.
 */
class SiblingPopulationTest {

    @Test
    @DisplayName("Should leave the evaluated cell out of a keyed population")
    void shouldExcludeOwnCell() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("a", 100.0);
        values.put("b", 100.0);
        values.put("c", 110.0);
        SiblingPopulation population = SiblingPopulation.of(values);

        assertThat(population.size()).isEqualTo(3);
        assertThat(population.peersOf("a", 100.0)).containsExactly(100.0, 110.0);
    }

    @Test
    @DisplayName("Should drop exactly one matching value from an anonymous population")
    void shouldDropOneMatchingValue() {
        SiblingPopulation population = SiblingPopulation.ofValues(List.of(100.0, 100.0, 110.0));

        assertThat(population.peersOf("x", 100.0)).containsExactly(100.0, 110.0);
        assertThat(population.peersOf("x", 120.0)).containsExactly(100.0, 100.0, 110.0);
    }

    @Test
    @DisplayName("Should skip null and NaN values")
    void shouldSkipAbsentValues() {
        SiblingPopulation population = SiblingPopulation.ofValues(Arrays.asList(100.0, null, Double.NaN));
        assertThat(population.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should build a keyed population from the first discharge of each series")
    void shouldBuildFromSeries() {
        SiblingPopulation population = SiblingPopulation.fromSeries(List.of(
                capacities("a", 180, 190),
                capacities("b", 200),
                capacities("c")));

        assertThat(population.size()).isEqualTo(2);
        assertThat(population.peersOf("a", 190.0)).containsExactly(200.0);
        assertThat(SiblingPopulation.empty().isEmpty()).isTrue();
    }
}
