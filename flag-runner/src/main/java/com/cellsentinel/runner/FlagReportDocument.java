package com.cellsentinel.runner;

import com.cellsentinel.core.model.FlagSet;
import com.cellsentinel.core.summary.ExperimentFlagReport;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON shape of the runner's output: the experiment roll-up followed by the
 * flags of every cell in input order.
 *
 * @since 1.0.0
 */
public class FlagReportDocument {

    private final String experimentId;
    private final Instant generatedAt;
    private final Summary summary;
    private final List<CellFlagsDocument> cells;

    FlagReportDocument(String experimentId, Instant generatedAt, Map<String, FlagSet> flagsByCell) {
        Objects.requireNonNull(flagsByCell, "Flag sets must not be null");
        this.experimentId = experimentId;
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        this.summary = new Summary(ExperimentFlagReport.of(flagsByCell));
        this.cells = flagsByCell.values().stream().map(CellFlagsDocument::new).toList();
    }

    /**
     * Build the output document for one run.
     *
     * @param experimentId identifier of the experiment
     * @param flagsByCell  flag sets keyed by cell, in input order
     * @return the document, stamped with the current time
     */
    public static FlagReportDocument of(String experimentId, Map<String, FlagSet> flagsByCell) {
        return new FlagReportDocument(experimentId, Instant.now(), flagsByCell);
    }

    public String getExperimentId() {
        return experimentId;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public Summary getSummary() {
        return summary;
    }

    public List<CellFlagsDocument> getCells() {
        return cells;
    }

    /**
     * JSON shape of {@link ExperimentFlagReport}.
     */
    public static class Summary {

        private final int totalFlags;
        private final int cellsEvaluated;
        private final int cellsWithFlags;
        private final Map<String, Integer> bySeverity = new LinkedHashMap<>();
        private final Map<String, Integer> byType = new LinkedHashMap<>();
        private final Map<String, Integer> byCategory = new LinkedHashMap<>();

        Summary(ExperimentFlagReport report) {
            this.totalFlags = report.getTotalFlags();
            this.cellsEvaluated = report.getCellsEvaluated();
            this.cellsWithFlags = report.getCellsWithFlags();
            report.getBySeverity().forEach((k, v) -> bySeverity.put(k.name(), v));
            report.getByType().forEach((k, v) -> byType.put(k.getId(), v));
            report.getByCategory().forEach((k, v) -> byCategory.put(k.name(), v));
        }

        public int getTotalFlags() {
            return totalFlags;
        }

        public int getCellsEvaluated() {
            return cellsEvaluated;
        }

        public int getCellsWithFlags() {
            return cellsWithFlags;
        }

        public Map<String, Integer> getBySeverity() {
            return bySeverity;
        }

        public Map<String, Integer> getByType() {
            return byType;
        }

        public Map<String, Integer> getByCategory() {
            return byCategory;
        }
    }
}
