package com.cellsentinel.runner;

import com.cellsentinel.core.config.DetectorThresholds;
import com.cellsentinel.core.config.ThresholdsLoader;
import com.cellsentinel.core.detection.FlagAggregator;
import com.cellsentinel.core.model.FlagSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

/**
 * Main entry point of the batch flag runner.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Experiment JSON (INPUT_PATH or args[0])
 *     → ExperimentReader → validated CellSeries
 *     → BatchFlagRunner (runs all detectors per cell, in parallel)
 *     → FlagReportDocument
 *     → FlagReportWriter → JSON (OUTPUT_PATH or args[1])
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link RunnerConfig}; detector limits come from {@link ThresholdsLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CellFlagsJob {

    private static final Logger LOG = LoggerFactory.getLogger(CellFlagsJob.class);

    private CellFlagsJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        RunnerConfig config = RunnerConfig.fromEnvironment(args);
        LOG.info("Starting Cell Sentinel with config: {}", config);

        // 2. Run
        FlagReportDocument report = run(config);
        LOG.info("Finished experiment '{}': {} flag(s) on {} of {} cell(s)",
                report.getExperimentId(),
                report.getSummary().getTotalFlags(),
                report.getSummary().getCellsWithFlags(),
                report.getSummary().getCellsEvaluated());
    }

    /**
     * Read, evaluate and write one experiment.
     *
     * @param config runner configuration
     * @return the report that was written
     * @throws InterruptedException if interrupted while cells are evaluated
     */
    static FlagReportDocument run(RunnerConfig config) throws InterruptedException {
        DetectorThresholds thresholds = loadThresholds(config);
        Experiment experiment = new ExperimentReader().read(Path.of(config.getInputPath()));

        Map<String, FlagSet> flags;
        try (BatchFlagRunner runner = new BatchFlagRunner(
                FlagAggregator.withStandardDetectors(thresholds), config.getParallelism())) {
            flags = runner.run(experiment.getCells());
        }

        FlagReportDocument report = FlagReportDocument.of(experiment.getExperimentId(), flags);
        new FlagReportWriter().write(report, Path.of(config.getOutputPath()));
        return report;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectorThresholds loadThresholds(RunnerConfig config) {
        if (config.hasThresholdsPath()) {
            return ThresholdsLoader.fromFile(config.getThresholdsPath());
        }
        return ThresholdsLoader.load();
    }
}
