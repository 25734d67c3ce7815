package com.cellsentinel.runner;

import com.cellsentinel.core.detection.FlagAggregator;
import com.cellsentinel.core.detection.SiblingPopulation;
import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.FlagSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates the cells of an experiment in parallel on a fixed thread pool.
 *
 * <p>
 * The sibling population is built once, before any cell is evaluated, and
 * shared read-only by all tasks. Results are collected back in input order,
 * so the output equals {@link FlagAggregator#aggregateAll(List)} regardless
 * of parallelism.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchFlagRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BatchFlagRunner.class);

    private final FlagAggregator aggregator;
    private final ExecutorService executor;
    private final int parallelism;

    /**
     * @param aggregator  the aggregator to run; must not be {@code null}
     * @param parallelism number of worker threads; must be at least 1
     */
    public BatchFlagRunner(FlagAggregator aggregator, int parallelism) {
        this.aggregator = Objects.requireNonNull(aggregator, "FlagAggregator must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
        this.executor = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
    }

    /**
     * Evaluate every cell of an experiment.
     *
     * @param experiment cells of one experiment; must not be {@code null}
     * @return flag sets keyed by cell identifier, in input order
     * @throws IllegalArgumentException if two cells share an identifier
     * @throws InterruptedException     if the calling thread is interrupted
     *                                  while waiting for the workers
     */
    public Map<String, FlagSet> run(List<CellSeries> experiment) throws InterruptedException {
        Objects.requireNonNull(experiment, "Experiment must not be null");
        requireUniqueIdentifiers(experiment);

        long startNanos = System.nanoTime();
        SiblingPopulation population = SiblingPopulation.fromSeries(experiment);
        List<Callable<FlagSet>> tasks = new ArrayList<>(experiment.size());
        for (CellSeries series : experiment) {
            tasks.add(() -> aggregator.aggregate(series, population));
        }

        List<Future<FlagSet>> futures = executor.invokeAll(tasks);
        Map<String, FlagSet> out = new LinkedHashMap<>();
        for (Future<FlagSet> future : futures) {
            FlagSet flags = await(future);
            out.put(flags.getCellIdentifier(), flags);
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info("Evaluated {} cell(s) on {} thread(s) in {} ms", experiment.size(), parallelism, durationMs);
        return out;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static FlagSet await(Future<FlagSet> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Cell evaluation failed", cause);
        }
    }

    private static void requireUniqueIdentifiers(List<CellSeries> experiment) {
        Set<String> seen = new HashSet<>();
        for (CellSeries series : experiment) {
            if (!seen.add(series.getCellIdentifier())) {
                throw new IllegalArgumentException(
                        "Duplicate cell identifier in experiment: '" + series.getCellIdentifier() + "'");
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "cell-flags-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
