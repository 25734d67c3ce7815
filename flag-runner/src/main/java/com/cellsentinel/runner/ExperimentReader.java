package com.cellsentinel.runner;

import com.cellsentinel.core.model.CellSeries;
import com.cellsentinel.core.model.InvalidSeriesException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads an experiment input document (JSON) into validated {@link CellSeries}.
 *
 * <p>
 * Unlike a streaming consumer, a batch run must not silently drop data: a
 * malformed document or an invalid series rejects the whole experiment before
 * any detection starts.
 * </p>
 *
 * @since 1.0.0
 */
public class ExperimentReader {

    private static final Logger LOG = LoggerFactory.getLogger(ExperimentReader.class);

    private final ObjectMapper mapper;

    public ExperimentReader() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // cycle numbers are integral; 1.7 must not become 1
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }

    /**
     * Read an experiment from a file.
     *
     * @param path path to the JSON document; must not be {@code null}
     * @return the validated experiment
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or parsed
     * @throws InvalidSeriesException   if a cell violates series invariants
     */
    public Experiment read(Path path) {
        Objects.requireNonNull(path, "Input path must not be null");
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Input file not found: " + path.toAbsolutePath());
        }
        LOG.info("Reading experiment from {}", path.toAbsolutePath());
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read input file: " + path, e);
        }
    }

    /**
     * Read an experiment from a stream.
     *
     * @param in JSON document
     * @return the validated experiment
     * @throws IllegalStateException  if the document is malformed, including
     *                                null cell or cycle entries and
     *                                fractional cycle numbers
     * @throws InvalidSeriesException if a cell violates series invariants
     */
    public Experiment read(InputStream in) {
        Objects.requireNonNull(in, "Input stream must not be null");
        ExperimentDocument document;
        try {
            document = mapper.readValue(in, ExperimentDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed experiment document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read experiment document", e);
        }
        if (document == null) {
            throw new IllegalStateException("Experiment document is empty");
        }
        return toExperiment(document);
    }

    private static Experiment toExperiment(ExperimentDocument document) {
        List<CellSeries> cells = new ArrayList<>();
        if (document.getCells() != null) {
            for (CellDocument cell : document.getCells()) {
                if (cell == null) {
                    throw new IllegalStateException("Malformed experiment document: null entry in cells");
                }
                cells.add(cell.toSeries());
            }
        }
        if (cells.isEmpty()) {
            LOG.warn("Experiment '{}' contains no cells", document.getExperimentId());
        }
        Experiment experiment = new Experiment(document.getExperimentId(), cells);
        LOG.info("Loaded {}", experiment);
        return experiment;
    }
}
