package com.cellsentinel.runner;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a {@link FlagReportDocument} as pretty-printed JSON with ISO-8601
 * timestamps.
 *
 * @since 1.0.0
 */
public class FlagReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(FlagReportWriter.class);

    private final ObjectMapper mapper;

    public FlagReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Write the document to a file, creating parent directories as needed.
     *
     * @param document the report; must not be {@code null}
     * @param path     destination; must not be {@code null}
     * @throws IllegalStateException if the file cannot be written
     */
    public void write(FlagReportDocument document, Path path) {
        Objects.requireNonNull(path, "Output path must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                write(document, out);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write flag report: " + path, e);
        }
        LOG.info("Wrote flags for {} cell(s) to {}", document.getCells().size(), path.toAbsolutePath());
    }

    /**
     * Write the document to a stream. The stream is not closed.
     *
     * @param document the report; must not be {@code null}
     * @param out      destination stream
     * @throws IOException if writing fails
     */
    public void write(FlagReportDocument document, OutputStream out) throws IOException {
        Objects.requireNonNull(document, "FlagReportDocument must not be null");
        mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, document);
    }

    /**
     * @param document the report
     * @return the JSON text
     * @throws IllegalStateException if serialization fails
     */
    public String writeAsString(FlagReportDocument document) {
        Objects.requireNonNull(document, "FlagReportDocument must not be null");
        try {
            return mapper.writeValueAsString(document);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize flag report", e);
        }
    }
}
