package com.cellsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Loads and validates {@link DetectorThresholds} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_THRESHOLDS_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Keys left out of the YAML keep their defaults. All {@code load*} methods
 * call {@link DetectorThresholds#validate()} after parsing so that a bad
 * limit fails fast instead of silently changing what gets flagged.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdsLoader.class);

    /** Environment variable that can override the default thresholds location. */
    public static final String ENV_THRESHOLDS_PATH = "CELL_THRESHOLDS_PATH";

    /** Classpath resource holding the reference thresholds. */
    public static final String DEFAULT_RESOURCE = "detector-thresholds.yml";

    private ThresholdsLoader() {
        // utility class: not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load thresholds using automatic resolution.
     *
     * <ol>
     * <li>If {@code CELL_THRESHOLDS_PATH} is set, load from that file. A path
     * that does not exist is an error.</li>
     * <li>Otherwise, fall back to {@value #DEFAULT_RESOURCE} on the classpath,
     * or the built-in defaults if that resource is absent.</li>
     * </ol>
     *
     * @return parsed and validated thresholds
     * @throws IllegalArgumentException if {@code CELL_THRESHOLDS_PATH} names a
     *                                  missing file
     * @throws IllegalStateException    if validation fails
     */
    public static DetectorThresholds load() {
        return load(System.getenv(ENV_THRESHOLDS_PATH));
    }

    static DetectorThresholds load(String configuredPath) {
        if (configuredPath != null && !configuredPath.isBlank()) {
            LOG.info("Loading detector thresholds from environment path: {}", configuredPath);
            return fromFile(configuredPath);
        }
        if (ThresholdsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.info("No {} on classpath – using built-in detector thresholds", DEFAULT_RESOURCE);
            return DetectorThresholds.defaults();
        }
        LOG.info("Loading detector thresholds from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load thresholds from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated thresholds
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectorThresholds fromFile(String path) {
        Objects.requireNonNull(path, "Thresholds file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Thresholds file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read thresholds file: " + path, e);
        }
    }

    /**
     * Load thresholds from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated thresholds
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectorThresholds fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ThresholdsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DetectorThresholds parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorThresholds.class, options));

        DetectorThresholds thresholds;
        try {
            thresholds = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed thresholds YAML in " + source + ": " + e.getMessage(), e);
        }

        if (thresholds == null) {
            LOG.warn("Thresholds source {} is empty – using built-in defaults", source);
            thresholds = DetectorThresholds.defaults();
        }
        thresholds.validate();

        LOG.info("Loaded detector thresholds: {}", thresholds);
        return thresholds;
    }
}
