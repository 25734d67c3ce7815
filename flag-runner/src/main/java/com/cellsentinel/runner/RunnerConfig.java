package com.cellsentinel.runner;

import com.cellsentinel.core.config.ThresholdsLoader;

import java.util.Objects;

/**
 * Typed, immutable configuration of the batch flag runner.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the runner can be driven from a shell, a container or a scheduler without
 * extra files.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    public static final String ENV_INPUT_PATH = "INPUT_PATH";
    public static final String ENV_OUTPUT_PATH = "OUTPUT_PATH";
    public static final String ENV_PARALLELISM = "RUNNER_PARALLELISM";

    static final String DEFAULT_OUTPUT_PATH = "cell-flags.json";

    // ---------------------------------------------------------------
    // Files
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String outputPath;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final int parallelism;

    // ---------------------------------------------------------------
    // Thresholds
    // ---------------------------------------------------------------
    private final String thresholdsPath;

    private RunnerConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.parallelism = b.parallelism;
        this.thresholdsPath = b.thresholdsPath;
    }

    /**
     * Build a {@link RunnerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment() {
        return fromEnvironment(new String[0]);
    }

    /**
     * Build a {@link RunnerConfig} from environment variables, letting
     * positional command-line arguments override the file locations.
     *
     * @param args {@code [input [output]]}; may be empty
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment(String[] args) {
        Objects.requireNonNull(args, "args must not be null");
        try {
            return new Builder()
                    .inputPath(args.length > 0 ? args[0] : env(ENV_INPUT_PATH, ""))
                    .outputPath(args.length > 1 ? args[1] : env(ENV_OUTPUT_PATH, DEFAULT_OUTPUT_PATH))
                    .parallelism(parseIntEnv(ENV_PARALLELISM, "1"))
                    .thresholdsPath(env(ThresholdsLoader.ENV_THRESHOLDS_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public int getParallelism() {
        return parallelism;
    }

    public String getThresholdsPath() {
        return thresholdsPath;
    }

    public boolean hasThresholdsPath() {
        return thresholdsPath != null && !thresholdsPath.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * The {@link #build()} method checks that both paths are non-blank and
     * that parallelism is at least 1.
     * </p>
     */
    public static class Builder {
        private String inputPath = "";
        private String outputPath = DEFAULT_OUTPUT_PATH;
        private int parallelism = 1;
        private String thresholdsPath = "";

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder thresholdsPath(String v) {
            this.thresholdsPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            requireNonBlank(inputPath, "inputPath");
            requireNonBlank(outputPath, "outputPath");
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (thresholdsPath == null) {
                thresholdsPath = "";
            }
            return new RunnerConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", parallelism=" + parallelism +
                ", thresholdsPath='" + thresholdsPath + '\'' +
                '}';
    }
}
