package com.providersentinel.job;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable configuration object for the scan job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults:
 * </p>
 * <ul>
 * <li>{@code DATA_DIR}: directory holding the input files
 * ({@code ./data})</li>
 * <li>{@code OUTPUT_PATH}: report file ({@code fraud_signals.json})</li>
 * <li>{@code DETECTOR_THREADS}: worker pool size (available processors,
 * capped at 6)</li>
 * <li>{@code SIGNALS_CONFIG_PATH}: external detection rules file (empty
 * means the bundled {@code signals.yml})</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String ENV_DATA_DIR = "DATA_DIR";
    public static final String ENV_OUTPUT_PATH = "OUTPUT_PATH";
    public static final String ENV_DETECTOR_THREADS = "DETECTOR_THREADS";
    public static final String ENV_SIGNALS_CONFIG_PATH = "SIGNALS_CONFIG_PATH";

    /** One thread per signal kind is the most the engine can use. */
    static final int MAX_DEFAULT_THREADS = 6;

    private final Path dataDir;
    private final Path outputPath;
    private final int detectorThreads;
    private final String signalsConfigPath;

    private JobConfig(Builder b) {
        this.dataDir = b.dataDir;
        this.outputPath = b.outputPath;
        this.detectorThreads = b.detectorThreads;
        this.signalsConfigPath = b.signalsConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory, resolved from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from the given variables.
     *
     * @param env variable name to value
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    static JobConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .dataDir(Paths.get(env(env, ENV_DATA_DIR, "./data")))
                    .outputPath(Paths.get(env(env, ENV_OUTPUT_PATH, "fraud_signals.json")))
                    .detectorThreads(Integer.parseInt(
                            env(env, ENV_DETECTOR_THREADS, String.valueOf(defaultThreads()))))
                    .signalsConfigPath(env(env, ENV_SIGNALS_CONFIG_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    static int defaultThreads() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_DEFAULT_THREADS));
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getDataDir() {
        return dataDir;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public int getDetectorThreads() {
        return detectorThreads;
    }

    /**
     * @return the external rules file, or empty to use the bundled rules
     */
    public Optional<Path> getSignalsConfig() {
        if (signalsConfigPath.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(signalsConfigPath));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that paths are present and that
     * the thread count is at least 1.
     * </p>
     */
    public static class Builder {
        private Path dataDir = Paths.get("./data");
        private Path outputPath = Paths.get("fraud_signals.json");
        private int detectorThreads = defaultThreads();
        private String signalsConfigPath = "";

        public Builder dataDir(Path v) {
            this.dataDir = v;
            return this;
        }

        public Builder outputPath(Path v) {
            this.outputPath = v;
            return this;
        }

        public Builder detectorThreads(int v) {
            this.detectorThreads = v;
            return this;
        }

        public Builder signalsConfigPath(String v) {
            this.signalsConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(dataDir, "dataDir required");
            Objects.requireNonNull(outputPath, "outputPath required");
            if (detectorThreads < 1) {
                throw new IllegalArgumentException("detectorThreads must be >= 1, got: " + detectorThreads);
            }
            if (signalsConfigPath == null) {
                signalsConfigPath = "";
            }
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "dataDir=" + dataDir +
                ", outputPath=" + outputPath +
                ", detectorThreads=" + detectorThreads +
                ", signalsConfigPath='" + signalsConfigPath + '\'' +
                '}';
    }
}
