package com.curvematch.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Typed, immutable configuration for a curve matching run.
 *
 * <p>
 * Values are resolved from environment variables with defaults matching the
 * conventional layout ({@code Data/train.csv}, {@code Data/ideal.csv},
 * {@code Data/test.csv}, {@code output/results.json}). Input file names are
 * resolved against the data directory unless they are absolute.
 * </p>
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

    private final Path dataDir;
    private final String trainingFile;
    private final String idealFile;
    private final String testFile;
    private final Path resultsPath;
    private final String matcherConfigPath;

    private JobConfig(Builder b) {
        this.dataDir = Path.of(b.dataDir);
        this.trainingFile = b.trainingFile;
        this.idealFile = b.idealFile;
        this.testFile = b.testFile;
        this.resultsPath = Path.of(b.resultsFile);
        this.matcherConfigPath = b.matcherConfigPath;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a value is blank
     */
    public static JobConfig fromEnvironment() {
        return new Builder()
                .dataDir(env("CURVE_DATA_DIR", "Data"))
                .trainingFile(env("CURVE_TRAINING_FILE", "train.csv"))
                .idealFile(env("CURVE_IDEAL_FILE", "ideal.csv"))
                .testFile(env("CURVE_TEST_FILE", "test.csv"))
                .resultsFile(env("CURVE_RESULTS_FILE", "output/results.json"))
                .matcherConfigPath(env("MATCHER_CONFIG_PATH", ""))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getDataDir() {
        return dataDir;
    }

    public Path getTrainingPath() {
        return dataDir.resolve(trainingFile);
    }

    public Path getIdealPath() {
        return dataDir.resolve(idealFile);
    }

    public Path getTestPath() {
        return dataDir.resolve(testFile);
    }

    public Path getResultsPath() {
        return resultsPath;
    }

    /**
     * @return explicit matcher config path, or an empty string to use
     *         automatic resolution
     */
    public String getMatcherConfigPath() {
        return matcherConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     */
    public static class Builder {
        private String dataDir = "Data";
        private String trainingFile = "train.csv";
        private String idealFile = "ideal.csv";
        private String testFile = "test.csv";
        private String resultsFile = "output/results.json";
        private String matcherConfigPath = "";

        public Builder dataDir(String v) {
            this.dataDir = v;
            return this;
        }

        public Builder trainingFile(String v) {
            this.trainingFile = v;
            return this;
        }

        public Builder idealFile(String v) {
            this.idealFile = v;
            return this;
        }

        public Builder testFile(String v) {
            this.testFile = v;
            return this;
        }

        public Builder resultsFile(String v) {
            this.resultsFile = v;
            return this;
        }

        public Builder matcherConfigPath(String v) {
            this.matcherConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if a required value is blank
         */
        public JobConfig build() {
            requireNonBlank(dataDir, "dataDir");
            requireNonBlank(trainingFile, "trainingFile");
            requireNonBlank(idealFile, "idealFile");
            requireNonBlank(testFile, "testFile");
            requireNonBlank(resultsFile, "resultsFile");
            Objects.requireNonNull(matcherConfigPath, "matcherConfigPath required");

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "training=" + getTrainingPath() +
                ", ideal=" + getIdealPath() +
                ", test=" + getTestPath() +
                ", results=" + resultsPath +
                ", matcherConfigPath='" + matcherConfigPath + '\'' +
                '}';
    }
}
