package com.curvematch.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should default to the conventional data layout")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.builder().build();

        assertThat(config.getTrainingPath()).isEqualTo(Path.of("Data", "train.csv"));
        assertThat(config.getIdealPath()).isEqualTo(Path.of("Data", "ideal.csv"));
        assertThat(config.getTestPath()).isEqualTo(Path.of("Data", "test.csv"));
        assertThat(config.getResultsPath()).isEqualTo(Path.of("output/results.json"));
        assertThat(config.getMatcherConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should resolve input files against the data directory")
    void shouldResolveAgainstDataDir() {
        JobConfig config = JobConfig.builder()
                .dataDir("/srv/curves")
                .trainingFile("training.csv")
                .build();

        assertThat(config.getTrainingPath()).isEqualTo(Path.of("/srv/curves/training.csv"));
        assertThat(config.getDataDir()).isEqualTo(Path.of("/srv/curves"));
    }

    @Test
    @DisplayName("Should reject blank file names")
    void shouldRejectBlank() {
        assertThatThrownBy(() -> JobConfig.builder().idealFile(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("idealFile");
    }

    @Test
    @DisplayName("Should include resolved paths in toString")
    void shouldDescribeItself() {
        assertThat(JobConfig.builder().build().toString()).contains("train.csv").contains("results.json");
    }
}
