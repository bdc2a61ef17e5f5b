package com.providersentinel.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults when no variables are set")
    void shouldApplyDefaults() {
        JobConfig config = JobConfig.fromEnvironment(Map.of());

        assertThat(config.getDataDir()).isEqualTo(Paths.get("./data"));
        assertThat(config.getOutputPath()).isEqualTo(Paths.get("fraud_signals.json"));
        assertThat(config.getDetectorThreads()).isBetween(1, JobConfig.MAX_DEFAULT_THREADS);
        assertThat(config.getSignalsConfig()).isEmpty();
    }

    @Test
    @DisplayName("Should read every variable from the environment")
    void shouldReadVariables() {
        JobConfig config = JobConfig.fromEnvironment(Map.of(
                JobConfig.ENV_DATA_DIR, "/srv/data",
                JobConfig.ENV_OUTPUT_PATH, " out/report.json ",
                JobConfig.ENV_DETECTOR_THREADS, "3",
                JobConfig.ENV_SIGNALS_CONFIG_PATH, "/etc/signals.yml"));

        assertThat(config.getDataDir()).isEqualTo(Paths.get("/srv/data"));
        assertThat(config.getOutputPath()).isEqualTo(Paths.get("out/report.json"));
        assertThat(config.getDetectorThreads()).isEqualTo(3);
        assertThat(config.getSignalsConfig()).contains(Paths.get("/etc/signals.yml"));
    }

    @Test
    @DisplayName("Should wrap a non-numeric thread count in IllegalStateException")
    void shouldRejectNonNumericThreads() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of(JobConfig.ENV_DETECTOR_THREADS, "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("Builder should reject a thread count below one")
    void builderShouldRejectZeroThreads() {
        assertThatThrownBy(() -> new JobConfig.Builder().detectorThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("detectorThreads");
    }
}
