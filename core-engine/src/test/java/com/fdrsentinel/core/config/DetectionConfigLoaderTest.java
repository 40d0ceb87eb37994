package com.fdrsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionConfigLoader}.
 */
class DetectionConfigLoaderTest {

    @Test
    @DisplayName("Should load settings from classpath and overlay them on defaults")
    void shouldLoadFromClasspath() {
        DetectionConfig config = DetectionConfigLoader.fromClasspath("test-detection.yml");

        assertThat(config.getTimeColumn()).isEqualTo("Elapsed Time");
        assertThat(config.getWindowSize()).isEqualTo(30);
        assertThat(config.getStride()).isEqualTo(2);
        assertThat(config.getEpochs()).isEqualTo(5);
        assertThat(config.getThresholdPercentile()).isEqualTo(95.0);
        assertThat(config.getSegmentGapSeconds()).isEqualTo(1.5);
        assertThat(config.getRobustZThreshold()).isEqualTo(6.0);
        assertThat(config.isDebug()).isTrue();
        // untouched keys keep their defaults
        assertThat(config.getBatchSize()).isEqualTo(128);
        assertThat(config.getExcludedColumns())
                .contains("Tail Number")
                .containsAll(DetectionConfig.DEFAULT_EXCLUDED_COLUMNS);
    }

    @Test
    @DisplayName("Keys absent from the file should come from FDR_* variables")
    void shouldOverlayFileOnEnvironment() {
        DetectionConfig base = DetectionConfig.fromEnvironment(Map.of(
                "FDR_WINDOW_SIZE", "20",
                "FDR_BATCH_SIZE", "64",
                "FDR_THRESHOLD_PERCENTILE", "99"));

        DetectionConfig config = DetectionConfigLoader.fromClasspath("test-detection.yml", base);

        // set by the file
        assertThat(config.getWindowSize()).isEqualTo(30);
        assertThat(config.getThresholdPercentile()).isEqualTo(95.0);
        // left to the environment
        assertThat(config.getBatchSize()).isEqualTo(64);
    }

    @Test
    @DisplayName("Without a config file, load should honour FDR_* variables")
    void shouldLoadFromEnvironmentWithoutFile() {
        DetectionConfig config = DetectionConfigLoader.load(Map.of(
                "FDR_WINDOW_SIZE", "20",
                "FDR_WINDOW_STRIDE", "2",
                "FDR_EPOCHS", "7",
                "FDR_TIME_COLUMN", "Elapsed"));

        assertThat(config.getWindowSize()).isEqualTo(20);
        assertThat(config.getStride()).isEqualTo(2);
        assertThat(config.getEpochs()).isEqualTo(7);
        assertThat(config.getTimeColumn()).isEqualTo("Elapsed");
        assertThat(config.getBatchSize()).isEqualTo(128);
    }

    @Test
    @DisplayName("FDR_CONFIG_PATH should point load at a file layered over the environment")
    void shouldLoadFileNamedByEnvironment(@TempDir Path dir) throws Exception {
        Path yaml = dir.resolve("detection.yml");
        Files.writeString(yaml, "stride: 3\n", StandardCharsets.UTF_8);

        DetectionConfig config = DetectionConfigLoader.load(Map.of(
                DetectionConfigLoader.ENV_CONFIG_PATH, yaml.toString(),
                "FDR_WINDOW_SIZE", "20",
                "FDR_WINDOW_STRIDE", "2"));

        assertThat(config.getStride()).isEqualTo(3);
        assertThat(config.getWindowSize()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should report every invalid property at once")
    void shouldAggregateValidationErrors() {
        assertThatThrownBy(() -> DetectionConfigLoader.fromClasspath("invalid-detection.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowSize")
                .hasMessageContaining("stride")
                .hasMessageContaining("thresholdPercentile")
                .hasMessageContaining("ensembleContamination");
    }

    @Test
    @DisplayName("An empty file should yield the defaults")
    void shouldFallBackToDefaultsForEmptyFile() {
        DetectionConfig config = DetectionConfigLoader.fromClasspath("empty-detection.yml");

        assertThat(config.getWindowSize()).isEqualTo(DetectionConfig.defaults().getWindowSize());
        assertThat(config.getTimeColumn()).isEqualTo("Session Time");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> DetectionConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> DetectionConfigLoader.fromFile("/no/such/detection.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
