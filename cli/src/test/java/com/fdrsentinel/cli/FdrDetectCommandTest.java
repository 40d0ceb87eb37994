package com.fdrsentinel.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link FdrDetectCommand}.
 */
class FdrDetectCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = command(Map.of());
    }

    @Test
    @DisplayName("Robust strategy should print a JSON report and exit 0")
    void shouldRunRobustStrategy() throws Exception {
        Path csv = flightCsv("Session Time");

        int exitCode = commandLine.execute(csv.toString(), "--strategy", "robust");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.at("/summary/n_rows").asInt()).isEqualTo(200);
        assertThat(json.at("/summary/n_params_used").asInt()).isEqualTo(3);
        assertThat(json.at("/summary/total_anomalies").isInt()).isTrue();
        assertThat(json.at("/timeline/is_anomaly").size()).isEqualTo(200);
        assertThat(json.has("debugInfo")).isFalse();
        assertThat(json.at("/segments").size()).isPositive();
    }

    @Test
    @DisplayName("Reconstruction with --debug should report the backend that ran")
    void shouldReportBackendInDebugInfo() throws Exception {
        Path csv = flightCsv("Session Time");

        int exitCode = commandLine.execute(csv.toString(), "--debug");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.at("/debugInfo/backend").asText()).isEqualTo("linear_reconstructor");
        assertThat(json.at("/debugInfo/columns_used").size()).isEqualTo(3);
        assertThat(json.at("/debugInfo/mean").size()).isEqualTo(3);
        assertThat(json.at("/summary/window_size").asInt()).isEqualTo(60);
    }

    @Test
    @DisplayName("A config file should override the time column")
    void shouldUseConfigFile() throws Exception {
        Path csv = flightCsv("Elapsed");
        Path yaml = tempDir.resolve("detection.yml");
        Files.writeString(yaml, "timeColumn: \"Elapsed\"\nwindowSize: 20\nstride: 2\n", StandardCharsets.UTF_8);

        int exitCode = commandLine.execute(csv.toString(), "-c", yaml.toString());

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.at("/summary/window_size").asInt()).isEqualTo(20);
        assertThat(json.at("/summary/stride").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("FDR_* variables should set the window when no config file is given")
    void shouldHonourEnvironmentSettings() throws Exception {
        Path csv = flightCsv("Session Time");
        commandLine = command(Map.of("FDR_WINDOW_SIZE", "20", "FDR_WINDOW_STRIDE", "2"));

        int exitCode = commandLine.execute(csv.toString(), "--debug");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.at("/summary/window_size").asInt()).isEqualTo(20);
        assertThat(json.at("/summary/stride").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("A config file should override only the keys it sets")
    void shouldLayerConfigFileOverEnvironment() throws Exception {
        Path csv = flightCsv("Session Time");
        Path yaml = tempDir.resolve("stride.yml");
        Files.writeString(yaml, "stride: 4\n", StandardCharsets.UTF_8);
        commandLine = command(Map.of("FDR_WINDOW_SIZE", "20", "FDR_WINDOW_STRIDE", "2"));

        int exitCode = commandLine.execute(csv.toString(), "-c", yaml.toString());

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.at("/summary/window_size").asInt()).isEqualTo(20);
        assertThat(json.at("/summary/stride").asInt()).isEqualTo(4);
    }

    @Test
    @DisplayName("A missing time column should print an error and exit 1")
    void shouldFailWithoutTimeColumn() throws Exception {
        Path csv = flightCsv("Clock");

        int exitCode = commandLine.execute(csv.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).startsWith("Error: Input file must include a 'Session Time' column.");
    }

    @Test
    @DisplayName("A missing input file should print an error and exit 1")
    void shouldFailForMissingFile() {
        int exitCode = commandLine.execute(tempDir.resolve("absent.csv").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error: ");
    }

    @Test
    @DisplayName("An unknown strategy should print an error and exit 1")
    void shouldFailForUnknownStrategy() throws Exception {
        Path csv = flightCsv("Session Time");

        int exitCode = commandLine.execute(csv.toString(), "-s", "lstm");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown detection strategy");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private CommandLine command(Map<String, String> environment) {
        return new CommandLine(new FdrDetectCommand(environment))
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err));
    }

    /**
     * 200 one-second rows of three noisy parameters with a spike in rows 120-124.
     */
    private Path flightCsv(String timeColumn) throws Exception {
        Random random = new Random(3);
        StringBuilder csv = new StringBuilder(timeColumn)
                .append(",Pitch (deg),Oil Temp (deg C),Airspeed (kt),Tail Number\n");
        for (int r = 0; r < 200; r++) {
            double spike = r >= 120 && r < 125 ? 25.0 : 0.0;
            csv.append(r).append(',')
                    .append(format(Math.sin(r / 20.0) + 0.05 * random.nextGaussian() + spike)).append(',')
                    .append(format(80 + Math.cos(r / 30.0) + 0.05 * random.nextGaussian())).append(',')
                    .append(format(120 + 0.01 * r + 0.05 * random.nextGaussian())).append(',')
                    .append("N12345\n");
        }
        Path file = tempDir.resolve("flight-" + timeColumn + ".csv");
        Files.writeString(file, csv.toString(), StandardCharsets.UTF_8);
        return file;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.5f", value);
    }
}
