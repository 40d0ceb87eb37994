package com.fdrsentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the JSON field names of the detection result.
 */
class DetectionResultJsonTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
    }

    @Test
    @DisplayName("Reconstruction result should use the documented keys and omit robust fields")
    void shouldSerializeReconstructionResult() {
        DetectionResult result = new DetectionResult(
                Summary.builder()
                        .rowCount(3)
                        .parameterCount(1)
                        .segmentCount(1)
                        .topParameters(List.of(new DriverCount("Pitch (deg)", 1)))
                        .flagged(2, 66.6667)
                        .threshold(97.0, 0.5)
                        .windowing(60, 5)
                        .groupingOutcome(GroupingOutcome.THRESHOLD_SEGMENTS)
                        .build(),
                List.of(segment()),
                Timeline.of(new double[] { 0, 1, 2 }, new double[] { 0.1, 0.9, 0.8 }),
                null,
                "linear_reconstructor");

        JsonNode json = mapper.valueToTree(result);

        assertThat(fieldNames(json)).containsExactly("summary", "segments", "timeline");
        assertThat(fieldNames(json.get("summary"))).containsExactly(
                "n_rows", "n_params_used", "segments_found", "top_parameters", "flaggedRowCount",
                "flaggedPercent", "threshold_percentile", "threshold_value", "window_size", "stride",
                "grouping_outcome");
        assertThat(json.at("/summary/grouping_outcome").asText()).isEqualTo("threshold_segments");
        assertThat(json.at("/summary/top_parameters/0/parameter").asText()).isEqualTo("Pitch (deg)");
        assertThat(fieldNames(json.get("timeline"))).containsExactly("time", "score");

        JsonNode segment = json.at("/segments/0");
        assertThat(fieldNames(segment)).containsExactly("start_time", "end_time", "duration", "points",
                "severity", "score_peak", "top_drivers", "explanation", "driver_stats", "review");
        assertThat(segment.get("severity").asText()).isEqualTo("med");
        assertThat(segment.get("duration").asDouble()).isEqualTo(1.0);
        assertThat(segment.get("points").asInt()).isEqualTo(2);
        assertThat(fieldNames(segment.at("/top_drivers/0"))).containsExactly("parameter", "error");
        assertThat(fieldNames(segment.at("/driver_stats/0"))).containsExactly("param", "unit", "segment_min",
                "segment_max", "baseline_p5", "baseline_p95", "baseline_median");
    }

    @Test
    @DisplayName("Robust result should add component scores and debug scaling")
    void shouldSerializeRobustResult() {
        ScalingStatistics scaling = new ScalingStatistics("median", "iqr",
                new double[] { 1.5 }, new double[] { 0.25 });
        DetectionResult result = new DetectionResult(
                Summary.builder()
                        .rowCount(2)
                        .parameterCount(1)
                        .robust(1, 8.0, 0.01)
                        .groupingOutcome(GroupingOutcome.REVIEW_FALLBACK)
                        .build(),
                List.of(),
                Timeline.robust(new double[] { 0, 1 }, new double[] { 0.4, 9.1 }, new double[] { 0.1, 8.5 },
                        new double[] { 0.3, 0.6 }, new boolean[] { false, true }),
                new DebugInfo(List.of("Oil Temp (deg C)"), 9.0, 9.1, null, null, null, "robust_ensemble", scaling),
                "robust_ensemble");

        JsonNode json = mapper.valueToTree(result);

        assertThat(fieldNames(json.get("summary"))).contains("total_anomalies", "robust_z_threshold",
                "iforest_contamination").doesNotContain("window_size", "stride");
        assertThat(fieldNames(json.get("timeline"))).containsExactly("time", "score", "robust_z_max",
                "iforest_score", "is_anomaly");
        assertThat(json.at("/timeline/is_anomaly/1").asBoolean()).isTrue();
        assertThat(fieldNames(json.get("debugInfo"))).containsExactly("columns_used", "threshold", "max_score",
                "backend", "median", "iqr");
        assertThat(json.at("/debugInfo/median/Oil Temp (deg C)").asDouble()).isEqualTo(1.5);
        assertThat(json.at("/debugInfo/iqr/Oil Temp (deg C)").asDouble()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Robust drivers should report max_robust_z instead of error")
    void shouldSerializeRobustDriver() {
        JsonNode json = mapper.valueToTree(Driver.ofRobustZ("Roll (deg)", 12.5));

        assertThat(fieldNames(json)).containsExactly("parameter", "max_robust_z");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Segment segment() {
        return Segment.builder()
                .rows(1, 2)
                .times(1.0, 2.0)
                .severity(Severity.MEDIUM)
                .scorePeak(0.9)
                .topDrivers(List.of(Driver.ofError("Pitch (deg)", 0.7)))
                .explanation("Unusual behavior pattern compared to learned normal behavior for this flight.")
                .driverStats(List.of(new DriverStats("Pitch (deg)", "deg", 1, 2, 0, 1, 0.5)))
                .build();
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
