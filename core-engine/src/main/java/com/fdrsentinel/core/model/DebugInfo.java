package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Diagnostics emitted only on request. Scaling statistics are serialized
 * under their own names ({@code mean}/{@code std} or {@code median}/{@code iqr}),
 * each as a map from feature name to value.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "columns_used", "threshold", "max_score", "window_size", "stride", "epochs",
        "backend" })
public final class DebugInfo {

    @JsonProperty("columns_used")
    private final List<String> columnsUsed;

    @JsonProperty("threshold")
    private final double threshold;

    @JsonProperty("max_score")
    private final double maxScore;

    @JsonProperty("window_size")
    private final Integer windowSize;

    @JsonProperty("stride")
    private final Integer stride;

    @JsonProperty("epochs")
    private final Integer epochs;

    @JsonProperty("backend")
    private final String backend;

    private final Map<String, Map<String, Double>> scaling;

    public DebugInfo(List<String> columnsUsed, double threshold, double maxScore, Integer windowSize,
            Integer stride, Integer epochs, String backend, ScalingStatistics scalingStatistics) {
        this.columnsUsed = List.copyOf(Objects.requireNonNull(columnsUsed, "columnsUsed must not be null"));
        this.threshold = threshold;
        this.maxScore = maxScore;
        this.windowSize = windowSize;
        this.stride = stride;
        this.epochs = epochs;
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.scaling = new LinkedHashMap<>();
        if (scalingStatistics != null) {
            scaling.put(scalingStatistics.getCenterName(), byFeature(scalingStatistics.getCenter()));
            scaling.put(scalingStatistics.getSpreadName(), byFeature(scalingStatistics.getSpread()));
        }
    }

    public List<String> getColumnsUsed() {
        return columnsUsed;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMaxScore() {
        return maxScore;
    }

    public Integer getWindowSize() {
        return windowSize;
    }

    public Integer getStride() {
        return stride;
    }

    public Integer getEpochs() {
        return epochs;
    }

    public String getBackend() {
        return backend;
    }

    @JsonAnyGetter
    public Map<String, Map<String, Double>> getScaling() {
        return scaling;
    }

    private Map<String, Double> byFeature(double[] values) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int f = 0; f < values.length && f < columnsUsed.size(); f++) {
            map.put(columnsUsed.get(f), values[f]);
        }
        return map;
    }
}
