package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Run-level aggregates. Window fields are present only for the reconstruction
 * strategy, detector thresholds only for the robust strategy.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "n_rows", "n_params_used", "segments_found", "top_parameters",
        "flaggedRowCount", "flaggedPercent", "threshold_percentile", "threshold_value",
        "window_size", "stride", "total_anomalies", "robust_z_threshold", "iforest_contamination",
        "grouping_outcome" })
public final class Summary {

    @JsonProperty("n_rows")
    private final int rowCount;

    @JsonProperty("n_params_used")
    private final int parameterCount;

    @JsonProperty("segments_found")
    private final int segmentCount;

    @JsonProperty("top_parameters")
    private final List<DriverCount> topParameters;

    @JsonProperty("flaggedRowCount")
    private final int flaggedRowCount;

    @JsonProperty("flaggedPercent")
    private final double flaggedPercent;

    @JsonProperty("threshold_percentile")
    private final double thresholdPercentile;

    @JsonProperty("threshold_value")
    private final double thresholdValue;

    @JsonProperty("window_size")
    private final Integer windowSize;

    @JsonProperty("stride")
    private final Integer stride;

    @JsonProperty("total_anomalies")
    private final Integer totalAnomalies;

    @JsonProperty("robust_z_threshold")
    private final Double robustZThreshold;

    @JsonProperty("iforest_contamination")
    private final Double ensembleContamination;

    @JsonProperty("grouping_outcome")
    private final GroupingOutcome groupingOutcome;

    private Summary(Builder builder) {
        this.rowCount = builder.rowCount;
        this.parameterCount = builder.parameterCount;
        this.segmentCount = builder.segmentCount;
        this.topParameters = List.copyOf(builder.topParameters);
        this.flaggedRowCount = builder.flaggedRowCount;
        this.flaggedPercent = builder.flaggedPercent;
        this.thresholdPercentile = builder.thresholdPercentile;
        this.thresholdValue = builder.thresholdValue;
        this.windowSize = builder.windowSize;
        this.stride = builder.stride;
        this.totalAnomalies = builder.totalAnomalies;
        this.robustZThreshold = builder.robustZThreshold;
        this.ensembleContamination = builder.ensembleContamination;
        this.groupingOutcome = Objects.requireNonNull(builder.groupingOutcome,
                "groupingOutcome must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    public int getSegmentCount() {
        return segmentCount;
    }

    public List<DriverCount> getTopParameters() {
        return topParameters;
    }

    public int getFlaggedRowCount() {
        return flaggedRowCount;
    }

    public double getFlaggedPercent() {
        return flaggedPercent;
    }

    public double getThresholdPercentile() {
        return thresholdPercentile;
    }

    public double getThresholdValue() {
        return thresholdValue;
    }

    public Integer getWindowSize() {
        return windowSize;
    }

    public Integer getStride() {
        return stride;
    }

    public Integer getTotalAnomalies() {
        return totalAnomalies;
    }

    public Double getRobustZThreshold() {
        return robustZThreshold;
    }

    public Double getEnsembleContamination() {
        return ensembleContamination;
    }

    public GroupingOutcome getGroupingOutcome() {
        return groupingOutcome;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private int rowCount;
        private int parameterCount;
        private int segmentCount;
        private List<DriverCount> topParameters = List.of();
        private int flaggedRowCount;
        private double flaggedPercent;
        private double thresholdPercentile;
        private double thresholdValue;
        private Integer windowSize;
        private Integer stride;
        private Integer totalAnomalies;
        private Double robustZThreshold;
        private Double ensembleContamination;
        private GroupingOutcome groupingOutcome;

        public Builder rowCount(int rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder parameterCount(int parameterCount) {
            this.parameterCount = parameterCount;
            return this;
        }

        public Builder segmentCount(int segmentCount) {
            this.segmentCount = segmentCount;
            return this;
        }

        public Builder topParameters(List<DriverCount> topParameters) {
            this.topParameters = Objects.requireNonNull(topParameters, "topParameters must not be null");
            return this;
        }

        public Builder flagged(int flaggedRowCount, double flaggedPercent) {
            this.flaggedRowCount = flaggedRowCount;
            this.flaggedPercent = flaggedPercent;
            return this;
        }

        public Builder threshold(double thresholdPercentile, double thresholdValue) {
            this.thresholdPercentile = thresholdPercentile;
            this.thresholdValue = thresholdValue;
            return this;
        }

        public Builder windowing(int windowSize, int stride) {
            this.windowSize = windowSize;
            this.stride = stride;
            return this;
        }

        public Builder robust(int totalAnomalies, double robustZThreshold, double ensembleContamination) {
            this.totalAnomalies = totalAnomalies;
            this.robustZThreshold = robustZThreshold;
            this.ensembleContamination = ensembleContamination;
            return this;
        }

        public Builder groupingOutcome(GroupingOutcome groupingOutcome) {
            this.groupingOutcome = groupingOutcome;
            return this;
        }

        public Summary build() {
            return new Summary(this);
        }
    }
}
