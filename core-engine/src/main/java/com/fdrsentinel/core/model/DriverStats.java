package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Segment-local range of a driver set against its baseline distribution.
 * Statistics are {@link Double#NaN} when no valid value exists; the unit is
 * empty when the feature name carries no parenthesised suffix.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "param", "unit", "segment_min", "segment_max",
        "baseline_p5", "baseline_p95", "baseline_median" })
public final class DriverStats {

    @JsonProperty("param")
    private final String param;

    @JsonProperty("unit")
    private final String unit;

    @JsonProperty("segment_min")
    private final double segmentMin;

    @JsonProperty("segment_max")
    private final double segmentMax;

    @JsonProperty("baseline_p5")
    private final double baselineP5;

    @JsonProperty("baseline_p95")
    private final double baselineP95;

    @JsonProperty("baseline_median")
    private final double baselineMedian;

    public DriverStats(String param, String unit, double segmentMin, double segmentMax,
            double baselineP5, double baselineP95, double baselineMedian) {
        this.param = Objects.requireNonNull(param, "param must not be null");
        this.unit = unit == null ? "" : unit;
        this.segmentMin = segmentMin;
        this.segmentMax = segmentMax;
        this.baselineP5 = baselineP5;
        this.baselineP95 = baselineP95;
        this.baselineMedian = baselineMedian;
    }

    public String getParam() {
        return param;
    }

    public String getUnit() {
        return unit;
    }

    public double getSegmentMin() {
        return segmentMin;
    }

    public double getSegmentMax() {
        return segmentMax;
    }

    public double getBaselineP5() {
        return baselineP5;
    }

    public double getBaselineP95() {
        return baselineP95;
    }

    public double getBaselineMedian() {
        return baselineMedian;
    }
}
