package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Parallel per-row arrays for plotting. {@code time} and {@code score} are
 * always present; the robust strategy also fills the component scores and the
 * anomaly mask.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "time", "score", "robust_z_max", "iforest_score", "is_anomaly" })
public final class Timeline {

    @JsonProperty("time")
    private final double[] time;

    @JsonProperty("score")
    private final double[] score;

    @JsonProperty("robust_z_max")
    private final double[] robustZMax;

    @JsonProperty("iforest_score")
    private final double[] ensembleScore;

    @JsonProperty("is_anomaly")
    private final boolean[] anomaly;

    private Timeline(double[] time, double[] score, double[] robustZMax, double[] ensembleScore,
            boolean[] anomaly) {
        this.time = Objects.requireNonNull(time, "time must not be null");
        this.score = Objects.requireNonNull(score, "score must not be null");
        if (time.length != score.length) {
            throw new IllegalArgumentException("time and score must have the same length");
        }
        this.robustZMax = robustZMax;
        this.ensembleScore = ensembleScore;
        this.anomaly = anomaly;
    }

    public static Timeline of(double[] time, double[] score) {
        return new Timeline(time, score, null, null, null);
    }

    public static Timeline robust(double[] time, double[] combinedScore, double[] robustZMax,
            double[] ensembleScore, boolean[] anomaly) {
        return new Timeline(time, combinedScore,
                Objects.requireNonNull(robustZMax, "robustZMax must not be null"),
                Objects.requireNonNull(ensembleScore, "ensembleScore must not be null"),
                Objects.requireNonNull(anomaly, "anomaly must not be null"));
    }

    public double[] getTime() {
        return time;
    }

    public double[] getScore() {
        return score;
    }

    public double[] getRobustZMax() {
        return robustZMax;
    }

    public double[] getEnsembleScore() {
        return ensembleScore;
    }

    public boolean[] getAnomaly() {
        return anomaly;
    }
}
