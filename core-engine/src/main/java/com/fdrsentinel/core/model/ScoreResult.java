package com.fdrsentinel.core.model;

import java.util.Objects;

/**
 * Output of a scoring backend: one scalar score and one per-feature error
 * vector per scored unit (window or row).
 *
 * @since 1.0.0
 */
public final class ScoreResult {

    private final double[] scores;
    private final double[][] featureErrors;

    public ScoreResult(double[] scores, double[][] featureErrors) {
        this.scores = Objects.requireNonNull(scores, "scores must not be null");
        this.featureErrors = Objects.requireNonNull(featureErrors, "featureErrors must not be null");
        if (scores.length != featureErrors.length) {
            throw new IllegalArgumentException("Expected one error vector per score");
        }
    }

    public double[] getScores() {
        return scores;
    }

    public double[][] getFeatureErrors() {
        return featureErrors;
    }

    public int size() {
        return scores.length;
    }
}
