package com.fdrsentinel.core.model;

import java.util.Objects;

/**
 * Scores folded onto the original rows: {@code scores[row]} and
 * {@code featureErrors[row][feature]}.
 *
 * @since 1.0.0
 */
public final class TimelineScore {

    private final double[] scores;
    private final double[][] featureErrors;

    public TimelineScore(double[] scores, double[][] featureErrors) {
        this.scores = Objects.requireNonNull(scores, "scores must not be null");
        this.featureErrors = Objects.requireNonNull(featureErrors, "featureErrors must not be null");
        if (scores.length != featureErrors.length) {
            throw new IllegalArgumentException("Expected one error vector per row");
        }
    }

    public double[] getScores() {
        return scores;
    }

    public double score(int row) {
        return scores[row];
    }

    public double featureError(int row, int feature) {
        return featureErrors[row][feature];
    }

    public int size() {
        return scores.length;
    }
}
