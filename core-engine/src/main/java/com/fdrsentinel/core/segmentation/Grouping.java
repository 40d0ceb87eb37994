package com.fdrsentinel.core.segmentation;

import com.fdrsentinel.core.model.GroupingOutcome;
import com.fdrsentinel.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Result of one segment-grouping pass: the branch taken, the spans it
 * produced, the anomaly mask it thresholded, and the tiers used to grade
 * severity.
 *
 * @since 1.0.0
 */
public final class Grouping {

    private final GroupingOutcome outcome;
    private final List<RowSpan> spans;
    private final boolean[] mask;
    private final double[] scores;
    private final double threshold;
    private final double mediumThreshold;

    Grouping(GroupingOutcome outcome, List<RowSpan> spans, boolean[] mask, double[] scores,
            double threshold, double mediumThreshold) {
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.spans = List.copyOf(spans);
        this.mask = mask;
        this.scores = scores;
        this.threshold = threshold;
        this.mediumThreshold = mediumThreshold;
    }

    public GroupingOutcome getOutcome() {
        return outcome;
    }

    public List<RowSpan> getSpans() {
        return spans;
    }

    /**
     * @return per-row anomaly mask; all false for a degenerate distribution
     */
    public boolean[] getMask() {
        return mask.clone();
    }

    public double[] getScores() {
        return scores;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isDegenerate() {
        return outcome == GroupingOutcome.DEGENERATE_DISTRIBUTION;
    }

    /**
     * @return the highest score inside the span
     */
    public double peak(RowSpan span) {
        double peak = Double.NEGATIVE_INFINITY;
        for (int r = span.startRow(); r <= span.endRow(); r++) {
            peak = Math.max(peak, scores[r]);
        }
        return peak;
    }

    /**
     * Grade a span. Review spans and degenerate distributions are always low.
     */
    public Severity severity(RowSpan span) {
        if (span.review() || isDegenerate()) {
            return Severity.LOW;
        }
        double peak = peak(span);
        if (peak >= threshold) {
            return Severity.HIGH;
        }
        if (peak >= mediumThreshold) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
