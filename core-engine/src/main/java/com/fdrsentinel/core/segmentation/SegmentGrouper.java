package com.fdrsentinel.core.segmentation;

import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.model.GroupingOutcome;
import com.fdrsentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Clusters anomalous rows into time-contiguous spans.
 *
 * <h3>Policy branches</h3>
 * <ul>
 * <li>{@link GroupingOutcome#DEGENERATE_DISTRIBUTION}: every score is equal
 * within tolerance. No row is anomalous; the top rows are listed for
 * review.</li>
 * <li>{@link GroupingOutcome#THRESHOLD_SEGMENTS}: anomalous rows whose
 * successive timestamps differ by at most the configured gap share a span.</li>
 * <li>{@link GroupingOutcome#REVIEW_FALLBACK}: no anomalous row; the top rows
 * are listed for review.</li>
 * </ul>
 * <p>
 * A span runs from its first to its last anomalous row inclusive, so
 * non-anomalous rows between them belong to it.
 * </p>
 *
 * @since 1.0.0
 */
public final class SegmentGrouper {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentGrouper.class);

    private final double thresholdPercentile;
    private final double mediumPercentile;
    private final double gapSeconds;
    private final int reviewLimit;

    public SegmentGrouper(DetectionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.thresholdPercentile = config.getThresholdPercentile();
        this.mediumPercentile = config.getMediumPercentile();
        this.gapSeconds = config.getSegmentGapSeconds();
        this.reviewLimit = config.getReviewLimit();
    }

    /**
     * Threshold the scores at the configured percentile and group the rows at
     * or above it.
     */
    public Grouping groupByThreshold(double[] times, double[] scores) {
        checkLengths(times, scores);
        double threshold = Stats.percentile(scores, thresholdPercentile);
        boolean[] mask = new boolean[scores.length];
        if (!Stats.allClose(scores)) {
            for (int r = 0; r < scores.length; r++) {
                mask[r] = scores[r] >= threshold;
            }
        }
        return group(times, scores, mask, threshold);
    }

    /**
     * Group the rows of an externally computed anomaly mask. Severity tiers
     * still come from the percentiles of {@code scores}.
     */
    public Grouping groupByMask(double[] times, double[] scores, boolean[] mask) {
        checkLengths(times, scores);
        if (mask.length != scores.length) {
            throw new IllegalArgumentException("mask and scores must have the same length");
        }
        double threshold = Stats.percentile(scores, thresholdPercentile);
        boolean[] effective = Stats.allClose(scores) ? new boolean[mask.length] : mask.clone();
        return group(times, scores, effective, threshold);
    }

    private Grouping group(double[] times, double[] scores, boolean[] mask, double threshold) {
        double medium = Stats.percentile(scores, mediumPercentile);

        if (Stats.allClose(scores)) {
            LOG.warn("Score distribution is degenerate; listing top {} row(s) for review", reviewLimit);
            return new Grouping(GroupingOutcome.DEGENERATE_DISTRIBUTION, reviewSpans(scores), mask,
                    scores, threshold, medium);
        }

        List<RowSpan> spans = spansOf(times, mask);
        if (spans.isEmpty()) {
            LOG.warn("No anomalous rows; listing top {} row(s) for review", reviewLimit);
            return new Grouping(GroupingOutcome.REVIEW_FALLBACK, reviewSpans(scores), mask,
                    scores, threshold, medium);
        }

        LOG.info("Grouped anomalous rows into {} segment(s) at threshold {}", spans.size(), threshold);
        return new Grouping(GroupingOutcome.THRESHOLD_SEGMENTS, spans, mask, scores, threshold, medium);
    }

    List<RowSpan> spansOf(double[] times, boolean[] mask) {
        List<RowSpan> spans = new ArrayList<>();
        int start = -1;
        int last = -1;
        for (int r = 0; r < mask.length; r++) {
            if (!mask[r]) {
                continue;
            }
            if (start < 0) {
                start = r;
            } else if (times[r] - times[last] > gapSeconds) {
                spans.add(new RowSpan(start, last, false));
                start = r;
            }
            last = r;
        }
        if (start >= 0) {
            spans.add(new RowSpan(start, last, false));
        }
        return spans;
    }

    /**
     * @return the {@code reviewLimit} highest-scoring rows, ties to the lower index
     */
    List<RowSpan> reviewSpans(double[] scores) {
        return IntStream.range(0, scores.length)
                .boxed()
                .sorted((a, b) -> Double.compare(scores[b], scores[a]))
                .limit(reviewLimit)
                .map(RowSpan::review)
                .toList();
    }

    private static void checkLengths(double[] times, double[] scores) {
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(scores, "scores must not be null");
        if (times.length != scores.length) {
            throw new IllegalArgumentException("times and scores must have the same length");
        }
        if (scores.length == 0) {
            throw new IllegalArgumentException("Cannot group an empty score series");
        }
    }
}
