package com.fdrsentinel.core.attribution;

import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.model.Driver;
import com.fdrsentinel.core.model.DriverStats;
import com.fdrsentinel.core.model.FeatureMatrix;
import com.fdrsentinel.core.model.Segment;
import com.fdrsentinel.core.segmentation.Grouping;
import com.fdrsentinel.core.segmentation.RowSpan;
import com.fdrsentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Turns grouped spans into reportable {@link Segment}s.
 *
 * <p>
 * Each segment gets its ranked drivers, an explanation, and for every driver
 * the segment-local min/max beside the baseline p5/p95/median. The baseline
 * is every row outside the flagged mask, or every row if nothing is left.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriverAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(DriverAnalyzer.class);

    private final int explanationDriverCount;

    public DriverAnalyzer(DetectionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.explanationDriverCount = config.getExplanationDriverCount();
    }

    /**
     * @param grouping spans and severity tiers
     * @param times    resolved row times
     * @param values   unscaled feature values used for min/max and baseline
     * @param ranking  how drivers are ranked for this strategy
     */
    public Attribution analyze(Grouping grouping, double[] times, FeatureMatrix values, DriverRanking ranking) {
        Objects.requireNonNull(grouping, "grouping must not be null");
        Objects.requireNonNull(ranking, "ranking must not be null");

        List<Segment> drafts = new ArrayList<>();
        for (RowSpan span : grouping.getSpans()) {
            List<Driver> drivers = ranking.rank(span);
            drafts.add(Segment.builder()
                    .rows(span.startRow(), span.endRow())
                    .times(times[span.startRow()], times[span.endRow()])
                    .severity(grouping.severity(span))
                    .scorePeak(grouping.peak(span))
                    .topDrivers(drivers)
                    .explanation(Explanations.explain(drivers, explanationDriverCount, span.review()))
                    .review(span.review())
                    .build());
        }

        boolean[] flagged = flaggedMask(grouping.getMask(), times, drafts);
        boolean[] baselineRows = baselineRows(flagged);

        List<Segment> segments = new ArrayList<>(drafts.size());
        for (Segment draft : drafts) {
            Segment segment = draft.toBuilder()
                    .driverStats(driverStats(draft, times, values, baselineRows))
                    .build();
            LOG.debug("{} drivers={}", segment, segment.getTopDrivers());
            segments.add(segment);
        }
        return new Attribution(segments, flagged);
    }

    /**
     * @return {@code mask} unioned with every row whose time lies in a segment's range
     */
    static boolean[] flaggedMask(boolean[] mask, double[] times, List<Segment> segments) {
        boolean[] flagged = mask.clone();
        for (Segment segment : segments) {
            for (int r = 0; r < times.length; r++) {
                if (times[r] >= segment.getStartTime() && times[r] <= segment.getEndTime()) {
                    flagged[r] = true;
                }
            }
        }
        return flagged;
    }

    private static boolean[] baselineRows(boolean[] flagged) {
        boolean[] baseline = new boolean[flagged.length];
        boolean any = false;
        for (int r = 0; r < flagged.length; r++) {
            baseline[r] = !flagged[r];
            any |= baseline[r];
        }
        if (!any) {
            LOG.warn("Every row is flagged; baseline falls back to the full series");
            Arrays.fill(baseline, true);
        }
        return baseline;
    }

    private static List<DriverStats> driverStats(Segment segment, double[] times, FeatureMatrix values,
            boolean[] baselineRows) {
        List<String> features = values.getFeatures();
        List<DriverStats> stats = new ArrayList<>();
        for (Driver driver : segment.getTopDrivers()) {
            int f = features.indexOf(driver.getParameter());
            if (f < 0) {
                continue;
            }
            double[] column = values.column(f);
            List<Double> inSegment = new ArrayList<>();
            List<Double> baseline = new ArrayList<>();
            for (int r = 0; r < column.length; r++) {
                if (Double.isNaN(column[r])) {
                    continue;
                }
                if (times[r] >= segment.getStartTime() && times[r] <= segment.getEndTime()) {
                    inSegment.add(column[r]);
                }
                if (baselineRows[r]) {
                    baseline.add(column[r]);
                }
            }
            if (inSegment.isEmpty()) {
                continue;
            }
            double[] base = baseline.stream().mapToDouble(Double::doubleValue).toArray();
            stats.add(new DriverStats(
                    driver.getParameter(),
                    Explanations.unitOf(driver.getParameter()),
                    inSegment.stream().mapToDouble(Double::doubleValue).min().orElseThrow(),
                    inSegment.stream().mapToDouble(Double::doubleValue).max().orElseThrow(),
                    Stats.percentileIgnoringNaN(base, 5),
                    Stats.percentileIgnoringNaN(base, 95),
                    Stats.medianIgnoringNaN(base)));
        }
        return stats;
    }
}
