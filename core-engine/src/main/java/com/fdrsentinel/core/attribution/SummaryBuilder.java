package com.fdrsentinel.core.attribution;

import com.fdrsentinel.core.model.Driver;
import com.fdrsentinel.core.model.DriverCount;
import com.fdrsentinel.core.model.Segment;
import com.fdrsentinel.core.model.Summary;
import com.fdrsentinel.core.segmentation.Grouping;
import com.fdrsentinel.core.stats.Stats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-level aggregation shared by both strategies. Callers add their
 * strategy-specific fields to the returned builder.
 *
 * @since 1.0.0
 */
public final class SummaryBuilder {

    private SummaryBuilder() {
        // utility class
    }

    public static Summary.Builder summarize(int rows, int features, Attribution attribution,
            Grouping grouping, double thresholdPercentile) {
        int flagged = attribution.flaggedCount();
        return Summary.builder()
                .rowCount(rows)
                .parameterCount(features)
                .segmentCount(attribution.getSegments().size())
                .topParameters(countDrivers(attribution.getSegments()))
                .flagged(flagged, flaggedPercent(flagged, rows))
                .threshold(thresholdPercentile, grouping.getThreshold())
                .groupingOutcome(grouping.getOutcome());
    }

    /**
     * @return percentage of flagged rows rounded to 4 places, 0 for an empty series
     */
    static double flaggedPercent(int flagged, int rows) {
        return rows == 0 ? 0.0 : Stats.round(flagged * 100.0 / rows, 4);
    }

    /**
     * Count how many segments name each parameter, most frequent first. Equal
     * counts keep first-appearance order.
     */
    static List<DriverCount> countDrivers(List<Segment> segments) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Segment segment : segments) {
            for (Driver driver : segment.getTopDrivers()) {
                counts.merge(driver.getParameter(), 1, Integer::sum);
            }
        }
        List<DriverCount> result = new ArrayList<>();
        counts.forEach((parameter, count) -> result.add(new DriverCount(parameter, count)));
        result.sort((a, b) -> Integer.compare(b.getCount(), a.getCount()));
        return result;
    }
}
