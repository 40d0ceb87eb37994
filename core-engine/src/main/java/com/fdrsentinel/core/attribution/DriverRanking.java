package com.fdrsentinel.core.attribution;

import com.fdrsentinel.core.model.Driver;
import com.fdrsentinel.core.model.TimelineScore;
import com.fdrsentinel.core.segmentation.RowSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Ranks the features of a span by how much they contributed to it. Rankings
 * are descending; equal magnitudes keep feature order.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DriverRanking {

    List<Driver> rank(RowSpan span);

    /**
     * Rank by mean per-feature reconstruction error over the span.
     */
    static DriverRanking byMeanError(TimelineScore timeline, List<String> features, int limit) {
        Objects.requireNonNull(timeline, "timeline must not be null");
        return span -> {
            double[] magnitude = new double[features.size()];
            for (int f = 0; f < magnitude.length; f++) {
                double sum = 0.0;
                for (int r = span.startRow(); r <= span.endRow(); r++) {
                    sum += timeline.featureError(r, f);
                }
                magnitude[f] = sum / span.length();
            }
            return top(features, magnitude, limit, Driver::ofError);
        };
    }

    /**
     * Rank by maximum absolute robust z over the span.
     */
    static DriverRanking byMaxRobustZ(double[][] robustZ, List<String> features, int limit) {
        Objects.requireNonNull(robustZ, "robustZ must not be null");
        return span -> {
            double[] magnitude = new double[features.size()];
            for (int r = span.startRow(); r <= span.endRow(); r++) {
                for (int f = 0; f < magnitude.length; f++) {
                    magnitude[f] = Math.max(magnitude[f], Math.abs(robustZ[r][f]));
                }
            }
            return top(features, magnitude, limit, Driver::ofRobustZ);
        };
    }

    private static List<Driver> top(List<String> features, double[] magnitude, int limit,
            BiFunction<String, Double, Driver> factory) {
        List<Integer> order = new ArrayList<>(features.size());
        for (int f = 0; f < features.size(); f++) {
            order.add(f);
        }
        // List.sort is stable, so ties keep feature order
        order.sort(Comparator.comparingDouble((Integer f) -> magnitude[f]).reversed());
        return order.stream()
                .limit(limit)
                .map(f -> factory.apply(features.get(f), magnitude[f]))
                .toList();
    }
}
