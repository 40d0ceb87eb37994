package com.fdrsentinel.core.preprocess;

import com.fdrsentinel.core.model.FeatureMatrix;
import com.fdrsentinel.core.model.ScalingStatistics;
import com.fdrsentinel.core.stats.Stats;

import java.util.Arrays;

/**
 * Fill and scaling policies for a {@link FeatureMatrix}.
 *
 * <p>
 * Statistics are always fitted on the leading training prefix only and then
 * applied to every row. A zero spread becomes 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class Standardizer {

    private Standardizer() {
        // utility class
    }

    /**
     * @return {@code max(1, floor(rows * fraction))}
     */
    public static int trainCount(int rows, double fraction) {
        return Math.max(1, (int) (rows * fraction));
    }

    /**
     * Forward-fill then back-fill missing cells per feature. A feature with no
     * valid value at all stays missing.
     */
    public static FeatureMatrix fillMissing(FeatureMatrix matrix) {
        double[][] values = matrix.toArray();
        for (int f = 0; f < matrix.featureCount(); f++) {
            double last = Double.NaN;
            for (double[] row : values) {
                if (Double.isNaN(row[f])) {
                    row[f] = last;
                } else {
                    last = row[f];
                }
            }
            double next = Double.NaN;
            for (int r = values.length - 1; r >= 0; r--) {
                if (Double.isNaN(values[r][f])) {
                    values[r][f] = next;
                } else {
                    next = values[r][f];
                }
            }
        }
        return new FeatureMatrix(matrix.getFeatures(), values);
    }

    /**
     * Mean and sample standard deviation over the first {@code trainRows} rows.
     */
    public static ScalingStatistics fitMeanStd(FeatureMatrix matrix, int trainRows) {
        int features = matrix.featureCount();
        double[] mean = new double[features];
        double[] std = new double[features];
        for (int f = 0; f < features; f++) {
            double[] train = Stats.finite(prefix(matrix.column(f), trainRows));
            mean[f] = train.length == 0 ? 0.0 : Stats.mean(train);
            std[f] = nonZero(Stats.sampleStandardDeviation(train));
        }
        return new ScalingStatistics("mean", "std", mean, std);
    }

    /**
     * Median and interquartile range over the first {@code trainRows} rows,
     * ignoring missing cells.
     */
    public static ScalingStatistics fitMedianIqr(FeatureMatrix matrix, int trainRows) {
        int features = matrix.featureCount();
        double[] median = new double[features];
        double[] iqr = new double[features];
        for (int f = 0; f < features; f++) {
            double[] train = prefix(matrix.column(f), trainRows);
            double m = Stats.medianIgnoringNaN(train);
            double spread = Stats.percentileIgnoringNaN(train, 75) - Stats.percentileIgnoringNaN(train, 25);
            median[f] = Double.isNaN(m) ? 0.0 : m;
            iqr[f] = Double.isNaN(spread) ? 1.0 : nonZero(spread);
        }
        return new ScalingStatistics("median", "iqr", median, iqr);
    }

    /**
     * Apply the statistics to every row. Missing cells become {@code missingAs}.
     */
    public static double[][] apply(FeatureMatrix matrix, ScalingStatistics statistics, double missingAs) {
        double[][] scaled = new double[matrix.rowCount()][matrix.featureCount()];
        for (int r = 0; r < scaled.length; r++) {
            for (int f = 0; f < scaled[r].length; f++) {
                double v = matrix.get(r, f);
                scaled[r][f] = Double.isNaN(v) ? missingAs : statistics.apply(f, v);
            }
        }
        return scaled;
    }

    private static double[] prefix(double[] column, int rows) {
        return Arrays.copyOf(column, Math.min(rows, column.length));
    }

    private static double nonZero(double spread) {
        return spread == 0.0 ? 1.0 : spread;
    }
}
