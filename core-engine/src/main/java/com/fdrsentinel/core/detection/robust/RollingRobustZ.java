package com.fdrsentinel.core.detection.robust;

import com.fdrsentinel.core.stats.Stats;

import java.util.Arrays;

/**
 * Center-aligned rolling median / median-absolute-deviation z-scores.
 *
 * <p>
 * For a window of {@code w} rows, row {@code i} sees rows
 * {@code [i - w/2, i + (w-1)/2]} clipped to the series. A window with fewer
 * than {@code minPeriods} valid values yields no statistic. Then
 * {@code z = 0.6745 * (v - median) / MAD}; a zero or missing MAD, a missing
 * value, or a non-finite result gives {@code z = 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollingRobustZ {

    static final double CONSISTENCY = 0.6745;

    private final int window;
    private final int minPeriods;

    public RollingRobustZ(int window, int minPeriods) {
        if (window <= 0 || minPeriods <= 0 || minPeriods > window) {
            throw new IllegalArgumentException("Require 0 < minPeriods <= window, got window="
                    + window + " minPeriods=" + minPeriods);
        }
        this.window = window;
        this.minPeriods = minPeriods;
    }

    /**
     * @param values one feature in row order, {@link Double#NaN} for missing
     * @return the robust z-score of every row
     */
    public double[] zScores(double[] values) {
        double[] median = rollingMedian(values);
        double[] deviation = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviation[i] = Math.abs(values[i] - median[i]);
        }
        double[] mad = rollingMedian(deviation);

        double[] z = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double score = CONSISTENCY * (values[i] - median[i]) / mad[i];
            z[i] = mad[i] == 0.0 || !Double.isFinite(score) ? 0.0 : score;
        }
        return z;
    }

    /**
     * @param rows row-major values, one column per feature
     * @return row-major z-scores
     */
    public double[][] zScores(double[][] rows) {
        int features = rows.length == 0 ? 0 : rows[0].length;
        double[][] z = new double[rows.length][features];
        for (int f = 0; f < features; f++) {
            double[] column = new double[rows.length];
            for (int r = 0; r < rows.length; r++) {
                column[r] = rows[r][f];
            }
            double[] scores = zScores(column);
            for (int r = 0; r < rows.length; r++) {
                z[r][f] = scores[r];
            }
        }
        return z;
    }

    /**
     * @return per row, the largest absolute z across features
     */
    public static double[] maxAbs(double[][] z) {
        double[] max = new double[z.length];
        for (int r = 0; r < z.length; r++) {
            for (double v : z[r]) {
                max[r] = Math.max(max[r], Math.abs(v));
            }
        }
        return max;
    }

    double[] rollingMedian(double[] values) {
        int before = window / 2;
        int after = (window - 1) / 2;
        double[] result = new double[values.length];
        double[] buffer = new double[window];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - before);
            int to = Math.min(values.length - 1, i + after);
            int count = 0;
            for (int j = from; j <= to; j++) {
                if (!Double.isNaN(values[j])) {
                    buffer[count++] = values[j];
                }
            }
            result[i] = count < minPeriods ? Double.NaN : Stats.median(Arrays.copyOf(buffer, count));
        }
        return result;
    }
}
