package com.fdrsentinel.core.stats;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics shared by every pipeline stage.
 *
 * <p>
 * Percentiles use linear interpolation between closest ranks
 * ({@link EstimationType#R_7}), so a value reported here matches the usual
 * spreadsheet / numpy definition. Missing values are encoded as
 * {@link Double#NaN} throughout the engine; the {@code *IgnoringNaN} variants
 * drop them first.
 * </p>
 *
 * @since 1.0.0
 */
public final class Stats {

    /** Absolute tolerance of {@link #allClose(double[])}. */
    static final double ABSOLUTE_TOLERANCE = 1e-8;

    /** Relative tolerance of {@link #allClose(double[])}. */
    static final double RELATIVE_TOLERANCE = 1e-5;

    private Stats() {
        // utility class
    }

    /**
     * Linear-interpolation percentile.
     *
     * @param values     non-empty sample; must not contain NaN
     * @param percentile percentile in [0, 100]
     * @return the interpolated percentile
     * @throws IllegalArgumentException if {@code values} is empty or the
     *                                  percentile is out of range
     */
    public static double percentile(double[] values, double percentile) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of an empty sample");
        }
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be in [0, 100], got: " + percentile);
        }
        if (percentile == 0) {
            return StatUtils.min(values);
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, percentile);
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /**
     * Percentile over the finite entries of {@code values}.
     *
     * @return the percentile, or {@link Double#NaN} if no finite entry exists
     */
    public static double percentileIgnoringNaN(double[] values, double percentile) {
        double[] finite = finite(values);
        return finite.length == 0 ? Double.NaN : percentile(finite, percentile);
    }

    public static double medianIgnoringNaN(double[] values) {
        return percentileIgnoringNaN(values, 50);
    }

    public static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    /**
     * Bias-corrected (n − 1) standard deviation; {@link Double#NaN} for fewer
     * than two values is mapped to 0.
     */
    public static double sampleStandardDeviation(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return new StandardDeviation(true).evaluate(values);
    }

    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    /**
     * Whether every value is numerically indistinguishable from the first one
     * ({@code |v − v0| ≤ 1e-8 + 1e-5·|v0|}). An empty array is trivially close.
     */
    public static boolean allClose(double[] values) {
        if (values.length == 0) {
            return true;
        }
        double reference = values[0];
        double tolerance = ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * Math.abs(reference);
        for (double v : values) {
            if (!(Math.abs(v - reference) <= tolerance)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Round half-to-even to a fixed number of decimal places. Non-finite
     * values are returned unchanged.
     */
    public static double round(double value, int places) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double[] round(double[] values, int places) {
        double[] rounded = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            rounded[i] = round(values[i], places);
        }
        return rounded;
    }
}
