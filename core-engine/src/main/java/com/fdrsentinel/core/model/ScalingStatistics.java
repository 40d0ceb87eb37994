package com.fdrsentinel.core.model;

import java.util.Objects;

/**
 * Per-feature affine scaling fitted on the training prefix:
 * {@code scaled = (value - center) / spread}. A spread is never zero.
 *
 * <p>
 * The reconstruction path uses mean / standard deviation, the robust path
 * median / interquartile range; {@link #getCenterName()} and
 * {@link #getSpreadName()} say which.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScalingStatistics {

    private final String centerName;
    private final String spreadName;
    private final double[] center;
    private final double[] spread;

    public ScalingStatistics(String centerName, String spreadName, double[] center, double[] spread) {
        this.centerName = Objects.requireNonNull(centerName, "centerName must not be null");
        this.spreadName = Objects.requireNonNull(spreadName, "spreadName must not be null");
        this.center = Objects.requireNonNull(center, "center must not be null").clone();
        this.spread = Objects.requireNonNull(spread, "spread must not be null").clone();
        if (center.length != spread.length) {
            throw new IllegalArgumentException("center and spread must have the same length");
        }
        for (double s : spread) {
            if (s == 0.0) {
                throw new IllegalArgumentException("spread must not contain zero");
            }
        }
    }

    public String getCenterName() {
        return centerName;
    }

    public String getSpreadName() {
        return spreadName;
    }

    public double[] getCenter() {
        return center.clone();
    }

    public double[] getSpread() {
        return spread.clone();
    }

    public double apply(int feature, double value) {
        return (value - center[feature]) / spread[feature];
    }
}
