package com.fdrsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Row-major numeric matrix restricted to the selected features. Missing cells
 * are {@link Double#NaN} until a fill policy has been applied.
 *
 * @since 1.0.0
 */
public final class FeatureMatrix {

    private final List<String> features;
    private final double[][] values;

    public FeatureMatrix(List<String> features, double[][] values) {
        this.features = List.copyOf(Objects.requireNonNull(features, "features must not be null"));
        Objects.requireNonNull(values, "values must not be null");
        this.values = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            if (values[r].length != this.features.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + values[r].length
                        + " cells, expected " + this.features.size());
            }
            this.values[r] = values[r].clone();
        }
    }

    public List<String> getFeatures() {
        return features;
    }

    public int rowCount() {
        return values.length;
    }

    public int featureCount() {
        return features.size();
    }

    public double get(int row, int feature) {
        return values[row][feature];
    }

    /**
     * @return a copy of one feature's values, in row order
     */
    public double[] column(int feature) {
        double[] column = new double[values.length];
        for (int r = 0; r < values.length; r++) {
            column[r] = values[r][feature];
        }
        return column;
    }

    /**
     * @return a deep copy of the matrix
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            copy[r] = values[r].clone();
        }
        return copy;
    }
}
