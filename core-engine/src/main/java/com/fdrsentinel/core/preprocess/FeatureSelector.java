package com.fdrsentinel.core.preprocess;

import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.error.NoFeaturesException;
import com.fdrsentinel.core.model.FeatureMatrix;
import com.fdrsentinel.core.model.FlightTable;
import com.fdrsentinel.core.model.ResolvedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Picks the measurement columns worth scoring.
 *
 * <p>
 * A column is kept when it is not excluded by configuration (or the time
 * column itself) and its numeric coercion has at least one valid value, at
 * most 40% missing cells, at least 10 distinct values, and a value set that is
 * not just {0, 1}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureSelector {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureSelector.class);

    static final double MAX_MISSING_RATIO = 0.4;
    static final int MIN_DISTINCT_VALUES = 10;

    private final Set<String> excluded;

    public FeatureSelector(DetectionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.excluded = new HashSet<>(config.getExcludedColumns());
        this.excluded.add(config.getTimeColumn());
    }

    /**
     * @return the retained features as a raw matrix ({@link Double#NaN} for missing)
     * @throws NoFeaturesException if no column qualifies
     */
    public FeatureMatrix select(ResolvedSeries series) {
        FlightTable table = series.getTable();
        List<String> names = new ArrayList<>();
        List<double[]> columns = new ArrayList<>();

        for (String name : table.getColumnNames()) {
            if (excluded.contains(name)) {
                LOG.trace("Skipping excluded column '{}'", name);
                continue;
            }
            double[] values = table.requireColumn(name).toNumeric();
            String rejection = rejectionReason(values);
            if (rejection != null) {
                LOG.trace("Rejected column '{}': {}", name, rejection);
                continue;
            }
            names.add(name);
            columns.add(values);
        }

        if (names.isEmpty()) {
            throw new NoFeaturesException("No numeric parameters available for anomaly detection.");
        }
        LOG.info("Selected {} of {} column(s) as features", names.size(), table.getColumnNames().size());

        double[][] matrix = new double[table.getRowCount()][names.size()];
        for (int f = 0; f < names.size(); f++) {
            double[] column = columns.get(f);
            for (int r = 0; r < column.length; r++) {
                matrix[r][f] = column[r];
            }
        }
        return new FeatureMatrix(names, matrix);
    }

    /**
     * @return why a coerced column is unusable, or {@code null} if it qualifies
     */
    static String rejectionReason(double[] values) {
        int missing = 0;
        Set<Double> distinct = new HashSet<>();
        for (double v : values) {
            if (Double.isNaN(v)) {
                missing++;
            } else {
                distinct.add(v + 0.0);
            }
        }
        if (distinct.isEmpty()) {
            return "no numeric values";
        }
        if ((double) missing / values.length > MAX_MISSING_RATIO) {
            return "missing ratio above " + MAX_MISSING_RATIO;
        }
        if (distinct.size() <= 1) {
            return "constant";
        }
        if (distinct.size() < MIN_DISTINCT_VALUES) {
            return "fewer than " + MIN_DISTINCT_VALUES + " distinct values";
        }
        if (Set.of(0.0, 1.0).containsAll(distinct)) {
            return "boolean flag";
        }
        return null;
    }
}
