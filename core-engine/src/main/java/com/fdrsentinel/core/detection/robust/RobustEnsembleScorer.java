package com.fdrsentinel.core.detection.robust;

import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.model.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Row-level scorer combining rolling robust z-scores on the raw values with
 * an isolation forest on the robust-scaled values.
 *
 * <p>
 * Call {@link #fit(double[][])} with the scaled rows, then
 * {@link #score(FeatureMatrix, double[][])}. A row is anomalous when its
 * largest absolute robust z reaches the configured threshold or the forest
 * flags it.
 * </p>
 *
 * @since 1.0.0
 */
public final class RobustEnsembleScorer {

    private static final Logger LOG = LoggerFactory.getLogger(RobustEnsembleScorer.class);

    private final RollingRobustZ rollingZ;
    private final IsolationForest forest;
    private final double zThreshold;

    public RobustEnsembleScorer(DetectionConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.rollingZ = new RollingRobustZ(config.getRobustWindow(), config.getRobustMinPeriods());
        this.forest = new IsolationForest(config.getEnsembleTrees(), config.getEnsembleSampleSize(),
                config.getEnsembleContamination(), config.getSeed());
        this.zThreshold = config.getRobustZThreshold();
    }

    public void fit(double[][] scaled) {
        forest.fit(scaled);
    }

    /**
     * @param raw    unscaled feature values ({@link Double#NaN} for missing)
     * @param scaled robust-scaled values with missing cells set to 0
     */
    public RobustScores score(FeatureMatrix raw, double[][] scaled) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (raw.rowCount() != scaled.length) {
            throw new IllegalArgumentException("raw and scaled must have the same row count");
        }
        double[][] z = rollingZ.zScores(raw.toArray());
        double[] maxZ = RollingRobustZ.maxAbs(z);
        double[] ensemble = forest.scores(scaled);

        int rows = scaled.length;
        boolean[] outlier = new boolean[rows];
        double[] combined = new double[rows];
        boolean[] anomaly = new boolean[rows];
        for (int r = 0; r < rows; r++) {
            outlier[r] = forest.isOutlier(ensemble[r]);
            combined[r] = maxZ[r] + ensemble[r];
            anomaly[r] = maxZ[r] >= zThreshold || outlier[r];
        }
        RobustScores scores = new RobustScores(z, maxZ, ensemble, combined, anomaly);
        LOG.info("Robust scoring flagged {} of {} row(s)", scores.anomalyCount(), rows);
        return scores;
    }
}
