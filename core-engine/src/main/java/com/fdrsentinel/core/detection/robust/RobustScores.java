package com.fdrsentinel.core.detection.robust;

/**
 * Per-row outputs of the robust scorer.
 *
 * @since 1.0.0
 */
public final class RobustScores {

    private final double[][] robustZ;
    private final double[] maxRobustZ;
    private final double[] ensembleScore;
    private final double[] combinedScore;
    private final boolean[] anomaly;

    RobustScores(double[][] robustZ, double[] maxRobustZ, double[] ensembleScore,
            double[] combinedScore, boolean[] anomaly) {
        this.robustZ = robustZ;
        this.maxRobustZ = maxRobustZ;
        this.ensembleScore = ensembleScore;
        this.combinedScore = combinedScore;
        this.anomaly = anomaly;
    }

    /** Row-major robust z per feature. */
    public double[][] getRobustZ() {
        return robustZ;
    }

    public double[] getMaxRobustZ() {
        return maxRobustZ;
    }

    public double[] getEnsembleScore() {
        return ensembleScore;
    }

    /** {@code maxRobustZ + ensembleScore}. */
    public double[] getCombinedScore() {
        return combinedScore;
    }

    /** {@code maxRobustZ >= threshold || ensembleOutlier}. */
    public boolean[] getAnomaly() {
        return anomaly;
    }

    public int anomalyCount() {
        int count = 0;
        for (boolean a : anomaly) {
            if (a) {
                count++;
            }
        }
        return count;
    }
}
