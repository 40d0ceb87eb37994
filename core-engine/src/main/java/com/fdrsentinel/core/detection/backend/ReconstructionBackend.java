package com.fdrsentinel.core.detection.backend;

import com.fdrsentinel.core.model.ScoreResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Base for backends that score by squared reconstruction error.
 *
 * <p>
 * Inputs are windows flattened time-major; the per-feature error of a window
 * is the mean squared error of that feature over the window's time steps.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class ReconstructionBackend implements ScoringBackend {

    protected final int windowLength;
    protected final int featureCount;
    protected final int inputWidth;
    private volatile boolean fitted;

    protected ReconstructionBackend(int windowLength, int featureCount) {
        if (windowLength <= 0 || featureCount <= 0) {
            throw new IllegalArgumentException("windowLength and featureCount must be positive");
        }
        this.windowLength = windowLength;
        this.featureCount = featureCount;
        this.inputWidth = windowLength * featureCount;
    }

    @Override
    public final void fit(double[][] training) {
        if (training.length == 0) {
            throw new IllegalArgumentException("Cannot fit on zero windows");
        }
        checkWidth(training);
        train(training);
        fitted = true;
    }

    @Override
    public final ScoreResult score(double[][] windows) {
        if (!fitted) {
            throw new IllegalStateException(getKind().getLabel() + " has not been fitted");
        }
        checkWidth(windows);
        double[][] reconstructed = reconstruct(windows);

        double[] scores = new double[windows.length];
        double[][] featureErrors = new double[windows.length][featureCount];
        for (int w = 0; w < windows.length; w++) {
            double total = 0.0;
            for (int t = 0; t < windowLength; t++) {
                for (int f = 0; f < featureCount; f++) {
                    int i = t * featureCount + f;
                    double diff = windows[w][i] - reconstructed[w][i];
                    double squared = diff * diff;
                    total += squared;
                    featureErrors[w][f] += squared;
                }
            }
            scores[w] = total / inputWidth;
            for (int f = 0; f < featureCount; f++) {
                featureErrors[w][f] /= windowLength;
            }
        }
        return new ScoreResult(scores, featureErrors);
    }

    protected abstract void train(double[][] training);

    /**
     * @return one reconstruction per input window, same width
     */
    protected abstract double[][] reconstruct(double[][] windows);

    /**
     * Shuffle the training rows and cut them into mini-batches.
     */
    protected static List<double[][]> shuffledBatches(double[][] training, int batchSize, Random random) {
        int[] order = new int[training.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        List<double[][]> batches = new ArrayList<>();
        for (int start = 0; start < order.length; start += batchSize) {
            int size = Math.min(batchSize, order.length - start);
            double[][] batch = new double[size][];
            for (int i = 0; i < size; i++) {
                batch[i] = training[order[start + i]];
            }
            batches.add(batch);
        }
        return batches;
    }

    private void checkWidth(double[][] rows) {
        for (double[] row : rows) {
            if (row.length != inputWidth) {
                throw new IllegalArgumentException("Expected windows of width " + inputWidth
                        + ", got " + row.length);
            }
        }
    }
}
