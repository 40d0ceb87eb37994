package com.fdrsentinel.core.detection.backend;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Principal-component reconstructor: projects centered windows onto the
 * leading right singular vectors of the training matrix and back.
 *
 * <p>
 * Keeps {@code clamp(width / 2, 2, 32)} components, further limited by the
 * number of training windows and the width itself.
 * </p>
 *
 * @since 1.0.0
 */
public class LinearReconstructionBackend extends ReconstructionBackend {

    private static final Logger LOG = LoggerFactory.getLogger(LinearReconstructionBackend.class);

    static final int MIN_COMPONENTS = 2;
    static final int MAX_COMPONENTS = 32;

    private double[] mean;
    private RealMatrix components;

    public LinearReconstructionBackend(int windowLength, int featureCount) {
        super(windowLength, featureCount);
    }

    /**
     * @return {@code clamp(width / 2, 2, 32)}
     */
    public static int componentCount(int inputWidth) {
        return Math.max(MIN_COMPONENTS, Math.min(MAX_COMPONENTS, inputWidth / 2));
    }

    @Override
    protected void train(double[][] training) {
        int samples = training.length;
        mean = new double[inputWidth];
        for (double[] row : training) {
            for (int i = 0; i < inputWidth; i++) {
                mean[i] += row[i] / samples;
            }
        }
        double[][] centered = new double[samples][inputWidth];
        for (int s = 0; s < samples; s++) {
            for (int i = 0; i < inputWidth; i++) {
                centered[s][i] = training[s][i] - mean[i];
            }
        }

        RealMatrix v = new SingularValueDecomposition(new Array2DRowRealMatrix(centered, false)).getV();
        int k = Math.min(componentCount(inputWidth), Math.min(v.getColumnDimension(), inputWidth));
        k = Math.min(k, samples);
        components = v.getSubMatrix(0, inputWidth - 1, 0, k - 1);
        LOG.info("Fitted {} principal component(s) on {} window(s) of width {}", k, samples, inputWidth);
    }

    @Override
    protected double[][] reconstruct(double[][] windows) {
        double[][] reconstructed = new double[windows.length][];
        for (int w = 0; w < windows.length; w++) {
            double[] centered = new double[inputWidth];
            for (int i = 0; i < inputWidth; i++) {
                centered[i] = windows[w][i] - mean[i];
            }
            double[] projected = components.preMultiply(centered);
            double[] back = components.operate(projected);
            for (int i = 0; i < inputWidth; i++) {
                back[i] += mean[i];
            }
            reconstructed[w] = back;
        }
        return reconstructed;
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.LINEAR_RECONSTRUCTOR;
    }
}
