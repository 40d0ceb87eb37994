package com.fdrsentinel.core.detection.backend;

import org.nd4j.autodiff.samediff.SDVariable;
import org.nd4j.autodiff.samediff.SameDiff;
import org.nd4j.autodiff.samediff.TrainingConfig;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.weightinit.impl.XavierInitScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Random;

/**
 * The same autoencoder topology as {@link Dl4jAutoencoderBackend}, built as an
 * ND4J SameDiff graph.
 *
 * @since 1.0.0
 */
public class SameDiffAutoencoderBackend extends ReconstructionBackend {

    private static final Logger LOG = LoggerFactory.getLogger(SameDiffAutoencoderBackend.class);

    static final String INPUT = "input";
    static final String LABEL = "label";
    static final String OUTPUT = "output";

    private final int epochs;
    private final int batchSize;
    private final long seed;
    private SameDiff graph;

    public SameDiffAutoencoderBackend(int windowLength, int featureCount, int epochs, int batchSize, long seed) {
        super(windowLength, featureCount);
        this.epochs = epochs;
        this.batchSize = batchSize;
        this.seed = seed;
    }

    SameDiff buildGraph() {
        Nd4j.getRandom().setSeed(seed);
        SameDiff sd = SameDiff.create();
        SDVariable input = sd.placeHolder(INPUT, DataType.DOUBLE, -1, inputWidth);
        SDVariable label = sd.placeHolder(LABEL, DataType.DOUBLE, -1, inputWidth);

        SDVariable x = input;
        int in = inputWidth;
        int[] widths = Dl4jAutoencoderBackend.HIDDEN_WIDTHS;
        for (int i = 0; i < widths.length; i++) {
            SDVariable w = sd.var("w" + i, new XavierInitScheme('c', in, widths[i]), DataType.DOUBLE, in, widths[i]);
            SDVariable b = sd.zero("b" + i, DataType.DOUBLE, widths[i]);
            x = sd.nn().relu(sd.nn().linear(x, w, b), 0);
            in = widths[i];
        }
        SDVariable wOut = sd.var("wOut", new XavierInitScheme('c', in, inputWidth), DataType.DOUBLE, in, inputWidth);
        SDVariable bOut = sd.zero("bOut", DataType.DOUBLE, inputWidth);
        SDVariable output = sd.nn().linear(OUTPUT, x, wOut, bOut);

        sd.loss().meanSquaredError("loss", label, output, null);
        sd.setLossVariables("loss");
        sd.setTrainingConfig(new TrainingConfig.Builder()
                .updater(new Adam(Dl4jAutoencoderBackend.LEARNING_RATE))
                .dataSetFeatureMapping(INPUT)
                .dataSetLabelMapping(LABEL)
                .build());
        return sd;
    }

    @Override
    protected void train(double[][] training) {
        graph = buildGraph();
        Random random = new Random(seed);
        for (int epoch = 0; epoch < epochs; epoch++) {
            for (double[][] batch : shuffledBatches(training, batchSize, random)) {
                INDArray features = Nd4j.create(batch);
                graph.fit(new DataSet(features, features));
            }
        }
        LOG.info("Trained tensor-graph autoencoder on {} window(s) for {} epoch(s)", training.length, epochs);
    }

    @Override
    protected synchronized double[][] reconstruct(double[][] windows) {
        INDArray out = graph.outputSingle(Collections.singletonMap(INPUT, Nd4j.create(windows)), OUTPUT);
        return out.toDoubleMatrix();
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.TENSOR_GRAPH_AUTOENCODER;
    }
}
