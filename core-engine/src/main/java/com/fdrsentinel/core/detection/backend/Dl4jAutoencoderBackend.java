package com.fdrsentinel.core.detection.backend;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Feed-forward autoencoder on Deeplearning4j: dense ReLU layers
 * {@code width -> 128 -> 64 -> 32 -> 64 -> 128 -> width} trained with Adam
 * under mean-squared-error loss.
 *
 * @since 1.0.0
 */
public class Dl4jAutoencoderBackend extends ReconstructionBackend {

    private static final Logger LOG = LoggerFactory.getLogger(Dl4jAutoencoderBackend.class);

    static final int[] HIDDEN_WIDTHS = { 128, 64, 32, 64, 128 };
    static final double LEARNING_RATE = 1e-3;

    private final int epochs;
    private final int batchSize;
    private final long seed;
    private MultiLayerNetwork network;

    public Dl4jAutoencoderBackend(int windowLength, int featureCount, int epochs, int batchSize, long seed) {
        super(windowLength, featureCount);
        this.epochs = epochs;
        this.batchSize = batchSize;
        this.seed = seed;
    }

    MultiLayerConfiguration configuration() {
        NeuralNetConfiguration.ListBuilder layers = new NeuralNetConfiguration.Builder()
                .seed(seed)
                .dataType(DataType.DOUBLE)
                .updater(new Adam(LEARNING_RATE))
                .weightInit(WeightInit.XAVIER)
                .list();
        int in = inputWidth;
        for (int i = 0; i < HIDDEN_WIDTHS.length; i++) {
            layers.layer(i, new DenseLayer.Builder()
                    .nIn(in)
                    .nOut(HIDDEN_WIDTHS[i])
                    .activation(Activation.RELU)
                    .build());
            in = HIDDEN_WIDTHS[i];
        }
        layers.layer(HIDDEN_WIDTHS.length, new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                .nIn(in)
                .nOut(inputWidth)
                .activation(Activation.IDENTITY)
                .build());
        return layers.build();
    }

    @Override
    protected void train(double[][] training) {
        network = new MultiLayerNetwork(configuration());
        network.init();
        Random random = new Random(seed);
        for (int epoch = 0; epoch < epochs; epoch++) {
            for (double[][] batch : shuffledBatches(training, batchSize, random)) {
                INDArray features = Nd4j.create(batch);
                network.fit(new DataSet(features, features));
            }
            LOG.debug("Epoch {}/{} loss={}", epoch + 1, epochs, network.score());
        }
        LOG.info("Trained autoencoder on {} window(s) for {} epoch(s)", training.length, epochs);
    }

    @Override
    protected synchronized double[][] reconstruct(double[][] windows) {
        return network.output(Nd4j.create(windows), false).toDoubleMatrix();
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.NEURAL_AUTOENCODER;
    }
}
