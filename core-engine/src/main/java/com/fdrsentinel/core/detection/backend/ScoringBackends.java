package com.fdrsentinel.core.detection.backend;

import com.fdrsentinel.core.config.DetectionConfig;

import java.util.Objects;

/**
 * Instantiates the backend for a {@link BackendKind}.
 *
 * @since 1.0.0
 */
public final class ScoringBackends {

    private ScoringBackends() {
        // utility class
    }

    public static ScoringBackend create(BackendKind kind, int windowLength, int featureCount,
            DetectionConfig config) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return switch (kind) {
            case NEURAL_AUTOENCODER -> new Dl4jAutoencoderBackend(windowLength, featureCount,
                    config.getEpochs(), config.getBatchSize(), config.getSeed());
            case TENSOR_GRAPH_AUTOENCODER -> new SameDiffAutoencoderBackend(windowLength, featureCount,
                    config.getEpochs(), config.getBatchSize(), config.getSeed());
            case LINEAR_RECONSTRUCTOR -> new LinearReconstructionBackend(windowLength, featureCount);
        };
    }
}
