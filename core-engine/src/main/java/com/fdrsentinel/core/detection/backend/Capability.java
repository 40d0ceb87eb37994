package com.fdrsentinel.core.detection.backend;

/**
 * Numerical frameworks a scoring backend may need at runtime.
 *
 * @since 1.0.0
 */
public enum Capability {

    /** Layered neural networks (Deeplearning4j) on a working ND4J backend. */
    NEURAL_NETWORK,

    /** Trainable tensor graphs (ND4J SameDiff) on a working ND4J backend. */
    TENSOR_GRAPH
}
