package com.fdrsentinel.core.detection.backend;

/**
 * Concrete reconstruction backends, in order of preference.
 *
 * @since 1.0.0
 */
public enum BackendKind {

    NEURAL_AUTOENCODER("neural_autoencoder"),
    TENSOR_GRAPH_AUTOENCODER("tensor_graph_autoencoder"),
    LINEAR_RECONSTRUCTOR("linear_reconstructor");

    private final String label;

    BackendKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
