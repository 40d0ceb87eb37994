package com.fdrsentinel.core.detection.backend;

import java.util.Objects;
import java.util.Set;

/**
 * Pure mapping from available capabilities to the backend to use: neural
 * network first, then tensor graph, then the linear reconstructor.
 *
 * @since 1.0.0
 */
public final class BackendSelector {

    private BackendSelector() {
        // utility class
    }

    public static BackendKind select(Set<Capability> capabilities) {
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        if (capabilities.contains(Capability.NEURAL_NETWORK)) {
            return BackendKind.NEURAL_AUTOENCODER;
        }
        if (capabilities.contains(Capability.TENSOR_GRAPH)) {
            return BackendKind.TENSOR_GRAPH_AUTOENCODER;
        }
        return BackendKind.LINEAR_RECONSTRUCTOR;
    }
}
