package com.fdrsentinel.core.detection.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BackendSelector} and capability probing.
 */
class BackendSelectorTest {

    @Test
    @DisplayName("Neural network capability should win over tensor graph")
    void shouldPreferNeuralNetwork() {
        assertThat(BackendSelector.select(EnumSet.allOf(Capability.class)))
                .isEqualTo(BackendKind.NEURAL_AUTOENCODER);
    }

    @Test
    @DisplayName("Tensor graph alone should select the graph autoencoder")
    void shouldSelectTensorGraph() {
        assertThat(BackendSelector.select(Set.of(Capability.TENSOR_GRAPH)))
                .isEqualTo(BackendKind.TENSOR_GRAPH_AUTOENCODER);
    }

    @Test
    @DisplayName("No capability should fall back to the linear reconstructor")
    void shouldFallBackToLinear() {
        assertThat(BackendSelector.select(CapabilityProbe.none().probe()))
                .isEqualTo(BackendKind.LINEAR_RECONSTRUCTOR);
        assertThat(BackendKind.LINEAR_RECONSTRUCTOR.getLabel()).isEqualTo("linear_reconstructor");
    }

    @Test
    @DisplayName("A fixed probe should report exactly what it was given")
    void shouldReportFixedCapabilities() {
        CapabilityProbe probe = CapabilityProbe.of(Set.of(Capability.NEURAL_NETWORK));

        assertThat(probe.probe()).containsExactly(Capability.NEURAL_NETWORK);
    }

    @Test
    @DisplayName("Classpath probe should find nothing in an isolated class loader")
    void shouldFindNothingWithoutLibraries() throws Exception {
        try (URLClassLoader isolated = new URLClassLoader(new URL[0], null)) {
            assertThat(new ClasspathCapabilityProbe(isolated).probe()).isEmpty();
        }
    }
}
