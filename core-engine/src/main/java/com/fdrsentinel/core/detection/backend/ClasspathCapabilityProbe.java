package com.fdrsentinel.core.detection.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Detects capabilities by looking for marker classes without initializing
 * them. Both capabilities also need an ND4J runtime backend (CPU or CUDA).
 *
 * @since 1.0.0
 */
public final class ClasspathCapabilityProbe implements CapabilityProbe {

    private static final Logger LOG = LoggerFactory.getLogger(ClasspathCapabilityProbe.class);

    static final String NEURAL_NETWORK_CLASS = "org.deeplearning4j.nn.multilayer.MultiLayerNetwork";
    static final String TENSOR_GRAPH_CLASS = "org.nd4j.autodiff.samediff.SameDiff";
    static final List<String> ND4J_RUNTIME_CLASSES = List.of(
            "org.nd4j.linalg.cpu.nativecpu.CpuBackend",
            "org.nd4j.linalg.jcublas.JCublasBackend");

    private final ClassLoader classLoader;

    public ClasspathCapabilityProbe() {
        this(ClasspathCapabilityProbe.class.getClassLoader());
    }

    ClasspathCapabilityProbe(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Set<Capability> probe() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (ND4J_RUNTIME_CLASSES.stream().noneMatch(this::present)) {
            LOG.debug("No ND4J runtime backend on the classpath");
            return capabilities;
        }
        if (present(NEURAL_NETWORK_CLASS)) {
            capabilities.add(Capability.NEURAL_NETWORK);
        }
        if (present(TENSOR_GRAPH_CLASS)) {
            capabilities.add(Capability.TENSOR_GRAPH);
        }
        LOG.debug("Detected capabilities: {}", capabilities);
        return capabilities;
    }

    private boolean present(String className) {
        try {
            Class.forName(className, false, classLoader);
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.trace("{} not available: {}", className, e.toString());
            return false;
        }
    }
}
