package com.fdrsentinel.core.detection;

import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.detection.backend.CapabilityProbe;
import com.fdrsentinel.core.detection.backend.ClasspathCapabilityProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates {@link FlightAnomalyDetector} instances for a
 * {@link DetectionStrategy}.
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create a detector that probes the classpath for neural backends.
     */
    public static FlightAnomalyDetector create(DetectionStrategy strategy, DetectionConfig config) {
        return create(strategy, config, new ClasspathCapabilityProbe());
    }

    /**
     * Create a detector.
     *
     * @param strategy which pipeline to run; must not be {@code null}
     * @param config   detection parameters; must not be {@code null}
     * @param probe    capability source for backend selection (reconstruction only)
     * @return a new detector
     * @throws NullPointerException if any argument is {@code null}
     */
    public static FlightAnomalyDetector create(DetectionStrategy strategy, DetectionConfig config,
            CapabilityProbe probe) {
        Objects.requireNonNull(strategy, "DetectionStrategy must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        Objects.requireNonNull(probe, "CapabilityProbe must not be null");
        LOG.info("Creating {} detector with {}", strategy, config);
        return switch (strategy) {
            case RECONSTRUCTION -> new ReconstructionDetector(config, probe);
            case ROBUST -> new RobustEnsembleDetector(config);
        };
    }
}
