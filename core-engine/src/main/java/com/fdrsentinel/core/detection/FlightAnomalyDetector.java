package com.fdrsentinel.core.detection;

import com.fdrsentinel.core.model.DetectionResult;
import com.fdrsentinel.core.model.FlightTable;

/**
 * Contract for whole-flight anomaly detection.
 * <p>
 * One call is one synchronous batch run: the table goes in, a complete
 * result comes out, or one of the {@code com.fdrsentinel.core.error}
 * exceptions propagates and nothing is returned. Implementations hold no
 * state between calls.
 * </p>
 */
public interface FlightAnomalyDetector {

    /**
     * Detect anomalous segments in one flight recording.
     *
     * @param table the flight data, including the configured time column
     * @return summary, segments, timeline and optional debug information
     */
    DetectionResult detect(FlightTable table);

    /**
     * @return the strategy this detector implements
     */
    DetectionStrategy getStrategy();
}
