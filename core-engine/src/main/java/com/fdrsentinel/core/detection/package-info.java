/**
 * Detection strategies and the factory that creates them.
 *
 * <p>
 * {@link com.fdrsentinel.core.detection.ReconstructionDetector} scores
 * windows with a backend chosen by
 * {@link com.fdrsentinel.core.detection.backend.BackendSelector};
 * {@link com.fdrsentinel.core.detection.RobustEnsembleDetector} scores rows
 * with {@link com.fdrsentinel.core.detection.robust.RobustEnsembleScorer}.
 * </p>
 */
package com.fdrsentinel.core.detection;
