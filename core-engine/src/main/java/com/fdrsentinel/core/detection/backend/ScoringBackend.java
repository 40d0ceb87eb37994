package com.fdrsentinel.core.detection.backend;

import com.fdrsentinel.core.model.ScoreResult;

/**
 * A model that learns normal windows and scores how poorly it reproduces new
 * ones.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #fit(double[][])} is called once with the training windows. After
 * that, {@link #score(double[][])} must not change the model and may be
 * called concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public interface ScoringBackend {

    /**
     * @param training flattened training windows, one per row
     */
    void fit(double[][] training);

    /**
     * @param windows flattened windows to score
     * @return mean squared error per window and per-feature error per window
     */
    ScoreResult score(double[][] windows);

    BackendKind getKind();
}
