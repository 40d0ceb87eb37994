package com.fdrsentinel.core.segmentation;

import com.fdrsentinel.core.model.ScoreResult;
import com.fdrsentinel.core.model.TimelineScore;
import com.fdrsentinel.core.model.WindowSet;

import java.util.Objects;

/**
 * Folds window-level scores onto rows. Each row takes the maximum over all
 * windows covering it, for the scalar score and element-wise for the
 * per-feature errors. Rows covered by no window stay at 0.
 *
 * @since 1.0.0
 */
public final class ScoreMapper {

    private ScoreMapper() {
        // utility class
    }

    public static TimelineScore map(int rows, WindowSet windows, ScoreResult windowScores) {
        Objects.requireNonNull(windows, "windows must not be null");
        Objects.requireNonNull(windowScores, "windowScores must not be null");
        if (windows.size() != windowScores.size()) {
            throw new IllegalArgumentException("Expected " + windows.size() + " window scores, got "
                    + windowScores.size());
        }

        int features = windows.getFeatureCount();
        double[] scores = new double[rows];
        double[][] errors = new double[rows][features];
        double[] windowScore = windowScores.getScores();
        double[][] windowErrors = windowScores.getFeatureErrors();

        for (int w = 0; w < windows.size(); w++) {
            int end = Math.min(rows, windows.start(w) + windows.getWindowLength());
            for (int r = windows.start(w); r < end; r++) {
                scores[r] = Math.max(scores[r], windowScore[w]);
                for (int f = 0; f < features; f++) {
                    errors[r][f] = Math.max(errors[r][f], windowErrors[w][f]);
                }
            }
        }
        return new TimelineScore(scores, errors);
    }
}
