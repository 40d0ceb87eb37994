package com.fdrsentinel.core.detection.backend;

import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.model.ScoreResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link LinearReconstructionBackend}.
 */
class LinearReconstructionBackendTest {

    private LinearReconstructionBackend backend;

    @BeforeEach
    void setUp() {
        backend = new LinearReconstructionBackend(2, 2);
    }

    @Test
    @DisplayName("Component count should be half the width clamped to [2, 32]")
    void shouldClampComponents() {
        assertThat(LinearReconstructionBackend.componentCount(3)).isEqualTo(2);
        assertThat(LinearReconstructionBackend.componentCount(10)).isEqualTo(5);
        assertThat(LinearReconstructionBackend.componentCount(600)).isEqualTo(32);
    }

    @Test
    @DisplayName("Windows in the training subspace should reconstruct with negligible error")
    void shouldReconstructTrainingSubspace() {
        backend.fit(planeWindows());

        ScoreResult result = backend.score(new double[][] { { 3, 4, 3, 4 }, { 5, -5, -5, 5 } });

        assertThat(result.getScores()[0]).isLessThan(1e-12);
        assertThat(result.getScores()[1]).isCloseTo(25.0, within(1e-9));
        assertThat(result.getFeatureErrors()[1]).hasSize(2);
    }

    @Test
    @DisplayName("Per-feature errors should average the squared error over time steps")
    void shouldAverageFeatureErrors() {
        backend.fit(planeWindows());

        ScoreResult result = backend.score(new double[][] { { 5, -5, -5, 5 } });

        double[] errors = result.getFeatureErrors()[0];
        assertThat((errors[0] + errors[1]) / 2).isCloseTo(result.getScores()[0],
                within(1e-9));
    }

    @Test
    @DisplayName("Scoring before fitting should fail")
    void shouldRejectScoreBeforeFit() {
        assertThatThrownBy(() -> backend.score(new double[][] { { 1, 2, 3, 4 } }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("linear_reconstructor");
    }

    @Test
    @DisplayName("Windows of the wrong width should be rejected")
    void shouldRejectWrongWidth() {
        assertThatThrownBy(() -> backend.fit(new double[][] { { 1, 2, 3 } }))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Factory should build the linear backend")
    void shouldCreateLinearFromFactory() {
        ScoringBackend created = ScoringBackends.create(BackendKind.LINEAR_RECONSTRUCTOR, 2, 2,
                DetectionConfig.defaults());

        assertThat(created).isInstanceOf(LinearReconstructionBackend.class);
        assertThat(created.getKind()).isEqualTo(BackendKind.LINEAR_RECONSTRUCTOR);
    }

    /** Windows spanning the plane of (1, 0, 1, 0) and (0, 1, 0, 1). */
    private static double[][] planeWindows() {
        double[][] windows = new double[10][];
        for (int i = 0; i < windows.length; i++) {
            double a = i;
            double b = (i * i) % 7;
            windows[i] = new double[] { a, b, a, b };
        }
        return windows;
    }
}
