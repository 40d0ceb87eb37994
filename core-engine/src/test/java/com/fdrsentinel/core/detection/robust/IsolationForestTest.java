package com.fdrsentinel.core.detection.robust;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IsolationForest}.
 */
class IsolationForestTest {

    @Test
    @DisplayName("A far-away row should score highest and be flagged")
    void shouldIsolateOutlier() {
        double[][] rows = clusterWithOutlier();
        IsolationForest forest = new IsolationForest(100, 256, 0.01, 42L);

        forest.fit(rows);
        double[] scores = forest.scores(rows);

        int outlier = rows.length - 1;
        for (int r = 0; r < outlier; r++) {
            assertThat(scores[outlier]).isGreaterThan(scores[r]);
        }
        assertThat(forest.isOutlier(scores[outlier])).isTrue();
        assertThat(Arrays.stream(scores)).allSatisfy(s -> assertThat(s).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("The same seed should give the same scores")
    void shouldBeDeterministic() {
        double[][] rows = clusterWithOutlier();
        IsolationForest first = new IsolationForest(50, 64, 0.05, 7L);
        IsolationForest second = new IsolationForest(50, 64, 0.05, 7L);

        first.fit(rows);
        second.fit(rows);

        assertThat(first.scores(rows)).containsExactly(second.scores(rows));
        assertThat(first.getOffset()).isEqualTo(second.getOffset());
    }

    @Test
    @DisplayName("Average path length should follow the harmonic approximation")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationTree.averagePathLength(1)).isZero();
        assertThat(IsolationTree.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationTree.averagePathLength(256)).isBetween(10.0, 11.0);
    }

    @Test
    @DisplayName("Scoring before fitting and invalid settings should be rejected")
    void shouldRejectMisuse() {
        assertThatThrownBy(() -> new IsolationForest(10, 16, 0.01, 1L).scores(new double[1][1]))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new IsolationForest(10, 16, 0.0, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IsolationForest(0, 16, 0.01, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static double[][] clusterWithOutlier() {
        Random random = new Random(11);
        double[][] rows = new double[101][2];
        for (int r = 0; r < 100; r++) {
            rows[r][0] = random.nextGaussian();
            rows[r][1] = random.nextGaussian();
        }
        rows[100][0] = 20.0;
        rows[100][1] = 20.0;
        return rows;
    }
}
