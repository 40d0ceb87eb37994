package com.fdrsentinel.core.preprocess;

import com.fdrsentinel.core.model.FeatureMatrix;
import com.fdrsentinel.core.model.ScalingStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Standardizer}.
 */
class StandardizerTest {

    private static final double NAN = Double.NaN;

    @Test
    @DisplayName("Missing cells should be forward-filled then back-filled")
    void shouldFillMissing() {
        FeatureMatrix matrix = matrix(new double[][] { { NAN }, { 2 }, { NAN }, { 4 }, { NAN } });

        FeatureMatrix filled = Standardizer.fillMissing(matrix);

        assertThat(filled.column(0)).containsExactly(2, 2, 2, 4, 4);
    }

    @Test
    @DisplayName("Training prefix should be floor(rows * fraction) with a minimum of one")
    void shouldComputeTrainCount() {
        assertThat(Standardizer.trainCount(10, 0.7)).isEqualTo(7);
        assertThat(Standardizer.trainCount(3, 0.7)).isEqualTo(2);
        assertThat(Standardizer.trainCount(1, 0.7)).isEqualTo(1);
    }

    @Test
    @DisplayName("Mean and sample std should come from the training prefix only")
    void shouldFitOnPrefix() {
        FeatureMatrix matrix = matrix(new double[][] { { 1 }, { 2 }, { 3 }, { 100 } });

        ScalingStatistics stats = Standardizer.fitMeanStd(matrix, 3);
        double[][] scaled = Standardizer.apply(matrix, stats, 0.0);

        assertThat(stats.getCenter()[0]).isEqualTo(2.0);
        assertThat(stats.getSpread()[0]).isEqualTo(1.0);
        assertThat(scaled[3][0]).isEqualTo(98.0);
    }

    @Test
    @DisplayName("Zero spread should be replaced by one")
    void shouldReplaceZeroSpread() {
        FeatureMatrix matrix = matrix(new double[][] { { 5 }, { 5 }, { 5 }, { 9 } });

        ScalingStatistics stats = Standardizer.fitMeanStd(matrix, 3);

        assertThat(stats.getSpread()[0]).isEqualTo(1.0);
        assertThat(Standardizer.apply(matrix, stats, 0.0)[3][0]).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Median/IQR scaling should ignore missing cells and map them to the fill value")
    void shouldScaleRobustly() {
        FeatureMatrix matrix = matrix(new double[][] { { 1 }, { 2 }, { NAN }, { 3 }, { 5 }, { 50 } });

        ScalingStatistics stats = Standardizer.fitMedianIqr(matrix, 5);
        double[][] scaled = Standardizer.apply(matrix, stats, 0.0);

        // prefix values 1, 2, 3, 5 -> median 2.5, q1 1.75, q3 3.5
        assertThat(stats.getCenter()[0]).isCloseTo(2.5, within(1e-12));
        assertThat(stats.getSpread()[0]).isCloseTo(1.75, within(1e-12));
        assertThat(scaled[2][0]).isZero();
        assertThat(stats.getCenterName()).isEqualTo("median");
        assertThat(stats.getSpreadName()).isEqualTo("iqr");
    }

    private static FeatureMatrix matrix(double[][] values) {
        return new FeatureMatrix(List.of("Oil Temp (C)"), values);
    }
}
