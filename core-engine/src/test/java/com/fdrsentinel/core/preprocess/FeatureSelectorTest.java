package com.fdrsentinel.core.preprocess;

import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.error.NoFeaturesException;
import com.fdrsentinel.core.model.FeatureMatrix;
import com.fdrsentinel.core.model.FlightTable;
import com.fdrsentinel.core.model.ResolvedSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FeatureSelector}.
 */
class FeatureSelectorTest {

    private static final int ROWS = 20;

    private FeatureSelector selector;

    @BeforeEach
    void setUp() {
        selector = new FeatureSelector(DetectionConfig.defaults());
    }

    @Test
    @DisplayName("Should keep a column with 30% missing and drop one with 50% missing")
    void shouldApplyMissingRatio() {
        FlightTable table = FlightTable.builder()
                .numericColumn("Session Time", ramp())
                .numericColumn("Mostly Present", withMissing(ramp(), 6))
                .numericColumn("Half Missing", withMissing(ramp(), 10))
                .build();

        FeatureMatrix matrix = selector.select(series(table));

        assertThat(matrix.getFeatures()).containsExactly("Mostly Present");
        assertThat(matrix.get(0, 0)).isNaN();
    }

    @Test
    @DisplayName("Should drop excluded, constant, low-cardinality and flag columns")
    void shouldRejectUnsuitableColumns() {
        FlightTable table = FlightTable.builder()
                .numericColumn("Session Time", ramp())
                .numericColumn("System Time", ramp())
                .numericColumn("Constant", IntStream.range(0, ROWS).mapToDouble(i -> 5.0).toArray())
                .numericColumn("Gear", IntStream.range(0, ROWS).mapToDouble(i -> i % 4).toArray())
                .numericColumn("Flag", IntStream.range(0, ROWS).mapToDouble(i -> i % 2).toArray())
                .numericColumn("Airspeed (kt)", ramp())
                .build();

        FeatureMatrix matrix = selector.select(series(table));

        assertThat(matrix.getFeatures()).containsExactly("Airspeed (kt)");
    }

    @Test
    @DisplayName("Text columns should be coerced to missing and rejected")
    void shouldRejectTextColumns() {
        List<Object> waypoints = new ArrayList<>();
        for (int i = 0; i < ROWS; i++) {
            waypoints.add("KJFK" + i);
        }
        FlightTable table = FlightTable.builder()
                .numericColumn("Session Time", ramp())
                .column("Waypoint", waypoints)
                .numericColumn("Pitch (deg)", ramp())
                .build();

        assertThat(selector.select(series(table)).getFeatures()).containsExactly("Pitch (deg)");
    }

    @Test
    @DisplayName("Should raise NoFeaturesException when nothing qualifies")
    void shouldRejectEmptySelection() {
        FlightTable table = FlightTable.builder()
                .numericColumn("Session Time", ramp())
                .numericColumn("Constant", IntStream.range(0, ROWS).mapToDouble(i -> 1.0).toArray())
                .build();

        assertThatThrownBy(() -> selector.select(series(table)))
                .isInstanceOf(NoFeaturesException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double[] ramp() {
        return IntStream.range(0, ROWS).mapToDouble(i -> i * 1.5).toArray();
    }

    private static double[] withMissing(double[] values, int missing) {
        double[] copy = values.clone();
        for (int i = 0; i < missing; i++) {
            copy[i] = Double.NaN;
        }
        return copy;
    }

    private static ResolvedSeries series(FlightTable table) {
        return new ResolvedSeries(table, table.requireColumn("Session Time").toNumeric());
    }
}
