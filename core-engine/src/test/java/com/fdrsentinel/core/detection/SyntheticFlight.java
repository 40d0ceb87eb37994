package com.fdrsentinel.core.detection;

import com.fdrsentinel.core.model.FlightTable;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.List;
import java.util.Random;

/**
 * Seeded synthetic flight recordings for detector tests: one row per second,
 * five slowly varying noisy parameters.
 */
final class SyntheticFlight {

    static final String TIME = "Session Time";
    static final List<String> PARAMETERS = List.of(
            "Pitch (deg)", "Roll (deg)", "Oil Temp (deg C)", "Airspeed (kt)", "Altitude (ft)");

    /** Parameters disturbed by the anomaly helpers. */
    static final List<String> DISTURBED = List.of(PARAMETERS.get(0), PARAMETERS.get(2));

    private SyntheticFlight() {
        // utility class
    }

    /**
     * @return values[feature][row] of clean data
     */
    static double[][] clean(int rows, long seed) {
        Random random = new Random(seed);
        double[][] values = new double[PARAMETERS.size()][rows];
        for (int r = 0; r < rows; r++) {
            for (int f = 0; f < values.length; f++) {
                double phase = f * Math.PI / 3.0;
                values[f][r] = Math.sin(2 * Math.PI * r / 1000.0 + phase) + 0.05 * random.nextGaussian();
            }
        }
        return values;
    }

    /**
     * Shift the disturbed parameters by ten clean standard deviations over
     * rows {@code [from, to]}.
     */
    static FlightTable withLevelShift(int rows, int from, int to) {
        double[][] values = clean(rows, 42L);
        for (int f : new int[] { 0, 2 }) {
            double shift = 10.0 * std(values[f]);
            for (int r = from; r <= to; r++) {
                values[f][r] += shift;
            }
        }
        return table(values);
    }

    /**
     * Add an alternating +/- ten standard deviation pattern to the disturbed
     * parameters over rows {@code [from, to]}.
     */
    static FlightTable withOscillation(int rows, int from, int to) {
        double[][] values = clean(rows, 42L);
        for (int f : new int[] { 0, 2 }) {
            double amplitude = 10.0 * std(values[f]);
            for (int r = from; r <= to; r++) {
                values[f][r] += r % 2 == 0 ? amplitude : -amplitude;
            }
        }
        return table(values);
    }

    static FlightTable flat(int rows) {
        double[] time = new double[rows];
        double[] level = new double[rows];
        for (int r = 0; r < rows; r++) {
            time[r] = r;
            level[r] = 1.0;
        }
        return FlightTable.builder()
                .numericColumn(TIME, time)
                .numericColumn(PARAMETERS.get(0), level)
                .numericColumn(PARAMETERS.get(1), level)
                .build();
    }

    private static FlightTable table(double[][] values) {
        int rows = values[0].length;
        double[] time = new double[rows];
        for (int r = 0; r < rows; r++) {
            time[r] = r;
        }
        FlightTable.Builder builder = FlightTable.builder().numericColumn(TIME, time);
        for (int f = 0; f < PARAMETERS.size(); f++) {
            builder.numericColumn(PARAMETERS.get(f), values[f]);
        }
        return builder.build();
    }

    private static double std(double[] values) {
        return new StandardDeviation().evaluate(values);
    }
}
