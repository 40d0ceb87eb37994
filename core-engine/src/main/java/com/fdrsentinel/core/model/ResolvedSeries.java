package com.fdrsentinel.core.model;

import java.util.Objects;

/**
 * A flight table whose rows are sorted by resolved time, with every row
 * carrying a valid timestamp in seconds since the first valid sample.
 *
 * @since 1.0.0
 */
public final class ResolvedSeries {

    private final FlightTable table;
    private final double[] times;

    public ResolvedSeries(FlightTable table, double[] times) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.times = Objects.requireNonNull(times, "times must not be null").clone();
        if (table.getRowCount() != times.length) {
            throw new IllegalArgumentException(
                    "Expected " + table.getRowCount() + " timestamps, got " + times.length);
        }
    }

    public FlightTable getTable() {
        return table;
    }

    public double[] getTimes() {
        return times.clone();
    }

    public double timeAt(int row) {
        return times[row];
    }

    public int size() {
        return times.length;
    }
}
