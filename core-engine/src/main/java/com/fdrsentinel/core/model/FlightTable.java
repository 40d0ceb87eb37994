package com.fdrsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Strongly-typed tabular input: an ordered list of equally long
 * {@link Column}s.
 *
 * <p>
 * This is the hand-off point from whatever loader read the flight log. The
 * pipeline never mutates a table; reordering produces a new instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlightTable {

    private final Map<String, Column> columns;
    private final int rowCount;

    private FlightTable(Map<String, Column> columns, int rowCount) {
        this.columns = Collections.unmodifiableMap(columns);
        this.rowCount = rowCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a table from a header and row-major cells. Short rows are padded
     * with missing cells; surplus cells are ignored. A repeated header name
     * {@code X} becomes {@code X.1}, {@code X.2}, ... (the first free suffix).
     *
     * @param header column names in order
     * @param rows   row-major cells
     * @return a new table
     */
    public static FlightTable fromRows(List<String> header, List<? extends List<?>> rows) {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        Builder builder = builder();
        Set<String> used = new HashSet<>(header);
        Set<String> seen = new HashSet<>();
        for (int c = 0; c < header.size(); c++) {
            List<Object> cells = new ArrayList<>(rows.size());
            for (List<?> row : rows) {
                cells.add(c < row.size() ? row.get(c) : null);
            }
            String name = header.get(c);
            if (!seen.add(name)) {
                name = nextFreeName(name, used);
            }
            builder.column(name, cells);
        }
        return builder.build();
    }

    private static String nextFreeName(String name, Set<String> used) {
        for (int suffix = 1; ; suffix++) {
            String candidate = name + "." + suffix;
            if (used.add(candidate)) {
                return candidate;
            }
        }
    }

    public int getRowCount() {
        return rowCount;
    }

    /**
     * @return column names in their original order
     */
    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Optional<Column> column(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    /**
     * @throws IllegalArgumentException if no column has this name
     */
    public Column requireColumn(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("No such column: '" + name + "'");
        }
        return column;
    }

    /**
     * Produce a table whose row {@code i} is this table's row {@code order[i]}.
     *
     * @param order row indices into this table; may drop rows
     * @return reordered copy
     */
    public FlightTable selectRows(int[] order) {
        Objects.requireNonNull(order, "order must not be null");
        Map<String, Column> reordered = new LinkedHashMap<>();
        for (Column column : columns.values()) {
            reordered.put(column.getName(), column.reorder(order));
        }
        return new FlightTable(reordered, order.length);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link FlightTable}. Every column must have the same
     * length; column names must be unique.
     */
    public static class Builder {
        private final Map<String, Column> columns = new LinkedHashMap<>();

        public Builder column(String name, List<?> cells) {
            Objects.requireNonNull(name, "Column name must not be null");
            if (columns.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate column: '" + name + "'");
            }
            columns.put(name, new Column(name, cells));
            return this;
        }

        public Builder numericColumn(String name, double... values) {
            List<Object> cells = new ArrayList<>(values.length);
            for (double v : values) {
                cells.add(Double.isNaN(v) ? null : v);
            }
            return column(name, cells);
        }

        /**
         * @return the table
         * @throws IllegalArgumentException if columns differ in length
         */
        public FlightTable build() {
            int rows = -1;
            for (Column column : columns.values()) {
                if (rows >= 0 && column.size() != rows) {
                    throw new IllegalArgumentException(
                            "Column '" + column.getName() + "' has " + column.size()
                                    + " rows, expected " + rows);
                }
                rows = column.size();
            }
            return new FlightTable(new LinkedHashMap<>(columns), Math.max(rows, 0));
        }
    }

    @Override
    public String toString() {
        return "FlightTable{columns=" + columns.keySet() + ", rows=" + rowCount + '}';
    }
}
