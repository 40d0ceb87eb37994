package com.fdrsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * One named column of a {@link FlightTable}.
 *
 * <p>
 * Cells are kept as loaded ({@link Number}, {@link String} or {@code null})
 * and coerced on demand: numbers pass through, strings in plain decimal or
 * exponent notation are parsed, anything else (blank, {@code n/a},
 * {@code 1.5f}, hex, non-finite) is <em>missing</em>.
 * </p>
 *
 * @since 1.0.0
 */
public final class Column {

    /** Plain decimal or exponent notation; no type suffixes, hex or special names. */
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private final String name;
    private final List<Object> cells;

    public Column(String name, List<?> cells) {
        this.name = Objects.requireNonNull(name, "Column name must not be null");
        Objects.requireNonNull(cells, "Column cells must not be null");
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public String getName() {
        return name;
    }

    public int size() {
        return cells.size();
    }

    /**
     * Retrieve a cell as a string.
     *
     * @return optional containing the trimmed, non-blank cell text
     */
    public Optional<String> stringValue(int row) {
        Object raw = cells.get(row);
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Retrieve a cell as a number, coercing numeric strings.
     *
     * @return optional containing a finite value, empty if the cell is missing
     */
    public OptionalDouble numericValue(int row) {
        double value = numericAt(row);
        return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Same as {@link #numericValue(int)} with {@link Double#NaN} for missing.
     */
    public double numericAt(int row) {
        Object raw = cells.get(row);
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            value = parse(s);
        } else {
            value = Double.NaN;
        }
        return Double.isFinite(value) ? value : Double.NaN;
    }

    /**
     * @return every cell coerced with {@link #numericAt(int)}
     */
    public double[] toNumeric() {
        double[] values = new double[cells.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = numericAt(i);
        }
        return values;
    }

    Column reorder(int[] order) {
        List<Object> reordered = new ArrayList<>(order.length);
        for (int index : order) {
            reordered.add(cells.get(index));
        }
        return new Column(name, reordered);
    }

    private static double parse(String text) {
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    @Override
    public String toString() {
        return "Column{name='" + name + "', size=" + cells.size() + '}';
    }
}
