package com.fdrsentinel.core.preprocess;

import com.fdrsentinel.core.error.EmptyInputException;
import com.fdrsentinel.core.error.MissingTimeColumnException;
import com.fdrsentinel.core.error.TimeParseException;
import com.fdrsentinel.core.model.Column;
import com.fdrsentinel.core.model.FlightTable;
import com.fdrsentinel.core.model.ResolvedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Turns the raw time column into seconds and orders the table by it.
 *
 * <h3>Resolution order</h3>
 * <ol>
 * <li>Plain numbers, when most non-blank cells are numeric; the other cells
 * do not resolve.</li>
 * <li>Durations: {@code [D day[s][,]] H:MM:SS[.fff]} or ISO-8601
 * ({@code PT1M30S}).</li>
 * <li>Absolute timestamps (ISO-8601 or common date-time layouts), expressed
 * relative to the first valid one.</li>
 * </ol>
 * <p>
 * Rows whose time does not resolve are dropped; the rest are stable-sorted by
 * time.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TimeResolver.class);

    private static final Pattern CLOCK_DURATION = Pattern.compile(
            "^(-)?(?:(\\d+)\\s+days?,?\\s*)?(\\d+):(\\d{1,2}):(\\d{1,2}(?:\\.\\d+)?)$");

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSSSSSSSS][.SSSSSS][.SSS]"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss[.SSS]"),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm[:ss][.SSS]"),
            DateTimeFormatter.ofPattern("d.M.yyyy H:mm[:ss][.SSS]"));

    private TimeResolver() {
        // utility class
    }

    /**
     * Resolve the time column and reorder the table.
     *
     * @param table      input table
     * @param timeColumn name of the time column
     * @return the sorted table with its timestamps in seconds
     * @throws MissingTimeColumnException if the column is absent
     * @throws EmptyInputException        if the table has no rows
     * @throws TimeParseException         if no interpretation yields a valid value
     */
    public static ResolvedSeries resolve(FlightTable table, String timeColumn) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(timeColumn, "timeColumn must not be null");

        Column column = table.column(timeColumn)
                .orElseThrow(() -> new MissingTimeColumnException(
                        "Input file must include a '" + timeColumn + "' column."));
        if (table.getRowCount() == 0) {
            throw new EmptyInputException("No rows available for anomaly detection.");
        }

        double[] seconds = parse(column);

        int[] order = IntStream.range(0, seconds.length)
                .filter(i -> !Double.isNaN(seconds[i]))
                .boxed()
                .sorted((a, b) -> Double.compare(seconds[a], seconds[b]))
                .mapToInt(Integer::intValue)
                .toArray();
        if (order.length == 0) {
            throw new EmptyInputException("No rows available for anomaly detection.");
        }
        int dropped = seconds.length - order.length;
        if (dropped > 0) {
            LOG.warn("Dropped {} row(s) whose '{}' could not be resolved", dropped, timeColumn);
        }

        double[] sorted = Arrays.stream(order).mapToDouble(i -> seconds[i]).toArray();
        LOG.info("Resolved {} row(s) spanning {} s", sorted.length, sorted[sorted.length - 1] - sorted[0]);
        return new ResolvedSeries(table.selectRows(order), sorted);
    }

    /**
     * @return seconds per row, {@link Double#NaN} where a row does not resolve
     * @throws TimeParseException if no row resolves under any interpretation
     */
    static double[] parse(Column column) {
        int rows = column.size();

        if (isNumeric(column)) {
            LOG.debug("Time column '{}' is numeric", column.getName());
            // non-numeric cells such as "n/a" come back as NaN and their rows are dropped
            return column.toNumeric();
        }

        double[] durations = new double[rows];
        if (mapEach(column, durations, TimeResolver::parseDuration)) {
            LOG.debug("Time column '{}' parsed as durations", column.getName());
            return durations;
        }

        double[] instants = new double[rows];
        if (mapEach(column, instants, TimeResolver::parseTimestamp)) {
            LOG.debug("Time column '{}' parsed as timestamps", column.getName());
            double base = Arrays.stream(instants).filter(v -> !Double.isNaN(v)).findFirst().orElseThrow();
            for (int i = 0; i < rows; i++) {
                instants[i] -= base;
            }
            return instants;
        }

        throw new TimeParseException(
                "Unable to parse " + column.getName() + " column to numeric seconds.");
    }

    private static boolean isNumeric(Column column) {
        int present = 0;
        int numeric = 0;
        for (int i = 0; i < column.size(); i++) {
            if (column.stringValue(i).isEmpty()) {
                continue;
            }
            present++;
            if (column.numericValue(i).isPresent()) {
                numeric++;
            }
        }
        return numeric > 0 && 2 * numeric > present;
    }

    private static boolean mapEach(Column column, double[] target, ToDoubleFunction<String> parser) {
        boolean any = false;
        for (int i = 0; i < column.size(); i++) {
            Optional<String> text = column.stringValue(i);
            target[i] = text.map(parser::applyAsDouble).orElse(Double.NaN);
            any |= !Double.isNaN(target[i]);
        }
        return any;
    }

    /**
     * @return total seconds, or {@link Double#NaN} if the text is not a duration
     */
    static double parseDuration(String text) {
        Matcher m = CLOCK_DURATION.matcher(text.trim());
        if (m.matches()) {
            double days = m.group(2) != null ? Double.parseDouble(m.group(2)) : 0.0;
            double total = days * 86_400.0
                    + Double.parseDouble(m.group(3)) * 3_600.0
                    + Double.parseDouble(m.group(4)) * 60.0
                    + Double.parseDouble(m.group(5));
            return m.group(1) != null ? -total : total;
        }
        try {
            Duration duration = Duration.parse(text.trim());
            return duration.getSeconds() + duration.getNano() / 1e9;
        } catch (DateTimeParseException e) {
            return Double.NaN;
        }
    }

    /**
     * @return epoch seconds (local times read as UTC), or {@link Double#NaN}
     */
    static double parseTimestamp(String text) {
        String trimmed = text.trim();
        try {
            return toSeconds(OffsetDateTime.parse(trimmed).toInstant());
        } catch (DateTimeParseException e) {
            LOG.trace("'{}' is not an offset date-time", trimmed);
        }
        for (DateTimeFormatter format : LOCAL_DATE_TIME_FORMATS) {
            try {
                return toSeconds(LocalDateTime.parse(trimmed, format).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException e) {
                LOG.trace("'{}' does not match {}", trimmed, format);
            }
        }
        try {
            return toSeconds(LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Double.NaN;
        }
    }

    private static double toSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }
}
