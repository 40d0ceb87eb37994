package com.fdrsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A time-contiguous cluster of anomalous rows, the unit of reporting.
 *
 * <p>
 * {@link #getStartRow()} and {@link #getEndRow()} are inclusive indices into
 * the time-sorted series and are not serialized.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Times, severity and the row range are required;
 * driver lists default to empty.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "start_time", "end_time", "duration", "points", "severity", "score_peak",
        "top_drivers", "explanation", "driver_stats", "review" })
public final class Segment {

    @JsonProperty("start_time")
    private final double startTime;

    @JsonProperty("end_time")
    private final double endTime;

    @JsonProperty("points")
    private final int points;

    @JsonProperty("severity")
    private final Severity severity;

    @JsonProperty("score_peak")
    private final double scorePeak;

    @JsonProperty("top_drivers")
    private final List<Driver> topDrivers;

    @JsonProperty("explanation")
    private final String explanation;

    @JsonProperty("driver_stats")
    private final List<DriverStats> driverStats;

    @JsonProperty("review")
    private final boolean review;

    @JsonIgnore
    private final int startRow;

    @JsonIgnore
    private final int endRow;

    private Segment(Builder builder) {
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.scorePeak = builder.scorePeak;
        this.topDrivers = List.copyOf(builder.topDrivers);
        this.explanation = builder.explanation;
        this.driverStats = List.copyOf(builder.driverStats);
        this.review = builder.review;
        this.startRow = builder.startRow;
        this.endRow = builder.endRow;
        if (startRow < 0 || endRow < startRow) {
            throw new IllegalArgumentException("Invalid row range [" + startRow + ", " + endRow + "]");
        }
        this.points = endRow - startRow + 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this segment's values
     */
    public Builder toBuilder() {
        return new Builder()
                .rows(startRow, endRow)
                .times(startTime, endTime)
                .severity(severity)
                .scorePeak(scorePeak)
                .topDrivers(topDrivers)
                .explanation(explanation)
                .driverStats(driverStats)
                .review(review);
    }

    public double getStartTime() {
        return startTime;
    }

    public double getEndTime() {
        return endTime;
    }

    @JsonProperty("duration")
    public double getDuration() {
        return endTime - startTime;
    }

    public int getPoints() {
        return points;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getScorePeak() {
        return scorePeak;
    }

    public List<Driver> getTopDrivers() {
        return topDrivers;
    }

    public String getExplanation() {
        return explanation;
    }

    public List<DriverStats> getDriverStats() {
        return driverStats;
    }

    public boolean isReview() {
        return review;
    }

    public int getStartRow() {
        return startRow;
    }

    public int getEndRow() {
        return endRow;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private double startTime;
        private double endTime;
        private Severity severity;
        private double scorePeak;
        private List<Driver> topDrivers = List.of();
        private String explanation = "";
        private List<DriverStats> driverStats = List.of();
        private boolean review;
        private int startRow = -1;
        private int endRow = -1;

        public Builder rows(int startRow, int endRow) {
            this.startRow = startRow;
            this.endRow = endRow;
            return this;
        }

        public Builder times(double startTime, double endTime) {
            this.startTime = startTime;
            this.endTime = endTime;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder scorePeak(double scorePeak) {
            this.scorePeak = scorePeak;
            return this;
        }

        public Builder topDrivers(List<Driver> topDrivers) {
            this.topDrivers = Objects.requireNonNull(topDrivers, "topDrivers must not be null");
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = Objects.requireNonNull(explanation, "explanation must not be null");
            return this;
        }

        public Builder driverStats(List<DriverStats> driverStats) {
            this.driverStats = Objects.requireNonNull(driverStats, "driverStats must not be null");
            return this;
        }

        public Builder review(boolean review) {
            this.review = review;
            return this;
        }

        public Segment build() {
            return new Segment(this);
        }
    }

    @Override
    public String toString() {
        return "Segment{rows=[" + startRow + ", " + endRow + "], time=[" + startTime + ", " + endTime
                + "], severity=" + severity + ", peak=" + scorePeak + ", review=" + review + '}';
    }
}
