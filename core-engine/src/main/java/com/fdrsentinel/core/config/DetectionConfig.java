package com.fdrsentinel.core.config;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, immutable configuration threaded through every detection stage.
 *
 * <p>
 * No stage reads process state: the caller constructs one instance at the
 * call boundary (programmatically, from {@link #fromEnvironment()}, or from
 * YAML through {@link DetectionConfigLoader}) and passes it down.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} or the {@link Builder}. The builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Columns that identify the sample or the flight rather than measure anything. */
    public static final List<String> DEFAULT_EXCLUDED_COLUMNS = List.of(
            "Session Time",
            "System Time",
            "GPS Date & Time",
            "Destination Waypoint ID",
            "Transponder Code (octal)");

    // ---------------------------------------------------------------
    // Input
    // ---------------------------------------------------------------
    private final String timeColumn;
    private final Set<String> excludedColumns;

    // ---------------------------------------------------------------
    // Windowing / reconstruction training
    // ---------------------------------------------------------------
    private final int windowSize;
    private final int stride;
    private final int epochs;
    private final int batchSize;
    private final double trainFraction;
    private final long seed;

    // ---------------------------------------------------------------
    // Segmentation / attribution
    // ---------------------------------------------------------------
    private final double thresholdPercentile;
    private final double mediumPercentile;
    private final double segmentGapSeconds;
    private final int topDriverCount;
    private final int explanationDriverCount;
    private final int reviewLimit;

    // ---------------------------------------------------------------
    // Robust statistics + isolation ensemble
    // ---------------------------------------------------------------
    private final int robustWindow;
    private final int robustMinPeriods;
    private final double robustZThreshold;
    private final int robustDriverCount;
    private final int ensembleTrees;
    private final int ensembleSampleSize;
    private final double ensembleContamination;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final boolean debug;

    private DetectionConfig(Builder b) {
        this.timeColumn = b.timeColumn;
        this.excludedColumns = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludedColumns));
        this.windowSize = b.windowSize;
        this.stride = b.stride;
        this.epochs = b.epochs;
        this.batchSize = b.batchSize;
        this.trainFraction = b.trainFraction;
        this.seed = b.seed;
        this.thresholdPercentile = b.thresholdPercentile;
        this.mediumPercentile = b.mediumPercentile;
        this.segmentGapSeconds = b.segmentGapSeconds;
        this.topDriverCount = b.topDriverCount;
        this.explanationDriverCount = b.explanationDriverCount;
        this.reviewLimit = b.reviewLimit;
        this.robustWindow = b.robustWindow;
        this.robustMinPeriods = b.robustMinPeriods;
        this.robustZThreshold = b.robustZThreshold;
        this.robustDriverCount = b.robustDriverCount;
        this.ensembleTrees = b.ensembleTrees;
        this.ensembleSampleSize = b.ensembleSampleSize;
        this.ensembleContamination = b.ensembleContamination;
        this.debug = b.debug;
    }

    /**
     * @return configuration with every documented default
     */
    public static DetectionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy this configuration into a new builder, e.g. to flip a single flag.
     *
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .timeColumn(timeColumn)
                .excludedColumns(excludedColumns)
                .windowSize(windowSize)
                .stride(stride)
                .epochs(epochs)
                .batchSize(batchSize)
                .trainFraction(trainFraction)
                .seed(seed)
                .thresholdPercentile(thresholdPercentile)
                .mediumPercentile(mediumPercentile)
                .segmentGapSeconds(segmentGapSeconds)
                .topDriverCount(topDriverCount)
                .explanationDriverCount(explanationDriverCount)
                .reviewLimit(reviewLimit)
                .robustWindow(robustWindow)
                .robustMinPeriods(robustMinPeriods)
                .robustZThreshold(robustZThreshold)
                .robustDriverCount(robustDriverCount)
                .ensembleTrees(ensembleTrees)
                .ensembleSampleSize(ensembleSampleSize)
                .ensembleContamination(ensembleContamination)
                .debug(debug);
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link DetectionConfig} from {@code FDR_*} environment variables.
     *
     * <p>
     * Intended for the process entry point only; stages receive the resulting
     * object and never consult the environment themselves.
     * </p>
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static DetectionConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link DetectionConfig} from {@code FDR_*} entries of the given
     * variable map. Absent or blank entries keep the defaults.
     *
     * @param environment variable name to value; must not be {@code null}
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static DetectionConfig fromEnvironment(Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        try {
            return builder()
                    .timeColumn(env(environment, "FDR_TIME_COLUMN", "Session Time"))
                    .windowSize(Integer.parseInt(env(environment, "FDR_WINDOW_SIZE", "60")))
                    .stride(Integer.parseInt(env(environment, "FDR_WINDOW_STRIDE", "5")))
                    .epochs(Integer.parseInt(env(environment, "FDR_EPOCHS", "30")))
                    .batchSize(Integer.parseInt(env(environment, "FDR_BATCH_SIZE", "128")))
                    .thresholdPercentile(Double.parseDouble(env(environment, "FDR_THRESHOLD_PERCENTILE", "97")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getTimeColumn() {
        return timeColumn;
    }

    /**
     * @return unmodifiable set of column names never used as features
     */
    public Set<String> getExcludedColumns() {
        return excludedColumns;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getStride() {
        return stride;
    }

    public int getEpochs() {
        return epochs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public double getTrainFraction() {
        return trainFraction;
    }

    public long getSeed() {
        return seed;
    }

    public double getThresholdPercentile() {
        return thresholdPercentile;
    }

    public double getMediumPercentile() {
        return mediumPercentile;
    }

    public double getSegmentGapSeconds() {
        return segmentGapSeconds;
    }

    public int getTopDriverCount() {
        return topDriverCount;
    }

    public int getExplanationDriverCount() {
        return explanationDriverCount;
    }

    public int getReviewLimit() {
        return reviewLimit;
    }

    public int getRobustWindow() {
        return robustWindow;
    }

    public int getRobustMinPeriods() {
        return robustMinPeriods;
    }

    public double getRobustZThreshold() {
        return robustZThreshold;
    }

    public int getRobustDriverCount() {
        return robustDriverCount;
    }

    public int getEnsembleTrees() {
        return ensembleTrees;
    }

    public int getEnsembleSampleSize() {
        return ensembleSampleSize;
    }

    public double getEnsembleContamination() {
        return ensembleContamination;
    }

    public boolean isDebug() {
        return debug;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (positive window/stride/epochs/batch, percentiles in (0, 100],
     * train fraction in (0, 1], contamination in (0, 0.5]).
     * </p>
     */
    public static class Builder {
        private String timeColumn = "Session Time";
        private Set<String> excludedColumns = new LinkedHashSet<>(DEFAULT_EXCLUDED_COLUMNS);
        private int windowSize = 60;
        private int stride = 5;
        private int epochs = 30;
        private int batchSize = 128;
        private double trainFraction = 0.7;
        private long seed = 42L;
        private double thresholdPercentile = 97.0;
        private double mediumPercentile = 90.0;
        private double segmentGapSeconds = 2.0;
        private int topDriverCount = 5;
        private int explanationDriverCount = 3;
        private int reviewLimit = 10;
        private int robustWindow = 51;
        private int robustMinPeriods = 10;
        private double robustZThreshold = 8.0;
        private int robustDriverCount = 3;
        private int ensembleTrees = 200;
        private int ensembleSampleSize = 256;
        private double ensembleContamination = 0.01;
        private boolean debug;

        public Builder timeColumn(String v) {
            this.timeColumn = v;
            return this;
        }

        public Builder excludedColumns(Set<String> v) {
            this.excludedColumns = v != null ? new LinkedHashSet<>(v) : new LinkedHashSet<>();
            return this;
        }

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder stride(int v) {
            this.stride = v;
            return this;
        }

        public Builder epochs(int v) {
            this.epochs = v;
            return this;
        }

        public Builder batchSize(int v) {
            this.batchSize = v;
            return this;
        }

        public Builder trainFraction(double v) {
            this.trainFraction = v;
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Builder thresholdPercentile(double v) {
            this.thresholdPercentile = v;
            return this;
        }

        public Builder mediumPercentile(double v) {
            this.mediumPercentile = v;
            return this;
        }

        public Builder segmentGapSeconds(double v) {
            this.segmentGapSeconds = v;
            return this;
        }

        public Builder topDriverCount(int v) {
            this.topDriverCount = v;
            return this;
        }

        public Builder explanationDriverCount(int v) {
            this.explanationDriverCount = v;
            return this;
        }

        public Builder reviewLimit(int v) {
            this.reviewLimit = v;
            return this;
        }

        public Builder robustWindow(int v) {
            this.robustWindow = v;
            return this;
        }

        public Builder robustMinPeriods(int v) {
            this.robustMinPeriods = v;
            return this;
        }

        public Builder robustZThreshold(double v) {
            this.robustZThreshold = v;
            return this;
        }

        public Builder robustDriverCount(int v) {
            this.robustDriverCount = v;
            return this;
        }

        public Builder ensembleTrees(int v) {
            this.ensembleTrees = v;
            return this;
        }

        public Builder ensembleSampleSize(int v) {
            this.ensembleSampleSize = v;
            return this;
        }

        public Builder ensembleContamination(double v) {
            this.ensembleContamination = v;
            return this;
        }

        public Builder debug(boolean v) {
            this.debug = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectionConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public DetectionConfig build() {
            requireNonBlank(timeColumn, "timeColumn");
            Objects.requireNonNull(excludedColumns, "excludedColumns required");

            requirePositive(windowSize, "windowSize");
            requirePositive(stride, "stride");
            requirePositive(epochs, "epochs");
            requirePositive(batchSize, "batchSize");
            requirePositive(topDriverCount, "topDriverCount");
            requirePositive(explanationDriverCount, "explanationDriverCount");
            requirePositive(reviewLimit, "reviewLimit");
            requirePositive(robustDriverCount, "robustDriverCount");
            requirePositive(ensembleTrees, "ensembleTrees");
            requirePositive(ensembleSampleSize, "ensembleSampleSize");

            requirePercentile(thresholdPercentile, "thresholdPercentile");
            requirePercentile(mediumPercentile, "mediumPercentile");

            if (!(trainFraction > 0 && trainFraction <= 1)) {
                throw new IllegalArgumentException(
                        "trainFraction must be in (0, 1], got: " + trainFraction);
            }
            if (!(segmentGapSeconds >= 0)) {
                throw new IllegalArgumentException(
                        "segmentGapSeconds must be >= 0, got: " + segmentGapSeconds);
            }
            if (robustWindow < 1 || robustMinPeriods < 1 || robustMinPeriods > robustWindow) {
                throw new IllegalArgumentException(
                        "robustMinPeriods must be in [1, robustWindow], got: "
                                + robustMinPeriods + " / " + robustWindow);
            }
            if (!(robustZThreshold > 0)) {
                throw new IllegalArgumentException(
                        "robustZThreshold must be > 0, got: " + robustZThreshold);
            }
            if (!(ensembleContamination > 0 && ensembleContamination <= 0.5)) {
                throw new IllegalArgumentException(
                        "ensembleContamination must be in (0, 0.5], got: " + ensembleContamination);
            }

            return new DetectionConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }

        private static void requirePercentile(double value, String name) {
            if (!(value > 0 && value <= 100)) {
                throw new IllegalArgumentException(name + " must be in (0, 100], got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> environment, String name, String defaultValue) {
        String value = environment.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "timeColumn='" + timeColumn + '\'' +
                ", windowSize=" + windowSize +
                ", stride=" + stride +
                ", epochs=" + epochs +
                ", batchSize=" + batchSize +
                ", trainFraction=" + trainFraction +
                ", thresholdPercentile=" + thresholdPercentile +
                ", segmentGapSeconds=" + segmentGapSeconds +
                ", robustWindow=" + robustWindow +
                ", robustZThreshold=" + robustZThreshold +
                ", ensembleTrees=" + ensembleTrees +
                ", ensembleContamination=" + ensembleContamination +
                ", seed=" + seed +
                ", debug=" + debug +
                '}';
    }
}
