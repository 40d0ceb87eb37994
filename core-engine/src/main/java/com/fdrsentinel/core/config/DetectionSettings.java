package com.fdrsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Mutable POJO bound from the detection YAML file.
 *
 * <p>
 * Every property is optional; an absent property keeps the value of the
 * base configuration it is overlaid on. Expected YAML structure:
 * </p>
 *
 * <pre>
 * timeColumn: Session Time
 * windowSize: 60
 * stride: 5
 * epochs: 30
 * batchSize: 128
 * thresholdPercentile: 97
 * robustZThreshold: 8.0
 * excludedColumns:
 *   - System Time
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading, then {@link #toConfig(DetectionConfig)}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String timeColumn;
    private List<String> excludedColumns;
    private Integer windowSize;
    private Integer stride;
    private Integer epochs;
    private Integer batchSize;
    private Double trainFraction;
    private Long seed;
    private Double thresholdPercentile;
    private Double segmentGapSeconds;
    private Integer topDriverCount;
    private Integer reviewLimit;
    private Integer robustWindow;
    private Integer robustMinPeriods;
    private Double robustZThreshold;
    private Integer ensembleTrees;
    private Double ensembleContamination;
    private Boolean debug;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every property that is present.
     *
     * <p>
     * Collects all errors and throws a single exception if any property is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more properties are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (timeColumn != null && timeColumn.isBlank()) {
            errors.add("'timeColumn' must not be blank");
        }
        positive(windowSize, "windowSize", errors);
        positive(stride, "stride", errors);
        positive(epochs, "epochs", errors);
        positive(batchSize, "batchSize", errors);
        positive(topDriverCount, "topDriverCount", errors);
        positive(reviewLimit, "reviewLimit", errors);
        positive(robustWindow, "robustWindow", errors);
        positive(robustMinPeriods, "robustMinPeriods", errors);
        positive(ensembleTrees, "ensembleTrees", errors);

        if (thresholdPercentile != null && !(thresholdPercentile > 0 && thresholdPercentile <= 100)) {
            errors.add("'thresholdPercentile' must be in (0, 100]");
        }
        if (trainFraction != null && !(trainFraction > 0 && trainFraction <= 1)) {
            errors.add("'trainFraction' must be in (0, 1]");
        }
        if (segmentGapSeconds != null && !(segmentGapSeconds >= 0)) {
            errors.add("'segmentGapSeconds' must be >= 0");
        }
        if (robustZThreshold != null && !(robustZThreshold > 0)) {
            errors.add("'robustZThreshold' must be > 0");
        }
        if (ensembleContamination != null && !(ensembleContamination > 0 && ensembleContamination <= 0.5)) {
            errors.add("'ensembleContamination' must be in (0, 0.5]");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection settings validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    /**
     * Overlay the present properties on {@code base}.
     *
     * @param base configuration supplying every property the file leaves out,
     *             usually {@link DetectionConfig#fromEnvironment()}
     * @return the resulting immutable configuration
     */
    public DetectionConfig toConfig(DetectionConfig base) {
        Objects.requireNonNull(base, "base config must not be null");
        DetectionConfig.Builder b = base.toBuilder();
        if (timeColumn != null) {
            b.timeColumn(timeColumn);
        }
        if (excludedColumns != null) {
            LinkedHashSet<String> excluded = new LinkedHashSet<>(base.getExcludedColumns());
            excluded.addAll(excludedColumns);
            b.excludedColumns(excluded);
        }
        if (windowSize != null) {
            b.windowSize(windowSize);
        }
        if (stride != null) {
            b.stride(stride);
        }
        if (epochs != null) {
            b.epochs(epochs);
        }
        if (batchSize != null) {
            b.batchSize(batchSize);
        }
        if (trainFraction != null) {
            b.trainFraction(trainFraction);
        }
        if (seed != null) {
            b.seed(seed);
        }
        if (thresholdPercentile != null) {
            b.thresholdPercentile(thresholdPercentile);
        }
        if (segmentGapSeconds != null) {
            b.segmentGapSeconds(segmentGapSeconds);
        }
        if (topDriverCount != null) {
            b.topDriverCount(topDriverCount);
        }
        if (reviewLimit != null) {
            b.reviewLimit(reviewLimit);
        }
        if (robustWindow != null) {
            b.robustWindow(robustWindow);
        }
        if (robustMinPeriods != null) {
            b.robustMinPeriods(robustMinPeriods);
        }
        if (robustZThreshold != null) {
            b.robustZThreshold(robustZThreshold);
        }
        if (ensembleTrees != null) {
            b.ensembleTrees(ensembleTrees);
        }
        if (ensembleContamination != null) {
            b.ensembleContamination(ensembleContamination);
        }
        if (debug != null) {
            b.debug(debug);
        }
        return b.build();
    }

    private static void positive(Integer value, String name, List<String> errors) {
        if (value != null && value < 1) {
            errors.add("'" + name + "' must be >= 1");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getTimeColumn() {
        return timeColumn;
    }

    public void setTimeColumn(String timeColumn) {
        this.timeColumn = timeColumn;
    }

    public List<String> getExcludedColumns() {
        return excludedColumns;
    }

    public void setExcludedColumns(List<String> excludedColumns) {
        this.excludedColumns = excludedColumns != null ? new ArrayList<>(excludedColumns) : null;
    }

    public Integer getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(Integer windowSize) {
        this.windowSize = windowSize;
    }

    public Integer getStride() {
        return stride;
    }

    public void setStride(Integer stride) {
        this.stride = stride;
    }

    public Integer getEpochs() {
        return epochs;
    }

    public void setEpochs(Integer epochs) {
        this.epochs = epochs;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(Integer batchSize) {
        this.batchSize = batchSize;
    }

    public Double getTrainFraction() {
        return trainFraction;
    }

    public void setTrainFraction(Double trainFraction) {
        this.trainFraction = trainFraction;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public Double getThresholdPercentile() {
        return thresholdPercentile;
    }

    public void setThresholdPercentile(Double thresholdPercentile) {
        this.thresholdPercentile = thresholdPercentile;
    }

    public Double getSegmentGapSeconds() {
        return segmentGapSeconds;
    }

    public void setSegmentGapSeconds(Double segmentGapSeconds) {
        this.segmentGapSeconds = segmentGapSeconds;
    }

    public Integer getTopDriverCount() {
        return topDriverCount;
    }

    public void setTopDriverCount(Integer topDriverCount) {
        this.topDriverCount = topDriverCount;
    }

    public Integer getReviewLimit() {
        return reviewLimit;
    }

    public void setReviewLimit(Integer reviewLimit) {
        this.reviewLimit = reviewLimit;
    }

    public Integer getRobustWindow() {
        return robustWindow;
    }

    public void setRobustWindow(Integer robustWindow) {
        this.robustWindow = robustWindow;
    }

    public Integer getRobustMinPeriods() {
        return robustMinPeriods;
    }

    public void setRobustMinPeriods(Integer robustMinPeriods) {
        this.robustMinPeriods = robustMinPeriods;
    }

    public Double getRobustZThreshold() {
        return robustZThreshold;
    }

    public void setRobustZThreshold(Double robustZThreshold) {
        this.robustZThreshold = robustZThreshold;
    }

    public Integer getEnsembleTrees() {
        return ensembleTrees;
    }

    public void setEnsembleTrees(Integer ensembleTrees) {
        this.ensembleTrees = ensembleTrees;
    }

    public Double getEnsembleContamination() {
        return ensembleContamination;
    }

    public void setEnsembleContamination(Double ensembleContamination) {
        this.ensembleContamination = ensembleContamination;
    }

    public Boolean getDebug() {
        return debug;
    }

    public void setDebug(Boolean debug) {
        this.debug = debug;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "timeColumn='" + timeColumn + '\'' +
                ", windowSize=" + windowSize +
                ", stride=" + stride +
                ", epochs=" + epochs +
                ", batchSize=" + batchSize +
                ", thresholdPercentile=" + thresholdPercentile +
                ", robustZThreshold=" + robustZThreshold +
                '}';
    }
}
