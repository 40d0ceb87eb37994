package com.fdrsentinel.core.detection;

import com.fdrsentinel.core.attribution.Attribution;
import com.fdrsentinel.core.attribution.DriverAnalyzer;
import com.fdrsentinel.core.attribution.DriverRanking;
import com.fdrsentinel.core.attribution.SummaryBuilder;
import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.detection.backend.BackendKind;
import com.fdrsentinel.core.detection.backend.BackendSelector;
import com.fdrsentinel.core.detection.backend.CapabilityProbe;
import com.fdrsentinel.core.detection.backend.ScoringBackend;
import com.fdrsentinel.core.detection.backend.ScoringBackends;
import com.fdrsentinel.core.model.DebugInfo;
import com.fdrsentinel.core.model.DetectionResult;
import com.fdrsentinel.core.model.FeatureMatrix;
import com.fdrsentinel.core.model.FlightTable;
import com.fdrsentinel.core.model.ResolvedSeries;
import com.fdrsentinel.core.model.ScalingStatistics;
import com.fdrsentinel.core.model.ScoreResult;
import com.fdrsentinel.core.model.Summary;
import com.fdrsentinel.core.model.Timeline;
import com.fdrsentinel.core.model.TimelineScore;
import com.fdrsentinel.core.model.WindowSet;
import com.fdrsentinel.core.preprocess.FeatureSelector;
import com.fdrsentinel.core.preprocess.Standardizer;
import com.fdrsentinel.core.preprocess.TimeResolver;
import com.fdrsentinel.core.preprocess.Windower;
import com.fdrsentinel.core.segmentation.Grouping;
import com.fdrsentinel.core.segmentation.ScoreMapper;
import com.fdrsentinel.core.segmentation.SegmentGrouper;
import com.fdrsentinel.core.stats.Stats;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Windowed reconstruction-error detection.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Resolve time, select features, forward/back-fill.</li>
 * <li>Standardize with mean / standard deviation of the training prefix.</li>
 * <li>Cut windows; fit the selected backend on the leading training
 * windows; score every window.</li>
 * <li>Fold window scores onto rows (max), threshold, group, attribute.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class ReconstructionDetector implements FlightAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionDetector.class);

    private final DetectionConfig config;
    private final CapabilityProbe probe;
    private final FeatureSelector featureSelector;
    private final SegmentGrouper grouper;
    private final DriverAnalyzer analyzer;

    public ReconstructionDetector(DetectionConfig config, CapabilityProbe probe) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.featureSelector = new FeatureSelector(config);
        this.grouper = new SegmentGrouper(config);
        this.analyzer = new DriverAnalyzer(config);
    }

    @Override
    public DetectionResult detect(FlightTable table) {
        ResolvedSeries series = TimeResolver.resolve(table, config.getTimeColumn());
        double[] times = series.getTimes();
        FeatureMatrix features = Standardizer.fillMissing(featureSelector.select(series));
        int rows = features.rowCount();

        ScalingStatistics scaling = Standardizer.fitMeanStd(features,
                Standardizer.trainCount(rows, config.getTrainFraction()));
        double[][] scaled = Standardizer.apply(features, scaling, 0.0);

        WindowSet windows = Windower.window(scaled, config.getWindowSize(), config.getStride());
        BackendKind kind = BackendSelector.select(probe.probe());
        LOG.info("Using {} backend", kind.getLabel());
        ScoringBackend backend = ScoringBackends.create(kind, windows.getWindowLength(),
                features.featureCount(), config);
        backend.fit(windows.head(Standardizer.trainCount(windows.size(), config.getTrainFraction())));
        ScoreResult windowScores = backend.score(windows.getWindows());

        TimelineScore timeline = ScoreMapper.map(rows, windows, windowScores);
        Grouping grouping = grouper.groupByThreshold(times, timeline.getScores());
        Attribution attribution = analyzer.analyze(grouping, times, features,
                DriverRanking.byMeanError(timeline, features.getFeatures(), config.getTopDriverCount()));

        Summary summary = SummaryBuilder.summarize(rows, features.featureCount(), attribution, grouping,
                        config.getThresholdPercentile())
                .windowing(windows.getWindowLength(), windows.getStride())
                .build();
        LOG.info("Found {} segment(s), {} flagged row(s) of {}", summary.getSegmentCount(),
                summary.getFlaggedRowCount(), rows);

        DebugInfo debug = config.isDebug()
                ? new DebugInfo(features.getFeatures(), grouping.getThreshold(),
                        StatUtils.max(timeline.getScores()), windows.getWindowLength(), windows.getStride(),
                        config.getEpochs(), kind.getLabel(), scaling)
                : null;
        return new DetectionResult(summary, attribution.getSegments(),
                Timeline.of(Stats.round(times, 4), Stats.round(timeline.getScores(), 6)),
                debug, kind.getLabel());
    }

    @Override
    public DetectionStrategy getStrategy() {
        return DetectionStrategy.RECONSTRUCTION;
    }
}
