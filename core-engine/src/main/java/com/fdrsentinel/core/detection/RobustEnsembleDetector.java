package com.fdrsentinel.core.detection;

import com.fdrsentinel.core.attribution.Attribution;
import com.fdrsentinel.core.attribution.DriverAnalyzer;
import com.fdrsentinel.core.attribution.DriverRanking;
import com.fdrsentinel.core.attribution.SummaryBuilder;
import com.fdrsentinel.core.config.DetectionConfig;
import com.fdrsentinel.core.detection.robust.RobustEnsembleScorer;
import com.fdrsentinel.core.detection.robust.RobustScores;
import com.fdrsentinel.core.model.DebugInfo;
import com.fdrsentinel.core.model.DetectionResult;
import com.fdrsentinel.core.model.FeatureMatrix;
import com.fdrsentinel.core.model.FlightTable;
import com.fdrsentinel.core.model.ResolvedSeries;
import com.fdrsentinel.core.model.ScalingStatistics;
import com.fdrsentinel.core.model.Summary;
import com.fdrsentinel.core.model.Timeline;
import com.fdrsentinel.core.preprocess.FeatureSelector;
import com.fdrsentinel.core.preprocess.Standardizer;
import com.fdrsentinel.core.preprocess.TimeResolver;
import com.fdrsentinel.core.segmentation.Grouping;
import com.fdrsentinel.core.segmentation.SegmentGrouper;
import com.fdrsentinel.core.stats.Stats;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Row-level robust detection: rolling median/MAD z-scores on the raw values
 * and an isolation forest on median/IQR-scaled values. Rows are anomalous
 * when either fires; severity is graded on the combined score.
 *
 * @since 1.0.0
 */
public class RobustEnsembleDetector implements FlightAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RobustEnsembleDetector.class);

    /** Backend identity reported for this strategy. */
    public static final String BACKEND = "robust_ensemble";

    private final DetectionConfig config;
    private final FeatureSelector featureSelector;
    private final SegmentGrouper grouper;
    private final DriverAnalyzer analyzer;

    public RobustEnsembleDetector(DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.featureSelector = new FeatureSelector(config);
        this.grouper = new SegmentGrouper(config);
        this.analyzer = new DriverAnalyzer(config);
    }

    @Override
    public DetectionResult detect(FlightTable table) {
        ResolvedSeries series = TimeResolver.resolve(table, config.getTimeColumn());
        double[] times = series.getTimes();
        FeatureMatrix features = featureSelector.select(series);
        int rows = features.rowCount();

        ScalingStatistics scaling = Standardizer.fitMedianIqr(features,
                Standardizer.trainCount(rows, config.getTrainFraction()));
        double[][] scaled = Standardizer.apply(features, scaling, 0.0);

        RobustEnsembleScorer scorer = new RobustEnsembleScorer(config);
        scorer.fit(scaled);
        RobustScores scores = scorer.score(features, scaled);

        Grouping grouping = grouper.groupByMask(times, scores.getCombinedScore(), scores.getAnomaly());
        Attribution attribution = analyzer.analyze(grouping, times, features,
                DriverRanking.byMaxRobustZ(scores.getRobustZ(), features.getFeatures(),
                        config.getRobustDriverCount()));

        Summary summary = SummaryBuilder.summarize(rows, features.featureCount(), attribution, grouping,
                        config.getThresholdPercentile())
                .robust(scores.anomalyCount(), config.getRobustZThreshold(), config.getEnsembleContamination())
                .build();
        LOG.info("Found {} segment(s), {} anomalous row(s) of {}", summary.getSegmentCount(),
                scores.anomalyCount(), rows);

        DebugInfo debug = config.isDebug()
                ? new DebugInfo(features.getFeatures(), grouping.getThreshold(),
                        StatUtils.max(scores.getCombinedScore()), null, null, null, BACKEND, scaling)
                : null;
        Timeline timeline = Timeline.robust(
                Stats.round(times, 4),
                Stats.round(scores.getCombinedScore(), 6),
                Stats.round(scores.getMaxRobustZ(), 4),
                Stats.round(scores.getEnsembleScore(), 4),
                scores.getAnomaly());
        return new DetectionResult(summary, attribution.getSegments(), timeline, debug, BACKEND);
    }

    @Override
    public DetectionStrategy getStrategy() {
        return DetectionStrategy.ROBUST;
    }
}
