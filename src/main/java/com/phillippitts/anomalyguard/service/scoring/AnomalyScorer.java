package com.phillippitts.anomalyguard.service.scoring;

import com.phillippitts.anomalyguard.config.properties.ScoringProperties;
import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.ScoreResult;
import com.phillippitts.anomalyguard.domain.TrainedModel;
import com.phillippitts.anomalyguard.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores feature vectors against the active model of their series, or against the bootstrap
 * baseline when there is none.
 *
 * <p>Baseline scoring compares the window mean with the rolling mean of the last K window means.
 * Until {@code baseline-min-windows} windows have been observed the baseline never flags
 * anything. Every non-empty window is folded into the baseline after it is scored, also while a
 * model is active, so the fallback is warm if the model is lost.
 *
 * <p>Scoring never throws for a well-formed vector; empty-window vectors are scored like any
 * other so a series that stopped reporting stands out.
 */
@Component
public class AnomalyScorer {

    private static final Logger LOG = LogManager.getLogger(AnomalyScorer.class);

    static final String SOURCE_MODEL = "model";
    static final String SOURCE_BASELINE = "baseline";

    private final ScoringAlgorithm algorithm;
    private final BaselineTracker baseline;
    private final ScoringProperties props;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public AnomalyScorer(ScoringAlgorithm algorithm,
                         BaselineTracker baseline,
                         ScoringProperties props,
                         PipelineMetrics metrics,
                         Clock clock) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.baseline = Objects.requireNonNull(baseline, "baseline");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param vector features of one sealed window
     * @param model  active model of the series, if any
     * @return score and decision for the window
     */
    public ScoreResult score(FeatureVector vector, Optional<TrainedModel> model) {
        Objects.requireNonNull(vector, "vector");
        long startNanos = System.nanoTime();
        ScoreResult result;
        String source;
        if (model.isPresent() && isCompatible(model.get())) {
            result = scoreWithModel(vector, model.get());
            source = SOURCE_MODEL;
        } else {
            result = scoreWithBaseline(vector);
            source = SOURCE_BASELINE;
        }
        metrics.recordScoringLatency(source, System.nanoTime() - startNanos);
        metrics.incrementDecision(result.decision());

        if (!vector.empty()) {
            baseline.observe(vector.seriesKey(), vector.mean());
        }
        return result;
    }

    private ScoreResult scoreWithModel(FeatureVector vector, TrainedModel model) {
        double score = algorithm.score(model.parameters(), vector);
        double threshold = props.isAdaptiveThreshold() ? model.threshold() : props.getDefaultThreshold();
        return new ScoreResult(vector.seriesKey(), vector.windowId(), vector.windowStart(), vector.windowEnd(),
                score, score >= threshold, model.version(), clock.instant());
    }

    private ScoreResult scoreWithBaseline(FeatureVector vector) {
        BaselineTracker.Snapshot snapshot = baseline.snapshot(vector.seriesKey());
        double score = 0.0;
        boolean decision = false;
        if (snapshot.windows() >= props.getBaselineMinWindows()) {
            double z = Math.abs(vector.mean() - snapshot.mean()) / snapshot.effectiveStdDev();
            score = AbstractZScoreAlgorithm.toScore(z);
            decision = z >= props.getBaselineZThreshold();
        }
        return new ScoreResult(vector.seriesKey(), vector.windowId(), vector.windowStart(), vector.windowEnd(),
                score, decision, ScoreResult.BASELINE_VERSION, clock.instant());
    }

    private boolean isCompatible(TrainedModel model) {
        if (algorithm.name().equals(model.algorithm())) {
            return true;
        }
        LOG.warn("Model v{} for {} was trained with {} but scorer uses {}; using baseline",
                model.version(), model.seriesKey(), model.algorithm(), algorithm.name());
        return false;
    }
}
