package com.phillippitts.anomalyguard.service.pipeline;

import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.ScoreResult;
import com.phillippitts.anomalyguard.domain.SealedWindow;
import com.phillippitts.anomalyguard.domain.TelemetryRecord;
import com.phillippitts.anomalyguard.domain.TrainedModel;
import com.phillippitts.anomalyguard.service.alert.AlertEmitter;
import com.phillippitts.anomalyguard.service.feature.FeatureExtractor;
import com.phillippitts.anomalyguard.service.metrics.PipelineMetrics;
import com.phillippitts.anomalyguard.service.model.DriftTracker;
import com.phillippitts.anomalyguard.service.model.ModelStore;
import com.phillippitts.anomalyguard.service.retraining.FeatureHistory;
import com.phillippitts.anomalyguard.service.scoring.AnomalyScorer;
import com.phillippitts.anomalyguard.service.window.EventWindowBuffer;
import com.phillippitts.anomalyguard.service.window.WindowSealedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Wires the stages together: ingest into the window buffer, and for every sealed window
 * extract features, look up the model, score, feed drift tracking and the training history,
 * hand the result to the sinks and finally to the alert emitter.
 *
 * <p>Sealed windows are processed on the pipeline pool, serialized per series, so results and
 * alerts of one series keep window order while different series proceed in parallel. A failure
 * while processing one window is logged and counted and affects nothing else.
 */
@Component
public class AnomalyPipeline {

    private static final Logger LOG = LogManager.getLogger(AnomalyPipeline.class);

    static final String MDC_SERIES = "series";
    static final String MDC_WINDOW = "window";

    private final EventWindowBuffer buffer;
    private final FeatureExtractor extractor;
    private final ModelStore modelStore;
    private final AnomalyScorer scorer;
    private final DriftTracker driftTracker;
    private final FeatureHistory history;
    private final List<ScoreResultSink> sinks;
    private final AlertEmitter alertEmitter;
    private final PipelineMetrics metrics;
    private final SeriesSerialExecutor serialExecutor;

    public AnomalyPipeline(EventWindowBuffer buffer,
                           FeatureExtractor extractor,
                           ModelStore modelStore,
                           AnomalyScorer scorer,
                           DriftTracker driftTracker,
                           FeatureHistory history,
                           List<ScoreResultSink> sinks,
                           AlertEmitter alertEmitter,
                           PipelineMetrics metrics,
                           @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.modelStore = Objects.requireNonNull(modelStore, "modelStore");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.driftTracker = Objects.requireNonNull(driftTracker, "driftTracker");
        this.history = Objects.requireNonNull(history, "history");
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
        this.alertEmitter = Objects.requireNonNull(alertEmitter, "alertEmitter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.serialExecutor = new SeriesSerialExecutor(Objects.requireNonNull(pipelineExecutor, "pipelineExecutor"));
    }

    /**
     * Entry point for producers.
     *
     * @throws com.phillippitts.anomalyguard.exception.OutOfOrderRejectedException if the record
     *         arrived too late and was dropped
     * @throws com.phillippitts.anomalyguard.exception.ClockSkewRejectedException if the record
     *         is stamped too far in the future and was dropped
     */
    public void ingest(TelemetryRecord record) {
        buffer.ingest(record);
    }

    @EventListener
    public void onWindowSealed(WindowSealedEvent event) {
        SealedWindow window = event.window();
        dispatch(window);
    }

    CompletableFuture<Void> dispatch(SealedWindow window) {
        return serialExecutor.submit(window.seriesKey(), () -> process(window));
    }

    /**
     * Runs all stages for one sealed window on the calling thread.
     *
     * @param window sealed window
     * @return the score result, or empty if a stage failed before scoring completed
     */
    public Optional<ScoreResult> process(SealedWindow window) {
        ThreadContext.put(MDC_SERIES, window.seriesKey().canonical());
        ThreadContext.put(MDC_WINDOW, Long.toString(window.windowId()));
        String stage = "extract";
        try {
            FeatureVector vector = extractor.extract(window);

            stage = "score";
            Optional<TrainedModel> model = modelStore.getActive(window.seriesKey());
            ScoreResult result = scorer.score(vector, model);

            stage = "history";
            driftTracker.record(result);
            history.append(vector);

            stage = "sink";
            for (ScoreResultSink sink : sinks) {
                publishToSink(sink, result);
            }

            stage = "alert";
            alertEmitter.handle(result);
            return Optional.of(result);
        } catch (RuntimeException e) {
            metrics.incrementPipelineFailure(stage);
            LOG.error("Pipeline stage '{}' failed for {} window {}: {}",
                    stage, window.seriesKey(), window.windowId(), e.toString(), e);
            return Optional.empty();
        } finally {
            ThreadContext.remove(MDC_SERIES);
            ThreadContext.remove(MDC_WINDOW);
        }
    }

    private void publishToSink(ScoreResultSink sink, ScoreResult result) {
        try {
            sink.accept(result);
        } catch (RuntimeException e) {
            metrics.incrementPipelineFailure("sink");
            LOG.warn("Score sink {} failed: {}", sink.getClass().getSimpleName(), e.toString());
        }
    }

    /** Visible for tests */
    int pendingSeries() {
        return serialExecutor.activeSeries();
    }
}
