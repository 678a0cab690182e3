package com.phillippitts.anomalyguard.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the anomaly pipeline.
 *
 * <p>Series keys are deliberately not used as tags; per-series detail goes to logs and the
 * score audit sink. All metrics are exposed via Micrometer at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "anomalyguard";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementIngested() {
        Counter.builder(METRIC_PREFIX + ".records.ingested")
                .description("Records accepted into an open window")
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the record was dropped (e.g. out_of_order)
     */
    public void incrementDropped(String reason) {
        Counter.builder(METRIC_PREFIX + ".records.dropped")
                .description("Records rejected by the window buffer")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param empty whether the sealed window held no records
     */
    public void incrementWindowsSealed(boolean empty) {
        Counter.builder(METRIC_PREFIX + ".windows.sealed")
                .description("Windows sealed and handed to the pipeline")
                .tag("empty", String.valueOf(empty))
                .register(registry)
                .increment();
    }

    /**
     * Records how long one window took from extraction to alert handling.
     *
     * @param source "model" or "baseline"
     * @param durationNanos duration in nanoseconds
     */
    public void recordScoringLatency(String source, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".scoring.latency")
                .description("Time taken to score one window")
                .tag("source", source)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementDecision(boolean anomalous) {
        Counter.builder(METRIC_PREFIX + ".scoring.decisions")
                .description("Scoring decisions by outcome")
                .tag("anomalous", String.valueOf(anomalous))
                .register(registry)
                .increment();
    }

    /**
     * @param transition alert transition (created, updated, acknowledged, resolved)
     */
    public void incrementAlert(String transition) {
        Counter.builder(METRIC_PREFIX + ".alerts")
                .description("Alert transitions")
                .tag("transition", transition)
                .register(registry)
                .increment();
    }

    public void incrementTrainingSuccess() {
        Counter.builder(METRIC_PREFIX + ".training.success")
                .description("Models trained and activated")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure category (insufficient_history, numerical, timeout, cancelled, ...)
     */
    public void incrementTrainingFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".training.failure")
                .description("Training attempts that did not produce a model")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCorruptModel() {
        Counter.builder(METRIC_PREFIX + ".models.corrupt")
                .description("Stored models that failed their integrity check")
                .register(registry)
                .increment();
    }

    /**
     * @param stage pipeline stage that raised an unexpected error
     */
    public void incrementPipelineFailure(String stage) {
        Counter.builder(METRIC_PREFIX + ".pipeline.failure")
                .description("Windows whose pipeline run failed")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }
}
