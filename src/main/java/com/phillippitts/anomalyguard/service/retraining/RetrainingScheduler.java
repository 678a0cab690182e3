package com.phillippitts.anomalyguard.service.retraining;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.config.properties.ScoringProperties;
import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.ModelParameters;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.domain.SeriesTrainingState;
import com.phillippitts.anomalyguard.domain.TrainedModel;
import com.phillippitts.anomalyguard.exception.InsufficientHistoryException;
import com.phillippitts.anomalyguard.exception.TrainingCancelledException;
import com.phillippitts.anomalyguard.exception.TrainingFailureException;
import com.phillippitts.anomalyguard.service.feature.FeatureExtractor;
import com.phillippitts.anomalyguard.service.metrics.PipelineMetrics;
import com.phillippitts.anomalyguard.service.model.DriftTracker;
import com.phillippitts.anomalyguard.service.model.ModelStore;
import com.phillippitts.anomalyguard.service.model.StalenessPolicy;
import com.phillippitts.anomalyguard.service.scoring.ScoringAlgorithm;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Trains and replaces per-series models in the background.
 *
 * <p>{@link #runSweep()} holds no timer of its own; something external (the in-process
 * {@code PipelineTimers}, a test, an operator) invokes it. A sweep looks at every series known
 * to the feature history or the model store and submits a training task to the training pool
 * for each series that is untrained or whose model the {@link StalenessPolicy} considers stale.
 *
 * <p><b>State machine per series:</b>
 * <pre>
 *   UNTRAINED --sweep--> TRAINING --success--> ACTIVE --stale--> STALE --sweep--> TRAINING
 *                           |--insufficient history--> UNTRAINED (STALE when a model exists)
 *                           '--failure/timeout/cancel--> STALE (failure streak + 1)
 * </pre>
 * The transition into TRAINING is a compare-and-set, so a series never has two training tasks
 * in flight and a sweep that overlaps a running task leaves it alone.
 *
 * <p>A timeout is counted as a failure the moment it fires, and the task is flagged for
 * cancellation, but the series stays TRAINING until the task itself returns. Whatever the late
 * task produces is discarded.
 *
 * <p>Failures never touch the active model; the series keeps scoring with it (or with the
 * bootstrap baseline) and is retried on the next sweep.
 */
@Component
public class RetrainingScheduler {

    private static final Logger LOG = LogManager.getLogger(RetrainingScheduler.class);

    static final String MDC_SERIES = "series";

    private final ModelStore modelStore;
    private final FeatureHistory history;
    private final StalenessPolicy stalenessPolicy;
    private final DriftTracker driftTracker;
    private final ScoringAlgorithm algorithm;
    private final RetrainingProperties props;
    private final ScoringProperties scoringProps;
    private final Executor trainingExecutor;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final ConcurrentMap<SeriesKey, SeriesTrainingState> states = new ConcurrentHashMap<>();
    private final ConcurrentMap<SeriesKey, Integer> failureStreaks = new ConcurrentHashMap<>();
    private final ConcurrentMap<SeriesKey, TrainingTask> inFlight = new ConcurrentHashMap<>();

    public RetrainingScheduler(ModelStore modelStore,
                               FeatureHistory history,
                               StalenessPolicy stalenessPolicy,
                               DriftTracker driftTracker,
                               ScoringAlgorithm algorithm,
                               RetrainingProperties props,
                               ScoringProperties scoringProps,
                               @Qualifier("trainingExecutor") Executor trainingExecutor,
                               ApplicationEventPublisher publisher,
                               PipelineMetrics metrics,
                               Clock clock) {
        this.modelStore = Objects.requireNonNull(modelStore, "modelStore");
        this.history = Objects.requireNonNull(history, "history");
        this.stalenessPolicy = Objects.requireNonNull(stalenessPolicy, "stalenessPolicy");
        this.driftTracker = Objects.requireNonNull(driftTracker, "driftTracker");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.props = Objects.requireNonNull(props, "props");
        this.scoringProps = Objects.requireNonNull(scoringProps, "scoringProps");
        this.trainingExecutor = Objects.requireNonNull(trainingExecutor, "trainingExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Examines every known series and schedules training where needed. Safe to call while a
     * previous sweep's tasks are still running.
     *
     * @return counts of examined, scheduled and skipped series
     */
    public SweepReport runSweep() {
        Instant now = clock.instant();
        Set<SeriesKey> known = new HashSet<>(history.knownSeries());
        known.addAll(modelStore.knownSeries());

        int scheduled = 0;
        int skipped = 0;
        for (SeriesKey key : known) {
            try {
                if (scheduleIfNeeded(key, now)) {
                    scheduled++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                // One broken series must not stop the sweep
                LOG.error("Sweep failed for {}: {}", key, e.toString(), e);
                metrics.incrementPipelineFailure("sweep");
                skipped++;
            }
        }
        SweepReport report = new SweepReport(known.size(), scheduled, skipped);
        LOG.debug("Retraining sweep: examined={}, scheduled={}, skipped={}",
                report.examined(), report.scheduled(), report.skipped());
        return report;
    }

    /**
     * Requests cancellation of the in-flight training task of a series.
     *
     * @return true if a task was running and has been flagged
     */
    public boolean cancel(SeriesKey seriesKey) {
        TrainingTask task = inFlight.get(seriesKey);
        if (task == null) {
            return false;
        }
        task.cancel();
        LOG.info("Cancellation requested for training of {}", seriesKey);
        return true;
    }

    @PreDestroy
    public void cancelAll() {
        if (!inFlight.isEmpty()) {
            LOG.info("Cancelling {} in-flight training task(s)", inFlight.size());
        }
        inFlight.values().forEach(TrainingTask::cancel);
    }

    public SeriesTrainingState state(SeriesKey seriesKey) {
        return states.getOrDefault(seriesKey, SeriesTrainingState.UNTRAINED);
    }

    public int failureStreak(SeriesKey seriesKey) {
        return failureStreaks.getOrDefault(seriesKey, 0);
    }

    /**
     * @return series whose consecutive failure count reached {@code failure-streak-threshold},
     *         with their current streak
     */
    public Map<SeriesKey, Integer> degradedSeries() {
        int threshold = props.getFailureStreakThreshold();
        return failureStreaks.entrySet().stream()
                .filter(e -> e.getValue() >= threshold)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    /** Visible for tests */
    boolean isTraining(SeriesKey seriesKey) {
        return inFlight.containsKey(seriesKey);
    }

    private boolean scheduleIfNeeded(SeriesKey key, Instant now) {
        SeriesTrainingState previous = states.get(key);
        if (previous == SeriesTrainingState.TRAINING) {
            return false;
        }

        Optional<TrainedModel> current = modelStore.getActive(key);
        SeriesTrainingState observed;
        if (current.isEmpty()) {
            observed = SeriesTrainingState.UNTRAINED;
        } else {
            Optional<String> staleReason = stalenessPolicy.staleReason(current.get(), now);
            observed = staleReason.isPresent() ? SeriesTrainingState.STALE : SeriesTrainingState.ACTIVE;
            staleReason.ifPresent(reason -> LOG.info("Model v{} for {} is stale: {}",
                    current.get().version(), key, reason));
        }
        if (observed == SeriesTrainingState.ACTIVE) {
            if (previous == null) {
                states.putIfAbsent(key, SeriesTrainingState.ACTIVE);
            } else {
                states.replace(key, previous, SeriesTrainingState.ACTIVE);
            }
            return false;
        }

        boolean claimed = previous == null
                ? states.putIfAbsent(key, SeriesTrainingState.TRAINING) == null
                : states.replace(key, previous, SeriesTrainingState.TRAINING);
        if (!claimed) {
            return false;
        }

        TrainingTask task = new TrainingTask(key, clock.instant());
        inFlight.put(key, task);
        try {
            CompletableFuture<TrainedModel> work = CompletableFuture.supplyAsync(() -> train(task), trainingExecutor);
            work.whenComplete((model, error) -> complete(task, model, error));
            work.copy()
                    .orTimeout(props.getTrainingTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((model, error) -> {
                        if (unwrap(error) instanceof TimeoutException) {
                            timedOut(task);
                        }
                    });
            return true;
        } catch (RejectedExecutionException e) {
            LOG.warn("Training pool saturated; {} will be retried on the next sweep", key);
            inFlight.remove(key, task);
            states.put(key, observed);
            return false;
        }
    }

    private TrainedModel train(TrainingTask task) {
        SeriesKey key = task.seriesKey;
        ThreadContext.put(MDC_SERIES, key.canonical());
        try {
            List<FeatureVector> corpus = history.lastWindows(key, props.getHistoryWindows());
            if (corpus.size() < props.getMinSampleSize()) {
                throw new InsufficientHistoryException(key, corpus.size(), props.getMinSampleSize());
            }
            ModelParameters parameters = algorithm.train(corpus, task::isCancelled);
            double threshold = adaptiveThreshold(parameters, corpus, task);
            long version = modelStore.latestVersion(key) + 1;
            return TrainedModel.create(key, version, clock.instant(), corpus.size(), parameters, threshold);
        } finally {
            ThreadContext.remove(MDC_SERIES);
        }
    }

    /**
     * Percentile of the model's own scores over its training corpus, clamped to
     * [{@code min-threshold}, 1].
     */
    private double adaptiveThreshold(ModelParameters parameters, List<FeatureVector> corpus, TrainingTask task) {
        double[] scores = new double[corpus.size()];
        for (int i = 0; i < scores.length; i++) {
            if (i % props.getBatchSize() == 0 && task.isCancelled()) {
                throw new TrainingCancelledException("Training cancelled while computing threshold");
            }
            scores[i] = algorithm.score(parameters, corpus.get(i));
        }
        Arrays.sort(scores);
        double percentile = FeatureExtractor.percentile(scores, props.getThresholdPercentile());
        return Math.min(1.0, Math.max(scoringProps.getMinThreshold(), percentile));
    }

    /**
     * Runs on the training thread once the task has returned, however long that took.
     */
    private void complete(TrainingTask task, TrainedModel model, Throwable error) {
        SeriesKey key = task.seriesKey;
        try {
            if (!task.finish()) {
                // timeout already counted as the failure
                states.put(key, SeriesTrainingState.STALE);
                LOG.info("Training of {} returned after its timeout; result discarded", key);
                return;
            }
            if (error == null) {
                activate(task, model);
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof InsufficientHistoryException insufficient) {
                SeriesTrainingState fallback = modelStore.getActive(key).isPresent()
                        ? SeriesTrainingState.STALE : SeriesTrainingState.UNTRAINED;
                states.put(key, fallback);
                LOG.debug("{}; retrying next sweep", insufficient.getMessage());
                return;
            }
            if (cause instanceof TrainingFailureException failure) {
                fail(key, failure.getReason(), failure.getMessage());
            } else {
                LOG.error("Unexpected training error for {}", key, cause);
                fail(key, "error", cause.toString());
            }
        } catch (RuntimeException e) {
            LOG.error("Could not finish training for {}", key, e);
            fail(key, "error", e.toString());
        } finally {
            inFlight.remove(key, task);
        }
    }

    private void activate(TrainingTask task, TrainedModel model) {
        SeriesKey key = task.seriesKey;
        modelStore.put(key, model);
        driftTracker.reset(key);
        failureStreaks.remove(key);
        states.put(key, SeriesTrainingState.ACTIVE);
        metrics.incrementTrainingSuccess();
        long millis = Math.max(0, clock.millis() - task.startedAt.toEpochMilli());
        publisher.publishEvent(new ModelTrainedEvent(model, millis, clock.instant()));
    }

    /**
     * Series stays TRAINING and keeps its in-flight entry; {@link #complete} releases it.
     */
    private void timedOut(TrainingTask task) {
        if (!task.expire()) {
            return;
        }
        task.cancel();
        recordFailure(task.seriesKey, "timeout", "Training exceeded " + props.getTrainingTimeout());
    }

    private void fail(SeriesKey key, String reason, String message) {
        states.put(key, SeriesTrainingState.STALE);
        recordFailure(key, reason, message);
    }

    private void recordFailure(SeriesKey key, String reason, String message) {
        int streak = failureStreaks.merge(key, 1, Integer::sum);
        metrics.incrementTrainingFailure(reason);
        LOG.debug("Training failed for {} (streak {}): {}", key, streak, message);
        publisher.publishEvent(new TrainingFailedEvent(key, reason, message, streak, clock.instant()));
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static final class TrainingTask {
        private static final int RUNNING = 0;
        private static final int FINISHED = 1;
        private static final int TIMED_OUT = 2;

        private final SeriesKey seriesKey;
        private final Instant startedAt;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicInteger phase = new AtomicInteger(RUNNING);

        TrainingTask(SeriesKey seriesKey, Instant startedAt) {
            this.seriesKey = seriesKey;
            this.startedAt = startedAt;
        }

        void cancel() {
            cancelled.set(true);
        }

        /** @return false if the timeout fired first */
        boolean finish() {
            return phase.compareAndSet(RUNNING, FINISHED);
        }

        /** @return false if the task already returned */
        boolean expire() {
            return phase.compareAndSet(RUNNING, TIMED_OUT);
        }

        boolean isCancelled() {
            return cancelled.get() || Thread.currentThread().isInterrupted();
        }
    }
}
