package com.phillippitts.anomalyguard.service.retraining;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.config.properties.ScoringProperties;
import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.ScoreResult;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.domain.SeriesTrainingState;
import com.phillippitts.anomalyguard.domain.TrainedModel;
import com.phillippitts.anomalyguard.service.feature.FeatureExtractor;
import com.phillippitts.anomalyguard.service.metrics.PipelineMetrics;
import com.phillippitts.anomalyguard.service.model.DriftTracker;
import com.phillippitts.anomalyguard.service.model.InMemoryModelStore;
import com.phillippitts.anomalyguard.service.model.StalenessPolicy;
import com.phillippitts.anomalyguard.service.scoring.RobustZScoreAlgorithm;
import com.phillippitts.anomalyguard.testutil.EventCapturingPublisher;
import com.phillippitts.anomalyguard.testutil.MutableClock;
import com.phillippitts.anomalyguard.testutil.SyncExecutor;
import com.phillippitts.anomalyguard.testutil.TestData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.anomalyguard.testutil.TestData.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RetrainingSchedulerTest {

    private static final SeriesKey CPU = SeriesKey.of("cpu.usage");

    private RetrainingProperties props;
    private ScoringProperties scoringProps;
    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;
    private InMemoryModelStore store;
    private InMemoryFeatureHistory history;
    private DriftTracker drift;
    private EventCapturingPublisher publisher;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        props = new RetrainingProperties();
        props.setMinSampleSize(30);
        props.setFailureStreakThreshold(3);
        scoringProps = new ScoringProperties();
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
        store = new InMemoryModelStore(props, metrics);
        history = new InMemoryFeatureHistory(props);
        drift = new DriftTracker(props);
        publisher = new EventCapturingPublisher();
        clock = new MutableClock(T0);
    }

    private RetrainingScheduler scheduler(Executor executor) {
        return new RetrainingScheduler(store, history, new StalenessPolicy(props, store, drift), drift,
                new RobustZScoreAlgorithm(props.getBatchSize()), props, scoringProps, executor, publisher,
                metrics, clock);
    }

    private void appendNormalHistory(int windows, long seed) {
        TestData.normalVectors(CPU, windows, 10.0, seed).forEach(history::append);
    }

    private void appendIdenticalHistory(int windows) {
        for (int i = 1; i <= windows; i++) {
            history.append(TestData.vector(CPU, 1_000 + i, 10.0, 0.01));
        }
    }

    @Test
    void insufficientHistoryLeavesSeriesUntrained() {
        appendNormalHistory(10, 1L);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());

        SweepReport report = scheduler.runSweep();

        assertThat(report.examined()).isEqualTo(1);
        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.UNTRAINED);
        assertThat(store.getActive(CPU)).isEmpty();
        assertThat(scheduler.failureStreak(CPU)).isZero();
        assertThat(publisher.eventsOfType(TrainingFailedEvent.class)).isEmpty();
    }

    @Test
    void sufficientHistoryProducesActiveModel() {
        appendNormalHistory(100, 2L);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());

        SweepReport report = scheduler.runSweep();

        assertThat(report.scheduled()).isEqualTo(1);
        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.ACTIVE);
        TrainedModel model = store.getActive(CPU).orElseThrow();
        assertThat(model.version()).isEqualTo(1);
        assertThat(model.trainingWindowCount()).isEqualTo(100);
        assertThat(model.threshold()).isBetween(scoringProps.getMinThreshold(), 1.0);
        assertThat(model.algorithm()).isEqualTo(RobustZScoreAlgorithm.NAME);
        assertThat(publisher.eventsOfType(ModelTrainedEvent.class)).hasSize(1);
        assertThat(registry.counter("anomalyguard.training.success").count()).isEqualTo(1.0);
    }

    @Test
    void freshModelIsNotRetrained() {
        appendNormalHistory(100, 3L);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());
        scheduler.runSweep();

        SweepReport second = scheduler.runSweep();

        assertThat(second.scheduled()).isZero();
        assertThat(second.skipped()).isEqualTo(1);
        assertThat(store.getActive(CPU).orElseThrow().version()).isEqualTo(1);
    }

    @Test
    void agedModelIsReplacedWithNextVersion() {
        appendNormalHistory(100, 4L);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());
        scheduler.runSweep();

        clock.advance(props.getMaxModelAge().plusMinutes(1));
        scheduler.runSweep();

        assertThat(store.getActive(CPU).orElseThrow().version()).isEqualTo(2);
        assertThat(store.retainedVersions(CPU)).extracting(TrainedModel::version).containsExactly(1L);
    }

    @Test
    void driftingModelIsRetrainedAndDriftReset() {
        appendNormalHistory(100, 5L);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());
        scheduler.runSweep();
        for (int i = 0; i < 30; i++) {
            drift.record(new ScoreResult(CPU, i, T0, T0.plusSeconds(60), 0.97, true, 1, T0));
        }
        assertThat(drift.isDrifting(CPU)).isTrue();

        scheduler.runSweep();

        assertThat(store.getActive(CPU).orElseThrow().version()).isEqualTo(2);
        assertThat(drift.isDrifting(CPU)).isFalse();
    }

    @Test
    void sweepSkipsSeriesAlreadyTraining() {
        ManualExecutor executor = new ManualExecutor();
        appendNormalHistory(100, 6L);
        RetrainingScheduler scheduler = scheduler(executor);

        assertThat(scheduler.runSweep().scheduled()).isEqualTo(1);
        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.TRAINING);

        SweepReport overlapping = scheduler.runSweep();
        assertThat(overlapping.scheduled()).isZero();
        assertThat(executor.pending()).isEqualTo(1);

        executor.runAll();
        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.ACTIVE);
        assertThat(store.latestVersion(CPU)).isEqualTo(1);
    }

    @Test
    void mostlyIdleSeriesGetsModel() {
        SeriesKey errors = SeriesKey.of("errors.count");
        FeatureExtractor extractor = new FeatureExtractor();
        TestData.mostlyIdleWindows(errors, 100, 16L).stream().map(extractor::extract).forEach(history::append);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());

        scheduler.runSweep();

        assertThat(scheduler.state(errors)).isEqualTo(SeriesTrainingState.ACTIVE);
        assertThat(store.getActive(errors)).isPresent();
        assertThat(scheduler.failureStreak(errors)).isZero();
        assertThat(publisher.eventsOfType(TrainingFailedEvent.class)).isEmpty();
    }

    @Test
    void failedTrainingMarksStaleAndKeepsPreviousModel() {
        appendNormalHistory(100, 7L);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());
        scheduler.runSweep();
        TrainedModel v1 = store.getActive(CPU).orElseThrow();

        appendIdenticalHistory(props.getHistoryWindows());
        store.markStale(CPU);
        scheduler.runSweep();

        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.STALE);
        assertThat(scheduler.failureStreak(CPU)).isEqualTo(1);
        assertThat(store.getActive(CPU)).contains(v1);
        TrainingFailedEvent failed = publisher.eventsOfType(TrainingFailedEvent.class).get(0);
        assertThat(failed.reason()).isEqualTo("no_variance");
        assertThat(failed.failureStreak()).isEqualTo(1);
        assertThat(registry.counter("anomalyguard.training.failure", "reason", "no_variance").count())
                .isEqualTo(1.0);
    }

    @Test
    void repeatedFailuresDegradeSeriesUntilNextSuccess() {
        appendIdenticalHistory(40);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());

        for (int i = 0; i < 3; i++) {
            scheduler.runSweep();
        }
        assertThat(scheduler.failureStreak(CPU)).isEqualTo(3);
        assertThat(scheduler.degradedSeries()).containsEntry(CPU, 3);

        appendNormalHistory(100, 8L);
        scheduler.runSweep();

        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.ACTIVE);
        assertThat(scheduler.failureStreak(CPU)).isZero();
        assertThat(scheduler.degradedSeries()).isEmpty();
    }

    @Test
    void cancelStopsInFlightTraining() {
        ManualExecutor executor = new ManualExecutor();
        appendNormalHistory(100, 9L);
        RetrainingScheduler scheduler = scheduler(executor);
        scheduler.runSweep();

        assertThat(scheduler.cancel(CPU)).isTrue();
        executor.runAll();

        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.STALE);
        assertThat(store.getActive(CPU)).isEmpty();
        assertThat(publisher.eventsOfType(TrainingFailedEvent.class))
                .extracting(TrainingFailedEvent::reason).containsExactly("cancelled");
        assertThat(scheduler.cancel(CPU)).isFalse();
    }

    @Test
    void cancelAllFlagsEveryTask() {
        ManualExecutor executor = new ManualExecutor();
        SeriesKey mem = SeriesKey.of("mem.used");
        appendNormalHistory(100, 10L);
        TestData.normalVectors(mem, 100, 50.0, 11L).forEach(history::append);
        RetrainingScheduler scheduler = scheduler(executor);
        scheduler.runSweep();

        scheduler.cancelAll();
        executor.runAll();

        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.STALE);
        assertThat(scheduler.state(mem)).isEqualTo(SeriesTrainingState.STALE);
    }

    @Test
    void trainingTimeoutCountsFailureButHoldsSeriesUntilTaskReturns() {
        props.setTrainingTimeout(Duration.ofMillis(50));
        ManualExecutor executor = new ManualExecutor();
        appendNormalHistory(100, 12L);
        RetrainingScheduler scheduler = scheduler(executor);

        scheduler.runSweep();

        await().atMost(5, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(scheduler.failureStreak(CPU)).isEqualTo(1));
        assertThat(publisher.eventsOfType(TrainingFailedEvent.class))
                .extracting(TrainingFailedEvent::reason).containsExactly("timeout");
        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.TRAINING);
        assertThat(scheduler.isTraining(CPU)).isTrue();

        // the late task sees the cancellation and produces nothing
        executor.runAll();
        assertThat(store.getActive(CPU)).isEmpty();
        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.STALE);
        assertThat(scheduler.isTraining(CPU)).isFalse();
        assertThat(scheduler.failureStreak(CPU)).isEqualTo(1);
        assertThat(publisher.eventsOfType(TrainingFailedEvent.class)).hasSize(1);
    }

    @Test
    void sweepDuringTimedOutTaskStartsNoSecondTask() throws InterruptedException {
        props.setTrainingTimeout(Duration.ofMillis(100));
        appendNormalHistory(100, 15L);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger reads = new AtomicInteger();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        FeatureHistory blocking = new FeatureHistory() {
            @Override
            public void append(FeatureVector vector) {
                history.append(vector);
            }

            @Override
            public List<FeatureVector> lastWindows(SeriesKey seriesKey, int limit) {
                reads.incrementAndGet();
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    running.decrementAndGet();
                }
                return history.lastWindows(seriesKey, limit);
            }

            @Override
            public int size(SeriesKey seriesKey) {
                return history.size(seriesKey);
            }

            @Override
            public Set<SeriesKey> knownSeries() {
                return history.knownSeries();
            }
        };
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            RetrainingScheduler scheduler = new RetrainingScheduler(store, blocking,
                    new StalenessPolicy(props, store, drift), drift, new RobustZScoreAlgorithm(props.getBatchSize()),
                    props, scoringProps, pool, publisher, metrics, clock);

            assertThat(scheduler.runSweep().scheduled()).isEqualTo(1);
            await().atMost(5, TimeUnit.SECONDS)
                    .untilAsserted(() -> assertThat(publisher.eventsOfType(TrainingFailedEvent.class)).hasSize(1));

            SweepReport second = scheduler.runSweep();

            assertThat(second.scheduled()).isZero();
            assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.TRAINING);

            release.countDown();
            await().atMost(5, TimeUnit.SECONDS)
                    .untilAsserted(() -> assertThat(scheduler.isTraining(CPU)).isFalse());
            assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.STALE);
            assertThat(store.getActive(CPU)).isEmpty();
            assertThat(reads.get()).isEqualTo(1);
            assertThat(maxRunning.get()).isEqualTo(1);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void rejectedSubmissionIsRetriedOnNextSweep() {
        appendNormalHistory(100, 13L);
        RetrainingScheduler scheduler = scheduler(command -> {
            throw new RejectedExecutionException("full");
        });

        SweepReport report = scheduler.runSweep();

        assertThat(report.scheduled()).isZero();
        assertThat(scheduler.state(CPU)).isEqualTo(SeriesTrainingState.UNTRAINED);
        assertThat(scheduler.isTraining(CPU)).isFalse();
    }

    @Test
    void corruptModelIsRetrainedWithHigherVersion() {
        appendNormalHistory(100, 14L);
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());
        scheduler.runSweep();
        TrainedModel good = store.getActive(CPU).orElseThrow();
        store.put(CPU, new TrainedModel(CPU, 2, T0, good.trainingWindowCount(), good.parameters(),
                good.threshold(), good.checksum()));

        scheduler.runSweep();

        TrainedModel replacement = store.getActive(CPU).orElseThrow();
        assertThat(replacement.version()).isEqualTo(3);
        assertThat(replacement.verifyIntegrity()).isTrue();
    }

    @Test
    void modelsAreNeverTrainedBelowMinimumSampleSize() {
        RetrainingScheduler scheduler = scheduler(new SyncExecutor());
        for (int batch = 0; batch < 10; batch++) {
            TestData.normalVectors(CPU, 5, 10.0, 100L + batch).forEach(history::append);
            scheduler.runSweep();
            store.getActive(CPU).ifPresent(model ->
                    assertThat(model.trainingWindowCount()).isGreaterThanOrEqualTo(props.getMinSampleSize()));
        }
        assertThat(store.getActive(CPU)).isPresent();
    }

    /** Queues tasks until the test runs them. */
    private static final class ManualExecutor implements Executor {
        private final Deque<Runnable> tasks = new ArrayDeque<>();

        @Override
        public synchronized void execute(Runnable command) {
            tasks.add(command);
        }

        synchronized int pending() {
            return tasks.size();
        }

        void runAll() {
            Runnable next;
            while ((next = poll()) != null) {
                next.run();
            }
        }

        private synchronized Runnable poll() {
            return tasks.poll();
        }
    }
}
