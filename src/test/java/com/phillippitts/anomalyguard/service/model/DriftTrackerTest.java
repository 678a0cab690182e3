package com.phillippitts.anomalyguard.service.model;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.domain.ScoreResult;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.phillippitts.anomalyguard.testutil.TestData.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DriftTrackerTest {

    private static final SeriesKey CPU = SeriesKey.of("cpu.usage");

    private DriftTracker tracker;

    @BeforeEach
    void setUp() {
        RetrainingProperties props = new RetrainingProperties();
        props.setDriftAlpha(0.5);
        props.setDriftThreshold(0.8);
        tracker = new DriftTracker(props);
    }

    private static ScoreResult result(double score, long modelVersion) {
        return new ScoreResult(CPU, 1, T0, T0.plusSeconds(60), score, false, modelVersion, T0);
    }

    @Test
    void ewmaFollowsScores() {
        tracker.record(result(0.2, 1));
        tracker.record(result(0.6, 1));

        assertThat(tracker.ewma(CPU)).isPresent();
        assertThat(tracker.ewma(CPU).getAsDouble()).isCloseTo(0.4, within(1e-12));
    }

    @Test
    void singleHighScoreIsNotDrift() {
        tracker.record(result(0.99, 1));

        assertThat(tracker.ewma(CPU)).isEmpty();
        assertThat(tracker.isDrifting(CPU)).isFalse();
    }

    @Test
    void sustainedHighScoresAreDrift() {
        for (int i = 0; i < 5; i++) {
            tracker.record(result(0.95, 1));
        }

        assertThat(tracker.isDrifting(CPU)).isTrue();
    }

    @Test
    void baselineScoresAreIgnored() {
        for (int i = 0; i < 5; i++) {
            tracker.record(result(0.95, ScoreResult.BASELINE_VERSION));
        }

        assertThat(tracker.ewma(CPU)).isEmpty();
    }

    @Test
    void newModelVersionRestartsEwma() {
        for (int i = 0; i < 5; i++) {
            tracker.record(result(0.95, 1));
        }
        tracker.record(result(0.1, 2));

        assertThat(tracker.isDrifting(CPU)).isFalse();
    }

    @Test
    void resetForgetsSeries() {
        for (int i = 0; i < 5; i++) {
            tracker.record(result(0.95, 1));
        }
        tracker.reset(CPU);

        assertThat(tracker.ewma(CPU)).isEmpty();
    }
}
