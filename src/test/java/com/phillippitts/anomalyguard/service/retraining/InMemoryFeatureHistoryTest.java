package com.phillippitts.anomalyguard.service.retraining;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.SealedWindow;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.testutil.TestData;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryFeatureHistoryTest {

    private static final SeriesKey CPU = SeriesKey.of("cpu.usage");

    @Test
    void keepsMostRecentWindowsOldestFirst() {
        RetrainingProperties props = new RetrainingProperties();
        props.setHistoryWindows(5);
        InMemoryFeatureHistory history = new InMemoryFeatureHistory(props);

        TestData.normalVectors(CPU, 8, 10.0, 1L).forEach(history::append);

        assertThat(history.size(CPU)).isEqualTo(5);
        assertThat(history.lastWindows(CPU, 3)).extracting(FeatureVector::windowId).containsExactly(6L, 7L, 8L);
        assertThat(history.lastWindows(CPU, 100)).extracting(FeatureVector::windowId)
                .containsExactly(4L, 5L, 6L, 7L, 8L);
    }

    @Test
    void ignoresEmptyWindowVectors() {
        InMemoryFeatureHistory history = new InMemoryFeatureHistory(new RetrainingProperties());
        SealedWindow empty = new SealedWindow(CPU, 1, TestData.windowStart(1), TestData.windowStart(2), List.of());

        history.append(FeatureVector.emptyFor(empty));

        assertThat(history.size(CPU)).isZero();
        assertThat(history.knownSeries()).isEmpty();
    }

    @Test
    void unknownSeriesHasNoHistory() {
        InMemoryFeatureHistory history = new InMemoryFeatureHistory(new RetrainingProperties());

        assertThat(history.lastWindows(CPU, 10)).isEmpty();
    }
}
