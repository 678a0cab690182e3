package com.phillippitts.anomalyguard.service.alert;

import com.phillippitts.anomalyguard.config.properties.AlertProperties;
import com.phillippitts.anomalyguard.domain.Alert;
import com.phillippitts.anomalyguard.domain.AlertState;
import com.phillippitts.anomalyguard.domain.ScoreResult;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.service.metrics.PipelineMetrics;
import com.phillippitts.anomalyguard.testutil.EventCapturingPublisher;
import com.phillippitts.anomalyguard.testutil.MutableClock;
import com.phillippitts.anomalyguard.testutil.TestData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.phillippitts.anomalyguard.testutil.TestData.T0;
import static org.assertj.core.api.Assertions.assertThat;

class AlertEmitterTest {

    private static final SeriesKey CPU = SeriesKey.of("cpu.usage");

    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private AlertEmitter emitter;
    private long nextWindow = 1;

    @BeforeEach
    void setUp() {
        AlertProperties props = new AlertProperties();
        props.setCoolDownCount(3);
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        emitter = new AlertEmitter(props, publisher, new PipelineMetrics(registry), new MutableClock(T0));
    }

    private ScoreResult result(SeriesKey key, double score, boolean anomalous) {
        long id = nextWindow++;
        return new ScoreResult(key, id, TestData.windowStart(id), TestData.windowStart(id + 1),
                score, anomalous, 1, T0);
    }

    private AlertEvent.Type[] eventTypes() {
        return publisher.eventsOfType(AlertEvent.class).stream().map(AlertEvent::type).toArray(AlertEvent.Type[]::new);
    }

    @Test
    void consecutiveAnomaliesProduceSingleAlert() {
        for (int i = 0; i < 5; i++) {
            emitter.handle(result(CPU, 0.97 + i * 0.005, true));
        }

        assertThat(emitter.activeAlerts()).hasSize(1);
        Alert alert = emitter.activeAlert(CPU).orElseThrow();
        assertThat(alert.windowCount()).isEqualTo(5);
        assertThat(alert.peakScore()).isEqualTo(0.97 + 4 * 0.005);
        assertThat(alert.rangeStart()).isEqualTo(TestData.windowStart(1));
        assertThat(alert.rangeEnd()).isEqualTo(TestData.windowStart(6));
        assertThat(alert.state()).isEqualTo(AlertState.OPEN);
        assertThat(eventTypes()).containsExactly(AlertEvent.Type.CREATED, AlertEvent.Type.UPDATED,
                AlertEvent.Type.UPDATED, AlertEvent.Type.UPDATED, AlertEvent.Type.UPDATED);
    }

    @Test
    void normalResultWithoutAlertDoesNothing() {
        Optional<Alert> handled = emitter.handle(result(CPU, 0.1, false));

        assertThat(handled).isEmpty();
        assertThat(publisher.all()).isEmpty();
    }

    @Test
    void alertResolvesAfterCoolDown() {
        emitter.handle(result(CPU, 0.99, true));
        emitter.handle(result(CPU, 0.1, false));
        emitter.handle(result(CPU, 0.1, false));
        assertThat(emitter.activeAlert(CPU)).isPresent();

        Optional<Alert> resolved = emitter.handle(result(CPU, 0.1, false));

        assertThat(resolved).hasValueSatisfying(a -> {
            assertThat(a.state()).isEqualTo(AlertState.RESOLVED);
            assertThat(a.resolvedAt()).isEqualTo(T0);
        });
        assertThat(emitter.activeAlert(CPU)).isEmpty();
        assertThat(eventTypes()).containsExactly(AlertEvent.Type.CREATED, AlertEvent.Type.RESOLVED);
        assertThat(registry.counter("anomalyguard.alerts", "transition", "resolved").count()).isEqualTo(1.0);
    }

    @Test
    void anomalyDuringCoolDownResetsCounter() {
        emitter.handle(result(CPU, 0.99, true));
        emitter.handle(result(CPU, 0.1, false));
        emitter.handle(result(CPU, 0.1, false));
        emitter.handle(result(CPU, 0.98, true));
        emitter.handle(result(CPU, 0.1, false));
        emitter.handle(result(CPU, 0.1, false));

        assertThat(emitter.activeAlert(CPU)).isPresent();
        assertThat(emitter.activeAlert(CPU).orElseThrow().windowCount()).isEqualTo(2);

        emitter.handle(result(CPU, 0.1, false));
        assertThat(emitter.activeAlert(CPU)).isEmpty();
    }

    @Test
    void newAnomalyAfterResolutionOpensNewAlert() {
        Alert first = emitter.handle(result(CPU, 0.99, true)).orElseThrow();
        for (int i = 0; i < 3; i++) {
            emitter.handle(result(CPU, 0.1, false));
        }

        Alert second = emitter.handle(result(CPU, 0.99, true)).orElseThrow();

        assertThat(second.id()).isNotEqualTo(first.id());
        assertThat(second.windowCount()).isEqualTo(1);
    }

    @Test
    void acknowledgedAlertKeepsMergingAndCoolsDown() {
        emitter.handle(result(CPU, 0.99, true));

        Alert acknowledged = emitter.acknowledge(CPU).orElseThrow();
        assertThat(acknowledged.state()).isEqualTo(AlertState.ACKNOWLEDGED);

        Alert merged = emitter.handle(result(CPU, 0.995, true)).orElseThrow();
        assertThat(merged.state()).isEqualTo(AlertState.ACKNOWLEDGED);
        assertThat(merged.id()).isEqualTo(acknowledged.id());
        assertThat(merged.windowCount()).isEqualTo(2);

        for (int i = 0; i < 3; i++) {
            emitter.handle(result(CPU, 0.1, false));
        }
        assertThat(emitter.activeAlert(CPU)).isEmpty();
        assertThat(eventTypes()).containsExactly(AlertEvent.Type.CREATED, AlertEvent.Type.ACKNOWLEDGED,
                AlertEvent.Type.UPDATED, AlertEvent.Type.RESOLVED);
    }

    @Test
    void acknowledgeWithoutAlertIsEmptyAndRepeatedAcknowledgeIsQuiet() {
        assertThat(emitter.acknowledge(CPU)).isEmpty();

        emitter.handle(result(CPU, 0.99, true));
        emitter.acknowledge(CPU);
        emitter.acknowledge(CPU);

        assertThat(publisher.eventsOfType(AlertEvent.class)).hasSize(2);
    }

    @Test
    void seriesAreIndependent() {
        SeriesKey mem = SeriesKey.of("mem.used");
        emitter.handle(result(CPU, 0.99, true));
        emitter.handle(result(mem, 0.99, true));
        emitter.handle(result(mem, 0.1, false));

        assertThat(emitter.activeAlerts()).extracting(Alert::seriesKey).containsExactlyInAnyOrder(CPU, mem);
    }
}
