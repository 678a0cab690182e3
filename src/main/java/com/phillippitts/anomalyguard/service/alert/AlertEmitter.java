package com.phillippitts.anomalyguard.service.alert;

import com.phillippitts.anomalyguard.config.properties.AlertProperties;
import com.phillippitts.anomalyguard.domain.Alert;
import com.phillippitts.anomalyguard.domain.AlertState;
import com.phillippitts.anomalyguard.domain.ScoreResult;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns score results into deduplicated alerts, at most one active alert per series.
 *
 * <p>Consecutive anomalous results merge into the active alert (OPEN or ACKNOWLEDGED). The alert
 * resolves after {@code cool-down-count} consecutive non-anomalous results; an anomalous result
 * during cool-down resets the count. Every transition is published as an {@link AlertEvent}
 * after the per-series state was updated.
 */
@Component
public class AlertEmitter {

    private static final Logger LOG = LogManager.getLogger(AlertEmitter.class);

    private final AlertProperties props;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final ConcurrentMap<SeriesKey, Tracked> active = new ConcurrentHashMap<>();

    public AlertEmitter(AlertProperties props,
                        ApplicationEventPublisher publisher,
                        PipelineMetrics metrics,
                        Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Applies one score result to the series' alert.
     *
     * @param result scored window
     * @return the alert affected by the result (created, merged, cooling down or just resolved);
     *         empty when the series has no alert and the result is not anomalous
     */
    public Optional<Alert> handle(ScoreResult result) {
        Objects.requireNonNull(result, "result");
        Instant now = clock.instant();
        AtomicReference<AlertEvent> transition = new AtomicReference<>();
        AtomicReference<Alert> affected = new AtomicReference<>();

        active.compute(result.seriesKey(), (key, current) -> {
            if (result.decision()) {
                if (current == null) {
                    Alert opened = Alert.open(result, now);
                    transition.set(new AlertEvent(AlertEvent.Type.CREATED, opened, now));
                    affected.set(opened);
                    return new Tracked(opened, 0);
                }
                Alert merged = current.alert().merge(result, now);
                transition.set(new AlertEvent(AlertEvent.Type.UPDATED, merged, now));
                affected.set(merged);
                return new Tracked(merged, 0);
            }
            if (current == null) {
                return null;
            }
            int calm = current.calmStreak() + 1;
            if (calm >= props.getCoolDownCount()) {
                Alert resolved = current.alert().resolve(now);
                transition.set(new AlertEvent(AlertEvent.Type.RESOLVED, resolved, now));
                affected.set(resolved);
                return null;
            }
            affected.set(current.alert());
            return new Tracked(current.alert(), calm);
        });

        publish(transition.get());
        return Optional.ofNullable(affected.get());
    }

    /**
     * Moves the series' OPEN alert to ACKNOWLEDGED. Acknowledged alerts keep merging anomalies
     * and still resolve through cool-down.
     *
     * @return the acknowledged alert, or empty when the series has no active alert
     */
    public Optional<Alert> acknowledge(SeriesKey seriesKey) {
        Instant now = clock.instant();
        AtomicReference<AlertEvent> transition = new AtomicReference<>();
        Tracked tracked = active.computeIfPresent(seriesKey, (key, current) -> {
            if (current.alert().state() != AlertState.OPEN) {
                return current;
            }
            Alert acknowledged = current.alert().acknowledge(now);
            transition.set(new AlertEvent(AlertEvent.Type.ACKNOWLEDGED, acknowledged, now));
            return new Tracked(acknowledged, current.calmStreak());
        });
        publish(transition.get());
        return tracked == null ? Optional.empty() : Optional.of(tracked.alert());
    }

    public Optional<Alert> activeAlert(SeriesKey seriesKey) {
        Tracked tracked = active.get(seriesKey);
        return tracked == null ? Optional.empty() : Optional.of(tracked.alert());
    }

    public List<Alert> activeAlerts() {
        return active.values().stream().map(Tracked::alert).toList();
    }

    private void publish(AlertEvent event) {
        if (event == null) {
            return;
        }
        Alert alert = event.alert();
        metrics.incrementAlert(event.type().name().toLowerCase(Locale.ROOT));
        if (event.type() == AlertEvent.Type.UPDATED) {
            LOG.debug("Alert {} for {} updated: {} windows, peak {}",
                    alert.id(), alert.seriesKey(), alert.windowCount(), alert.peakScore());
        } else {
            LOG.info("Alert {} for {} {}: range [{} - {}), {} windows, peak {}",
                    alert.id(), alert.seriesKey(), event.type(), alert.rangeStart(), alert.rangeEnd(),
                    alert.windowCount(), alert.peakScore());
        }
        publisher.publishEvent(event);
    }

    private record Tracked(Alert alert, int calmStreak) {}
}
