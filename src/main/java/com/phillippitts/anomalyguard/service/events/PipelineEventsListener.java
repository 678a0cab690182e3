package com.phillippitts.anomalyguard.service.events;

import com.phillippitts.anomalyguard.service.retraining.ModelTrainedEvent;
import com.phillippitts.anomalyguard.service.retraining.TrainingFailedEvent;
import com.phillippitts.anomalyguard.service.window.RecordDroppedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log output for operational pipeline events. Per-record and per-series warnings are
 * throttled to one line per key per minute.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    PipelineEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onRecordDropped(RecordDroppedEvent e) {
        if (!shouldLog("dropped-" + e.reason() + '-' + e.seriesKey().canonical())) {
            return;
        }
        if (e.reason() == RecordDroppedEvent.DropReason.CLOCK_SKEW) {
            LOG.warn("Dropping future records for {}: timestamp {} is past the latest acceptable {}. "
                    + "Check producer clocks or raise pipeline.window.max-clock-skew.",
                    e.seriesKey(), e.recordTimestamp(), e.boundary());
        } else {
            LOG.warn("Dropping late records for {}: timestamp {} is behind seal boundary {}. "
                    + "Check producer clocks or raise pipeline.window.grace-period.",
                    e.seriesKey(), e.recordTimestamp(), e.boundary());
        }
    }

    @EventListener
    void onTrainingFailed(TrainingFailedEvent e) {
        if (shouldLog("training-" + e.seriesKey().canonical() + '-' + e.reason())) {
            LOG.warn("Training failed for {}: reason={}, streak={}, detail={}",
                    e.seriesKey(), e.reason(), e.failureStreak(), e.message());
        }
    }

    @EventListener
    void onModelTrained(ModelTrainedEvent e) {
        LOG.info("Model v{} ({}) ready for {} after {} ms",
                e.model().version(), e.model().algorithm(), e.model().seriesKey(), e.trainingMillis());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
