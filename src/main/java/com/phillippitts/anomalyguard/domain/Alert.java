package com.phillippitts.anomalyguard.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Deduplicated alert for one series.
 *
 * <p>Instances are immutable; state changes produce a new instance through the {@code with*}
 * methods so readers never see a partially updated alert.
 *
 * @param id          alert identity
 * @param seriesKey   series the alert belongs to
 * @param rangeStart  start of the earliest anomalous window
 * @param rangeEnd    end of the latest anomalous window
 * @param peakScore   highest score observed while the alert was active
 * @param windowCount number of anomalous windows merged into this alert
 * @param state       lifecycle state
 * @param openedAt    when the alert was created
 * @param updatedAt   when the alert last changed
 * @param resolvedAt  when the alert resolved, or null while active
 */
public record Alert(
        UUID id,
        SeriesKey seriesKey,
        Instant rangeStart,
        Instant rangeEnd,
        double peakScore,
        int windowCount,
        AlertState state,
        Instant openedAt,
        Instant updatedAt,
        Instant resolvedAt
) {

    public Alert {
        Objects.requireNonNull(id, "Alert id must not be null");
        Objects.requireNonNull(seriesKey, "Series key must not be null");
        Objects.requireNonNull(rangeStart, "Range start must not be null");
        Objects.requireNonNull(rangeEnd, "Range end must not be null");
        Objects.requireNonNull(state, "State must not be null");
        Objects.requireNonNull(openedAt, "Opened-at must not be null");
        Objects.requireNonNull(updatedAt, "Updated-at must not be null");
    }

    /** Opens a new alert from the first anomalous result for a series. */
    public static Alert open(ScoreResult result, Instant now) {
        return new Alert(UUID.randomUUID(), result.seriesKey(), result.windowStart(), result.windowEnd(),
                result.score(), 1, AlertState.OPEN, now, now, null);
    }

    /** Merges another anomalous result: extends the range and keeps the highest score. */
    public Alert merge(ScoreResult result, Instant now) {
        Instant start = result.windowStart().isBefore(rangeStart) ? result.windowStart() : rangeStart;
        Instant end = result.windowEnd().isAfter(rangeEnd) ? result.windowEnd() : rangeEnd;
        return new Alert(id, seriesKey, start, end, Math.max(peakScore, result.score()), windowCount + 1,
                state, openedAt, now, null);
    }

    public Alert acknowledge(Instant now) {
        return new Alert(id, seriesKey, rangeStart, rangeEnd, peakScore, windowCount,
                AlertState.ACKNOWLEDGED, openedAt, now, null);
    }

    public Alert resolve(Instant now) {
        return new Alert(id, seriesKey, rangeStart, rangeEnd, peakScore, windowCount,
                AlertState.RESOLVED, openedAt, now, now);
    }

    public boolean isActive() {
        return state.isActive();
    }
}
