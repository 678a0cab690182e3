package com.phillippitts.anomalyguard.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One observability event for a series. Immutable once accepted by the window buffer.
 *
 * @param seriesKey series the record belongs to
 * @param timestamp wall-clock time the event was observed
 * @param value     numeric value (must be finite)
 * @param tags      optional per-record tags that are not part of the series identity
 */
public record TelemetryRecord(
        SeriesKey seriesKey,
        Instant timestamp,
        double value,
        Map<String, String> tags
) {

    public TelemetryRecord {
        Objects.requireNonNull(seriesKey, "Series key must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Record value must be finite, got: " + value);
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static TelemetryRecord of(SeriesKey seriesKey, Instant timestamp, double value) {
        return new TelemetryRecord(seriesKey, timestamp, value, Map.of());
    }
}
