package com.phillippitts.anomalyguard.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A closed time-slice of records for one series.
 *
 * <p>Records are ordered by non-decreasing timestamp. Once sealed a window is never modified;
 * late records go to the next window or are dropped.
 *
 * @param seriesKey series the window belongs to
 * @param windowId  per-series sequence number, starting at 1
 * @param start     inclusive start bound
 * @param end       exclusive end bound
 * @param records   records in timestamp order (possibly empty)
 */
public record SealedWindow(
        SeriesKey seriesKey,
        long windowId,
        Instant start,
        Instant end,
        List<TelemetryRecord> records
) {

    public SealedWindow {
        Objects.requireNonNull(seriesKey, "Series key must not be null");
        Objects.requireNonNull(start, "Window start must not be null");
        Objects.requireNonNull(end, "Window end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " precedes start " + start);
        }
        records = records == null ? List.of() : List.copyOf(records);
        for (int i = 1; i < records.size(); i++) {
            if (records.get(i).timestamp().isBefore(records.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Window records must be in timestamp order");
            }
        }
    }

    public boolean emptyWindow() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
