package com.phillippitts.anomalyguard.exception;

import com.phillippitts.anomalyguard.domain.SeriesKey;

import java.time.Duration;
import java.time.Instant;

/**
 * Thrown when a record arrives earlier than the series' last seal boundary minus the grace period.
 * The record is dropped and counted; this is never fatal to the pipeline.
 */
public class OutOfOrderRejectedException extends AnomalyGuardException {

    private final transient SeriesKey seriesKey;
    private final Instant timestamp;
    private final Instant boundary;

    public OutOfOrderRejectedException(SeriesKey seriesKey, Instant timestamp, Instant boundary, Duration grace) {
        super("Record for " + seriesKey + " at " + timestamp + " is "
                + Duration.between(timestamp, boundary).toMillis() + "ms behind seal boundary "
                + boundary + " (grace " + grace.toMillis() + "ms)");
        this.seriesKey = seriesKey;
        this.timestamp = timestamp;
        this.boundary = boundary;
    }

    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Instant getBoundary() {
        return boundary;
    }
}
