package com.phillippitts.anomalyguard.exception;

import com.phillippitts.anomalyguard.domain.SeriesKey;

import java.time.Duration;
import java.time.Instant;

/**
 * Thrown when a record is stamped further in the future than the buffer clock allows.
 * Accepting it would roll the series' window forward and turn every on-time record into a
 * late one, so it is dropped and counted instead.
 */
public class ClockSkewRejectedException extends AnomalyGuardException {

    private final transient SeriesKey seriesKey;
    private final Instant timestamp;
    private final Instant latestAccepted;

    public ClockSkewRejectedException(SeriesKey seriesKey, Instant timestamp, Instant now, Duration maxSkew) {
        super("Record for " + seriesKey + " at " + timestamp + " is "
                + Duration.between(now, timestamp).toMillis() + "ms ahead of buffer clock "
                + now + " (max skew " + maxSkew.toMillis() + "ms)");
        this.seriesKey = seriesKey;
        this.timestamp = timestamp;
        this.latestAccepted = now.plus(maxSkew);
    }

    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Instant getLatestAccepted() {
        return latestAccepted;
    }
}
