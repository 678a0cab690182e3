package com.phillippitts.anomalyguard.exception;

import com.phillippitts.anomalyguard.domain.SeriesKey;

/**
 * Thrown when a series has fewer historical windows than the minimum training sample size.
 * Retraining is deferred to the next sweep.
 */
public class InsufficientHistoryException extends AnomalyGuardException {

    private final transient SeriesKey seriesKey;
    private final int available;
    private final int required;

    public InsufficientHistoryException(SeriesKey seriesKey, int available, int required) {
        super("Insufficient history for " + seriesKey + ": " + available + " windows, need " + required);
        this.seriesKey = seriesKey;
        this.available = available;
        this.required = required;
    }

    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
