package com.phillippitts.anomalyguard.exception;

import com.phillippitts.anomalyguard.domain.SeriesKey;

/**
 * Thrown when a stored model fails its integrity check. Callers treat it as "no model"
 * and the series is scheduled for retraining.
 */
public class ModelCorruptException extends AnomalyGuardException {

    private final transient SeriesKey seriesKey;
    private final long version;

    public ModelCorruptException(SeriesKey seriesKey, long version) {
        super("Model v" + version + " for " + seriesKey + " failed integrity check");
        this.seriesKey = seriesKey;
        this.version = version;
    }

    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    public long getVersion() {
        return version;
    }
}
