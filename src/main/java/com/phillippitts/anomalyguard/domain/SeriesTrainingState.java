package com.phillippitts.anomalyguard.domain;

/**
 * Per-series retraining lifecycle.
 *
 * <pre>
 * UNTRAINED → TRAINING → ACTIVE → STALE → TRAINING → ACTIVE → ...
 * </pre>
 *
 * A failed or deferred training returns the series to UNTRAINED or STALE.
 */
public enum SeriesTrainingState {
    UNTRAINED,
    TRAINING,
    ACTIVE,
    STALE
}
