package com.phillippitts.anomalyguard.service.model;

import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.domain.TrainedModel;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Owner of the per-series scoring models.
 *
 * <p>Exactly one model is active per series. Replacing it is an atomic swap: a reader sees
 * either the old or the new model, never a mix. Models are immutable, so a scorer may keep the
 * reference it got for the duration of one scoring call.
 *
 * <p>An empty result from {@link #getActive(SeriesKey)} is not an error: the series has never
 * been trained (or its model failed the integrity check) and callers fall back to the
 * bootstrap baseline.
 */
public interface ModelStore {

    /**
     * @param seriesKey series to look up
     * @return active model, or empty when none exists or the stored one is corrupt
     */
    Optional<TrainedModel> getActive(SeriesKey seriesKey);

    /**
     * Atomically replaces the active model of a series and clears its stale mark.
     *
     * @param seriesKey series the model belongs to
     * @param model     model to activate; its version must exceed the current version
     */
    void put(SeriesKey seriesKey, TrainedModel model);

    /**
     * Flags the series' model for retraining on the next sweep. The model keeps scoring.
     */
    void markStale(SeriesKey seriesKey);

    boolean isMarkedStale(SeriesKey seriesKey);

    /**
     * Reinstates the most recent retained previous version.
     *
     * @return the reinstated model, or empty when no previous version is retained
     */
    Optional<TrainedModel> rollback(SeriesKey seriesKey);

    /**
     * @return highest version ever stored for the series, 0 when none
     */
    long latestVersion(SeriesKey seriesKey);

    /**
     * @return previous versions retained for rollback, newest first
     */
    List<TrainedModel> retainedVersions(SeriesKey seriesKey);

    Set<SeriesKey> knownSeries();
}
