package com.phillippitts.anomalyguard.service.retraining;

import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.SeriesKey;

import java.util.List;
import java.util.Set;

/**
 * Training corpus source: the most recent feature vectors of non-empty windows per series.
 */
public interface FeatureHistory {

    /**
     * Appends a vector. Empty-window vectors are ignored.
     */
    void append(FeatureVector vector);

    /**
     * @param seriesKey series to read
     * @param limit     maximum number of vectors
     * @return up to {@code limit} most recent vectors, oldest first
     */
    List<FeatureVector> lastWindows(SeriesKey seriesKey, int limit);

    int size(SeriesKey seriesKey);

    Set<SeriesKey> knownSeries();
}
