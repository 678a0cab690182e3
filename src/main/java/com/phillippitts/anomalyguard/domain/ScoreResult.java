package com.phillippitts.anomalyguard.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable outcome of scoring one window. Append-only audit entry.
 *
 * @param seriesKey    series that was scored
 * @param windowId     window the feature vector was built from
 * @param windowStart  inclusive window start
 * @param windowEnd    exclusive window end
 * @param score        anomaly score in [0, 1]
 * @param decision     true when the score crossed the applicable threshold
 * @param modelVersion version of the model used; {@link #BASELINE_VERSION} for the bootstrap baseline
 * @param scoredAt     when scoring happened
 */
public record ScoreResult(
        SeriesKey seriesKey,
        long windowId,
        Instant windowStart,
        Instant windowEnd,
        double score,
        boolean decision,
        long modelVersion,
        Instant scoredAt
) {

    public static final long BASELINE_VERSION = 0L;

    public ScoreResult {
        Objects.requireNonNull(seriesKey, "Series key must not be null");
        Objects.requireNonNull(windowStart, "Window start must not be null");
        Objects.requireNonNull(windowEnd, "Window end must not be null");
        Objects.requireNonNull(scoredAt, "Scored-at must not be null");
        if (!(score >= 0.0 && score <= 1.0)) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got: " + score);
        }
    }

    public boolean usedBaseline() {
        return modelVersion == BASELINE_VERSION;
    }
}
