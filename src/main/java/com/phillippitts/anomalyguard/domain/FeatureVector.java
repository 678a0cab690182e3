package com.phillippitts.anomalyguard.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-length numeric summary of exactly one sealed window.
 *
 * <p>The layout is fixed by {@link #FEATURE_NAMES}; values are always finite. A vector built
 * from a window without records is the all-zero sentinel with {@link #empty()} set, so that
 * absence of data can itself be scored.
 */
public final class FeatureVector {

    public static final int COUNT = 0;
    public static final int MEAN = 1;
    public static final int VARIANCE = 2;
    public static final int MIN = 3;
    public static final int MAX = 4;
    public static final int RATE_OF_CHANGE = 5;
    public static final int PERCENTILE_SPREAD = 6;

    public static final List<String> FEATURE_NAMES = List.of(
            "count", "mean", "variance", "min", "max", "rateOfChange", "percentileSpread");

    public static final int LENGTH = FEATURE_NAMES.size();

    private final SeriesKey seriesKey;
    private final long windowId;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final double[] values;
    private final boolean empty;

    public FeatureVector(SeriesKey seriesKey, long windowId, Instant windowStart, Instant windowEnd,
                         double[] values, boolean empty) {
        this.seriesKey = Objects.requireNonNull(seriesKey, "seriesKey");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart");
        this.windowEnd = Objects.requireNonNull(windowEnd, "windowEnd");
        Objects.requireNonNull(values, "values");
        if (values.length != LENGTH) {
            throw new IllegalArgumentException("Feature vector must have " + LENGTH
                    + " values, got " + values.length);
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Feature values must be finite");
            }
        }
        this.windowId = windowId;
        this.values = values.clone();
        this.empty = empty;
    }

    /** Sentinel vector for a window that sealed without any records. */
    public static FeatureVector emptyFor(SealedWindow window) {
        return new FeatureVector(window.seriesKey(), window.windowId(), window.start(), window.end(),
                new double[LENGTH], true);
    }

    public SeriesKey seriesKey() {
        return seriesKey;
    }

    public long windowId() {
        return windowId;
    }

    public Instant windowStart() {
        return windowStart;
    }

    public Instant windowEnd() {
        return windowEnd;
    }

    public boolean empty() {
        return empty;
    }

    public double get(int index) {
        return values[index];
    }

    public double mean() {
        return values[MEAN];
    }

    public double variance() {
        return values[VARIANCE];
    }

    public double count() {
        return values[COUNT];
    }

    /** Returns a defensive copy of the feature values. */
    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector other)) {
            return false;
        }
        return windowId == other.windowId
                && empty == other.empty
                && seriesKey.equals(other.seriesKey)
                && windowStart.equals(other.windowStart)
                && windowEnd.equals(other.windowEnd)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(seriesKey, windowId, windowStart, windowEnd, empty);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector[series=" + seriesKey + ", window=" + windowId
                + ", empty=" + empty + ", values=" + Arrays.toString(values) + ']';
    }
}
