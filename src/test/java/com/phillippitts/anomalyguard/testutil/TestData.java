package com.phillippitts.anomalyguard.testutil;

import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.SealedWindow;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.domain.TelemetryRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builders for windows and feature vectors shared by the tests.
 */
public final class TestData {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    public static final Duration WINDOW = Duration.ofSeconds(60);

    private TestData() {
    }

    public static Instant windowStart(long windowId) {
        return T0.plus(WINDOW.multipliedBy(windowId - 1));
    }

    /** Window with one record per second carrying the given values. */
    public static SealedWindow window(SeriesKey key, long windowId, double... values) {
        Instant start = windowStart(windowId);
        List<TelemetryRecord> records = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            records.add(TelemetryRecord.of(key, start.plusSeconds(i), values[i]));
        }
        return new SealedWindow(key, windowId, start, start.plus(WINDOW), records);
    }

    /** 60 values uniformly spread over {@code center +- jitter}. */
    public static double[] noisy(Random random, double center, double jitter) {
        double[] values = new double[60];
        for (int i = 0; i < values.length; i++) {
            values[i] = center + (random.nextDouble() * 2 - 1) * jitter;
        }
        return values;
    }

    /** Feature vector with the given mean and plausible values for the other features. */
    public static FeatureVector vector(SeriesKey key, long windowId, double mean, double variance) {
        double[] values = new double[FeatureVector.LENGTH];
        values[FeatureVector.COUNT] = 60;
        values[FeatureVector.MEAN] = mean;
        values[FeatureVector.VARIANCE] = variance;
        values[FeatureVector.MIN] = mean - Math.sqrt(variance) * 2;
        values[FeatureVector.MAX] = mean + Math.sqrt(variance) * 2;
        values[FeatureVector.RATE_OF_CHANGE] = 0.0;
        values[FeatureVector.PERCENTILE_SPREAD] = Math.sqrt(variance) * 3;
        Instant start = windowStart(windowId);
        return new FeatureVector(key, windowId, start, start.plus(WINDOW), values, false);
    }

    /**
     * Windows of an error counter that is zero most of the time. Ids {@code 5k} and {@code 5k+2}
     * carry a few sporadic errors, all other windows are zeros.
     */
    public static List<SealedWindow> mostlyIdleWindows(SeriesKey key, int count, long seed) {
        Random random = new Random(seed);
        List<SealedWindow> out = new ArrayList<>(count);
        for (int id = 1; id <= count; id++) {
            double[] values = new double[60];
            if (id % 5 == 0 || id % 5 == 2) {
                int errors = 1 + random.nextInt(4);
                for (int e = 0; e < errors; e++) {
                    values[random.nextInt(values.length)] = 1 + random.nextInt(3);
                }
            }
            out.add(window(key, id, values));
        }
        return out;
    }

    /** {@code count} vectors around {@code mean} with small deterministic jitter. */
    public static List<FeatureVector> normalVectors(SeriesKey key, int count, double mean, long seed) {
        Random random = new Random(seed);
        List<FeatureVector> out = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            double m = mean + (random.nextDouble() * 2 - 1) * 0.05;
            double v = 0.01 + random.nextDouble() * 0.002;
            out.add(vector(key, i, m, v));
        }
        return out;
    }
}
