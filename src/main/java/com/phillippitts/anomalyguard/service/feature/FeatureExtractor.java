package com.phillippitts.anomalyguard.service.feature;

import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.SealedWindow;
import com.phillippitts.anomalyguard.domain.TelemetryRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Converts a sealed window into a {@link FeatureVector}.
 *
 * <p>Extraction is a pure function of the window's records: it never mutates the window, keeps
 * no state between calls and always evaluates in record order, so identical windows produce
 * bit-identical vectors.
 *
 * <p>Features, in {@link FeatureVector#FEATURE_NAMES} order:
 * <ul>
 *   <li>count - number of records</li>
 *   <li>mean - arithmetic mean of values</li>
 *   <li>variance - population variance, 0.0 when count &lt; 2</li>
 *   <li>min, max</li>
 *   <li>rateOfChange - mean of first differences, 0.0 when count &lt; 2</li>
 *   <li>percentileSpread - p95 minus p5 (linear interpolation)</li>
 * </ul>
 *
 * <p>Non-finite intermediate results (overflow on extreme values) are clamped to 0.0 and
 * logged so they can never poison a model.
 */
@Component
public class FeatureExtractor {

    private static final Logger LOG = LogManager.getLogger(FeatureExtractor.class);

    static final double LOW_PERCENTILE = 5.0;
    static final double HIGH_PERCENTILE = 95.0;

    /**
     * @param window sealed window (not modified)
     * @return feature vector for the window; the empty-window sentinel if it has no records
     */
    public FeatureVector extract(SealedWindow window) {
        Objects.requireNonNull(window, "window");
        if (window.emptyWindow()) {
            return FeatureVector.emptyFor(window);
        }

        List<TelemetryRecord> records = window.records();
        int n = records.size();
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = records.get(i).value();
        }

        double sum = 0.0;
        double min = values[0];
        double max = values[0];
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / n;

        double variance = 0.0;
        double rateOfChange = 0.0;
        if (n >= 2) {
            double squares = 0.0;
            for (double v : values) {
                double d = v - mean;
                squares += d * d;
            }
            variance = squares / n;

            double diffs = 0.0;
            for (int i = 1; i < n; i++) {
                diffs += values[i] - values[i - 1];
            }
            rateOfChange = diffs / (n - 1);
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double spread = percentile(sorted, HIGH_PERCENTILE) - percentile(sorted, LOW_PERCENTILE);

        double[] features = new double[FeatureVector.LENGTH];
        features[FeatureVector.COUNT] = n;
        features[FeatureVector.MEAN] = mean;
        features[FeatureVector.VARIANCE] = variance;
        features[FeatureVector.MIN] = min;
        features[FeatureVector.MAX] = max;
        features[FeatureVector.RATE_OF_CHANGE] = rateOfChange;
        features[FeatureVector.PERCENTILE_SPREAD] = spread;
        clampNonFinite(window, features);

        return new FeatureVector(window.seriesKey(), window.windowId(), window.start(), window.end(),
                features, false);
    }

    /**
     * Linear-interpolated percentile of an ascending array.
     *
     * @param sorted ascending, non-empty
     * @param percentile in [0, 100]
     */
    public static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    private static void clampNonFinite(SealedWindow window, double[] features) {
        for (int i = 0; i < features.length; i++) {
            if (!Double.isFinite(features[i])) {
                LOG.warn("Non-finite {} ({}) for {} window {}; clamped to 0.0",
                        FeatureVector.FEATURE_NAMES.get(i), features[i], window.seriesKey(), window.windowId());
                features[i] = 0.0;
            }
        }
    }
}
