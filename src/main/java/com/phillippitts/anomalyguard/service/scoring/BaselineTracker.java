package com.phillippitts.anomalyguard.service.scoring;

import com.phillippitts.anomalyguard.config.properties.ScoringProperties;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rolling mean and standard deviation of the last K window means per series.
 *
 * <p>Used to score series that have no trained model yet. Running sums are maintained
 * incrementally as windows enter and leave the rolling window.
 */
@Component
public class BaselineTracker {

    private final ScoringProperties props;
    private final ConcurrentMap<SeriesKey, Rolling> series = new ConcurrentHashMap<>();

    public BaselineTracker(ScoringProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Adds the mean of a non-empty window to the series' baseline.
     */
    public void observe(SeriesKey seriesKey, double windowMean) {
        if (!Double.isFinite(windowMean)) {
            return;
        }
        Rolling rolling = series.computeIfAbsent(seriesKey, key -> new Rolling());
        synchronized (rolling) {
            rolling.add(windowMean, props.getBaselineWindows());
        }
    }

    /**
     * @return current baseline statistics; {@link Snapshot#windows()} is 0 for an unseen series
     */
    public Snapshot snapshot(SeriesKey seriesKey) {
        Rolling rolling = series.get(seriesKey);
        if (rolling == null) {
            return new Snapshot(0, 0.0, 0.0);
        }
        synchronized (rolling) {
            return rolling.snapshot();
        }
    }

    public void reset(SeriesKey seriesKey) {
        series.remove(seriesKey);
    }

    /**
     * @param windows number of window means in the baseline
     * @param mean    mean of the window means
     * @param stdDev  population standard deviation of the window means
     */
    public record Snapshot(int windows, double mean, double stdDev) {

        /** Standard deviation floored relative to the mean, so a flat baseline still yields finite z. */
        public double effectiveStdDev() {
            return AbstractZScoreAlgorithm.floorScale(stdDev, mean);
        }
    }

    private static final class Rolling {
        private final Deque<Double> means = new ArrayDeque<>();
        private double sum;
        private double sumSquares;

        void add(double value, int capacity) {
            means.addLast(value);
            sum += value;
            sumSquares += value * value;
            while (means.size() > capacity) {
                double evicted = means.removeFirst();
                sum -= evicted;
                sumSquares -= evicted * evicted;
            }
        }

        Snapshot snapshot() {
            int n = means.size();
            if (n == 0) {
                return new Snapshot(0, 0.0, 0.0);
            }
            double mean = sum / n;
            double variance = Math.max(0.0, sumSquares / n - mean * mean);
            return new Snapshot(n, mean, Math.sqrt(variance));
        }
    }
}
