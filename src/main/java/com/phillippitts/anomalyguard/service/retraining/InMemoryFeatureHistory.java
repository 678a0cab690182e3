package com.phillippitts.anomalyguard.service.retraining;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded per-series history holding the last {@code history-windows} vectors.
 */
@Component
public class InMemoryFeatureHistory implements FeatureHistory {

    private final RetrainingProperties props;
    private final ConcurrentMap<SeriesKey, Deque<FeatureVector>> history = new ConcurrentHashMap<>();

    public InMemoryFeatureHistory(RetrainingProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public void append(FeatureVector vector) {
        Objects.requireNonNull(vector, "vector");
        if (vector.empty()) {
            return;
        }
        Deque<FeatureVector> deque = history.computeIfAbsent(vector.seriesKey(), key -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(vector);
            while (deque.size() > props.getHistoryWindows()) {
                deque.removeFirst();
            }
        }
    }

    @Override
    public List<FeatureVector> lastWindows(SeriesKey seriesKey, int limit) {
        Deque<FeatureVector> deque = history.get(seriesKey);
        if (deque == null || limit <= 0) {
            return List.of();
        }
        synchronized (deque) {
            List<FeatureVector> newestFirst = new ArrayList<>(Math.min(limit, deque.size()));
            Iterator<FeatureVector> it = deque.descendingIterator();
            while (it.hasNext() && newestFirst.size() < limit) {
                newestFirst.add(it.next());
            }
            List<FeatureVector> out = new ArrayList<>(newestFirst.size());
            for (int i = newestFirst.size() - 1; i >= 0; i--) {
                out.add(newestFirst.get(i));
            }
            return out;
        }
    }

    @Override
    public int size(SeriesKey seriesKey) {
        Deque<FeatureVector> deque = history.get(seriesKey);
        if (deque == null) {
            return 0;
        }
        synchronized (deque) {
            return deque.size();
        }
    }

    @Override
    public Set<SeriesKey> knownSeries() {
        return Set.copyOf(history.keySet());
    }
}
