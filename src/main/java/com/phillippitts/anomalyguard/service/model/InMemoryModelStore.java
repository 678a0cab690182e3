package com.phillippitts.anomalyguard.service.model;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.domain.TrainedModel;
import com.phillippitts.anomalyguard.exception.ModelCorruptException;
import com.phillippitts.anomalyguard.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ModelStore} keeping immutable {@link ModelEntry} snapshots in a concurrent map.
 *
 * <p>Every mutation replaces the whole entry through {@link ConcurrentMap#compute}, which
 * serializes writers of the same series and publishes the new entry atomically to readers.
 */
@Component
public class InMemoryModelStore implements ModelStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryModelStore.class);

    private final ConcurrentMap<SeriesKey, ModelEntry> entries = new ConcurrentHashMap<>();
    private final RetrainingProperties props;
    private final PipelineMetrics metrics;

    public InMemoryModelStore(RetrainingProperties props, PipelineMetrics metrics) {
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public Optional<TrainedModel> getActive(SeriesKey seriesKey) {
        ModelEntry entry = entries.get(seriesKey);
        if (entry == null || entry.active() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(verified(seriesKey, entry.active()));
        } catch (ModelCorruptException e) {
            LOG.error("{}; falling back to baseline and scheduling retrain", e.getMessage());
            metrics.incrementCorruptModel();
            markStale(seriesKey);
            return Optional.empty();
        }
    }

    @Override
    public void put(SeriesKey seriesKey, TrainedModel model) {
        Objects.requireNonNull(seriesKey, "seriesKey");
        Objects.requireNonNull(model, "model");
        if (!seriesKey.equals(model.seriesKey())) {
            throw new IllegalArgumentException("Model for " + model.seriesKey() + " cannot be stored under " + seriesKey);
        }
        entries.compute(seriesKey, (key, current) -> {
            if (current == null) {
                return new ModelEntry(model, List.of(), false, model.version());
            }
            if (model.version() <= current.latestVersion()) {
                throw new IllegalArgumentException("Model version " + model.version()
                        + " for " + key + " must exceed " + current.latestVersion());
            }
            List<TrainedModel> previous = new ArrayList<>();
            if (current.active() != null) {
                previous.add(current.active());
            }
            previous.addAll(current.previous());
            while (previous.size() > props.getRetainedVersions()) {
                previous.remove(previous.size() - 1);
            }
            return new ModelEntry(model, List.copyOf(previous), false, model.version());
        });
        LOG.info("Activated model v{} for {} (trained on {} windows, threshold {})",
                model.version(), seriesKey, model.trainingWindowCount(), model.threshold());
    }

    @Override
    public void markStale(SeriesKey seriesKey) {
        entries.computeIfPresent(seriesKey, (key, current) -> current.stale()
                ? current
                : new ModelEntry(current.active(), current.previous(), true, current.latestVersion()));
    }

    @Override
    public boolean isMarkedStale(SeriesKey seriesKey) {
        ModelEntry entry = entries.get(seriesKey);
        return entry != null && entry.stale();
    }

    @Override
    public Optional<TrainedModel> rollback(SeriesKey seriesKey) {
        AtomicReference<TrainedModel> reinstated = new AtomicReference<>();
        entries.computeIfPresent(seriesKey, (key, current) -> {
            if (current.previous().isEmpty()) {
                return current;
            }
            TrainedModel restored = current.previous().get(0);
            reinstated.set(restored);
            List<TrainedModel> remaining = current.previous().subList(1, current.previous().size());
            return new ModelEntry(restored, List.copyOf(remaining), false, current.latestVersion());
        });
        TrainedModel restored = reinstated.get();
        if (restored != null) {
            LOG.warn("Rolled back {} to model v{}", seriesKey, restored.version());
        }
        return Optional.ofNullable(restored);
    }

    @Override
    public long latestVersion(SeriesKey seriesKey) {
        ModelEntry entry = entries.get(seriesKey);
        return entry == null ? 0L : entry.latestVersion();
    }

    @Override
    public List<TrainedModel> retainedVersions(SeriesKey seriesKey) {
        ModelEntry entry = entries.get(seriesKey);
        return entry == null ? List.of() : entry.previous();
    }

    @Override
    public Set<SeriesKey> knownSeries() {
        return Set.copyOf(entries.keySet());
    }

    private static TrainedModel verified(SeriesKey seriesKey, TrainedModel model) {
        if (!model.verifyIntegrity()) {
            throw new ModelCorruptException(seriesKey, model.version());
        }
        return model;
    }

    /**
     * Immutable snapshot of one series' models.
     *
     * @param active        model used for scoring
     * @param previous      versions retained for rollback, newest first
     * @param stale         explicitly marked for retraining
     * @param latestVersion highest version ever stored, so rollbacks never reuse a version number
     */
    record ModelEntry(TrainedModel active, List<TrainedModel> previous, boolean stale, long latestVersion) {}
}
