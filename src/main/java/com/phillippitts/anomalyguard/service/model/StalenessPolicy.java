package com.phillippitts.anomalyguard.service.model;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.domain.TrainedModel;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a series' active model needs retraining.
 *
 * <p>A model is stale when any of these holds:
 * <ul>
 *   <li>it was trained on fewer windows than {@code min-sample-size}</li>
 *   <li>it is older than {@code max-model-age}</li>
 *   <li>the store has it marked stale (explicitly, or after an integrity failure)</li>
 *   <li>the drift EWMA of its scores exceeds {@code drift-threshold}</li>
 * </ul>
 */
@Component
public class StalenessPolicy {

    private final RetrainingProperties props;
    private final ModelStore modelStore;
    private final DriftTracker driftTracker;

    public StalenessPolicy(RetrainingProperties props, ModelStore modelStore, DriftTracker driftTracker) {
        this.props = Objects.requireNonNull(props, "props");
        this.modelStore = Objects.requireNonNull(modelStore, "modelStore");
        this.driftTracker = Objects.requireNonNull(driftTracker, "driftTracker");
    }

    /**
     * @param model active model of the series
     * @param now   current time
     * @return reason the model is stale, or empty when it is fresh
     */
    public Optional<String> staleReason(TrainedModel model, Instant now) {
        if (model.trainingWindowCount() < props.getMinSampleSize()) {
            return Optional.of("trained on " + model.trainingWindowCount() + " windows");
        }
        if (model.trainedAt().plus(props.getMaxModelAge()).isBefore(now)) {
            return Optional.of("older than " + props.getMaxModelAge());
        }
        if (modelStore.isMarkedStale(model.seriesKey())) {
            return Optional.of("marked stale");
        }
        if (driftTracker.isDrifting(model.seriesKey())) {
            return Optional.of("score drift");
        }
        return Optional.empty();
    }

    public boolean isStale(TrainedModel model, Instant now) {
        return staleReason(model, now).isPresent();
    }
}
