package com.phillippitts.anomalyguard.service.model;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.domain.ScoreResult;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks an exponentially weighted mean of model scores per series.
 *
 * <p>A model that keeps producing high scores on ordinary traffic no longer describes the
 * series' normal behaviour. Only scores produced by a trained model count; the EWMA restarts
 * whenever the model version changes.
 */
@Component
public class DriftTracker {

    private final RetrainingProperties props;
    private final ConcurrentMap<SeriesKey, Ewma> ewmas = new ConcurrentHashMap<>();

    public DriftTracker(RetrainingProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    public void record(ScoreResult result) {
        if (result.usedBaseline()) {
            return;
        }
        double alpha = props.getDriftAlpha();
        ewmas.compute(result.seriesKey(), (key, current) -> {
            if (current == null || current.modelVersion() != result.modelVersion()) {
                return new Ewma(result.modelVersion(), result.score(), 1);
            }
            double next = alpha * result.score() + (1.0 - alpha) * current.value();
            return new Ewma(current.modelVersion(), next, current.observations() + 1);
        });
    }

    /**
     * @return current EWMA, empty until enough scores were observed for it to be meaningful
     */
    public OptionalDouble ewma(SeriesKey seriesKey) {
        Ewma ewma = ewmas.get(seriesKey);
        if (ewma == null || ewma.observations() < minObservations()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(ewma.value());
    }

    public boolean isDrifting(SeriesKey seriesKey) {
        OptionalDouble value = ewma(seriesKey);
        return value.isPresent() && value.getAsDouble() > props.getDriftThreshold();
    }

    public void reset(SeriesKey seriesKey) {
        ewmas.remove(seriesKey);
    }

    /** Roughly one EWMA time constant. */
    int minObservations() {
        return (int) Math.ceil(1.0 / props.getDriftAlpha());
    }

    private record Ewma(long modelVersion, double value, long observations) {}
}
