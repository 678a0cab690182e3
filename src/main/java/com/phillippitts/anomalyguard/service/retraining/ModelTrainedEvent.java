package com.phillippitts.anomalyguard.service.retraining;

import com.phillippitts.anomalyguard.domain.TrainedModel;

import java.time.Instant;

/**
 * Published after a newly trained model became active.
 */
public record ModelTrainedEvent(TrainedModel model, long trainingMillis, Instant at) {
}
