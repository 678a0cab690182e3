package com.phillippitts.anomalyguard.service.retraining;

import com.phillippitts.anomalyguard.domain.SeriesKey;

import java.time.Instant;

/**
 * Published when a training task fails; the previous model (if any) keeps scoring.
 *
 * @param seriesKey     series whose training failed
 * @param reason        short machine-readable reason, also used as a metric tag
 * @param message       human-readable detail
 * @param failureStreak consecutive failures including this one
 * @param at            when the failure was recorded
 */
public record TrainingFailedEvent(SeriesKey seriesKey, String reason, String message, int failureStreak, Instant at) {
}
