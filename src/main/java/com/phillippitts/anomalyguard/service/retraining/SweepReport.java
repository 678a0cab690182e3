package com.phillippitts.anomalyguard.service.retraining;

/**
 * Outcome of one retraining sweep.
 *
 * @param examined  series looked at
 * @param scheduled training tasks submitted
 * @param skipped   series left alone (fresh, already training, or submission failed)
 */
public record SweepReport(int examined, int scheduled, int skipped) {
}
