package com.phillippitts.anomalyguard.service.pipeline;

import com.phillippitts.anomalyguard.domain.ScoreResult;

/**
 * Egress for every score result, anomalous or not, in per-series order.
 */
public interface ScoreResultSink {

    void accept(ScoreResult result);
}
