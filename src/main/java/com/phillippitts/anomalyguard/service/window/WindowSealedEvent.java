package com.phillippitts.anomalyguard.service.window;

import com.phillippitts.anomalyguard.domain.SealedWindow;

import java.time.Instant;

/**
 * Published when a window is sealed. Ownership of the window passes to the listener
 * (the pipeline), which hands it to the feature extractor.
 *
 * @param window   the sealed window
 * @param sealedAt when the buffer sealed it
 * @param reason   what caused the seal
 */
public record WindowSealedEvent(SealedWindow window, Instant sealedAt, SealReason reason) {

    public enum SealReason { CADENCE, CAPACITY, ROLLOVER, EXPLICIT }
}
