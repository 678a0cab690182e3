package com.phillippitts.anomalyguard.exception;

/**
 * Thrown from inside a training task when its cancellation flag was observed between batches.
 */
public class TrainingCancelledException extends TrainingFailureException {

    public TrainingCancelledException(String message) {
        super(message, "cancelled");
    }
}
