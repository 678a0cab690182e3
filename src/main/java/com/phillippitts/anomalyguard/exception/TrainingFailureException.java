package com.phillippitts.anomalyguard.exception;

/**
 * Thrown when training cannot produce a usable model (numerical instability, too few distinct
 * feature values, timeout). The previous model stays active.
 */
public class TrainingFailureException extends AnomalyGuardException {

    private final String reason;

    public TrainingFailureException(String message) {
        super(message);
        this.reason = "unknown";
    }

    public TrainingFailureException(String message, String reason) {
        super(message + " (reason: " + reason + ")");
        this.reason = reason;
    }

    public TrainingFailureException(String message, String reason, Throwable cause) {
        super(message + " (reason: " + reason + ")", cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
