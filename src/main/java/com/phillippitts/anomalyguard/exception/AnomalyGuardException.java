package com.phillippitts.anomalyguard.exception;

/**
 * Base exception for all anomaly-guard application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AnomalyGuardException extends RuntimeException {

    public AnomalyGuardException(String message) {
        super(message);
    }

    public AnomalyGuardException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnomalyGuardException(Throwable cause) {
        super(cause);
    }
}
