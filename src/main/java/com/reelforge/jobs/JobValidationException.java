package com.reelforge.jobs;

/**
 * Raised when a job submission violates a queue constraint: unknown type,
 * unknown owner or out-of-range retry settings.
 */
public class JobValidationException extends IllegalArgumentException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
