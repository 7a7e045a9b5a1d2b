package com.plantwatch.detector.error;

/**
 * A store operation kept failing after its retry budget was spent.
 */
public class StoreUnavailableException extends DetectorException {

    private final String operation;
    private final int attempts;

    public StoreUnavailableException(String operation, int attempts, Throwable cause) {
        super(operation + " failed after " + attempts + " attempt(s)"
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }
}
