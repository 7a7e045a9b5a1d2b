package com.plantwatch.detector.error;

/**
 * Base type for the failure classes the detection pipeline handles explicitly.
 */
public abstract class DetectorException extends RuntimeException {

    protected DetectorException(String message) {
        super(message);
    }

    protected DetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
