package com.plantwatch.detector.error;

/**
 * Retraining could not save or publish a new registry; the previous one stays in effect.
 */
public class RegistrySwapException extends DetectorException {

    public RegistrySwapException(String message) {
        super(message);
    }

    public RegistrySwapException(String message, Throwable cause) {
        super(message, cause);
    }
}
