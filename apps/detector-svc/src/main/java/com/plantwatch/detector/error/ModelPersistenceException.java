package com.plantwatch.detector.error;

public class ModelPersistenceException extends DetectorException {

    public ModelPersistenceException(String message) {
        super(message);
    }

    public ModelPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
