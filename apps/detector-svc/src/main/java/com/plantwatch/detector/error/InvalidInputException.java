package com.plantwatch.detector.error;

public class InvalidInputException extends DetectorException {

    public InvalidInputException(String message) {
        super(message);
    }
}
