package com.plantwatch.detector.error;

public class InsufficientDataException extends DetectorException {

    private final String variableId;
    private final int available;
    private final int required;

    public InsufficientDataException(String variableId, int available, int required) {
        super("Insufficient data to train " + variableId + ": " + available + " points, " + required + " required");
        this.variableId = variableId;
        this.available = available;
        this.required = required;
    }

    public String variableId() {
        return variableId;
    }

    public int available() {
        return available;
    }

    public int required() {
        return required;
    }
}
