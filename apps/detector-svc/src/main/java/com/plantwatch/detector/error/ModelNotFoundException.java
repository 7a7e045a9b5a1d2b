package com.plantwatch.detector.error;

public class ModelNotFoundException extends DetectorException {

    private final String variableId;

    public ModelNotFoundException(String variableId) {
        super("No trained model for variable " + variableId);
        this.variableId = variableId;
    }

    public String variableId() {
        return variableId;
    }
}
