package com.plantwatch.detector.model;

import java.time.Instant;

public record Reading(
        String variableId,
        Instant timestamp,
        double value,
        String sourceTag
) {
    public Reading(String variableId, Instant timestamp, double value) {
        this(variableId, timestamp, value, null);
    }
}
