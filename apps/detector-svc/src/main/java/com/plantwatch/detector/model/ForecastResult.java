package com.plantwatch.detector.model;

import java.time.Instant;

public record ForecastResult(
        String variableId,
        Instant timestamp,
        double pointEstimate,
        double lowerBound,
        double upperBound
) {
}
