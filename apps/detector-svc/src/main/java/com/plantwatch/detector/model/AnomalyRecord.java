package com.plantwatch.detector.model;

import java.time.Instant;

/**
 * One scored reading. Written once to the result store and never updated.
 * {@code predictionErrorPct} is null when the point estimate is zero.
 */
public record AnomalyRecord(
        String variableId,
        Instant timestamp,
        double actualValue,
        double pointEstimate,
        double lowerBound,
        double upperBound,
        double residual,
        boolean outsideInterval,
        boolean highResidual,
        boolean anomaly,
        double anomalyScore,
        Double predictionErrorPct,
        String sourceTag
) {
}
