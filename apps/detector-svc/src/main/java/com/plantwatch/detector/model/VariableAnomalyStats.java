package com.plantwatch.detector.model;

/**
 * Per-variable aggregate over stored anomaly records. {@code stdResidual} is the sample standard
 * deviation, null for fewer than two records.
 */
public record VariableAnomalyStats(
        String variableId,
        long nPoints,
        long nAnomalies,
        double avgScore,
        double maxScore,
        double avgResidual,
        Double stdResidual
) {
}
