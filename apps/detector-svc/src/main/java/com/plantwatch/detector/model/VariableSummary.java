package com.plantwatch.detector.model;

import java.util.Arrays;

/**
 * Training-time statistics of a variable. {@code std} is the sample standard deviation
 * (zero for fewer than two points).
 */
public record VariableSummary(
        double mean,
        double std,
        double min,
        double max,
        int nPoints
) {

    public static VariableSummary of(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        double mean = Arrays.stream(values).average().orElse(0d);
        double std = 0d;
        if (values.length > 1) {
            double sumSquares = Arrays.stream(values)
                    .map(value -> Math.pow(value - mean, 2))
                    .sum();
            std = Math.sqrt(sumSquares / (values.length - 1));
        }
        double min = Arrays.stream(values).min().orElse(0d);
        double max = Arrays.stream(values).max().orElse(0d);
        return new VariableSummary(mean, std, min, max, values.length);
    }
}
