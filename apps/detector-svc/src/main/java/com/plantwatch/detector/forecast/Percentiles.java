package com.plantwatch.detector.forecast;

import java.util.List;

public final class Percentiles {

    private Percentiles() {
    }

    /**
     * Linear interpolation between closest ranks. {@code sortedValues} must be sorted ascending.
     */
    public static double percentile(List<Double> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.size() - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues.get(lower);
        }
        double weight = index - lower;
        return sortedValues.get(lower) * (1 - weight) + sortedValues.get(upper) * weight;
    }
}
