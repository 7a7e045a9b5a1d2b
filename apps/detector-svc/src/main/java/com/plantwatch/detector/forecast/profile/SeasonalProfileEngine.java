package com.plantwatch.detector.forecast.profile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.detector.error.ModelPersistenceException;
import com.plantwatch.detector.forecast.ForecastSettings;
import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.forecast.ForecastingEngine;
import com.plantwatch.detector.forecast.Percentiles;
import com.plantwatch.detector.model.Reading;
import java.io.IOException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * In-process engine. The interval half-width is the empirical {@code intervalWidth} quantile
 * of the absolute in-sample residuals, so no distribution is assumed.
 */
public class SeasonalProfileEngine implements ForecastingEngine {

    public static final String NAME = "profile";

    private final ObjectMapper objectMapper;

    public SeasonalProfileEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Forecaster train(String variableId, List<Reading> history, ForecastSettings settings) {
        List<Reading> points = history.stream()
                .filter(reading -> Double.isFinite(reading.value()))
                .toList();
        if (points.isEmpty()) {
            throw new IllegalArgumentException("history for " + variableId + " has no finite values");
        }
        double level = points.stream().mapToDouble(Reading::value).average().orElse(0d);

        double[] hourOffsets = new double[0];
        if (settings.dailySeasonality()) {
            hourOffsets = bucketOffsets(points, SeasonalProfileForecaster.HOURS, settings,
                    (reading, local) -> local.getHour(), reading -> level);
        }
        double[] weekdayOffsets = new double[0];
        if (settings.weeklySeasonality()) {
            double[] hours = hourOffsets;
            weekdayOffsets = bucketOffsets(points, SeasonalProfileForecaster.WEEKDAYS, settings,
                    (reading, local) -> local.getDayOfWeek().getValue() - 1,
                    reading -> level + (hours.length == 0 ? 0d : hours[reading.timestamp().atZone(settings.zone()).getHour()]));
        }

        SeasonalProfileForecaster withoutInterval = new SeasonalProfileForecaster(
                variableId, level, hourOffsets, weekdayOffsets, 0d, settings.zone().getId());
        List<Double> absoluteResiduals = new ArrayList<>(points.size());
        for (Reading reading : points) {
            absoluteResiduals.add(Math.abs(reading.value() - withoutInterval.pointEstimate(reading.timestamp())));
        }
        absoluteResiduals.sort(Double::compare);
        double halfWidth = Percentiles.percentile(absoluteResiduals, settings.intervalWidth() * 100d);

        return new SeasonalProfileForecaster(variableId, level, hourOffsets, weekdayOffsets, halfWidth, settings.zone().getId());
    }

    @Override
    public byte[] serialize(Forecaster forecaster) {
        if (!(forecaster instanceof SeasonalProfileForecaster profile)) {
            throw new ModelPersistenceException("profile engine cannot serialize " + forecaster.getClass().getSimpleName());
        }
        try {
            return objectMapper.writeValueAsBytes(profile);
        } catch (IOException ex) {
            throw new ModelPersistenceException("failed to serialize model for " + forecaster.variableId(), ex);
        }
    }

    @Override
    public Forecaster deserialize(String variableId, byte[] blob) {
        SeasonalProfileForecaster profile;
        try {
            profile = objectMapper.readValue(blob, SeasonalProfileForecaster.class);
        } catch (IOException | IllegalArgumentException ex) {
            throw new ModelPersistenceException("failed to read model for " + variableId, ex);
        }
        if (!variableId.equals(profile.variableId())) {
            throw new ModelPersistenceException("model blob belongs to " + profile.variableId() + ", expected " + variableId);
        }
        return profile;
    }

    private static double[] bucketOffsets(List<Reading> points,
                                          int buckets,
                                          ForecastSettings settings,
                                          BucketKey key,
                                          java.util.function.ToDoubleFunction<Reading> baseline) {
        double[] sums = new double[buckets];
        int[] counts = new int[buckets];
        for (Reading reading : points) {
            int bucket = key.bucket(reading, reading.timestamp().atZone(settings.zone()));
            sums[bucket] += reading.value() - baseline.applyAsDouble(reading);
            counts[bucket]++;
        }
        double[] offsets = new double[buckets];
        for (int i = 0; i < buckets; i++) {
            offsets[i] = counts[i] == 0 ? 0d : sums[i] / counts[i];
        }
        return offsets;
    }

    @FunctionalInterface
    private interface BucketKey {
        int bucket(Reading reading, ZonedDateTime local);
    }
}
