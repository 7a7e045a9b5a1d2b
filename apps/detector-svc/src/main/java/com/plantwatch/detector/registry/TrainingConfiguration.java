package com.plantwatch.detector.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.forecast.ForecastSettings;
import java.time.ZoneId;

/**
 * Settings a registry was trained with. Persisted in the manifest so a reloaded registry reports
 * the configuration that actually produced it.
 */
public record TrainingConfiguration(
        String engine,
        double intervalWidth,
        double thresholdMultiplier,
        boolean dailySeasonality,
        boolean weeklySeasonality,
        int minTrainingPoints,
        String zone
) {

    public static TrainingConfiguration from(DetectorProperties properties, String engine) {
        var forecaster = properties.forecaster();
        return new TrainingConfiguration(
                engine,
                forecaster.intervalWidth(),
                properties.scoring().thresholdMultiplier(),
                forecaster.dailySeasonality(),
                forecaster.weeklySeasonality(),
                properties.models().minTrainingPoints(),
                properties.zone()
        );
    }

    @JsonIgnore
    public ForecastSettings settings() {
        return new ForecastSettings(intervalWidth, dailySeasonality, weeklySeasonality, ZoneId.of(zone));
    }
}
