package com.plantwatch.detector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.detector.forecast.ForecastingEngine;
import com.plantwatch.detector.forecast.profile.SeasonalProfileEngine;
import com.plantwatch.detector.forecast.sidecar.ForecastSidecarClient;
import com.plantwatch.detector.forecast.sidecar.SidecarForecastingEngine;
import com.plantwatch.detector.registry.ModelRegistry;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import com.plantwatch.detector.registry.ModelRegistryStore;
import com.plantwatch.detector.registry.ModelTrainer;
import com.plantwatch.detector.registry.TrainingConfiguration;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DetectorConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DetectorConfiguration.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ForecastingEngine forecastingEngine(DetectorProperties properties, ObjectMapper objectMapper) {
        String engine = properties.forecaster().engine();
        if (SidecarForecastingEngine.NAME.equals(engine)) {
            log.info("Forecasting engine: sidecar at {}", properties.forecaster().sidecar().baseUrl());
            return new SidecarForecastingEngine(new ForecastSidecarClient(properties), objectMapper);
        }
        log.info("Forecasting engine: seasonal profile");
        return new SeasonalProfileEngine(objectMapper);
    }

    @Bean
    TrainingConfiguration trainingConfiguration(DetectorProperties properties, ForecastingEngine engine) {
        return TrainingConfiguration.from(properties, engine.name());
    }

    @Bean
    ModelTrainer modelTrainer(ForecastingEngine engine, TrainingConfiguration configuration, Clock clock) {
        return new ModelTrainer(engine, configuration, clock);
    }

    @Bean
    ModelRegistryStore modelRegistryStore(ForecastingEngine engine, ObjectMapper objectMapper) {
        return new ModelRegistryStore(engine, objectMapper);
    }

    /**
     * Starts empty; {@code RegistryInitializer} publishes the persisted registry during startup.
     */
    @Bean
    ModelRegistryHolder modelRegistryHolder(TrainingConfiguration configuration) {
        return new ModelRegistryHolder(ModelRegistry.empty(configuration));
    }
}
