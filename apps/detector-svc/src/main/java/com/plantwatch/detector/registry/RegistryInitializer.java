package com.plantwatch.detector.registry;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.retraining.RetrainingService;
import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

/**
 * Publishes the persisted registry before any worker starts. Startup fails when the model
 * directory is unreadable, or when no model is available and training on startup is off or
 * produces nothing.
 */
@Component
@DependsOn("databaseBootstrap")
public class RegistryInitializer {
    private static final Logger log = LoggerFactory.getLogger(RegistryInitializer.class);

    private final ModelRegistryStore store;
    private final ModelRegistryHolder holder;
    private final TrainingConfiguration configuration;
    private final RetrainingService retrainingService;
    private final DetectorProperties properties;

    public RegistryInitializer(ModelRegistryStore store,
                               ModelRegistryHolder holder,
                               TrainingConfiguration configuration,
                               RetrainingService retrainingService,
                               DetectorProperties properties) {
        this.store = store;
        this.holder = holder;
        this.configuration = configuration;
        this.retrainingService = retrainingService;
        this.properties = properties;
    }

    @PostConstruct
    void initialize() {
        Path directory = Path.of(properties.models().directory());
        ModelRegistry loaded = store.load(directory, configuration);
        if (!loaded.isEmpty()) {
            holder.publish(loaded);
            return;
        }
        if (!properties.retraining().trainOnStartup()) {
            throw new IllegalStateException("No trained models in " + directory.toAbsolutePath()
                    + " and detector.retraining.train-on-startup is false");
        }
        log.warn("No trained models in {}; training on startup", directory.toAbsolutePath());
        try {
            retrainingService.retrain("startup");
        } catch (RuntimeException ex) {
            throw new IllegalStateException("No trained models available and training on startup failed", ex);
        }
    }
}
