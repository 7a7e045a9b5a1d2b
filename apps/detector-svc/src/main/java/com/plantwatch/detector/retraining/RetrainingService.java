package com.plantwatch.detector.retraining;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.detection.StoreRetry;
import com.plantwatch.detector.error.RegistrySwapException;
import com.plantwatch.detector.model.Reading;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import com.plantwatch.detector.registry.ModelRegistryStore;
import com.plantwatch.detector.registry.ModelTrainer;
import com.plantwatch.detector.repository.ReadingRepository;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Full rebuild of the model registry from the complete reading history. The new registry is saved
 * before it is published; if either step fails the previous registry stays in effect.
 */
@Service
public class RetrainingService {
    private static final Logger log = LoggerFactory.getLogger(RetrainingService.class);

    private final ReadingRepository readings;
    private final ModelTrainer trainer;
    private final ModelRegistryStore store;
    private final ModelRegistryHolder holder;
    private final StoreRetry retry;
    private final Path modelDirectory;

    @Autowired
    public RetrainingService(ReadingRepository readings,
                             ModelTrainer trainer,
                             ModelRegistryStore store,
                             ModelRegistryHolder holder,
                             StoreRetry retry,
                             DetectorProperties properties) {
        this(readings, trainer, store, holder, retry, Path.of(properties.models().directory()));
    }

    RetrainingService(ReadingRepository readings,
                      ModelTrainer trainer,
                      ModelRegistryStore store,
                      ModelRegistryHolder holder,
                      StoreRetry retry,
                      Path modelDirectory) {
        this.readings = readings;
        this.trainer = trainer;
        this.store = store;
        this.holder = holder;
        this.retry = retry;
        this.modelDirectory = modelDirectory;
    }

    /**
     * Serialized so a manual trigger never overlaps the scheduled run.
     *
     * @throws RegistrySwapException when no variable could be trained or the registry could not be saved
     */
    public synchronized ModelTrainer.TrainingReport retrain(String trigger) {
        log.info("Retraining started ({})", trigger);
        List<Reading> history = retry.call("load training history", () -> readings.findBetween(null, null, List.of()));
        Map<String, List<Reading>> byVariable = new TreeMap<>();
        for (Reading reading : history) {
            byVariable.computeIfAbsent(reading.variableId(), key -> new ArrayList<>()).add(reading);
        }
        ModelTrainer.TrainingReport report = trainer.trainAll(byVariable);
        if (report.registry().isEmpty()) {
            throw new RegistrySwapException("Retraining (" + trigger + ") produced no models from "
                    + history.size() + " readings; keeping the current registry");
        }
        try {
            store.save(report.registry(), modelDirectory);
        } catch (RuntimeException ex) {
            throw new RegistrySwapException("Failed to save retrained registry; keeping the current registry", ex);
        }
        holder.publish(report.registry());
        log.info("Retraining finished ({}): {} variables trained, {} failed",
                trigger, report.trained().size(), report.failed().size());
        return report;
    }
}
