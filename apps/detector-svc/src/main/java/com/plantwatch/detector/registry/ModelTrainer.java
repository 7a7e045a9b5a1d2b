package com.plantwatch.detector.registry;

import com.plantwatch.detector.error.InsufficientDataException;
import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.forecast.ForecastingEngine;
import com.plantwatch.detector.model.Reading;
import com.plantwatch.detector.model.VariableSummary;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits one forecaster per variable. A variable that cannot be trained is reported and left out;
 * it never aborts the others.
 */
public class ModelTrainer {
    private static final Logger log = LoggerFactory.getLogger(ModelTrainer.class);

    private final ForecastingEngine engine;
    private final TrainingConfiguration configuration;
    private final Clock clock;

    public ModelTrainer(ForecastingEngine engine, TrainingConfiguration configuration, Clock clock) {
        this.engine = engine;
        this.configuration = configuration;
        this.clock = clock;
    }

    public record TrainingReport(ModelRegistry registry, List<String> trained, Map<String, String> failed) {}

    /**
     * @throws InsufficientDataException when fewer than the configured minimum of finite readings remain
     */
    public VariableModel train(String variableId, List<Reading> history) {
        List<Reading> clean = history.stream()
                .filter(reading -> Double.isFinite(reading.value()))
                .sorted(Comparator.comparing(Reading::timestamp))
                .toList();
        if (clean.size() < configuration.minTrainingPoints()) {
            throw new InsufficientDataException(variableId, clean.size(), configuration.minTrainingPoints());
        }
        Forecaster forecaster = engine.train(variableId, clean, configuration.settings());
        double[] values = clean.stream().mapToDouble(Reading::value).toArray();
        return new VariableModel(variableId, forecaster, VariableSummary.of(values), clock.instant());
    }

    public TrainingReport trainAll(Map<String, List<Reading>> historyByVariable) {
        Instant startedAt = clock.instant();
        Map<String, VariableModel> models = new TreeMap<>();
        Map<String, String> failed = new LinkedHashMap<>();
        new TreeMap<>(historyByVariable).forEach((variableId, history) -> {
            try {
                models.put(variableId, train(variableId, history));
                log.debug("Trained model for {} on {} readings", variableId, history.size());
            } catch (InsufficientDataException ex) {
                log.warn("Skipping {}: {}", variableId, ex.getMessage());
                failed.put(variableId, ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("Training failed for {}", variableId, ex);
                failed.put(variableId, ex.getClass().getSimpleName() + ": " + ex.getMessage());
            }
        });
        log.info("Training finished: {} trained, {} failed", models.size(), failed.size());
        ModelRegistry registry = new ModelRegistry(models, configuration, startedAt);
        return new TrainingReport(registry, List.copyOf(models.keySet()), failed);
    }

    public ForecastingEngine engine() {
        return engine;
    }

    public TrainingConfiguration configuration() {
        return configuration;
    }
}
