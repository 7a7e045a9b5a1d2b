package com.plantwatch.detector.registry;

import com.plantwatch.detector.error.ModelNotFoundException;
import com.plantwatch.detector.model.ForecastResult;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable set of per-variable models produced by one training run. Workers take a reference to
 * the current registry at the start of a cycle and use it throughout, so a concurrent swap never
 * mixes two generations within one batch.
 */
public final class ModelRegistry {

    private final Map<String, VariableModel> models;
    private final TrainingConfiguration configuration;
    private final Instant trainedAt;

    public ModelRegistry(Map<String, VariableModel> models, TrainingConfiguration configuration, Instant trainedAt) {
        this.models = Collections.unmodifiableMap(new TreeMap<>(models));
        this.configuration = configuration;
        this.trainedAt = trainedAt;
    }

    public static ModelRegistry empty(TrainingConfiguration configuration) {
        return new ModelRegistry(Map.of(), configuration, null);
    }

    /**
     * @throws ModelNotFoundException when no model was trained for the variable
     */
    public VariableModel lookup(String variableId) {
        VariableModel model = models.get(variableId);
        if (model == null) {
            throw new ModelNotFoundException(variableId);
        }
        return model;
    }

    public Optional<VariableModel> find(String variableId) {
        return Optional.ofNullable(models.get(variableId));
    }

    public boolean contains(String variableId) {
        return models.containsKey(variableId);
    }

    public ForecastResult forecast(String variableId, Instant timestamp) {
        return lookup(variableId).forecaster().forecast(timestamp);
    }

    public Set<String> variables() {
        return models.keySet();
    }

    public Map<String, VariableModel> models() {
        return models;
    }

    public int size() {
        return models.size();
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }

    public TrainingConfiguration configuration() {
        return configuration;
    }

    public Instant trainedAt() {
        return trainedAt;
    }
}
