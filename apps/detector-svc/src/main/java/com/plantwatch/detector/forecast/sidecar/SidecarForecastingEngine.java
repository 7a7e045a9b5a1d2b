package com.plantwatch.detector.forecast.sidecar;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plantwatch.detector.error.ModelPersistenceException;
import com.plantwatch.detector.forecast.ForecastSettings;
import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.forecast.ForecastingEngine;
import com.plantwatch.detector.model.Reading;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delegates training and prediction to the forecast sidecar. The sidecar owns the fitted model;
 * the blob persisted locally only records which model version to ask for.
 */
public class SidecarForecastingEngine implements ForecastingEngine {

    public static final String NAME = "sidecar";

    private final ForecastSidecarClient client;
    private final ObjectMapper objectMapper;

    public SidecarForecastingEngine(ForecastSidecarClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Forecaster train(String variableId, List<Reading> history, ForecastSettings settings) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("interval_width", settings.intervalWidth());
        params.put("daily_seasonality", settings.dailySeasonality());
        params.put("weekly_seasonality", settings.weeklySeasonality());
        params.put("timezone", settings.zone().getId());
        var request = new ForecastSidecarClient.TrainRequest(
                variableId,
                history.stream().map(reading -> reading.timestamp().toString()).toList(),
                history.stream().map(Reading::value).toList(),
                params
        );
        var response = client.train(request);
        String modelKey = response.modelKey() != null ? response.modelKey() : variableId;
        return new SidecarForecaster(variableId, modelKey, response.modelVersion(), client);
    }

    @Override
    public byte[] serialize(Forecaster forecaster) {
        if (!(forecaster instanceof SidecarForecaster sidecar)) {
            throw new ModelPersistenceException("sidecar engine cannot serialize " + forecaster.getClass().getSimpleName());
        }
        try {
            return objectMapper.writeValueAsBytes(new ModelHandle(sidecar.variableId(), sidecar.modelKey(), sidecar.modelVersion()));
        } catch (IOException ex) {
            throw new ModelPersistenceException("failed to serialize model handle for " + forecaster.variableId(), ex);
        }
    }

    @Override
    public Forecaster deserialize(String variableId, byte[] blob) {
        ModelHandle handle;
        try {
            handle = objectMapper.readValue(blob, ModelHandle.class);
        } catch (IOException ex) {
            throw new ModelPersistenceException("failed to read model handle for " + variableId, ex);
        }
        if (!variableId.equals(handle.variableId())) {
            throw new ModelPersistenceException("model handle belongs to " + handle.variableId() + ", expected " + variableId);
        }
        return new SidecarForecaster(variableId, handle.modelKey(), handle.modelVersion(), client);
    }

    record ModelHandle(
            @JsonProperty("variable_id") String variableId,
            @JsonProperty("model_key") String modelKey,
            @JsonProperty("model_version") String modelVersion
    ) {}
}
