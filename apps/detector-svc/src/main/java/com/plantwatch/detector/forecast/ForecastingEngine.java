package com.plantwatch.detector.forecast;

import com.plantwatch.detector.model.Reading;
import java.util.List;

/**
 * Pluggable forecasting algorithm. The detection pipeline only relies on the point estimate
 * and interval a trained {@link Forecaster} returns; how trend or seasonality is learned is
 * up to the engine.
 */
public interface ForecastingEngine {

    /**
     * Name recorded in the model manifest; a registry can only be loaded by the engine that wrote it.
     */
    String name();

    /**
     * @param history finite readings of one variable, sorted by timestamp
     */
    Forecaster train(String variableId, List<Reading> history, ForecastSettings settings);

    byte[] serialize(Forecaster forecaster);

    Forecaster deserialize(String variableId, byte[] blob);
}
