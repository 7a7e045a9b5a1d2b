package com.plantwatch.detector.forecast.sidecar;

import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.model.ForecastResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class SidecarForecaster implements Forecaster {

    private final String variableId;
    private final String modelKey;
    private final String modelVersion;
    private final ForecastSidecarClient client;

    SidecarForecaster(String variableId, String modelKey, String modelVersion, ForecastSidecarClient client) {
        this.variableId = variableId;
        this.modelKey = modelKey;
        this.modelVersion = modelVersion;
        this.client = client;
    }

    @Override
    public String variableId() {
        return variableId;
    }

    public String modelKey() {
        return modelKey;
    }

    public String modelVersion() {
        return modelVersion;
    }

    @Override
    public ForecastResult forecast(Instant timestamp) {
        return forecastAll(List.of(timestamp)).get(0);
    }

    /**
     * One {@code /predict} call for the whole list.
     */
    @Override
    public List<ForecastResult> forecastAll(List<Instant> timestamps) {
        if (timestamps.isEmpty()) {
            return List.of();
        }
        var response = client.predict(new ForecastSidecarClient.PredictRequest(
                modelKey, modelVersion, timestamps.stream().map(Instant::toString).toList()));
        List<ForecastResult> results = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            results.add(new ForecastResult(
                    variableId,
                    timestamps.get(i),
                    valueOrNaN(response.yhat().get(i)),
                    valueOrNaN(response.yhatLower().get(i)),
                    valueOrNaN(response.yhatUpper().get(i))
            ));
        }
        return results;
    }

    private static double valueOrNaN(Double value) {
        return value != null ? value : Double.NaN;
    }
}
