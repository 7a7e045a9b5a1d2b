package com.plantwatch.detector.forecast;

import com.plantwatch.detector.model.ForecastResult;
import java.time.Instant;
import java.util.List;

/**
 * A trained model for one variable. Implementations are immutable and safe to call from
 * several detection streams at once.
 */
public interface Forecaster {

    String variableId();

    ForecastResult forecast(Instant timestamp);

    /**
     * Forecasts for several timestamps, in the given order. Remote models override this to
     * answer in one round trip.
     */
    default List<ForecastResult> forecastAll(List<Instant> timestamps) {
        return timestamps.stream().map(this::forecast).toList();
    }
}
