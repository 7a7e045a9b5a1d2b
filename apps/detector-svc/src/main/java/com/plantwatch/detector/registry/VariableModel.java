package com.plantwatch.detector.registry;

import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.model.VariableSummary;
import java.time.Instant;

public record VariableModel(
        String variableId,
        Forecaster forecaster,
        VariableSummary summary,
        Instant trainedAt
) {}
