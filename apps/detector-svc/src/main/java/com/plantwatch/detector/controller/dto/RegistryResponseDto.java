package com.plantwatch.detector.controller.dto;

import com.plantwatch.detector.model.VariableSummary;
import com.plantwatch.detector.registry.TrainingConfiguration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record RegistryResponseDto(
        String engine,
        Instant trainedAt,
        TrainingConfiguration configuration,
        int variableCount,
        List<VariableModelDto> variables,
        Retraining retraining
) {

    public record VariableModelDto(String variableId, VariableSummary summary, Instant trainedAt) {}

    public record Retraining(LocalDate lastTrainingDate, long failures) {}
}
