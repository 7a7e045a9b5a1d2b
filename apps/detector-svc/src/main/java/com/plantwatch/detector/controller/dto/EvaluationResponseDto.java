package com.plantwatch.detector.controller.dto;

import com.plantwatch.detector.analytics.ModelEvaluationService;
import java.util.List;

public record EvaluationResponseDto(List<ModelEvaluationService.VariableEvaluation> variables, String traceId) {
}
