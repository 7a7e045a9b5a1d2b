package com.plantwatch.detector.controller.dto;

import com.plantwatch.detector.analytics.AnomalySummaryService;
import java.util.List;

public record AnomalySummaryResponseDto(List<AnomalySummaryService.VariableAnomalySummary> variables, String traceId) {
}
