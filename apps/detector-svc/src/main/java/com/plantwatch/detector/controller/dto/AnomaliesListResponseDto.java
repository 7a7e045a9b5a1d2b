package com.plantwatch.detector.controller.dto;

import java.util.List;

public record AnomaliesListResponseDto(List<AnomalyRecordDto> records, int count, String traceId) {
}
