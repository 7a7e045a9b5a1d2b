package com.plantwatch.detector.controller.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RetrainResponseDto(Instant trainedAt, List<String> trained, Map<String, String> failed, String traceId) {
}
