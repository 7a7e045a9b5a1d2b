package com.plantwatch.detector.controller.dto;

import com.plantwatch.detector.detection.StreamStatus;
import java.util.List;

public record StreamsResponseDto(List<StreamStatus> streams) {
}
