package com.plantwatch.detector.controller;

import com.plantwatch.detector.controller.dto.StreamsResponseDto;
import com.plantwatch.detector.detection.DetectionWorkerManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/streams")
public class StreamsController {

    private final DetectionWorkerManager workerManager;

    public StreamsController(DetectionWorkerManager workerManager) {
        this.workerManager = workerManager;
    }

    @GetMapping
    public ResponseEntity<StreamsResponseDto> list() {
        return ResponseEntity.ok(new StreamsResponseDto(workerManager.statuses()));
    }
}
