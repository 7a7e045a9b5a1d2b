package com.plantwatch.detector.controller;

import com.plantwatch.detector.controller.dto.RegistryResponseDto;
import com.plantwatch.detector.controller.dto.RetrainResponseDto;
import com.plantwatch.detector.registry.ModelRegistry;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import com.plantwatch.detector.registry.ModelTrainer;
import com.plantwatch.detector.retraining.RetrainingScheduler;
import com.plantwatch.detector.retraining.RetrainingService;
import com.plantwatch.detector.web.RequestContextHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/registry")
public class RegistryController {

    private final ModelRegistryHolder registryHolder;
    private final RetrainingService retrainingService;
    private final RetrainingScheduler retrainingScheduler;

    public RegistryController(ModelRegistryHolder registryHolder,
                              RetrainingService retrainingService,
                              RetrainingScheduler retrainingScheduler) {
        this.registryHolder = registryHolder;
        this.retrainingService = retrainingService;
        this.retrainingScheduler = retrainingScheduler;
    }

    @GetMapping
    public ResponseEntity<RegistryResponseDto> current() {
        ModelRegistry registry = registryHolder.current();
        return ResponseEntity.ok(new RegistryResponseDto(
                registry.configuration().engine(),
                registry.trainedAt(),
                registry.configuration(),
                registry.size(),
                registry.models().values().stream()
                        .map(model -> new RegistryResponseDto.VariableModelDto(model.variableId(), model.summary(), model.trainedAt()))
                        .toList(),
                new RegistryResponseDto.Retraining(retrainingScheduler.lastTrainingDate(), retrainingScheduler.failures())
        ));
    }

    @GetMapping("/{variableId}")
    public ResponseEntity<RegistryResponseDto.VariableModelDto> variable(@PathVariable("variableId") String variableId) {
        var model = registryHolder.current().lookup(variableId);
        return ResponseEntity.ok(new RegistryResponseDto.VariableModelDto(model.variableId(), model.summary(), model.trainedAt()));
    }

    @PostMapping("/retrain")
    public ResponseEntity<RetrainResponseDto> retrain() {
        ModelTrainer.TrainingReport report = retrainingService.retrain("manual");
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return ResponseEntity.ok(new RetrainResponseDto(report.registry().trainedAt(), report.trained(), report.failed(), traceId));
    }
}
