package com.plantwatch.detector.controller;

import com.plantwatch.detector.analytics.ModelEvaluationService;
import com.plantwatch.detector.controller.dto.EvaluationResponseDto;
import com.plantwatch.detector.web.RequestContextHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/evaluation")
public class EvaluationController {

    private final ModelEvaluationService evaluationService;

    public EvaluationController(ModelEvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @GetMapping
    public ResponseEntity<EvaluationResponseDto> evaluate(
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to
    ) {
        TimeRange range = TimeRange.parse(from, to);
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return ResponseEntity.ok(new EvaluationResponseDto(evaluationService.evaluate(range.from(), range.to()), traceId));
    }
}
