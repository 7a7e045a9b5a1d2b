package com.plantwatch.detector.controller;

import com.plantwatch.detector.analytics.AnomalySummaryService;
import com.plantwatch.detector.controller.dto.AnomaliesListResponseDto;
import com.plantwatch.detector.controller.dto.AnomalyRecordDto;
import com.plantwatch.detector.controller.dto.AnomalySummaryResponseDto;
import com.plantwatch.detector.detection.StoreRetry;
import com.plantwatch.detector.repository.AnomalyRecordRepository;
import com.plantwatch.detector.web.RequestContextHolder;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AnomaliesController {

    static final int MAX_LIMIT = 10_000;

    private final AnomalyRecordRepository results;
    private final AnomalySummaryService summaryService;
    private final StoreRetry retry;

    public AnomaliesController(AnomalyRecordRepository results, AnomalySummaryService summaryService, StoreRetry retry) {
        this.results = results;
        this.summaryService = summaryService;
        this.retry = retry;
    }

    @GetMapping
    public ResponseEntity<AnomaliesListResponseDto> list(
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "variable", required = false) String variable,
            @RequestParam(value = "onlyAnomalies", required = false, defaultValue = "true") boolean onlyAnomalies,
            @RequestParam(value = "limit", required = false, defaultValue = "1000") int limit
    ) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        TimeRange range = TimeRange.parse(from, to);
        List<AnomalyRecordDto> records = retry.call("query anomaly records",
                        () -> results.findBetween(range.from(), range.to(), blankToNull(variable), onlyAnomalies, limit))
                .stream()
                .map(AnomalyRecordDto::from)
                .toList();
        return ResponseEntity.ok(new AnomaliesListResponseDto(records, records.size(), traceId()));
    }

    @GetMapping("/summary")
    public ResponseEntity<AnomalySummaryResponseDto> summary(
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to
    ) {
        TimeRange range = TimeRange.parse(from, to);
        return ResponseEntity.ok(new AnomalySummaryResponseDto(summaryService.summarize(range.from(), range.to()), traceId()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String traceId() {
        return RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
    }
}
