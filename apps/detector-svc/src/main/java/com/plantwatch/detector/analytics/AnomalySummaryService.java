package com.plantwatch.detector.analytics;

import com.plantwatch.detector.detection.StoreRetry;
import com.plantwatch.detector.model.VariableAnomalyStats;
import com.plantwatch.detector.repository.AnomalyRecordRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Per-variable rollup of stored anomaly records, most anomalous variables first. Aggregation runs
 * in the result store, so the rollup always covers the whole range.
 */
@Service
public class AnomalySummaryService {

    private final AnomalyRecordRepository results;
    private final StoreRetry retry;

    public AnomalySummaryService(AnomalyRecordRepository results, StoreRetry retry) {
        this.results = results;
        this.retry = retry;
    }

    public record VariableAnomalySummary(
            String variableId,
            long nAnomalies,
            double anomalyRate,
            double avgScore,
            double maxScore,
            double avgResidual,
            Double stdResidual,
            long nPoints
    ) {}

    public List<VariableAnomalySummary> summarize(Instant fromInclusive, Instant toExclusive) {
        List<VariableAnomalyStats> stats = retry.call("aggregate anomaly records",
                () -> results.aggregateByVariable(fromInclusive, toExclusive));
        return summarize(stats);
    }

    static List<VariableAnomalySummary> summarize(List<VariableAnomalyStats> stats) {
        return stats.stream()
                .filter(variable -> variable.nPoints() > 0)
                .map(variable -> new VariableAnomalySummary(
                        variable.variableId(),
                        variable.nAnomalies(),
                        round((double) variable.nAnomalies() / variable.nPoints()),
                        round(variable.avgScore()),
                        round(variable.maxScore()),
                        round(variable.avgResidual()),
                        variable.stdResidual() != null ? round(variable.stdResidual()) : null,
                        variable.nPoints()))
                .sorted(Comparator.comparingLong(VariableAnomalySummary::nAnomalies).reversed()
                        .thenComparing(VariableAnomalySummary::variableId))
                .toList();
    }

    private static double round(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
