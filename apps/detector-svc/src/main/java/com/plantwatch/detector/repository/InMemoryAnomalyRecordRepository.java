package com.plantwatch.detector.repository;

import com.plantwatch.detector.model.AnomalyRecord;
import com.plantwatch.detector.model.VariableAnomalyStats;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAnomalyRecordRepository implements AnomalyRecordRepository {

    private final List<AnomalyRecord> storage = new ArrayList<>();

    @Override
    public synchronized int appendBatch(List<AnomalyRecord> records) {
        storage.addAll(records);
        return records.size();
    }

    @Override
    public synchronized Optional<Instant> findMaxTimestamp(Collection<String> variables) {
        return storage.stream()
                .filter(record -> variables == null || variables.isEmpty() || variables.contains(record.variableId()))
                .map(AnomalyRecord::timestamp)
                .max(Comparator.naturalOrder());
    }

    @Override
    public synchronized List<AnomalyRecord> findBetween(Instant fromInclusive, Instant toExclusive, String variableId, boolean onlyAnomalies, int limit) {
        return storage.stream()
                .filter(record -> fromInclusive == null || !record.timestamp().isBefore(fromInclusive))
                .filter(record -> toExclusive == null || record.timestamp().isBefore(toExclusive))
                .filter(record -> variableId == null || variableId.equals(record.variableId()))
                .filter(record -> !onlyAnomalies || record.anomaly())
                .sorted(Comparator.comparing(AnomalyRecord::timestamp).thenComparing(AnomalyRecord::variableId))
                .limit(limit)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public synchronized List<VariableAnomalyStats> aggregateByVariable(Instant fromInclusive, Instant toExclusive) {
        Map<String, List<AnomalyRecord>> byVariable = storage.stream()
                .filter(record -> fromInclusive == null || !record.timestamp().isBefore(fromInclusive))
                .filter(record -> toExclusive == null || record.timestamp().isBefore(toExclusive))
                .collect(Collectors.groupingBy(AnomalyRecord::variableId, TreeMap::new, Collectors.toList()));
        List<VariableAnomalyStats> stats = new ArrayList<>(byVariable.size());
        byVariable.forEach((variableId, records) -> {
            int n = records.size();
            double avgResidual = records.stream().mapToDouble(AnomalyRecord::residual).average().orElse(0d);
            Double stdResidual = null;
            if (n > 1) {
                double sumSquares = records.stream()
                        .mapToDouble(record -> Math.pow(record.residual() - avgResidual, 2))
                        .sum();
                stdResidual = Math.sqrt(sumSquares / (n - 1));
            }
            stats.add(new VariableAnomalyStats(
                    variableId,
                    n,
                    records.stream().filter(AnomalyRecord::anomaly).count(),
                    records.stream().mapToDouble(AnomalyRecord::anomalyScore).average().orElse(0d),
                    records.stream().mapToDouble(AnomalyRecord::anomalyScore).max().orElse(0d),
                    avgResidual,
                    stdResidual
            ));
        });
        return stats;
    }

    public synchronized List<AnomalyRecord> all() {
        return List.copyOf(storage);
    }
}
