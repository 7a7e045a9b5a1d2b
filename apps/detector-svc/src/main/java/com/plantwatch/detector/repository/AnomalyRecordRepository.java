package com.plantwatch.detector.repository;

import com.plantwatch.detector.model.AnomalyRecord;
import com.plantwatch.detector.model.VariableAnomalyStats;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only result sink. Records are never updated; a batch is either fully written or not at all.
 */
public interface AnomalyRecordRepository {

    /**
     * @return number of records written
     */
    int appendBatch(List<AnomalyRecord> records);

    /**
     * Latest record timestamp among the given variables (all variables when empty).
     */
    Optional<Instant> findMaxTimestamp(Collection<String> variables);

    /**
     * Records ordered by (timestamp, variable id).
     *
     * @param variableId restrict to one variable, or null for all
     */
    List<AnomalyRecord> findBetween(Instant fromInclusive, Instant toExclusive, String variableId, boolean onlyAnomalies, int limit);

    /**
     * Aggregates every record in the range, one entry per variable, ordered by variable id.
     */
    List<VariableAnomalyStats> aggregateByVariable(Instant fromInclusive, Instant toExclusive);
}
