package com.plantwatch.detector.repository;

import com.plantwatch.detector.model.Reading;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Read side of the process-readings feed. An empty variable collection means every variable.
 * Results are ordered by (timestamp, variable id).
 */
public interface ReadingRepository {

    /**
     * Readings strictly newer than {@code after}, limited to the first {@code maxTimestamps}
     * distinct timestamps so that a timestamp is never split across two cycles.
     */
    List<Reading> findAfter(Instant after, Collection<String> variables, int maxTimestamps);

    /**
     * @param fromInclusive lower bound, or null for no bound
     * @param toExclusive upper bound, or null for no bound
     */
    List<Reading> findBetween(Instant fromInclusive, Instant toExclusive, Collection<String> variables);
}
