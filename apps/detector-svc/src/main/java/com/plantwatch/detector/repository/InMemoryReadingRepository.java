package com.plantwatch.detector.repository;

import com.plantwatch.detector.model.Reading;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryReadingRepository implements ReadingRepository {

    private static final Comparator<Reading> ORDER = Comparator.comparing(Reading::timestamp)
            .thenComparing(Reading::variableId);

    private final List<Reading> storage = new CopyOnWriteArrayList<>();

    public void add(Reading reading) {
        storage.add(reading);
    }

    public void addAll(Collection<Reading> readings) {
        storage.addAll(readings);
    }

    @Override
    public List<Reading> findAfter(Instant after, Collection<String> variables, int maxTimestamps) {
        List<Reading> candidates = storage.stream()
                .filter(reading -> reading.timestamp().isAfter(after))
                .filter(reading -> matches(reading, variables))
                .sorted(ORDER)
                .toList();
        Set<Instant> allowed = candidates.stream()
                .map(Reading::timestamp)
                .distinct()
                .limit(maxTimestamps)
                .collect(Collectors.toSet());
        return candidates.stream()
                .filter(reading -> allowed.contains(reading.timestamp()))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Reading> findBetween(Instant fromInclusive, Instant toExclusive, Collection<String> variables) {
        return storage.stream()
                .filter(reading -> fromInclusive == null || !reading.timestamp().isBefore(fromInclusive))
                .filter(reading -> toExclusive == null || reading.timestamp().isBefore(toExclusive))
                .filter(reading -> matches(reading, variables))
                .sorted(ORDER)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static boolean matches(Reading reading, Collection<String> variables) {
        return variables == null || variables.isEmpty() || variables.contains(reading.variableId());
    }
}
