package com.plantwatch.detector.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.plantwatch.detector.model.Reading;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryReadingRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final InMemoryReadingRepository repository = new InMemoryReadingRepository();

    @Test
    void findAfterIsExclusiveOrderedAndLimitedByTimestamps() {
        repository.addAll(List.of(
                reading("B", 2), reading("A", 2),
                reading("A", 0), reading("A", 1), reading("B", 1),
                reading("A", 3)));

        List<Reading> batch = repository.findAfter(at(0), List.of(), 2);

        assertThat(batch).extracting(Reading::variableId, Reading::timestamp)
                .containsExactly(
                        tuple("A", at(1)),
                        tuple("B", at(1)),
                        tuple("A", at(2)),
                        tuple("B", at(2)));
    }

    @Test
    void findAfterRestrictsToVariables() {
        repository.addAll(List.of(reading("A", 1), reading("B", 1), reading("C", 2)));

        assertThat(repository.findAfter(at(0), List.of("B", "C"), 100))
                .extracting(Reading::variableId)
                .containsExactly("B", "C");
    }

    @Test
    void findBetweenIsHalfOpen() {
        repository.addAll(List.of(reading("A", 0), reading("A", 1), reading("A", 2)));

        assertThat(repository.findBetween(at(0), at(2), List.of()))
                .extracting(Reading::timestamp)
                .containsExactly(at(0), at(1));
        assertThat(repository.findBetween(null, null, null)).hasSize(3);
    }

    private static Reading reading(String variableId, int minutes) {
        return new Reading(variableId, at(minutes), minutes);
    }

    private static Instant at(int minutes) {
        return T0.plusSeconds(60L * minutes);
    }
}
