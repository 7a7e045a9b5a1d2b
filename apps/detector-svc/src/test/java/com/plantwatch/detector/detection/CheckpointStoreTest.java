package com.plantwatch.detector.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.model.AnomalyRecord;
import com.plantwatch.detector.repository.InMemoryAnomalyRecordRepository;
import com.plantwatch.detector.repository.InMemoryCheckpointRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class CheckpointStoreTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-02T00:00:00Z"), ZoneOffset.UTC);
    private final InMemoryCheckpointRepository checkpoints = new InMemoryCheckpointRepository(clock);
    private final InMemoryAnomalyRecordRepository results = new InMemoryAnomalyRecordRepository();
    private final StoreRetry retry = new StoreRetry(DetectorProperties.defaults().retry(), duration -> { });
    private final CheckpointStore store = new CheckpointStore(checkpoints, results, retry, clock, Duration.ofHours(24));

    @Test
    void coldStartLooksBackFromNow() {
        assertThat(store.resolve("global", List.of())).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    void storedCheckpointWinsWhenAhead() {
        checkpoints.advance("global", Instant.parse("2024-03-01T12:00:00Z"));
        results.appendBatch(List.of(record("A", Instant.parse("2024-03-01T11:00:00Z"))));

        assertThat(store.resolve("global", List.of())).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    void resultSinkWinsWhenCheckpointLagsBehind() {
        checkpoints.advance("global", Instant.parse("2024-03-01T10:00:00Z"));
        results.appendBatch(List.of(record("A", Instant.parse("2024-03-01T11:30:00Z"))));

        assertThat(store.resolve("global", List.of())).isEqualTo(Instant.parse("2024-03-01T11:30:00Z"));
    }

    @Test
    void sinkMaxIsRestrictedToStreamVariables() {
        results.appendBatch(List.of(
                record("A", Instant.parse("2024-03-01T08:00:00Z")),
                record("B", Instant.parse("2024-03-01T09:00:00Z"))));

        assertThat(store.resolve("stream-a", List.of("A"))).isEqualTo(Instant.parse("2024-03-01T08:00:00Z"));
    }

    @Test
    void advanceNeverMovesBackwards() {
        store.advance("global", Instant.parse("2024-03-01T12:00:00Z"));
        store.advance("global", Instant.parse("2024-03-01T06:00:00Z"));

        assertThat(checkpoints.find("global")).get()
                .satisfies(checkpoint -> assertThat(checkpoint.lastProcessedAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z")));
    }

    static AnomalyRecord record(String variableId, Instant timestamp) {
        return new AnomalyRecord(variableId, timestamp, 1, 1, 0, 2, 0, false, false, false, 0, 0d, null);
    }
}
