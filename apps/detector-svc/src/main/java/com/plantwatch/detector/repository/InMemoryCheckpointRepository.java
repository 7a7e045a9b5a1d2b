package com.plantwatch.detector.repository;

import com.plantwatch.detector.model.Checkpoint;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCheckpointRepository implements CheckpointRepository {

    private final Map<String, Checkpoint> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryCheckpointRepository(Clock clock) {
        this.clock = clock;
    }

    public InMemoryCheckpointRepository() {
        this(Clock.systemUTC());
    }

    @Override
    public Optional<Checkpoint> find(String streamId) {
        return Optional.ofNullable(storage.get(streamId));
    }

    @Override
    public Checkpoint advance(String streamId, Instant processedThrough) {
        return storage.merge(streamId, new Checkpoint(streamId, processedThrough, clock.instant()), (existing, proposed) ->
                existing.lastProcessedAt().isAfter(proposed.lastProcessedAt())
                        ? new Checkpoint(streamId, existing.lastProcessedAt(), proposed.updatedAt())
                        : proposed);
    }

    @Override
    public List<Checkpoint> findAll() {
        return storage.values().stream()
                .sorted(Comparator.comparing(Checkpoint::streamId))
                .toList();
    }
}
