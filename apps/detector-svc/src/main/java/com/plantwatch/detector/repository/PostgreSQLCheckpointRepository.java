package com.plantwatch.detector.repository;

import com.plantwatch.detector.entity.CheckpointEntity;
import com.plantwatch.detector.model.Checkpoint;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Primary
public class PostgreSQLCheckpointRepository implements CheckpointRepository {

    private final JpaCheckpointRepository jpaCheckpointRepository;
    private final Clock clock;

    public PostgreSQLCheckpointRepository(JpaCheckpointRepository jpaCheckpointRepository, Clock clock) {
        this.jpaCheckpointRepository = jpaCheckpointRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Checkpoint> find(String streamId) {
        return jpaCheckpointRepository.findById(streamId).map(this::toModel);
    }

    @Override
    @Transactional
    public Checkpoint advance(String streamId, Instant processedThrough) {
        jpaCheckpointRepository.upsertMonotonic(streamId, processedThrough, clock.instant());
        return jpaCheckpointRepository.findById(streamId)
                .map(this::toModel)
                .orElseThrow(() -> new IllegalStateException("Checkpoint for " + streamId + " missing after upsert"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Checkpoint> findAll() {
        return jpaCheckpointRepository.findAll().stream()
                .map(this::toModel)
                .sorted(Comparator.comparing(Checkpoint::streamId))
                .toList();
    }

    private Checkpoint toModel(CheckpointEntity entity) {
        return new Checkpoint(entity.getStreamId(), entity.getLastProcessedAt(), entity.getUpdatedAt());
    }
}
