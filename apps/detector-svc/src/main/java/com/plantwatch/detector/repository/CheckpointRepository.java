package com.plantwatch.detector.repository;

import com.plantwatch.detector.model.Checkpoint;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CheckpointRepository {

    Optional<Checkpoint> find(String streamId);

    /**
     * Moves the stream's checkpoint to {@code processedThrough} unless the stored one is already
     * later. A checkpoint never moves backwards.
     *
     * @return the checkpoint as stored after the call
     */
    Checkpoint advance(String streamId, Instant processedThrough);

    List<Checkpoint> findAll();
}
