package com.plantwatch.detector.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "detection_checkpoints")
public class CheckpointEntity {
    @Id
    @Column(name = "stream_id", length = 128)
    private String streamId;

    @Column(name = "last_processed_at", nullable = false)
    private Instant lastProcessedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public CheckpointEntity() {}

    public CheckpointEntity(String streamId, Instant lastProcessedAt, Instant updatedAt) {
        this.streamId = streamId;
        this.lastProcessedAt = lastProcessedAt;
        this.updatedAt = updatedAt;
    }

    public String getStreamId() { return streamId; }
    public void setStreamId(String streamId) { this.streamId = streamId; }
    public Instant getLastProcessedAt() { return lastProcessedAt; }
    public void setLastProcessedAt(Instant lastProcessedAt) { this.lastProcessedAt = lastProcessedAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
