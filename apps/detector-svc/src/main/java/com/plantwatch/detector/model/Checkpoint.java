package com.plantwatch.detector.model;

import java.time.Instant;

public record Checkpoint(String streamId, Instant lastProcessedAt, Instant updatedAt) {
}
