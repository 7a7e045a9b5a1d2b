package com.plantwatch.detector.detection;

import java.time.Instant;

public record StreamStatus(
        String streamId,
        WorkerState state,
        Instant checkpoint,
        StreamStats.Snapshot stats,
        DetectionCycleResult lastCycle
) {}
