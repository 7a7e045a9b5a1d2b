package com.plantwatch.detector.detection;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one poll-score-persist-checkpoint cycle of a stream.
 *
 * @param checkpoint checkpoint in effect after the cycle
 * @param backlog true when the poll hit the per-cycle timestamp limit, so more data is waiting
 */
public record DetectionCycleResult(
        String streamId,
        int timestampsProcessed,
        int recordsWritten,
        int anomalies,
        List<String> skippedVariables,
        List<String> failedVariables,
        Instant checkpoint,
        boolean backlog,
        WorkerState state,
        String error
) {

    public boolean failed() {
        return state == WorkerState.ERROR;
    }
}
