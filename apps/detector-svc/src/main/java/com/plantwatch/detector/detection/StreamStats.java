package com.plantwatch.detector.detection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;

/**
 * Cumulative counters of one stream. Logged at most once per interval rather than per cycle.
 */
public class StreamStats {

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong timestamps = new AtomicLong();
    private final AtomicLong records = new AtomicLong();
    private final AtomicLong anomalies = new AtomicLong();
    private final AtomicLong skippedVariables = new AtomicLong();
    private final AtomicLong failedVariables = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicReference<Instant> lastLoggedAt = new AtomicReference<>();
    private final Clock clock;
    private final Duration logInterval;

    public StreamStats(Clock clock, Duration logInterval) {
        this.clock = clock;
        this.logInterval = logInterval;
        this.lastLoggedAt.set(clock.instant());
    }

    public void record(DetectionCycleResult result) {
        cycles.incrementAndGet();
        if (result.failed()) {
            errors.incrementAndGet();
            return;
        }
        timestamps.addAndGet(result.timestampsProcessed());
        records.addAndGet(result.recordsWritten());
        anomalies.addAndGet(result.anomalies());
        skippedVariables.addAndGet(result.skippedVariables().size());
        failedVariables.addAndGet(result.failedVariables().size());
    }

    /**
     * @return true when a summary line was written
     */
    public boolean logIfDue(Logger log, String streamId) {
        Instant now = clock.instant();
        Instant last = lastLoggedAt.get();
        if (Duration.between(last, now).compareTo(logInterval) < 0 || !lastLoggedAt.compareAndSet(last, now)) {
            return false;
        }
        Snapshot s = snapshot();
        log.info("Stream {} stats: cycles={}, timestamps={}, records={}, anomalies={}, skippedVariables={}, failedVariables={}, errors={}",
                streamId, s.cycles(), s.timestamps(), s.records(), s.anomalies(), s.skippedVariables(), s.failedVariables(), s.errors());
        return true;
    }

    public Snapshot snapshot() {
        return new Snapshot(cycles.get(), timestamps.get(), records.get(), anomalies.get(),
                skippedVariables.get(), failedVariables.get(), errors.get());
    }

    public record Snapshot(
            long cycles,
            long timestamps,
            long records,
            long anomalies,
            long skippedVariables,
            long failedVariables,
            long errors
    ) {}
}
