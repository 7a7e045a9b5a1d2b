package com.plantwatch.detector.detection;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.model.Checkpoint;
import com.plantwatch.detector.repository.AnomalyRecordRepository;
import com.plantwatch.detector.repository.CheckpointRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Resolves where a stream resumes. Persisting results and advancing the checkpoint are two separate
 * writes, so after a crash between them the result sink may be ahead of the stored checkpoint; the
 * later of the two wins.
 */
@Component
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final CheckpointRepository checkpoints;
    private final AnomalyRecordRepository results;
    private final StoreRetry retry;
    private final Clock clock;
    private final Duration coldStartLookback;

    @Autowired
    public CheckpointStore(CheckpointRepository checkpoints,
                           AnomalyRecordRepository results,
                           StoreRetry retry,
                           Clock clock,
                           DetectorProperties properties) {
        this(checkpoints, results, retry, clock, properties.worker().coldStartLookback());
    }

    CheckpointStore(CheckpointRepository checkpoints,
                    AnomalyRecordRepository results,
                    StoreRetry retry,
                    Clock clock,
                    Duration coldStartLookback) {
        this.checkpoints = checkpoints;
        this.results = results;
        this.retry = retry;
        this.clock = clock;
        this.coldStartLookback = coldStartLookback;
    }

    public Instant resolve(String streamId, Collection<String> variables) {
        Optional<Instant> stored = retry.call("load checkpoint " + streamId,
                () -> checkpoints.find(streamId).map(Checkpoint::lastProcessedAt));
        Optional<Instant> sinkMax = retry.call("load result max timestamp " + streamId,
                () -> results.findMaxTimestamp(variables));
        if (stored.isPresent() && sinkMax.isPresent()) {
            if (sinkMax.get().isAfter(stored.get())) {
                log.warn("Stream {}: result sink is ahead of the checkpoint ({} > {}); resuming from the sink",
                        streamId, sinkMax.get(), stored.get());
                return sinkMax.get();
            }
            return stored.get();
        }
        if (stored.isPresent()) {
            return stored.get();
        }
        if (sinkMax.isPresent()) {
            log.warn("Stream {}: no stored checkpoint; resuming from result sink max {}", streamId, sinkMax.get());
            return sinkMax.get();
        }
        Instant coldStart = clock.instant().minus(coldStartLookback);
        log.info("Stream {}: cold start from {} (lookback {})", streamId, coldStart, coldStartLookback);
        return coldStart;
    }

    public Checkpoint advance(String streamId, Instant processedThrough) {
        return retry.call("advance checkpoint " + streamId, () -> checkpoints.advance(streamId, processedThrough));
    }

    public List<Checkpoint> all() {
        return checkpoints.findAll();
    }
}
