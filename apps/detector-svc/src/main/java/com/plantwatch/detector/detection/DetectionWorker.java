package com.plantwatch.detector.detection;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.error.InvalidInputException;
import com.plantwatch.detector.forecast.Forecaster;
import com.plantwatch.detector.model.AnomalyRecord;
import com.plantwatch.detector.model.Checkpoint;
import com.plantwatch.detector.model.ForecastResult;
import com.plantwatch.detector.model.Reading;
import com.plantwatch.detector.registry.ModelRegistry;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import com.plantwatch.detector.registry.VariableModel;
import com.plantwatch.detector.repository.AnomalyRecordRepository;
import com.plantwatch.detector.repository.ReadingRepository;
import com.plantwatch.detector.scoring.AnomalyScorer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Incremental detection loop of one stream: poll readings after the checkpoint, score them
 * against the current model registry, append the records and then advance the checkpoint.
 * <p>
 * The checkpoint only moves after a successful append. Any failure drops the cached
 * checkpoint so the next cycle re-resolves it from the stores.
 */
public class DetectionWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DetectionWorker.class);

    private static final Comparator<AnomalyRecord> RECORD_ORDER = Comparator.comparing(AnomalyRecord::timestamp)
            .thenComparing(AnomalyRecord::variableId);

    private final String streamId;
    private final List<String> variables;
    private final ReadingRepository readings;
    private final AnomalyRecordRepository results;
    private final CheckpointStore checkpointStore;
    private final ModelRegistryHolder registryHolder;
    private final AnomalyScorer scorer;
    private final StoreRetry retry;
    private final Ticker ticker;
    private final Duration pollInterval;
    private final Duration errorBackoff;
    private final int maxTimestampsPerCycle;
    private final StreamStats stats;

    private volatile WorkerState state = WorkerState.IDLE;
    private volatile Instant checkpoint;
    private volatile DetectionCycleResult lastResult;

    public DetectionWorker(DetectorProperties.Stream stream,
                           DetectorProperties.Worker settings,
                           ReadingRepository readings,
                           AnomalyRecordRepository results,
                           CheckpointStore checkpointStore,
                           ModelRegistryHolder registryHolder,
                           AnomalyScorer scorer,
                           StoreRetry retry,
                           Ticker ticker,
                           Clock clock) {
        this.streamId = stream.id();
        this.variables = stream.variables();
        this.readings = readings;
        this.results = results;
        this.checkpointStore = checkpointStore;
        this.registryHolder = registryHolder;
        this.scorer = scorer;
        this.retry = retry;
        this.ticker = ticker;
        this.pollInterval = settings.pollInterval();
        this.errorBackoff = settings.errorBackoff();
        this.maxTimestampsPerCycle = settings.maxTimestampsPerCycle();
        this.stats = new StreamStats(clock, settings.statsLogInterval());
    }

    @Override
    public void run() {
        MDC.put("stream", streamId);
        log.info("Detection worker for stream {} started (variables={}, pollInterval={})",
                streamId, variables.isEmpty() ? "<all>" : variables, pollInterval);
        try {
            while (!ticker.isStopped()) {
                DetectionCycleResult result = runOnce();
                stats.logIfDue(log, streamId);
                Duration wait = result.failed() ? errorBackoff : result.backlog() ? Duration.ZERO : pollInterval;
                if (!ticker.await(wait)) {
                    break;
                }
                if (state == WorkerState.ERROR) {
                    state = WorkerState.IDLE;
                }
            }
        } finally {
            log.info("Detection worker for stream {} stopped", streamId);
            MDC.remove("stream");
        }
    }

    /**
     * Executes a single cycle. Never throws; failures are reported in the result.
     */
    public DetectionCycleResult runOnce() {
        DetectionCycleResult result;
        try {
            result = cycle();
        } catch (RuntimeException ex) {
            WorkerState failedIn = state;
            state = WorkerState.ERROR;
            checkpoint = null;
            log.error("Stream {}: cycle failed while {}", streamId, failedIn, ex);
            result = new DetectionCycleResult(streamId, 0, 0, 0, List.of(), List.of(), null, false,
                    WorkerState.ERROR, ex.getMessage());
        }
        lastResult = result;
        stats.record(result);
        return result;
    }

    private DetectionCycleResult cycle() {
        if (checkpoint == null) {
            checkpoint = checkpointStore.resolve(streamId, variables);
        }
        Instant from = checkpoint;

        state = WorkerState.POLLING;
        List<Reading> batch = retry.call("poll readings " + streamId,
                () -> readings.findAfter(from, variables, maxTimestampsPerCycle));
        if (batch.isEmpty()) {
            state = WorkerState.IDLE;
            return new DetectionCycleResult(streamId, 0, 0, 0, List.of(), List.of(), from, false, state, null);
        }
        long distinctTimestamps = batch.stream().map(Reading::timestamp).distinct().count();
        Instant maxTimestamp = batch.stream().map(Reading::timestamp).max(Comparator.naturalOrder()).orElseThrow();

        state = WorkerState.SCORING;
        ScoredBatch scored = score(registryHolder.current(), batch);

        state = WorkerState.PERSISTING;
        List<AnomalyRecord> records = scored.records();
        int written = records.isEmpty() ? 0 : retry.call("append results " + streamId, () -> results.appendBatch(records));

        state = WorkerState.CHECKPOINTING;
        Checkpoint advanced = checkpointStore.advance(streamId, maxTimestamp);
        checkpoint = advanced.lastProcessedAt();

        state = WorkerState.IDLE;
        int anomalies = (int) records.stream().filter(AnomalyRecord::anomaly).count();
        if (anomalies > 0) {
            log.info("Stream {}: {} anomalies in {} records up to {}", streamId, anomalies, written, maxTimestamp);
        } else {
            log.debug("Stream {}: {} records up to {}, no anomalies", streamId, written, maxTimestamp);
        }
        return new DetectionCycleResult(
                streamId,
                (int) distinctTimestamps,
                written,
                anomalies,
                scored.skipped(),
                scored.failed(),
                checkpoint,
                distinctTimestamps >= maxTimestampsPerCycle,
                state,
                null
        );
    }

    private ScoredBatch score(ModelRegistry registry, List<Reading> batch) {
        Map<String, List<Reading>> byVariable = new TreeMap<>();
        for (Reading reading : batch) {
            byVariable.computeIfAbsent(reading.variableId(), key -> new ArrayList<>()).add(reading);
        }
        List<AnomalyRecord> records = new ArrayList<>(batch.size());
        List<String> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        byVariable.forEach((variableId, variableReadings) -> {
            Optional<VariableModel> model = registry.find(variableId);
            if (model.isEmpty()) {
                log.warn("Stream {}: no model for {}, {} readings skipped", streamId, variableId, variableReadings.size());
                skipped.add(variableId);
                return;
            }
            try {
                records.addAll(scoreVariable(model.get().forecaster(), variableReadings));
            } catch (RuntimeException ex) {
                log.warn("Stream {}: scoring {} failed, variable excluded from this batch", streamId, variableId, ex);
                failed.add(variableId);
            }
        });
        records.sort(RECORD_ORDER);
        return new ScoredBatch(records, skipped, failed);
    }

    private List<AnomalyRecord> scoreVariable(Forecaster forecaster, List<Reading> variableReadings) {
        List<ForecastResult> forecasts = forecaster.forecastAll(
                variableReadings.stream().map(Reading::timestamp).toList());
        List<Double> residuals = new ArrayList<>(variableReadings.size());
        for (int i = 0; i < variableReadings.size(); i++) {
            residuals.add(variableReadings.get(i).value() - forecasts.get(i).pointEstimate());
        }
        double residualStd = AnomalyScorer.residualStd(residuals);
        List<AnomalyRecord> scored = new ArrayList<>(variableReadings.size());
        for (int i = 0; i < variableReadings.size(); i++) {
            try {
                scored.add(scorer.score(variableReadings.get(i), forecasts.get(i), residualStd));
            } catch (InvalidInputException ex) {
                log.warn("Stream {}: {}", streamId, ex.getMessage());
            }
        }
        return scored;
    }

    public void stop() {
        ticker.stop();
    }

    public String streamId() {
        return streamId;
    }

    public List<String> variables() {
        return variables;
    }

    public WorkerState state() {
        return state;
    }

    public Instant checkpoint() {
        return checkpoint;
    }

    public Optional<DetectionCycleResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    public StreamStats stats() {
        return stats;
    }

    private record ScoredBatch(List<AnomalyRecord> records, List<String> skipped, List<String> failed) {}
}
