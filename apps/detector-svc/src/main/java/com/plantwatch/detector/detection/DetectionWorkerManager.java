package com.plantwatch.detector.detection;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.registry.ModelRegistryHolder;
import com.plantwatch.detector.repository.AnomalyRecordRepository;
import com.plantwatch.detector.repository.ReadingRepository;
import com.plantwatch.detector.scoring.AnomalyScorer;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs one {@link DetectionWorker} thread per configured stream for the lifetime of the context.
 * Stopping releases the idle waits and joins the threads; a cycle in progress completes first.
 */
@Component
public class DetectionWorkerManager implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(DetectionWorkerManager.class);

    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(60);

    private final DetectorProperties.Worker settings;
    private final List<DetectionWorker> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private volatile boolean running;

    public DetectionWorkerManager(DetectorProperties properties,
                                  ReadingRepository readings,
                                  AnomalyRecordRepository results,
                                  CheckpointStore checkpointStore,
                                  ModelRegistryHolder registryHolder,
                                  AnomalyScorer scorer,
                                  StoreRetry retry,
                                  Clock clock) {
        this.settings = properties.worker();
        for (DetectorProperties.Stream stream : properties.streams()) {
            workers.add(new DetectionWorker(stream, settings, readings, results, checkpointStore,
                    registryHolder, scorer, retry, new InterruptibleTicker(), clock));
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!settings.enabled() || settings.runOnce()) {
            log.info("Continuous detection not started (enabled={}, runOnce={})", settings.enabled(), settings.runOnce());
            return;
        }
        for (DetectionWorker worker : workers) {
            Thread thread = new Thread(worker, "detector-" + worker.streamId());
            thread.setUncaughtExceptionHandler((t, ex) -> log.error("Detection thread {} died", t.getName(), ex));
            threads.add(thread);
            thread.start();
        }
        running = true;
        log.info("Started {} detection worker(s)", workers.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        workers.forEach(DetectionWorker::stop);
        for (Thread thread : threads) {
            try {
                thread.join(JOIN_TIMEOUT.toMillis());
                if (thread.isAlive()) {
                    log.warn("Detection thread {} still running after {}", thread.getName(), JOIN_TIMEOUT);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} to stop", thread.getName());
                break;
            }
        }
        threads.clear();
        running = false;
        log.info("Detection workers stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * One cycle per stream, sequentially, on the calling thread.
     */
    public List<DetectionCycleResult> runAllOnce() {
        return workers.stream().map(DetectionWorker::runOnce).toList();
    }

    public List<StreamStatus> statuses() {
        return workers.stream()
                .map(worker -> new StreamStatus(
                        worker.streamId(),
                        worker.state(),
                        worker.checkpoint(),
                        worker.stats().snapshot(),
                        worker.lastResult().orElse(null)))
                .toList();
    }

    List<DetectionWorker> workers() {
        return workers;
    }
}
