package com.plantwatch.detector.detection;

import java.util.List;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * With {@code detector.worker.run-once=true} every stream runs a single cycle and the process exits:
 * 0 when all cycles succeeded, 1 otherwise.
 */
@Component
@ConditionalOnProperty(prefix = "detector.worker", name = "run-once", havingValue = "true")
public class DetectionRunOnceRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DetectionRunOnceRunner.class);

    private final DetectionWorkerManager manager;
    private final IntConsumer exit;

    @Autowired
    public DetectionRunOnceRunner(DetectionWorkerManager manager, ConfigurableApplicationContext context) {
        this(manager, code -> System.exit(SpringApplication.exit(context, () -> code)));
    }

    DetectionRunOnceRunner(DetectionWorkerManager manager, IntConsumer exit) {
        this.manager = manager;
        this.exit = exit;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<DetectionCycleResult> results = manager.runAllOnce();
        results.forEach(result -> log.info("Stream {}: {} timestamps, {} records, {} anomalies, state={}",
                result.streamId(), result.timestampsProcessed(), result.recordsWritten(), result.anomalies(), result.state()));
        int code = results.stream().anyMatch(DetectionCycleResult::failed) ? 1 : 0;
        exit.accept(code);
    }
}
