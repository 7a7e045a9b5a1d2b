package com.plantwatch.detector.config;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final DetectorProperties props;

    public StartupDiagnostics(DetectorProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var worker = props.worker();
        log.info("Worker config: enabled={}, pollInterval={}, coldStartLookback={}, errorBackoff={}, maxTimestampsPerCycle={}, runOnce={}",
                worker.enabled(), worker.pollInterval(), worker.coldStartLookback(), worker.errorBackoff(),
                worker.maxTimestampsPerCycle(), worker.runOnce());
        props.streams().forEach(stream -> log.info("Stream '{}': variables={}",
                stream.id(), stream.variables().isEmpty() ? "<all>" : stream.variables()));

        var retraining = props.retraining();
        log.info("Retraining config: enabled={}, target={} {}, catchUpWindow={}, trainOnStartup={}",
                retraining.enabled(), retraining.targetTime(), props.zone(), retraining.catchUpWindow(), retraining.trainOnStartup());

        var forecaster = props.forecaster();
        log.info("Model config: engine='{}', intervalWidth={}, thresholdMultiplier={}, minTrainingPoints={}, directory='{}', sidecarUrlPresent={}",
                forecaster.engine(), forecaster.intervalWidth(), props.scoring().thresholdMultiplier(),
                props.models().minTrainingPoints(), Path.of(props.models().directory()).toAbsolutePath(),
                forecaster.sidecar().hasBaseUrl());
    }
}
