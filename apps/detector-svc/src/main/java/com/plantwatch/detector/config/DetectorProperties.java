package com.plantwatch.detector.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "detector")
public record DetectorProperties(
        String zone,
        Worker worker,
        Retraining retraining,
        Models models,
        Scoring scoring,
        Forecaster forecaster,
        Retry retry,
        List<Stream> streams
) {

    public static final String GLOBAL_STREAM = "global";

    @ConstructorBinding
    public DetectorProperties {
        if (zone == null || zone.isBlank()) {
            zone = "UTC";
        }
        ZoneId.of(zone);
        worker = worker != null ? worker : new Worker(null, null, null, null, null, null, null);
        retraining = retraining != null ? retraining : new Retraining(null, null, null, null, null, null);
        models = models != null ? models : new Models(null, null);
        scoring = scoring != null ? scoring : new Scoring(null);
        forecaster = forecaster != null ? forecaster : new Forecaster(null, null, null, null, null);
        retry = retry != null ? retry : new Retry(null, null, null, null);
        if (streams == null || streams.isEmpty()) {
            streams = List.of(new Stream(GLOBAL_STREAM, List.of()));
        } else {
            long distinct = streams.stream().map(Stream::id).distinct().count();
            if (distinct != streams.size()) {
                throw new IllegalArgumentException("stream ids must be unique");
            }
            requireDisjoint(streams);
            streams = List.copyOf(streams);
        }
    }

    public static DetectorProperties defaults() {
        return new DetectorProperties(null, null, null, null, null, null, null, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public record Worker(
            Boolean enabled,
            Duration pollInterval,
            Duration coldStartLookback,
            Duration errorBackoff,
            Duration statsLogInterval,
            Integer maxTimestampsPerCycle,
            Boolean runOnce
    ) {
        public Worker {
            enabled = enabled == null || enabled;
            pollInterval = positiveOrDefault(pollInterval, Duration.ofSeconds(60), "pollInterval");
            coldStartLookback = positiveOrDefault(coldStartLookback, Duration.ofHours(24), "coldStartLookback");
            errorBackoff = positiveOrDefault(errorBackoff, Duration.ofSeconds(30), "errorBackoff");
            statsLogInterval = positiveOrDefault(statsLogInterval, Duration.ofMinutes(10), "statsLogInterval");
            if (maxTimestampsPerCycle == null) {
                maxTimestampsPerCycle = 10_000;
            } else if (maxTimestampsPerCycle <= 0) {
                throw new IllegalArgumentException("maxTimestampsPerCycle must be positive");
            }
            runOnce = runOnce != null && runOnce;
        }
    }

    public record Retraining(
            Boolean enabled,
            Integer hour,
            Integer minute,
            Duration catchUpWindow,
            Duration tickInterval,
            Boolean trainOnStartup
    ) {
        public Retraining {
            enabled = enabled == null || enabled;
            hour = hour != null ? hour : 2;
            minute = minute != null ? minute : 0;
            if (hour < 0 || hour > 23) {
                throw new IllegalArgumentException("hour must be between 0 and 23");
            }
            if (minute < 0 || minute > 59) {
                throw new IllegalArgumentException("minute must be between 0 and 59");
            }
            catchUpWindow = positiveOrDefault(catchUpWindow, Duration.ofMinutes(15), "catchUpWindow");
            tickInterval = positiveOrDefault(tickInterval, Duration.ofMinutes(1), "tickInterval");
            trainOnStartup = trainOnStartup != null && trainOnStartup;
        }

        public LocalTime targetTime() {
            return LocalTime.of(hour, minute);
        }
    }

    public record Models(String directory, Integer minTrainingPoints) {
        public Models {
            if (directory == null || directory.isBlank()) {
                directory = "models";
            }
            if (minTrainingPoints == null) {
                minTrainingPoints = 10;
            } else if (minTrainingPoints < 2) {
                throw new IllegalArgumentException("minTrainingPoints must be at least 2");
            }
        }
    }

    public record Scoring(Double thresholdMultiplier) {
        public Scoring {
            if (thresholdMultiplier == null) {
                thresholdMultiplier = 2.0d;
            } else if (!(thresholdMultiplier > 0)) {
                throw new IllegalArgumentException("thresholdMultiplier must be positive");
            }
        }
    }

    public record Forecaster(
            String engine,
            Double intervalWidth,
            Boolean dailySeasonality,
            Boolean weeklySeasonality,
            Sidecar sidecar
    ) {
        public Forecaster {
            engine = engine == null || engine.isBlank() ? "profile" : engine.trim().toLowerCase();
            if (!engine.equals("profile") && !engine.equals("sidecar")) {
                throw new IllegalArgumentException("engine must be 'profile' or 'sidecar' (actual='" + engine + "')");
            }
            if (intervalWidth == null) {
                intervalWidth = 0.95d;
            } else if (!(intervalWidth > 0 && intervalWidth < 1)) {
                throw new IllegalArgumentException("intervalWidth must be in (0, 1)");
            }
            dailySeasonality = dailySeasonality == null || dailySeasonality;
            weeklySeasonality = weeklySeasonality == null || weeklySeasonality;
            if (engine.equals("sidecar") && (sidecar == null || !sidecar.hasBaseUrl())) {
                throw new IllegalArgumentException("sidecar.baseUrl must be provided for the sidecar engine");
            }
            sidecar = sidecar != null ? sidecar : new Sidecar(null, null);
        }
    }

    public record Sidecar(String baseUrl, Duration timeout) {
        public Sidecar {
            timeout = positiveOrDefault(timeout, Duration.ofSeconds(30), "timeout");
        }

        public boolean hasBaseUrl() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    public record Retry(Integer maxAttempts, Duration initialBackoff, Double multiplier, Duration maxBackoff) {
        public Retry {
            if (maxAttempts == null) {
                maxAttempts = 3;
            } else if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            initialBackoff = positiveOrDefault(initialBackoff, Duration.ofMillis(500), "initialBackoff");
            if (multiplier == null) {
                multiplier = 2.0d;
            } else if (multiplier < 1.0d) {
                throw new IllegalArgumentException("multiplier must be >= 1");
            }
            maxBackoff = positiveOrDefault(maxBackoff, Duration.ofSeconds(10), "maxBackoff");
        }
    }

    /**
     * An independent detection loop with its own checkpoint. An empty variable list means
     * every variable in the feed.
     */
    public record Stream(String id, List<String> variables) {
        public Stream {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("stream id must be provided");
            }
            variables = variables == null ? List.of() : List.copyOf(variables);
        }
    }

    /**
     * Result records carry no stream id, so a stream resuming from the result store only sees
     * its own progress when no variable belongs to two streams.
     */
    private static void requireDisjoint(List<Stream> streams) {
        if (streams.size() < 2) {
            return;
        }
        Map<String, String> owners = new HashMap<>();
        for (Stream stream : streams) {
            if (stream.variables().isEmpty()) {
                throw new IllegalArgumentException("stream '" + stream.id()
                        + "' covers all variables and must be the only stream");
            }
            for (String variable : stream.variables()) {
                String owner = owners.putIfAbsent(variable, stream.id());
                if (owner != null && !owner.equals(stream.id())) {
                    throw new IllegalArgumentException("variable '" + variable + "' is assigned to streams '"
                            + owner + "' and '" + stream.id() + "'");
                }
            }
        }
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
