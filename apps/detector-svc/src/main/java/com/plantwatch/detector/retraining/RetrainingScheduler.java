package com.plantwatch.detector.retraining;

import com.plantwatch.detector.config.DetectorProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily retraining at a configured local time. A tick fires when the local time falls within
 * {@code [target, target + catchUpWindow)} and no run has succeeded yet that day, so a failed run
 * is retried on the following ticks of the window.
 */
@Component
public class RetrainingScheduler {
    private static final Logger log = LoggerFactory.getLogger(RetrainingScheduler.class);

    private final RetrainingService retrainingService;
    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime target;
    private final Duration catchUpWindow;
    private final boolean enabled;
    private final AtomicLong failures = new AtomicLong();
    private volatile LocalDate lastTrainingDate;

    @Autowired
    public RetrainingScheduler(RetrainingService retrainingService, DetectorProperties properties, Clock clock) {
        this(retrainingService,
                clock,
                properties.zoneId(),
                properties.retraining().targetTime(),
                properties.retraining().catchUpWindow(),
                properties.retraining().enabled());
    }

    RetrainingScheduler(RetrainingService retrainingService,
                        Clock clock,
                        ZoneId zone,
                        LocalTime target,
                        Duration catchUpWindow,
                        boolean enabled) {
        this.retrainingService = retrainingService;
        this.clock = clock;
        this.zone = zone;
        this.target = target;
        this.catchUpWindow = catchUpWindow;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${detector.retraining.tick-interval:PT1M}",
            initialDelayString = "${detector.retraining.tick-interval:PT1M}")
    public void tick() {
        if (!enabled) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        if (!isDue(now)) {
            return;
        }
        try {
            retrainingService.retrain("scheduled " + now.toLocalDate());
            lastTrainingDate = now.toLocalDate();
        } catch (RuntimeException ex) {
            long total = failures.incrementAndGet();
            log.error("Scheduled retraining failed (failure #{}); the current registry stays in effect", total, ex);
        }
    }

    boolean isDue(ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        if (today.equals(lastTrainingDate)) {
            return false;
        }
        ZonedDateTime windowStart = today.atTime(target).atZone(zone);
        ZonedDateTime windowEnd = windowStart.plus(catchUpWindow);
        return !now.isBefore(windowStart) && now.isBefore(windowEnd);
    }

    public LocalDate lastTrainingDate() {
        return lastTrainingDate;
    }

    public long failures() {
        return failures.get();
    }
}
