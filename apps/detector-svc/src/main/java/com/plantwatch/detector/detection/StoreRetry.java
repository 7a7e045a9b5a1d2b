package com.plantwatch.detector.detection;

import com.plantwatch.detector.config.DetectorProperties;
import com.plantwatch.detector.error.StoreUnavailableException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

/**
 * Bounded exponential-backoff retry around store calls. Only transient failures are retried; any
 * other data access failure is reported at once as {@link StoreUnavailableException}.
 */
@Component
public class StoreRetry {
    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final DetectorProperties.Retry policy;
    private final Sleeper sleeper;

    @Autowired
    public StoreRetry(DetectorProperties properties) {
        this(properties.retry(), duration -> Thread.sleep(duration.toMillis()));
    }

    StoreRetry(DetectorProperties.Retry policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> T call(String operation, Supplier<T> action) {
        Duration backoff = policy.initialBackoff();
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException ex) {
                if (!isTransient(ex)) {
                    if (ex instanceof DataAccessException) {
                        throw new StoreUnavailableException(operation, attempt, ex);
                    }
                    throw ex;
                }
                if (attempt >= policy.maxAttempts()) {
                    throw new StoreUnavailableException(operation, attempt, ex);
                }
                log.warn("{} failed (attempt {}/{}), retrying in {}: {}",
                        operation, attempt, policy.maxAttempts(), backoff, ex.getMessage());
                pause(operation, attempt, backoff, ex);
                backoff = next(backoff);
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    static boolean isTransient(Throwable ex) {
        return ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException
                || ex instanceof StoreUnavailableException;
    }

    private void pause(String operation, int attempt, Duration backoff, RuntimeException cause) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            StoreUnavailableException ex = new StoreUnavailableException(operation, attempt, cause);
            ex.addSuppressed(interrupted);
            throw ex;
        }
    }

    private Duration next(Duration current) {
        long nextMillis = (long) (current.toMillis() * policy.multiplier());
        Duration candidate = Duration.ofMillis(nextMillis);
        return candidate.compareTo(policy.maxBackoff()) > 0 ? policy.maxBackoff() : candidate;
    }
}
