package com.plantwatch.detector.detection;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Stopping releases a pending wait immediately. Work already in progress is not interrupted.
 */
public class InterruptibleTicker implements Ticker {

    private final CountDownLatch stopped = new CountDownLatch(1);

    @Override
    public boolean await(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return !isStopped();
        }
        try {
            return !stopped.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void stop() {
        stopped.countDown();
    }

    @Override
    public boolean isStopped() {
        return stopped.getCount() == 0;
    }
}
