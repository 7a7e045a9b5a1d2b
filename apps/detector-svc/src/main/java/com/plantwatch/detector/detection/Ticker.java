package com.plantwatch.detector.detection;

import java.time.Duration;

/**
 * Idle wait between detection cycles.
 */
public interface Ticker {

    /**
     * @return false once the ticker has been stopped; the caller should exit its loop
     */
    boolean await(Duration duration);

    void stop();

    boolean isStopped();
}
