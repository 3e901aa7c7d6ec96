package com.barometer.core.reactor;

import com.barometer.core.metrics.BarometerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Periodic refresh: sleeps for the interval, then requests a fetch and redraw,
 * exactly like a refresh signal. Runs on the calling thread until it is interrupted.
 */
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final SynchronizationCore<?> core;
    private final Duration interval;
    private final BarometerMetrics metrics;

    public RefreshScheduler(SynchronizationCore<?> core, Duration interval, BarometerMetrics metrics) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive, was " + interval);
        }
        this.core = core;
        this.interval = interval;
        this.metrics = metrics;
    }

    public void run() {
        log.info("Refreshing every {}s", interval.toSeconds());
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Thread.sleep(interval.toMillis());
                metrics.recordTick();
                core.wake(true, true);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Scheduler interrupted, stopping");
        }
    }

    public Duration interval() {
        return interval;
    }
}
