package com.owldoor.geocoder.service.ratelimit;

import java.time.Duration;

/**
 * Guarantees at least {@code minInterval} between consecutive grants, measured from the previous
 * grant regardless of how long the request itself took.
 */
public class FixedIntervalRateLimiter implements RateLimiter {

    private final long minIntervalNanos;
    private final TimeSource timeSource;

    private boolean granted;
    private long lastGrantNanos;

    public FixedIntervalRateLimiter(Duration minInterval, TimeSource timeSource) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative: " + minInterval);
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.timeSource = timeSource;
    }

    @Override
    public synchronized void acquire() {
        if (granted) {
            long wait = lastGrantNanos + minIntervalNanos - timeSource.nanoTime();
            while (wait > 0) {
                sleep(wait);
                wait = lastGrantNanos + minIntervalNanos - timeSource.nanoTime();
            }
        }
        lastGrantNanos = timeSource.nanoTime();
        granted = true;
    }

    private void sleep(long nanos) {
        try {
            timeSource.sleepNanos(nanos);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RateLimitInterruptedException(ie);
        }
    }
}
