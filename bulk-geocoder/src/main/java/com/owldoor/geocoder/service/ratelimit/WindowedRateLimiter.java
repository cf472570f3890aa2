package com.owldoor.geocoder.service.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Allows at most {@code maxRequests} grants in any rolling {@code window}. Once the budget is
 * spent, {@link #acquire()} waits until the oldest grant leaves the window.
 *
 * An optional minimum spacing can be layered on top; both constraints are checked against the
 * same grant history so neither wait can undo the other.
 */
@Slf4j
public class WindowedRateLimiter implements RateLimiter {

    private final int maxRequests;
    private final long windowNanos;
    private final long minIntervalNanos;
    private final TimeSource timeSource;

    private final Deque<Long> grants = new ArrayDeque<>();
    private boolean granted;
    private long lastGrantNanos;

    public WindowedRateLimiter(int maxRequests, Duration window, TimeSource timeSource) {
        this(maxRequests, window, Duration.ZERO, timeSource);
    }

    public WindowedRateLimiter(int maxRequests, Duration window, Duration minInterval, TimeSource timeSource) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1: " + maxRequests);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative: " + minInterval);
        }
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.minIntervalNanos = minInterval.toNanos();
        this.timeSource = timeSource;
    }

    @Override
    public synchronized void acquire() {
        while (true) {
            long now = timeSource.nanoTime();
            while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
                grants.pollFirst();
            }
            long wait = 0;
            if (grants.size() >= maxRequests) {
                wait = grants.peekFirst() + windowNanos - now;
                log.debug("Request budget of {} spent, waiting {} ms", maxRequests, wait / 1_000_000);
            }
            if (granted) {
                wait = Math.max(wait, lastGrantNanos + minIntervalNanos - now);
            }
            if (wait <= 0) {
                grants.addLast(now);
                lastGrantNanos = now;
                granted = true;
                return;
            }
            try {
                timeSource.sleepNanos(wait);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new RateLimitInterruptedException(ie);
            }
        }
    }
}
