package com.owldoor.geocoder.service.ratelimit;

/**
 * Gate in front of every outbound provider request. One instance per provider client,
 * never shared, and holding no state across process restarts.
 */
@FunctionalInterface
public interface RateLimiter {

    /**
     * Blocks until the next request may be issued.
     *
     * @throws RateLimitInterruptedException if the waiting thread is interrupted
     */
    void acquire();
}
