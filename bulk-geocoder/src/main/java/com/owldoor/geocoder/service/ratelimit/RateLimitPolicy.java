package com.owldoor.geocoder.service.ratelimit;

import java.time.Duration;

/**
 * Throttling rule attached to a provider: a minimum interval, a windowed budget, or both.
 *
 * @param minInterval minimum spacing between requests, or null
 * @param maxRequests request budget per window, or 0 when unbounded
 * @param window      rolling window for {@code maxRequests}, or null
 */
public record RateLimitPolicy(Duration minInterval, int maxRequests, Duration window) {

    public RateLimitPolicy {
        if (minInterval == null && (maxRequests <= 0 || window == null)) {
            throw new IllegalArgumentException("A rate limit needs a minimum interval or a request budget per window");
        }
    }

    public static RateLimitPolicy fixedInterval(Duration minInterval) {
        return new RateLimitPolicy(minInterval, 0, null);
    }

    public static RateLimitPolicy windowed(int maxRequests, Duration window) {
        return new RateLimitPolicy(null, maxRequests, window);
    }

    public boolean isWindowed() {
        return maxRequests > 0 && window != null;
    }

    public RateLimiter newLimiter(TimeSource timeSource) {
        if (!isWindowed()) {
            return new FixedIntervalRateLimiter(minInterval, timeSource);
        }
        return new WindowedRateLimiter(maxRequests, window,
                minInterval == null ? Duration.ZERO : minInterval, timeSource);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (minInterval != null) {
            sb.append("min interval ").append(minInterval.toMillis()).append(" ms");
        }
        if (isWindowed()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(maxRequests).append(" requests per ").append(window.toSeconds()).append(" s");
        }
        return sb.toString();
    }
}
