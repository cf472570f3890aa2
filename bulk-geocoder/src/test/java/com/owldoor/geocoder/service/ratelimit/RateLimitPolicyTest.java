package com.owldoor.geocoder.service.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateLimitPolicy Tests")
class RateLimitPolicyTest {

    @Test
    @DisplayName("Fixed interval policy builds a fixed interval limiter")
    void testFixedInterval() {
        RateLimitPolicy policy = RateLimitPolicy.fixedInterval(Duration.ofSeconds(1));
        assertFalse(policy.isWindowed());
        assertInstanceOf(FixedIntervalRateLimiter.class, policy.newLimiter(new FakeTimeSource()));
        assertEquals("min interval 1000 ms", policy.describe());
    }

    @Test
    @DisplayName("Windowed policy builds a windowed limiter")
    void testWindowed() {
        RateLimitPolicy policy = RateLimitPolicy.windowed(600, Duration.ofMinutes(1));
        assertTrue(policy.isWindowed());
        assertInstanceOf(WindowedRateLimiter.class, policy.newLimiter(new FakeTimeSource()));
        assertEquals("600 requests per 60 s", policy.describe());
    }

    @Test
    @DisplayName("Policy needs an interval or a complete budget")
    void testIncompletePolicyRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(null, 10, null));
        assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(null, 0, Duration.ofSeconds(1)));
    }
}
