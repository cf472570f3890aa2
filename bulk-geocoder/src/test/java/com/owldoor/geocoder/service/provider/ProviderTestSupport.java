package com.owldoor.geocoder.service.provider;

import com.owldoor.geocoder.exception.ProviderTransientException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Retry matching the production policy (3 attempts, exponential backoff, transient errors only)
 * with a millisecond base so tests stay fast.
 */
final class ProviderTestSupport {

    private ProviderTestSupport() {
    }

    static Retry fastRetry() {
        return Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(1, 2))
                .retryExceptions(ProviderTransientException.class)
                .build());
    }
}
