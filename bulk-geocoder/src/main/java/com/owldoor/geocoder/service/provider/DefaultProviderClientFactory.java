package com.owldoor.geocoder.service.provider;

import com.owldoor.geocoder.config.BulkGeocoderProperties;
import com.owldoor.geocoder.exception.ConfigurationException;
import com.owldoor.geocoder.service.ratelimit.RateLimitPolicy;
import com.owldoor.geocoder.service.ratelimit.RateLimiter;
import com.owldoor.geocoder.service.ratelimit.TimeSource;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Builds a client per run. Keys and the Nominatim User-Agent are checked here, so a bad
 * configuration fails before the first request.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DefaultProviderClientFactory implements ProviderClientFactory {

    public static final String RETRY_NAME = "geocoder";

    private final RestTemplate restTemplate;
    private final BulkGeocoderProperties properties;
    private final RetryRegistry retryRegistry;

    @Override
    public ProviderClient create(String providerId, String apiKey) {
        GeocodingProvider provider = GeocodingProvider.fromId(providerId);

        if (provider.isKeyRequired() && (apiKey == null || apiKey.isBlank())) {
            throw new ConfigurationException("An API key is required for provider '" + provider.getId() + "'");
        }

        String userAgent = properties.getHttp().getUserAgent();
        if (provider == GeocodingProvider.NOMINATIM && (userAgent == null || userAgent.isBlank())) {
            throw new ConfigurationException("Nominatim's usage policy requires an identifying User-Agent; "
                    + "set bulk-geocoder.http.user-agent");
        }

        RateLimitPolicy policy = rateLimitFor(provider);
        RateLimiter rateLimiter = policy.newLimiter(TimeSource.SYSTEM);
        Retry retry = retryRegistry.retry(RETRY_NAME);
        String baseUrl = baseUrlFor(provider);

        log.info("Using {} at {} ({})", provider.getDisplayName(), baseUrl, policy.describe());

        return switch (provider) {
            case NOMINATIM -> new NominatimClient(restTemplate, rateLimiter, retry, baseUrl, userAgent);
            case GOOGLE -> new GoogleClient(restTemplate, rateLimiter, retry, baseUrl, userAgent, apiKey.trim());
            case MAPBOX -> new MapboxClient(restTemplate, rateLimiter, retry, baseUrl, userAgent, apiKey.trim());
        };
    }

    RateLimitPolicy rateLimitFor(GeocodingProvider provider) {
        BulkGeocoderProperties.Provider override = properties.getProviders().get(provider.getId());
        if (override == null || (override.getMinInterval() == null && override.getMaxRequests() == null)) {
            return provider.getDefaultRateLimit();
        }
        int maxRequests = override.getMaxRequests() == null ? 0 : override.getMaxRequests();
        try {
            return new RateLimitPolicy(override.getMinInterval(), maxRequests, override.getWindow());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid rate limit for provider '" + provider.getId() + "': "
                    + e.getMessage(), e);
        }
    }

    private String baseUrlFor(GeocodingProvider provider) {
        BulkGeocoderProperties.Provider override = properties.getProviders().get(provider.getId());
        if (override != null && override.getBaseUrl() != null && !override.getBaseUrl().isBlank()) {
            return override.getBaseUrl();
        }
        return provider.getDefaultBaseUrl();
    }
}
