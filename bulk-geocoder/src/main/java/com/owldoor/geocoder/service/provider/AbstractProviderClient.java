package com.owldoor.geocoder.service.provider;

import com.owldoor.geocoder.exception.ProviderPermanentException;
import com.owldoor.geocoder.exception.ProviderTransientException;
import com.owldoor.geocoder.model.GeocodeResult;
import com.owldoor.geocoder.service.ratelimit.RateLimiter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Shared request plumbing for the provider clients.
 *
 * Each attempt, including retries, first takes a slot from the rate limiter. Transient failures
 * (timeouts, connection resets, 5xx, 429) are retried by the Resilience4j {@link Retry} with
 * exponential backoff; permanent failures are not. Either way, once the attempts are over the row
 * comes back as failed rather than as an exception.
 */
@Slf4j
public abstract class AbstractProviderClient implements ProviderClient {

    protected final RestTemplate restTemplate;
    protected final String baseUrl;
    protected final String apiKey;

    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final String userAgent;

    protected AbstractProviderClient(RestTemplate restTemplate, RateLimiter rateLimiter, Retry retry,
                                     String baseUrl, String userAgent, String apiKey) {
        this.restTemplate = restTemplate;
        this.rateLimiter = rateLimiter;
        this.retry = retry;
        this.baseUrl = baseUrl;
        this.userAgent = userAgent;
        this.apiKey = apiKey;
    }

    @Override
    public GeocodeResult geocode(String query) {
        try {
            return retry.executeSupplier(() -> {
                rateLimiter.acquire();
                return lookup(query);
            });
        } catch (ProviderTransientException e) {
            log.warn("{} lookup failed after retries for '{}': {}", provider().getId(), query, e.getMessage());
            return GeocodeResult.failed();
        } catch (ProviderPermanentException e) {
            log.warn("{} rejected '{}': {}", provider().getId(), query, e.getMessage());
            return GeocodeResult.failed();
        }
    }

    /**
     * One attempt against the provider, without retry or throttling.
     *
     * @return a success, or {@link GeocodeResult#failed()} when the provider found no match
     */
    protected abstract GeocodeResult lookup(String query);

    protected <T> T get(URI uri, Class<T> responseType) {
        log.debug("Calling {}: {}", provider().getId(), redact(uri.toString()));
        RequestEntity<Void> request = RequestEntity.get(uri)
                .header(HttpHeaders.USER_AGENT, userAgent)
                .build();
        try {
            return restTemplate.exchange(request, responseType).getBody();

        } catch (HttpStatusCodeException e) {
            HttpStatusCode status = e.getStatusCode();
            if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new ProviderTransientException("HTTP " + status.value() + " from " + provider().getId(), e);
            }
            throw new ProviderPermanentException("HTTP " + status.value() + " from " + provider().getId(), e);

        } catch (ResourceAccessException e) {
            // timeouts and connection resets
            throw new ProviderTransientException(redact(e.getMessage()), e);

        } catch (RestClientException e) {
            throw new ProviderPermanentException("Unreadable response from " + provider().getId()
                    + ": " + redact(e.getMessage()), e);
        }
    }

    protected String redact(String text) {
        if (text == null || apiKey == null || apiKey.isEmpty()) return text;
        return text.replace(apiKey, "****");
    }

    protected static double parseCoordinate(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ProviderPermanentException("Missing " + field + " in provider response");
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ProviderPermanentException("Unparseable " + field + ": " + value, e);
        }
    }
}
