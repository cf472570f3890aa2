package com.owldoor.geocoder.service.provider;

import com.owldoor.geocoder.exception.ProviderPermanentException;
import com.owldoor.geocoder.exception.ProviderTransientException;
import com.owldoor.geocoder.model.GeocodeResult;
import com.owldoor.geocoder.model.GoogleGeocodeResponse;
import com.owldoor.geocoder.service.ratelimit.RateLimiter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Google Maps Geocoding API.
 *
 * Google answers HTTP 200 for most errors and reports them in the body's {@code status}:
 * ZERO_RESULTS is a miss, OVER_QUERY_LIMIT and UNKNOWN_ERROR are worth retrying, anything
 * else (REQUEST_DENIED, INVALID_REQUEST) is a permanent rejection.
 */
@Slf4j
public class GoogleClient extends AbstractProviderClient {

    public GoogleClient(RestTemplate restTemplate, RateLimiter rateLimiter, Retry retry,
                        String baseUrl, String userAgent, String apiKey) {
        super(restTemplate, rateLimiter, retry, baseUrl, userAgent, apiKey);
    }

    @Override
    public GeocodingProvider provider() {
        return GeocodingProvider.GOOGLE;
    }

    @Override
    protected GeocodeResult lookup(String query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("address", "{address}")
                .queryParam("key", "{key}")
                .encode()
                .buildAndExpand(query, apiKey)
                .toUri();

        GoogleGeocodeResponse response = get(uri, GoogleGeocodeResponse.class);
        if (response == null || response.getStatus() == null) {
            throw new ProviderPermanentException("Empty response from google");
        }

        switch (response.getStatus()) {
            case "OK" -> {
                return toResult(response);
            }
            case "ZERO_RESULTS" -> {
                log.debug("No match for '{}'", query);
                return GeocodeResult.failed();
            }
            case "OVER_QUERY_LIMIT", "UNKNOWN_ERROR" ->
                    throw new ProviderTransientException("Google status " + response.getStatus());
            default -> throw new ProviderPermanentException("Google status " + response.getStatus()
                    + (response.getErrorMessage() != null ? ": " + redact(response.getErrorMessage()) : ""));
        }
    }

    private GeocodeResult toResult(GoogleGeocodeResponse response) {
        if (response.getResults() == null || response.getResults().isEmpty()) {
            return GeocodeResult.failed();
        }
        GoogleGeocodeResponse.Result best = response.getResults().get(0);
        if (best.getGeometry() == null || best.getGeometry().getLocation() == null
                || best.getGeometry().getLocation().getLat() == null
                || best.getGeometry().getLocation().getLng() == null) {
            throw new ProviderPermanentException("Google result without a location");
        }
        GoogleGeocodeResponse.Result.Location location = best.getGeometry().getLocation();
        return GeocodeResult.success(location.getLat(), location.getLng(), best.getFormattedAddress());
    }
}
