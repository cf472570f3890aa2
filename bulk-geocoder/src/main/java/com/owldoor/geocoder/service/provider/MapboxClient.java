package com.owldoor.geocoder.service.provider;

import com.owldoor.geocoder.exception.ProviderPermanentException;
import com.owldoor.geocoder.model.GeocodeResult;
import com.owldoor.geocoder.model.MapboxGeocodeResponse;
import com.owldoor.geocoder.service.ratelimit.RateLimiter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Mapbox forward geocoding. The query travels as a path segment ({@code /{query}.json}) and
 * the token as {@code access_token}. Feature centres are [longitude, latitude].
 */
@Slf4j
public class MapboxClient extends AbstractProviderClient {

    public MapboxClient(RestTemplate restTemplate, RateLimiter rateLimiter, Retry retry,
                        String baseUrl, String userAgent, String apiKey) {
        super(restTemplate, rateLimiter, retry, baseUrl, userAgent, apiKey);
    }

    @Override
    public GeocodingProvider provider() {
        return GeocodingProvider.MAPBOX;
    }

    @Override
    protected GeocodeResult lookup(String query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment("{query}.json")
                .queryParam("access_token", "{token}")
                .queryParam("limit", 1)
                .encode()
                .buildAndExpand(query, apiKey)
                .toUri();

        MapboxGeocodeResponse response = get(uri, MapboxGeocodeResponse.class);
        if (response == null || response.getFeatures() == null || response.getFeatures().isEmpty()) {
            log.debug("No match for '{}'", query);
            return GeocodeResult.failed();
        }

        MapboxGeocodeResponse.Feature best = response.getFeatures().get(0);
        if (best.getCenter() == null || best.getCenter().size() < 2
                || best.getCenter().get(0) == null || best.getCenter().get(1) == null) {
            throw new ProviderPermanentException("Mapbox feature without a centre");
        }
        return GeocodeResult.success(best.getCenter().get(1), best.getCenter().get(0), best.getPlaceName());
    }
}
