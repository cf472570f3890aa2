package com.owldoor.geocoder.service.provider;

import com.owldoor.geocoder.model.GeocodeResult;
import com.owldoor.geocoder.model.NominatimPlace;
import com.owldoor.geocoder.service.ratelimit.RateLimiter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * OpenStreetMap Nominatim search. No key, but the usage policy requires an identifying
 * User-Agent and at most one request per second; clients breaking either get blocked.
 */
@Slf4j
public class NominatimClient extends AbstractProviderClient {

    public NominatimClient(RestTemplate restTemplate, RateLimiter rateLimiter, Retry retry,
                           String baseUrl, String userAgent) {
        super(restTemplate, rateLimiter, retry, baseUrl, userAgent, null);
    }

    @Override
    public GeocodingProvider provider() {
        return GeocodingProvider.NOMINATIM;
    }

    @Override
    protected GeocodeResult lookup(String query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("q", "{q}")
                .queryParam("format", "json")
                .queryParam("limit", 1)
                .encode()
                .buildAndExpand(query)
                .toUri();

        NominatimPlace[] places = get(uri, NominatimPlace[].class);
        if (places == null || places.length == 0) {
            log.debug("No match for '{}'", query);
            return GeocodeResult.failed();
        }

        NominatimPlace best = places[0];
        return GeocodeResult.success(
                parseCoordinate(best.getLat(), "lat"),
                parseCoordinate(best.getLon(), "lon"),
                best.getDisplayName());
    }
}
