package com.owldoor.geocoder.service.provider;

import com.owldoor.geocoder.exception.ConfigurationException;
import com.owldoor.geocoder.service.ratelimit.RateLimitPolicy;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The supported geocoding backends. Each variant carries its default endpoint, whether it needs
 * an API key, and the rate policy its client is throttled with.
 */
public enum GeocodingProvider {

    /** OpenStreetMap Nominatim. Free, no key, 1 request/second and an identifying User-Agent. */
    NOMINATIM("nominatim", "OpenStreetMap Nominatim", false,
            "https://nominatim.openstreetmap.org/search",
            RateLimitPolicy.fixedInterval(Duration.ofSeconds(1))),

    /** Google Maps Geocoding API. Keyed, 50 requests/second. */
    GOOGLE("google", "Google Maps Geocoding", true,
            "https://maps.googleapis.com/maps/api/geocode/json",
            RateLimitPolicy.fixedInterval(Duration.ofMillis(20))),

    /** Mapbox Geocoding API. Keyed (access token), 600 requests/minute. */
    MAPBOX("mapbox", "Mapbox Geocoding", true,
            "https://api.mapbox.com/geocoding/v5/mapbox.places",
            RateLimitPolicy.windowed(600, Duration.ofMinutes(1)));

    private final String id;
    private final String displayName;
    private final boolean keyRequired;
    private final String defaultBaseUrl;
    private final RateLimitPolicy defaultRateLimit;

    GeocodingProvider(String id, String displayName, boolean keyRequired,
                      String defaultBaseUrl, RateLimitPolicy defaultRateLimit) {
        this.id = id;
        this.displayName = displayName;
        this.keyRequired = keyRequired;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultRateLimit = defaultRateLimit;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isKeyRequired() {
        return keyRequired;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public RateLimitPolicy getDefaultRateLimit() {
        return defaultRateLimit;
    }

    public static GeocodingProvider fromId(String id) {
        if (id == null || id.isBlank()) {
            return NOMINATIM;
        }
        String normalised = id.trim().toLowerCase(Locale.ROOT);
        for (GeocodingProvider p : values()) {
            if (p.id.equals(normalised)) return p;
        }
        throw new ConfigurationException("Unknown geocoding provider '" + id + "'. Choose one of: "
                + Arrays.stream(values()).map(GeocodingProvider::getId).collect(Collectors.joining(", ")));
    }
}
