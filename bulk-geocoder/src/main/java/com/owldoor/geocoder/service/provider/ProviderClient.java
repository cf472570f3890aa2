package com.owldoor.geocoder.service.provider;

import com.owldoor.geocoder.model.GeocodeResult;

/**
 * One geocoding backend behind a uniform, blocking lookup.
 *
 * Implementations throttle every outbound request through their own rate limiter. A "no match"
 * or exhausted retries come back as a failed result instead of an exception.
 */
public interface ProviderClient {

    GeocodingProvider provider();

    GeocodeResult geocode(String query);
}
