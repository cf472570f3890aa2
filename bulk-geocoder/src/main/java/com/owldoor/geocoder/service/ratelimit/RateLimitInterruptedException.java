package com.owldoor.geocoder.service.ratelimit;

import com.owldoor.geocoder.exception.GeocoderException;

/**
 * Thrown when a thread is interrupted while waiting for a slot. The interrupt flag is restored
 * before this is thrown, so callers treat it as shutdown rather than a row failure.
 */
public class RateLimitInterruptedException extends GeocoderException {

    public RateLimitInterruptedException(InterruptedException cause) {
        super("Interrupted while waiting for a rate limit slot", cause);
    }
}
