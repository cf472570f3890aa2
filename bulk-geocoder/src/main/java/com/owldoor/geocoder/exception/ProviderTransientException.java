package com.owldoor.geocoder.exception;

/**
 * Timeout, connection reset, HTTP 5xx or 429. Retried with backoff before the row degrades to failed.
 */
public class ProviderTransientException extends GeocoderException {

    public ProviderTransientException(String message) {
        super(message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
