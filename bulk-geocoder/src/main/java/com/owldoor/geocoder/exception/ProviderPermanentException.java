package com.owldoor.geocoder.exception;

/**
 * The provider rejected the request itself (bad query, denied key). Never retried.
 */
public class ProviderPermanentException extends GeocoderException {

    public ProviderPermanentException(String message) {
        super(message);
    }

    public ProviderPermanentException(String message, Throwable cause) {
        super(message, cause);
    }
}
