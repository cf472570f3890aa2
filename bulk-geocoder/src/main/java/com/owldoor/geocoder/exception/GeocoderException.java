package com.owldoor.geocoder.exception;

/**
 * Base type for every failure raised by the geocoding engine.
 */
public class GeocoderException extends RuntimeException {

    public GeocoderException(String message) {
        super(message);
    }

    public GeocoderException(String message, Throwable cause) {
        super(message, cause);
    }
}
