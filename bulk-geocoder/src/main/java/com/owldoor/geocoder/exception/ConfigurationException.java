package com.owldoor.geocoder.exception;

/**
 * Fatal, raised before any row is processed: missing API key, unreadable input,
 * unknown provider id, or no address columns configured.
 */
public class ConfigurationException extends GeocoderException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
