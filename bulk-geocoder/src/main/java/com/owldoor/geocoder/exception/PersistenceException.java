package com.owldoor.geocoder.exception;

/**
 * Output or checkpoint could not be written. Aborts the run; earlier committed chunks stay resumable.
 */
public class PersistenceException extends GeocoderException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
