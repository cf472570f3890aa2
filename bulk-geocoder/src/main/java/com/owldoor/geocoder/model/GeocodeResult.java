package com.owldoor.geocoder.model;

/**
 * Provider-neutral lookup outcome. Coordinates are present exactly when the status is SUCCESS.
 */
public record GeocodeResult(Double latitude, Double longitude, String formattedAddress, GeocodeStatus status) {

    private static final GeocodeResult FAILED = new GeocodeResult(null, null, null, GeocodeStatus.FAILED);
    private static final GeocodeResult NO_ADDRESS = new GeocodeResult(null, null, null, GeocodeStatus.NO_ADDRESS);

    public GeocodeResult {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        boolean hasCoordinates = latitude != null && longitude != null;
        if (hasCoordinates != (status == GeocodeStatus.SUCCESS)) {
            throw new IllegalArgumentException("Coordinates must be present only for a successful lookup");
        }
        if (status != GeocodeStatus.SUCCESS && (latitude != null || longitude != null)) {
            throw new IllegalArgumentException("Unsuccessful lookups carry no coordinates");
        }
    }

    public static GeocodeResult success(double latitude, double longitude, String formattedAddress) {
        return new GeocodeResult(latitude, longitude, formattedAddress, GeocodeStatus.SUCCESS);
    }

    public static GeocodeResult failed() {
        return FAILED;
    }

    public static GeocodeResult noAddress() {
        return NO_ADDRESS;
    }
}
