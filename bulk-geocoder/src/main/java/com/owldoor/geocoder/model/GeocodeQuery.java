package com.owldoor.geocoder.model;

/**
 * Address string derived from one input row. A null address marks a row with nothing to look up.
 */
public record GeocodeQuery(String address) {

    private static final GeocodeQuery INVALID = new GeocodeQuery(null);

    public static GeocodeQuery of(String address) {
        return address == null || address.isBlank() ? INVALID : new GeocodeQuery(address);
    }

    public static GeocodeQuery invalid() {
        return INVALID;
    }

    public boolean isValid() {
        return address != null;
    }
}
