package com.owldoor.geocoder.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Row outcome as written to the {@code geocode_status} column.
 */
public enum GeocodeStatus {
    SUCCESS("success"),
    FAILED("failed"),
    NO_ADDRESS("no_address");

    private final String label;

    GeocodeStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
