package com.owldoor.geocoder.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which input column(s) supply the address: either a single address column or
 * any combination of street/city/state/zip columns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnMapping {

    private String addressColumn;
    private String streetColumn;
    private String cityColumn;
    private String stateColumn;
    private String zipColumn;

    public boolean isSingleColumn() {
        return hasText(addressColumn);
    }

    public boolean hasComponents() {
        return hasText(streetColumn) || hasText(cityColumn) || hasText(stateColumn) || hasText(zipColumn);
    }

    public boolean isConfigured() {
        return isSingleColumn() || hasComponents();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
