package com.owldoor.geocoder.service;

import com.owldoor.geocoder.model.ColumnMapping;
import com.owldoor.geocoder.model.GeocodeQuery;
import com.owldoor.geocoder.model.InputRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the lookup string for a row. Pure: no I/O, same row and mapping give the same query.
 *
 * Single-column mode uses the trimmed value of the address column. Component mode joins the
 * non-blank street, city and state values with ", " and appends the zip after a space,
 * e.g. "1 Main St, Springfield, IL 62701". When both are configured, a blank address column
 * falls back to the components.
 */
@Component
public class AddressExtractor {

    public GeocodeQuery extract(InputRecord record, ColumnMapping mapping) {
        if (mapping.isSingleColumn()) {
            String address = trimmed(record.get(mapping.getAddressColumn()));
            if (address != null || !mapping.hasComponents()) {
                return GeocodeQuery.of(address);
            }
        }
        if (!mapping.hasComponents()) {
            return GeocodeQuery.invalid();
        }

        List<String> parts = new ArrayList<>(3);
        addIfPresent(parts, record, mapping.getStreetColumn());
        addIfPresent(parts, record, mapping.getCityColumn());
        addIfPresent(parts, record, mapping.getStateColumn());

        String query = String.join(", ", parts);
        String zip = column(record, mapping.getZipColumn());
        if (zip != null) {
            query = query.isEmpty() ? zip : query + " " + zip;
        }
        return GeocodeQuery.of(query);
    }

    private void addIfPresent(List<String> parts, InputRecord record, String column) {
        String value = column(record, column);
        if (value != null) parts.add(value);
    }

    private String column(InputRecord record, String column) {
        if (column == null || column.isBlank()) return null;
        return trimmed(record.get(column));
    }

    private String trimmed(String value) {
        if (value == null) return null;
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }
}
