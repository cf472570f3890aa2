package com.owldoor.geocoder.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Input row plus the four appended geocode columns. Original values are copied, never altered.
 */
public record OutputRecord(InputRecord input, GeocodeResult result) {

    public static final List<String> APPENDED_COLUMNS =
            List.of("latitude", "longitude", "geocode_status", "geocode_address");

    public static String[] header(List<String> inputColumns) {
        List<String> header = new ArrayList<>(inputColumns);
        header.addAll(APPENDED_COLUMNS);
        return header.toArray(new String[0]);
    }

    public String[] toRow() {
        List<String> row = new ArrayList<>(input.values());
        row.add(coordinate(result.latitude()));
        row.add(coordinate(result.longitude()));
        row.add(result.status().getLabel());
        row.add(str(result.formattedAddress()));
        return row.toArray(new String[0]);
    }

    /** Plain decimal, never scientific notation. */
    private static String coordinate(Double val) {
        return val == null ? "" : BigDecimal.valueOf(val).stripTrailingZeros().toPlainString();
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
