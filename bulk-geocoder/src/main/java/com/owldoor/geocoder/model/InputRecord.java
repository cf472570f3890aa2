package com.owldoor.geocoder.model;

import java.util.List;

/**
 * One data row of the input file, in header order.
 *
 * @param index   0-based position among data rows (the header is not counted)
 * @param columns header names
 * @param values  cell values, same length as {@code columns}
 */
public record InputRecord(long index, List<String> columns, List<String> values) {

    public InputRecord {
        columns = List.copyOf(columns);
        values = List.copyOf(values);
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException("Row " + index + " has " + values.size()
                    + " values for " + columns.size() + " columns");
        }
    }

    /**
     * Value of the first column with this name, or null when the column is not present.
     */
    public String get(String column) {
        if (column == null) return null;
        int i = columns.indexOf(column);
        return i < 0 ? null : values.get(i);
    }
}
