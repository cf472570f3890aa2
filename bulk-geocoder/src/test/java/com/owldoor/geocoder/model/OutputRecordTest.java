package com.owldoor.geocoder.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OutputRecord Tests")
class OutputRecordTest {

    private static final List<String> COLUMNS = List.of("id", "address");

    @Test
    @DisplayName("Header appends the four geocode columns in fixed order")
    void testHeader() {
        assertArrayEquals(
                new String[]{"id", "address", "latitude", "longitude", "geocode_status", "geocode_address"},
                OutputRecord.header(COLUMNS));
    }

    @Test
    @DisplayName("Successful row carries coordinates and formatted address")
    void testSuccessRow() {
        InputRecord input = new InputRecord(0, COLUMNS, List.of("1", "1600 Amphitheatre Pkwy"));
        String[] row = new OutputRecord(input, GeocodeResult.success(37.422, -122.084, "Google HQ")).toRow();

        assertArrayEquals(new String[]{"1", "1600 Amphitheatre Pkwy", "37.422", "-122.084", "success", "Google HQ"}, row);
    }

    @Test
    @DisplayName("Failed and no-address rows keep the column count with empty coordinates")
    void testUnsuccessfulRowsKeepWidth() {
        InputRecord input = new InputRecord(3, COLUMNS, List.of("4", ""));

        String[] failed = new OutputRecord(input, GeocodeResult.failed()).toRow();
        String[] noAddress = new OutputRecord(input, GeocodeResult.noAddress()).toRow();

        assertEquals(COLUMNS.size() + 4, failed.length);
        assertEquals(COLUMNS.size() + 4, noAddress.length);
        assertEquals("", failed[2]);
        assertEquals("", failed[3]);
        assertEquals("failed", failed[4]);
        assertEquals("no_address", noAddress[4]);
        assertEquals("", noAddress[5]);
    }

    @Test
    @DisplayName("Original values are copied unchanged")
    void testOriginalColumnsUntouched() {
        InputRecord input = new InputRecord(0, COLUMNS, List.of(" 7 ", "  padded, \"quoted\"  "));
        String[] row = new OutputRecord(input, GeocodeResult.failed()).toRow();

        assertEquals(" 7 ", row[0]);
        assertEquals("  padded, \"quoted\"  ", row[1]);
    }

    @Test
    @DisplayName("Result rejects coordinates on unsuccessful status")
    void testResultInvariant() {
        assertThrows(IllegalArgumentException.class,
                () -> new GeocodeResult(1.0, 2.0, null, GeocodeStatus.FAILED));
        assertThrows(IllegalArgumentException.class,
                () -> new GeocodeResult(null, null, "x", GeocodeStatus.SUCCESS));
        assertThrows(IllegalArgumentException.class,
                () -> new GeocodeResult(1.0, null, null, GeocodeStatus.NO_ADDRESS));
    }

    @Test
    @DisplayName("Coordinates near zero are written as plain decimals")
    void testSmallCoordinatesPlainDecimal() {
        InputRecord input = new InputRecord(0, COLUMNS, List.of("1", "Greenwich Park"));
        String[] row = new OutputRecord(input, GeocodeResult.success(51.4769, -0.0005, "Greenwich")).toRow();

        assertEquals("51.4769", row[2]);
        assertEquals("-0.0005", row[3]);

        String[] tiny = new OutputRecord(input, GeocodeResult.success(0.0000123, 0.0, "Null Island")).toRow();
        assertEquals("0.0000123", tiny[2]);
        assertEquals("0", tiny[3]);
    }
}
