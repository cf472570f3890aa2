package com.owldoor.geocoder.output;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.owldoor.geocoder.exception.ConfigurationException;
import com.owldoor.geocoder.exception.GeocoderException;
import com.owldoor.geocoder.model.InputRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Streams data rows of a delimited file with a header line, numbering them from 0.
 *
 * Blank lines are skipped and do not consume an index. Rows shorter than the header are padded
 * with empty values; longer rows are cut to the header width.
 */
@Slf4j
public class CsvRecordReader implements Closeable {

    private static final char BOM = '\uFEFF';

    private final Path path;
    private final CSVReader reader;
    private final List<String> columns;
    private long nextIndex;

    private CsvRecordReader(Path path, CSVReader reader, List<String> columns) {
        this.path = path;
        this.reader = reader;
        this.columns = columns;
    }

    public static CsvRecordReader open(Path path, CsvSettings settings) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ConfigurationException("Input file is not readable: " + path);
        }
        CSVReader csv = null;
        try {
            csv = new CSVReaderBuilder(Files.newBufferedReader(path, settings.charset()))
                    .withCSVParser(settings.parser())
                    .build();
            String[] header = csv.readNext();
            if (header == null || header.length == 0 || (header.length == 1 && header[0].isBlank())) {
                throw new ConfigurationException("Input file has no header row: " + path);
            }
            if (!header[0].isEmpty() && header[0].charAt(0) == BOM) {
                header[0] = header[0].substring(1);
            }
            return new CsvRecordReader(path, csv, List.of(header));

        } catch (IOException | CsvValidationException e) {
            closeQuietly(csv);
            throw new ConfigurationException("Cannot read input " + path + ": " + e.getMessage(), e);
        } catch (ConfigurationException e) {
            closeQuietly(csv);
            throw e;
        }
    }

    public List<String> columns() {
        return columns;
    }

    /**
     * @return the next data row, or null at end of input
     */
    public InputRecord next() {
        try {
            String[] values;
            do {
                values = reader.readNext();
                if (values == null) return null;
            } while (values.length == 1 && values[0].isBlank() && columns.size() > 1);

            if (values.length != columns.size()) {
                if (values.length > columns.size()) {
                    log.warn("Row {} has {} values for {} columns; extra values dropped",
                            nextIndex, values.length, columns.size());
                }
                values = Arrays.copyOf(values, columns.size());
                for (int i = 0; i < values.length; i++) {
                    if (values[i] == null) values[i] = "";
                }
            }
            return new InputRecord(nextIndex++, columns, Arrays.asList(values));

        } catch (IOException | CsvValidationException e) {
            throw new GeocoderException("Failed reading row " + nextIndex + " of " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private static void closeQuietly(CSVReader csv) {
        if (csv == null) return;
        try {
            csv.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure: {}", e.getMessage());
        }
    }
}
