package com.owldoor.geocoder.output;

import com.opencsv.CSVWriter;
import com.owldoor.geocoder.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Appends geocoded rows to the output file. Rows reach disk only through {@link #commit()},
 * which flushes and fsyncs so a checkpoint is never written ahead of its rows.
 */
@Slf4j
public class CsvOutputWriter implements Closeable {

    private final Path path;
    private final FileOutputStream stream;
    private final CSVWriter writer;

    private CsvOutputWriter(Path path, FileOutputStream stream, CsvSettings settings) {
        this.path = path;
        this.stream = stream;
        this.writer = new CSVWriter(
                new OutputStreamWriter(stream, settings.charset()),
                settings.delimiter(),
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
    }

    /** Starts a new output file, replacing any existing one. */
    public static CsvOutputWriter create(Path path, CsvSettings settings) {
        return open(path, settings, false);
    }

    /** Continues an existing output file. */
    public static CsvOutputWriter append(Path path, CsvSettings settings) {
        return open(path, settings, true);
    }

    private static CsvOutputWriter open(Path path, CsvSettings settings, boolean append) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new CsvOutputWriter(path, new FileOutputStream(path.toFile(), append), settings);
        } catch (IOException e) {
            throw new PersistenceException("Cannot open output file " + path, e);
        }
    }

    public void writeHeader(String[] header) {
        writer.writeNext(header, false);
    }

    public void writeRows(List<String[]> rows) {
        for (String[] row : rows) {
            writer.writeNext(row, false);
        }
    }

    public void commit() {
        try {
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("write error reported by CSV writer");
            }
            stream.getFD().sync();
        } catch (IOException e) {
            log.error("Failed to flush output file {}: {}", path, e.getMessage(), e);
            throw new PersistenceException("Output write failed for " + path, e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
