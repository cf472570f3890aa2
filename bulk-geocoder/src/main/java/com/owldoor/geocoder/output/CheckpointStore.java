package com.owldoor.geocoder.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import com.owldoor.geocoder.exception.ConfigurationException;
import com.owldoor.geocoder.exception.PersistenceException;
import com.owldoor.geocoder.model.Checkpoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Optional;

/**
 * Resume state for an output file.
 *
 * The sidecar {@code <output>.checkpoint} records how many output rows were committed. On load,
 * the output itself is scanned and any rows past the committed count (a chunk flushed but never
 * committed, or a torn last line) are trimmed, so appending continues exactly after the last
 * commit. Without a sidecar, the complete rows already in the output decide the resume point.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CheckpointStore {

    private static final String SUFFIX = ".checkpoint";

    private final ObjectMapper objectMapper;

    public static Path checkpointPath(Path output) {
        return output.resolveSibling(output.getFileName() + SUFFIX);
    }

    /**
     * @param output         output file of the run
     * @param expectedHeader header the run is going to write
     * @return the committed position, or empty when there is nothing to resume from
     * @throws ConfigurationException if the existing output has a different header
     */
    public Optional<Checkpoint> load(Path output, String[] expectedHeader, CsvSettings settings) {
        Checkpoint saved = readSidecar(checkpointPath(output));

        if (!Files.exists(output) || sizeOf(output) == 0) {
            if (saved != null) {
                log.warn("Checkpoint found for {} but the output file is missing; starting fresh", output);
            }
            return Optional.empty();
        }

        OutputScan scan = scan(output, expectedHeader, settings);

        long committed;
        if (saved == null) {
            committed = scan.completeRows();
            log.info("No checkpoint file for {}; inferred {} completed rows from the output", output, committed);
        } else if (scan.completeRows() < saved.getRowsWritten()) {
            committed = scan.completeRows();
            log.warn("Output {} holds {} complete rows but checkpoint says {}; resuming after the rows present",
                    output, committed, saved.getRowsWritten());
        } else {
            committed = saved.getRowsWritten();
        }

        if (scan.completeRows() != committed || scan.trailingGarbage()) {
            log.warn("Trimming {} to its {} committed rows", output, committed);
            truncate(output, committed, settings);
        }

        return Optional.of(Checkpoint.builder()
                .lastCompletedIndex(committed - 1)
                .rowsWritten(committed)
                .chunkSize(saved != null ? saved.getChunkSize() : null)
                .providerId(saved != null ? saved.getProviderId() : null)
                .updatedAt(saved != null ? saved.getUpdatedAt() : null)
                .build());
    }

    /**
     * Atomically replaces the sidecar. Call only after the chunk's rows have been flushed.
     */
    public void commit(Path output, Checkpoint checkpoint) {
        Path target = checkpointPath(output);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), checkpoint);
            replace(tmp, target);
            log.debug("Checkpoint committed: {}", checkpoint);
        } catch (IOException e) {
            log.error("Failed to write checkpoint {}: {}", target, e.getMessage(), e);
            throw new PersistenceException("Checkpoint write failed for " + target, e);
        }
    }

    /** Removes a stale checkpoint before a fresh, non-resumed run. */
    public void clear(Path output) {
        try {
            if (Files.deleteIfExists(checkpointPath(output))) {
                log.info("Discarded previous checkpoint for {}", output);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot remove checkpoint for " + output, e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Checkpoint readSidecar(Path sidecar) {
        if (!Files.exists(sidecar)) return null;
        try {
            return objectMapper.readValue(sidecar.toFile(), Checkpoint.class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", sidecar, e.getMessage());
            return null;
        }
    }

    private OutputScan scan(Path output, String[] expectedHeader, CsvSettings settings) {
        long rows = 0;
        boolean garbage = false;
        try (CSVReader reader = reader(output, settings)) {
            String[] header = reader.readNext();
            if (header == null || !Arrays.equals(header, expectedHeader)) {
                throw new ConfigurationException("Existing output " + output
                        + " has a different header than this run would write; refusing to resume. Found "
                        + Arrays.toString(header));
            }
            try {
                String[] row;
                while ((row = reader.readNext()) != null) {
                    if (row.length != expectedHeader.length) {
                        garbage = true;
                        break;
                    }
                    rows++;
                }
            } catch (IOException | CsvValidationException e) {
                // unterminated quote at end of file: the last write was cut short
                garbage = true;
            }
        } catch (IOException | CsvValidationException e) {
            throw new PersistenceException("Cannot read existing output " + output, e);
        }
        if (!garbage && rows > 0 && !endsWithLineEnd(output)) {
            // every committed row ends with a line end; a full-width row without one was cut short
            rows--;
            garbage = true;
        }
        return new OutputScan(rows, garbage);
    }

    private void truncate(Path output, long keepRows, CsvSettings settings) {
        Path tmp = output.resolveSibling(output.getFileName() + ".trim");
        try (CSVReader reader = reader(output, settings);
             Writer out = Files.newBufferedWriter(tmp, settings.charset());
             CSVWriter writer = new CSVWriter(out, settings.delimiter(), CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER, CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(reader.readNext(), false);
            for (long i = 0; i < keepRows; i++) {
                writer.writeNext(reader.readNext(), false);
            }
        } catch (IOException | CsvValidationException e) {
            throw new PersistenceException("Cannot trim uncommitted rows from " + output, e);
        }
        try {
            replace(tmp, output);
        } catch (IOException e) {
            throw new PersistenceException("Cannot replace " + output + " with its trimmed copy", e);
        }
    }

    private static CSVReader reader(Path path, CsvSettings settings) throws IOException {
        return new CSVReaderBuilder(Files.newBufferedReader(path, settings.charset()))
                .withCSVParser(settings.parser())
                .build();
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean endsWithLineEnd(Path path) {
        try (SeekableByteChannel channel = Files.newByteChannel(path)) {
            long size = channel.size();
            if (size == 0) return false;
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1).read(last);
            return last.get(0) == '\n';
        } catch (IOException e) {
            throw new PersistenceException("Cannot read existing output " + path, e);
        }
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new PersistenceException("Cannot stat output file " + path, e);
        }
    }

    private record OutputScan(long completeRows, boolean trailingGarbage) {}
}
