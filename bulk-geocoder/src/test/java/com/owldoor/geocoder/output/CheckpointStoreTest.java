package com.owldoor.geocoder.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.owldoor.geocoder.exception.ConfigurationException;
import com.owldoor.geocoder.model.Checkpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CheckpointStore Tests")
class CheckpointStoreTest {

    private static final String[] HEADER = {"id", "latitude", "longitude", "geocode_status", "geocode_address"};

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CheckpointStore store;
    private Path output;

    @BeforeEach
    void setUp() {
        store = new CheckpointStore(objectMapper);
        output = dir.resolve("out.csv");
    }

    private void writeOutput(int rows) {
        try (CsvOutputWriter writer = CsvOutputWriter.create(output, CsvSettings.DEFAULT)) {
            writer.writeHeader(HEADER);
            writer.writeRows(rows(0, rows));
            writer.commit();
        } catch (IOException e) {
            fail(e);
        }
    }

    private void appendRows(int from, int count) {
        try (CsvOutputWriter writer = CsvOutputWriter.append(output, CsvSettings.DEFAULT)) {
            writer.writeRows(rows(from, count));
            writer.commit();
        } catch (IOException e) {
            fail(e);
        }
    }

    private static List<String[]> rows(int from, int count) {
        List<String[]> rows = new ArrayList<>();
        for (int i = from; i < from + count; i++) {
            rows.add(new String[]{String.valueOf(i), "1.0", "2.0", "success", "Somewhere, " + i});
        }
        return rows;
    }

    private static Checkpoint committedThrough(long lastIndex) {
        return Checkpoint.builder()
                .lastCompletedIndex(lastIndex)
                .rowsWritten(lastIndex + 1)
                .chunkSize(10)
                .providerId("nominatim")
                .updatedAt("2026-01-01T00:00:00Z")
                .build();
    }

    private long dataLines() throws IOException {
        return Files.readAllLines(output, StandardCharsets.UTF_8).size() - 1;
    }

    @Test
    @DisplayName("Nothing to resume when the output does not exist")
    void testNoOutput() {
        assertTrue(store.load(output, HEADER, CsvSettings.DEFAULT).isEmpty());
    }

    @Test
    @DisplayName("Committed checkpoint is read back and written as snake_case JSON")
    void testCommitAndLoad() throws IOException {
        writeOutput(20);
        store.commit(output, committedThrough(19));

        JsonNode json = objectMapper.readTree(CheckpointStore.checkpointPath(output).toFile());
        assertEquals(19, json.get("last_completed_index").asLong());
        assertEquals("nominatim", json.get("provider_id").asText());

        Checkpoint loaded = store.load(output, HEADER, CsvSettings.DEFAULT).orElseThrow();
        assertEquals(19, loaded.getLastCompletedIndex());
        assertEquals(20, loaded.nextIndex());
        assertEquals("nominatim", loaded.getProviderId());
        assertEquals(20, dataLines());
    }

    @Test
    @DisplayName("Rows flushed after the last commit are trimmed")
    void testUncommittedRowsTrimmed() throws IOException {
        writeOutput(10);
        store.commit(output, committedThrough(9));
        appendRows(10, 7);

        Checkpoint loaded = store.load(output, HEADER, CsvSettings.DEFAULT).orElseThrow();

        assertEquals(9, loaded.getLastCompletedIndex());
        assertEquals(10, dataLines());
    }

    @Test
    @DisplayName("A torn last line is trimmed")
    void testTornLineTrimmed() throws IOException {
        writeOutput(5);
        store.commit(output, committedThrough(4));
        Files.writeString(output, "5,1.0,\"half a quoted", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        Checkpoint loaded = store.load(output, HEADER, CsvSettings.DEFAULT).orElseThrow();

        assertEquals(4, loaded.getLastCompletedIndex());
        assertEquals(5, dataLines());
    }

    @Test
    @DisplayName("Without a checkpoint file the resume point comes from the output row count")
    void testInferredFromOutput() {
        writeOutput(12);

        Optional<Checkpoint> loaded = store.load(output, HEADER, CsvSettings.DEFAULT);

        assertTrue(loaded.isPresent());
        assertEquals(11, loaded.get().getLastCompletedIndex());
        assertNull(loaded.get().getProviderId());
        assertNull(loaded.get().getChunkSize());
    }

    @Test
    @DisplayName("Output shorter than the checkpoint resumes after the rows actually present")
    void testOutputShorterThanCheckpoint() {
        writeOutput(3);
        store.commit(output, committedThrough(9));

        assertEquals(2, store.load(output, HEADER, CsvSettings.DEFAULT).orElseThrow().getLastCompletedIndex());
    }

    @Test
    @DisplayName("A different header refuses to resume")
    void testHeaderMismatch() {
        writeOutput(3);
        String[] other = {"name", "latitude", "longitude", "geocode_status", "geocode_address"};

        assertThrows(ConfigurationException.class, () -> store.load(output, other, CsvSettings.DEFAULT));
    }

    @Test
    @DisplayName("Clear removes the checkpoint file")
    void testClear() {
        writeOutput(1);
        store.commit(output, committedThrough(0));
        assertTrue(Files.exists(CheckpointStore.checkpointPath(output)));

        store.clear(output);

        assertFalse(Files.exists(CheckpointStore.checkpointPath(output)));
    }

    @Test
    @DisplayName("A full-width last row without a line end is treated as torn")
    void testUnterminatedLastRowTrimmed() throws IOException {
        writeOutput(2);
        Files.writeString(output, "2,0.002,-0.002,success,Resolv", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        Checkpoint loaded = store.load(output, HEADER, CsvSettings.DEFAULT).orElseThrow();

        assertEquals(1, loaded.getLastCompletedIndex());
        assertEquals(2, dataLines());
        assertTrue(Files.readString(output, StandardCharsets.UTF_8).endsWith("Somewhere, 1\"\n"));
    }

    @Test
    @DisplayName("An empty-output checkpoint trims every row written after it")
    void testEmptyCheckpointTrimsAll() throws IOException {
        writeOutput(3);
        store.commit(output, Checkpoint.builder().lastCompletedIndex(-1).rowsWritten(0).chunkSize(10).build());

        Checkpoint loaded = store.load(output, HEADER, CsvSettings.DEFAULT).orElseThrow();

        assertEquals(0, loaded.nextIndex());
        assertEquals(0, dataLines());
    }
}
