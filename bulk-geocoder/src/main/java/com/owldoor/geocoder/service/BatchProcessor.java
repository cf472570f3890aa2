package com.owldoor.geocoder.service;

import com.owldoor.geocoder.config.BulkGeocoderProperties;
import com.owldoor.geocoder.exception.ConfigurationException;
import com.owldoor.geocoder.exception.GeocoderException;
import com.owldoor.geocoder.exception.ProviderPermanentException;
import com.owldoor.geocoder.exception.ProviderTransientException;
import com.owldoor.geocoder.model.BatchState;
import com.owldoor.geocoder.model.Checkpoint;
import com.owldoor.geocoder.model.GeocodeJob;
import com.owldoor.geocoder.model.GeocodeQuery;
import com.owldoor.geocoder.model.GeocodeResult;
import com.owldoor.geocoder.model.GeocodeRun;
import com.owldoor.geocoder.model.GeocodeStatus;
import com.owldoor.geocoder.model.InputRecord;
import com.owldoor.geocoder.model.OutputRecord;
import com.owldoor.geocoder.model.RunStats;
import com.owldoor.geocoder.output.CheckpointStore;
import com.owldoor.geocoder.output.CsvOutputWriter;
import com.owldoor.geocoder.output.CsvRecordReader;
import com.owldoor.geocoder.output.CsvSettings;
import com.owldoor.geocoder.service.provider.ProviderClient;
import com.owldoor.geocoder.service.provider.ProviderClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one geocoding job: Idle → Initializing → Running → Completed | Aborted.
 *
 * Rows are handled strictly one at a time in input order. Results are buffered and written in
 * chunks; after each chunk is flushed to disk the checkpoint is committed, so an interrupted run
 * redoes at most one chunk. Row-level problems (no address, provider errors) only mark the row;
 * configuration problems abort before the first row, and write failures abort mid-run leaving
 * earlier chunks resumable.
 */
@Service
@Slf4j
public class BatchProcessor {

    static final int PROGRESS_INTERVAL = 100;

    private final ProviderClientFactory clientFactory;
    private final AddressExtractor addressExtractor;
    private final CheckpointStore checkpointStore;
    private final BulkGeocoderProperties properties;

    private final AtomicBoolean busy = new AtomicBoolean();
    private volatile BatchState state = BatchState.IDLE;
    private volatile GeocodeRun lastRun;

    public BatchProcessor(ProviderClientFactory clientFactory, AddressExtractor addressExtractor,
                          CheckpointStore checkpointStore, BulkGeocoderProperties properties) {
        this.clientFactory = clientFactory;
        this.addressExtractor = addressExtractor;
        this.checkpointStore = checkpointStore;
        this.properties = properties;
    }

    public BatchState getState() {
        return state;
    }

    public Optional<GeocodeRun> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    public boolean isBusy() {
        return busy.get();
    }

    /**
     * Runs the job to completion on the calling thread.
     *
     * @throws IllegalStateException if another job is already running in this processor
     */
    public GeocodeRun run(GeocodeJob job) {
        if (!busy.compareAndSet(false, true)) {
            throw new IllegalStateException("A geocoding run is already in progress");
        }
        return runClaimed(job);
    }

    /**
     * Claims this processor and hands the run to {@code executor}.
     *
     * @return false, without submitting anything, when a run is already in progress
     */
    public boolean start(GeocodeJob job, Executor executor) {
        if (!busy.compareAndSet(false, true)) {
            return false;
        }
        try {
            executor.execute(() -> runClaimed(job));
        } catch (RuntimeException e) {
            busy.set(false);
            throw e;
        }
        return true;
    }

    private GeocodeRun runClaimed(GeocodeJob job) {
        RunStats stats = new RunStats();
        GeocodeRun run = GeocodeRun.builder()
                .runId(UUID.randomUUID().toString())
                .provider(job.getProvider())
                .input(job.getInput())
                .output(job.getOutput())
                .startedAt(LocalDateTime.now())
                .lastCommittedIndex(-1)
                .build();
        lastRun = run;

        try {
            transition(run, BatchState.INITIALIZING);
            Session session;
            try {
                session = initialize(job, run);
            } catch (GeocoderException e) {
                return abort(run, stats, e);
            }

            try (session) {
                transition(run, BatchState.RUNNING);
                process(job, session, run, stats);
            } catch (GeocoderException e) {
                return abort(run, stats, e);
            } catch (IOException e) {
                log.warn("Failed to close files after run {}: {}", run.getRunId(), e.getMessage());
            }

            transition(run, BatchState.COMPLETED);
            finish(run, stats);
            logSummary(run, stats);
            return run;
        } finally {
            busy.set(false);
        }
    }

    // ── Initializing ─────────────────────────────────────────────────────────

    private Session initialize(GeocodeJob job, GeocodeRun run) {
        validate(job);
        ProviderClient client = clientFactory.create(job.getProvider(), job.getApiKey());
        CsvSettings settings = CsvSettings.from(properties.getCsv());

        Path input = Paths.get(job.getInput());
        Path output = Paths.get(job.getOutput());
        CsvRecordReader reader = CsvRecordReader.open(input, settings);

        try {
            String[] header = OutputRecord.header(reader.columns());
            warnOnMissingColumns(job, reader.columns());

            Optional<Checkpoint> checkpoint = job.isResume()
                    ? checkpointStore.load(output, header, settings)
                    : Optional.empty();

            CsvOutputWriter writer;
            long startIndex;
            if (checkpoint.isPresent()) {
                Checkpoint cp = checkpoint.get();
                if (cp.getProviderId() != null && !cp.getProviderId().equals(client.provider().getId())) {
                    log.warn("Resuming {} with provider {} although earlier rows used {}",
                            output, client.provider().getId(), cp.getProviderId());
                }
                startIndex = cp.nextIndex();
                writer = CsvOutputWriter.append(output, settings);
                log.info("Resuming from row {} ({} rows already in {})", startIndex, cp.getRowsWritten(), output);
            } else {
                if (job.isResume()) {
                    log.info("Nothing to resume for {}; starting from row 0", output);
                }
                checkpointStore.clear(output);
                startIndex = 0;
                writer = CsvOutputWriter.create(output, settings);
                try {
                    writer.writeHeader(header);
                    writer.commit();
                    checkpointStore.commit(output, Checkpoint.builder()
                            .lastCompletedIndex(-1)
                            .chunkSize(job.getChunkSize())
                            .providerId(client.provider().getId())
                            .rowsWritten(0)
                            .updatedAt(Instant.now().toString())
                            .build());
                } catch (RuntimeException e) {
                    closeQuietly(writer);
                    throw e;
                }
            }

            run.setResumedFromIndex(startIndex);
            run.setLastCommittedIndex(startIndex - 1);
            run.setProvider(client.provider().getId());

            log.info("Starting geocoding: provider={}, input={}, output={}, chunkSize={}, from row {}",
                    client.provider().getId(), input, output, job.getChunkSize(), startIndex);
            return new Session(client, reader, writer, output, startIndex);

        } catch (RuntimeException e) {
            closeQuietly(reader);
            throw e;
        }
    }

    private void validate(GeocodeJob job) {
        if (job.getInput() == null || job.getInput().isBlank()) {
            throw new ConfigurationException("An input file is required");
        }
        if (job.getOutput() == null || job.getOutput().isBlank()) {
            throw new ConfigurationException("An output file is required");
        }
        if (Paths.get(job.getInput()).toAbsolutePath().normalize()
                .equals(Paths.get(job.getOutput()).toAbsolutePath().normalize())) {
            throw new ConfigurationException("Output file must differ from the input file");
        }
        if (job.getColumns() == null || !job.getColumns().isConfigured()) {
            throw new ConfigurationException("Specify either an address column or at least one of "
                    + "the street, city, state and zip columns");
        }
        if (job.getChunkSize() < 1) {
            throw new ConfigurationException("Chunk size must be at least 1, got " + job.getChunkSize());
        }
    }

    private void warnOnMissingColumns(GeocodeJob job, List<String> columns) {
        var mapping = job.getColumns();
        for (String column : new String[]{mapping.getAddressColumn(), mapping.getStreetColumn(),
                mapping.getCityColumn(), mapping.getStateColumn(), mapping.getZipColumn()}) {
            if (column != null && !column.isBlank() && !columns.contains(column)) {
                log.warn("Column '{}' is not in the input header {}; it will be treated as empty", column, columns);
            }
        }
    }

    // ── Running ──────────────────────────────────────────────────────────────

    private void process(GeocodeJob job, Session session, GeocodeRun run, RunStats stats) {
        int chunkSize = job.getChunkSize();
        List<String[]> buffer = new ArrayList<>(Math.min(chunkSize, 10_000));
        long lastIndex = session.startIndex() - 1;

        InputRecord record;
        while ((record = session.reader().next()) != null) {
            if (record.index() < session.startIndex()) {
                continue;
            }
            GeocodeResult result = geocodeRow(session.client(), record, job);
            stats.record(result.status());
            buffer.add(new OutputRecord(record, result).toRow());
            lastIndex = record.index();

            if ((lastIndex + 1) % chunkSize == 0) {
                commitChunk(session, buffer, lastIndex, job, run);
            }
            if (stats.processed() % PROGRESS_INTERVAL == 0) {
                logProgress(lastIndex, stats);
            }
        }

        if (!buffer.isEmpty()) {
            commitChunk(session, buffer, lastIndex, job, run);
        }
    }

    private GeocodeResult geocodeRow(ProviderClient client, InputRecord record, GeocodeJob job) {
        GeocodeQuery query = addressExtractor.extract(record, job.getColumns());
        if (!query.isValid()) {
            log.debug("Row {} has no address data", record.index());
            return GeocodeResult.noAddress();
        }
        try {
            return client.geocode(query.address());
        } catch (ProviderTransientException | ProviderPermanentException e) {
            log.warn("Error on row {}: {}", record.index(), e.getMessage());
            return GeocodeResult.failed();
        }
    }

    private void commitChunk(Session session, List<String[]> buffer, long lastIndex, GeocodeJob job, GeocodeRun run) {
        session.writer().writeRows(buffer);
        session.writer().commit();
        checkpointStore.commit(session.output(), Checkpoint.builder()
                .lastCompletedIndex(lastIndex)
                .chunkSize(job.getChunkSize())
                .providerId(session.client().provider().getId())
                .rowsWritten(lastIndex + 1)
                .updatedAt(Instant.now().toString())
                .build());
        run.setLastCommittedIndex(lastIndex);
        log.info("Committed {} rows through row {}", buffer.size(), lastIndex);
        buffer.clear();
    }

    // ── Completed / Aborted ──────────────────────────────────────────────────

    private GeocodeRun abort(GeocodeRun run, RunStats stats, GeocoderException e) {
        transition(run, BatchState.ABORTED);
        run.setErrorMessage(e.getMessage());
        finish(run, stats);
        if (run.getLastCommittedIndex() >= 0) {
            log.error("Run {} aborted: {}. Last committed row: {}. Re-run with resume to continue from row {}.",
                    run.getRunId(), e.getMessage(), run.getLastCommittedIndex(), run.getLastCommittedIndex() + 1);
        } else {
            log.error("Run {} aborted: {}. No rows were committed.", run.getRunId(), e.getMessage());
        }
        logSummary(run, stats);
        return run;
    }

    private void finish(GeocodeRun run, RunStats stats) {
        run.applyStats(stats);
        run.setCompletedAt(LocalDateTime.now());
    }

    private void transition(GeocodeRun run, BatchState next) {
        log.debug("Run {}: {} -> {}", run.getRunId(), state, next);
        state = next;
        run.setState(next);
    }

    private void logProgress(long lastIndex, RunStats stats) {
        log.info("Progress: row {} | Success: {} | Failed: {} | No address: {} | Rate: {} rows/sec",
                lastIndex, stats.getSucceeded(), stats.getFailed(), stats.getSkipped(),
                String.format("%.2f", stats.rowsPerSecond()));
    }

    private void logSummary(GeocodeRun run, RunStats stats) {
        long processed = stats.processed();
        log.info("Geocoding {}: processed={}, success={} ({}), failed={} ({}), no_address={} ({}), "
                        + "elapsed={} min, rate={} rows/sec, output={}",
                run.getState() == BatchState.COMPLETED ? "complete" : "aborted",
                processed,
                stats.getSucceeded(), percent(stats.getSucceeded(), processed),
                stats.getFailed(), percent(stats.getFailed(), processed),
                stats.getSkipped(), percent(stats.getSkipped(), processed),
                String.format("%.1f", stats.elapsedMillis() / 60_000.0),
                String.format("%.2f", stats.rowsPerSecond()),
                run.getOutput());
    }

    private static String percent(long part, long total) {
        return total == 0 ? "0.0%" : String.format("%.1f%%", part * 100.0 / total);
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure: {}", e.getMessage());
        }
    }

    /**
     * Open resources of a run. Closing it closes input and output.
     */
    private record Session(ProviderClient client, CsvRecordReader reader, CsvOutputWriter writer,
                           Path output, long startIndex) implements Closeable {

        @Override
        public void close() throws IOException {
            try {
                reader.close();
            } finally {
                writer.close();
            }
        }
    }
}
