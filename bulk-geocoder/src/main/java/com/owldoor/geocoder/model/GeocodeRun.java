package com.owldoor.geocoder.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Report for one run: lifecycle state, per-status counts and the safe resume point.
 */
@Data
@Builder
public class GeocodeRun {

    private String runId;           // UUID
    private String provider;
    private String input;
    private String output;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private BatchState state;
    private long resumedFromIndex;  // first row index processed by this run
    private long lastCommittedIndex; // -1 when nothing committed
    private long attempted;
    private long succeeded;
    private long failed;
    private long skipped;
    private long elapsedMillis;
    private String errorMessage;    // null unless aborted

    public void applyStats(RunStats stats) {
        this.attempted = stats.getAttempted();
        this.succeeded = stats.getSucceeded();
        this.failed = stats.getFailed();
        this.skipped = stats.getSkipped();
        this.elapsedMillis = stats.elapsedMillis();
    }
}
