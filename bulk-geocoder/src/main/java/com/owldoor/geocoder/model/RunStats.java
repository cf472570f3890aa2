package com.owldoor.geocoder.model;

import lombok.Getter;

/**
 * Per-run counters. Created fresh for every run (a resumed run starts counting at zero)
 * and only ever incremented.
 */
@Getter
public class RunStats {

    private long attempted;
    private long succeeded;
    private long failed;
    private long skipped;

    private final long startNanos = System.nanoTime();

    public void record(GeocodeStatus status) {
        switch (status) {
            case SUCCESS -> {
                attempted++;
                succeeded++;
            }
            case FAILED -> {
                attempted++;
                failed++;
            }
            case NO_ADDRESS -> skipped++;
        }
    }

    /** Rows handled this run, including skipped ones. */
    public long processed() {
        return attempted + skipped;
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    public double rowsPerSecond() {
        long millis = elapsedMillis();
        return millis > 0 ? processed() * 1000.0 / millis : 0;
    }
}
