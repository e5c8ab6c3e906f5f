package com.tsingest.ingest;

import java.time.Duration;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Estimates total rows and time remaining while a file is streamed. Text files are estimated
 * from bytes consumed, columnar files know their row count up front.
 */
final class ProgressTracker {

    private final long totalBytes;
    private final long knownTotalRows;
    private final LongSupplier nanoClock;
    private final long startNanos;

    private ProgressTracker(long totalBytes, long knownTotalRows, LongSupplier nanoClock) {
        this.totalBytes = totalBytes;
        this.knownTotalRows = knownTotalRows;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
    }

    static ProgressTracker byBytes(long totalBytes, LongSupplier nanoClock) {
        return new ProgressTracker(totalBytes, -1, nanoClock);
    }

    static ProgressTracker byRows(long totalRows, LongSupplier nanoClock) {
        return new ProgressTracker(-1, totalRows, nanoClock);
    }

    Progress update(long rowsRead, long bytesRead) {
        Duration elapsed = Duration.ofNanos(nanoClock.getAsLong() - startNanos);
        long estimatedTotal = estimateTotalRows(rowsRead, bytesRead);
        double seconds = elapsed.toNanos() / 1e9;
        double rowsPerSecond = seconds > 0 ? rowsRead / seconds : 0.0;
        Optional<Duration> eta = Optional.empty();
        if (rowsRead > 0 && estimatedTotal >= rowsRead) {
            long remainingNanos = (long) (elapsed.toNanos() * ((double) (estimatedTotal - rowsRead) / rowsRead));
            eta = Optional.of(Duration.ofNanos(remainingNanos));
        }
        return new Progress(rowsRead, estimatedTotal, elapsed, eta, rowsPerSecond);
    }

    Duration elapsed() {
        return Duration.ofNanos(nanoClock.getAsLong() - startNanos);
    }

    private long estimateTotalRows(long rowsRead, long bytesRead) {
        if (knownTotalRows >= 0) {
            return knownTotalRows;
        }
        if (bytesRead <= 0 || totalBytes <= 0) {
            return rowsRead;
        }
        return Math.max(rowsRead, Math.round(rowsRead * ((double) totalBytes / bytesRead)));
    }

    record Progress(long rowsRead, long estimatedTotalRows, Duration elapsed, Optional<Duration> eta,
            double rowsPerSecond) {

        int percent() {
            return estimatedTotalRows > 0 ? (int) Math.min(100, rowsRead * 100 / estimatedTotalRows) : 0;
        }
    }
}
