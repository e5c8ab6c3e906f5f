package com.tsingest.event;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.springframework.context.ApplicationEvent;

/**
 * Published periodically while a file is streamed in chunks.
 *
 * <p>Published every {@code tsingest.ingestion.progress-log-interval-chunks} chunks. Purely
 * informational: nothing a listener does can change the load.
 */
public class IngestionProgressEvent extends ApplicationEvent {

    private final Path path;
    private final long rowsRead;
    private final int chunksRead;
    private final long estimatedTotalRows;
    private final Duration eta;
    private final double rowsPerSecond;

    public IngestionProgressEvent(
            Object source,
            Path path,
            long rowsRead,
            int chunksRead,
            long estimatedTotalRows,
            Duration eta,
            double rowsPerSecond) {
        super(source);
        this.path = path;
        this.rowsRead = rowsRead;
        this.chunksRead = chunksRead;
        this.estimatedTotalRows = estimatedTotalRows;
        this.eta = eta;
        this.rowsPerSecond = rowsPerSecond;
    }

    public Path getPath() {
        return path;
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public int getChunksRead() {
        return chunksRead;
    }

    public long getEstimatedTotalRows() {
        return estimatedTotalRows;
    }

    public Optional<Duration> getEta() {
        return Optional.ofNullable(eta);
    }

    public double getRowsPerSecond() {
        return rowsPerSecond;
    }

    /**
     * Progress as a percentage (0-100).
     */
    public int getProgressPercent() {
        return estimatedTotalRows > 0 ? (int) Math.min(100, (rowsRead * 100) / estimatedTotalRows) : 0;
    }
}
