package com.tsingest.memory;

import com.tsingest.config.IngestionConfig;
import com.tsingest.dataset.Column;
import com.tsingest.dataset.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether files are streamed and whether streaming may continue.
 *
 * <p>{@link #shouldChunk(long)} is a static sizing rule on the source file.
 * {@link #hasHeadroom()} is a live check that the ingestor repeats between chunks.
 * Memory queries never throw: when the platform cannot be read the governor assumes
 * headroom, so ordinary files are never blocked by a probe failure.
 */
@Service
public class MemoryGovernor {

    private static final Logger log = LoggerFactory.getLogger(MemoryGovernor.class);

    private final MemoryProbe memoryProbe;
    private final IngestionConfig ingestionConfig;

    public MemoryGovernor(MemoryProbe memoryProbe, IngestionConfig ingestionConfig) {
        this.memoryProbe = memoryProbe;
        this.ingestionConfig = ingestionConfig;
    }

    /**
     * Reads current memory. Re-queries the platform on every call.
     */
    public MemorySnapshot snapshot() {
        try {
            MemorySnapshot snapshot = memoryProbe.read();
            if (snapshot == null) {
                return MemorySnapshot.unknown();
            }
            return snapshot;
        } catch (RuntimeException e) {
            log.debug("Memory query failed, assuming headroom: {}", e.getMessage());
            return MemorySnapshot.unknown();
        }
    }

    /**
     * Whether usable memory still clears the configured safety margin
     * ({@code available * fraction >= margin}).
     */
    public boolean hasHeadroom() {
        MemorySnapshot snapshot = snapshot();
        if (!snapshot.known()) {
            return true;
        }
        double usable = snapshot.availableBytes() * ingestionConfig.getMemoryAvailableFraction();
        return usable >= ingestionConfig.getMemorySafetyMarginBytes();
    }

    /**
     * Whether at least {@code requiredBytes} are available.
     */
    public boolean hasHeadroom(long requiredBytes) {
        MemorySnapshot snapshot = snapshot();
        if (!snapshot.known()) {
            return true;
        }
        return snapshot.availableBytes() >= requiredBytes;
    }

    public boolean shouldChunk(long fileSizeBytes) {
        return fileSizeBytes > ingestionConfig.getChunkSizeThresholdBytes();
    }

    /**
     * Rough in-memory size of {@code dataset}: element width times row count per column,
     * time axis included.
     */
    public long estimateFootprint(Dataset dataset) {
        long rows = dataset.rowCount();
        long total = 0;
        for (Column column : dataset.columns()) {
            total += rows * column.type().getEstimatedWidthBytes();
        }
        if (dataset.hasTimeAxis()) {
            total += rows * dataset.timeAxis().get().values().type().getEstimatedWidthBytes();
        }
        return total;
    }
}
