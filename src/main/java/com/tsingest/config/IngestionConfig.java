package com.tsingest.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for file ingestion and the memory governor.
 *
 * <p>Binds to the {@code tsingest.ingestion.*} prefix in application.properties.
 * {@link #chunkSizeThresholdBytes} decides whether a file is streamed in chunks of
 * {@link #chunkRowCount} rows; the memory fields decide whether streaming may continue.
 */
@Configuration
@ConfigurationProperties(prefix = "tsingest.ingestion")
@Validated
@Getter
@Setter
public class IngestionConfig {

    public static final long MB = 1024L * 1024L;

    /** Rows per chunk when a file is streamed. */
    @Min(1)
    private int chunkRowCount = 50_000;

    /** Files strictly larger than this are streamed in chunks. Default: 100 MB. */
    @Min(0)
    private long chunkSizeThresholdBytes = 100 * MB;

    /** Minimum usable memory, in MB, required for streaming to continue without an explicit requirement. */
    @Min(0)
    private long memorySafetyMarginMb = 100;

    /** Share of available memory considered usable when checking the safety margin. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double memoryAvailableFraction = 0.8;

    /** Headroom is re-checked after every N chunks. */
    @Min(1)
    private int headroomCheckIntervalChunks = 1;

    /** Leading lines scanned when looking for the header row of a delimited file. */
    @Min(1)
    private int headerSniffLines = 10;

    /** Data rows sampled to pre-detect datetime columns. */
    @Min(1)
    private int datetimeSampleRows = 100;

    /** Progress events are published after every N chunks. */
    @Min(1)
    private int progressLogIntervalChunks = 10;

    public long getMemorySafetyMarginBytes() {
        return memorySafetyMarginMb * MB;
    }
}
