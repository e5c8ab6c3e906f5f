package com.tsingest.ingest;

import com.tsingest.dataset.Dataset;
import com.tsingest.memory.ChunkingDecision;
import java.nio.file.Path;
import java.time.Duration;

/**
 * A loaded file.
 *
 * @param truncated true when streaming stopped early for lack of memory; {@code dataset} then
 *                  holds only the rows read before the stop and is valid but incomplete
 * @param chunksRead chunks (or batches) consumed, 1 for a direct read
 */
public record IngestResult(
        Path source,
        SourceFormat format,
        Dataset dataset,
        ChunkingDecision decision,
        boolean truncated,
        int chunksRead,
        Duration elapsed) {

    public int rowsRead() {
        return dataset.rowCount();
    }

    public boolean chunked() {
        return decision.chunked();
    }
}
