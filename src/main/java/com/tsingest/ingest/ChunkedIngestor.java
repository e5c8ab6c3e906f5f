package com.tsingest.ingest;

import com.tsingest.config.IngestionConfig;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.TimeAxis;
import com.tsingest.event.FileIngestedEvent;
import com.tsingest.event.IngestionProgressEvent;
import com.tsingest.exception.DataFormatException;
import com.tsingest.exception.DataIoException;
import com.tsingest.exception.EmptyResultException;
import com.tsingest.ingest.ProgressTracker.Progress;
import com.tsingest.ingest.columnar.ColumnarFileReader;
import com.tsingest.ingest.columnar.CorruptColumnarFileException;
import com.tsingest.ingest.columnar.RowGroupReader;
import com.tsingest.ingest.parquet.ParquetRowGroupReader;
import com.tsingest.memory.ChunkingDecision;
import com.tsingest.memory.MemoryGovernor;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Loads one delimited-text, {@code .tscol} or Parquet file into a normalized {@link Dataset}.
 *
 * <p>Text files larger than the chunking threshold are streamed in chunks of
 * {@code chunk-row-count} rows; row-group files are streamed in batches when their metadata
 * reports more rows than that. While streaming, the {@link MemoryGovernor} is asked for headroom every
 * {@code headroom-check-interval-chunks} chunks; without headroom the load stops and returns
 * the rows read so far, flagged as truncated. Chunks are appended in file order.
 *
 * <p>Column names are normalized from the header once and reused for every chunk. Datetime
 * columns are detected from a sample of leading rows; numeric columns are decided over the
 * whole file before the first chunk is typed. After assembly the time axis is chosen
 * by {@link TimeAxisNormalizer}.
 */
@Service
public class ChunkedIngestor {

    private static final Logger log = LoggerFactory.getLogger(ChunkedIngestor.class);

    private final MemoryGovernor memoryGovernor;
    private final IngestionConfig ingestionConfig;
    private final ApplicationEventPublisher applicationEventPublisher;

    public ChunkedIngestor(
            MemoryGovernor memoryGovernor,
            IngestionConfig ingestionConfig,
            ApplicationEventPublisher applicationEventPublisher) {
        this.memoryGovernor = memoryGovernor;
        this.ingestionConfig = ingestionConfig;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Loads {@code path}.
     *
     * @throws DataIoException      if the file is missing or unreadable
     * @throws DataFormatException  if the extension or content is not supported
     * @throws EmptyResultException if no rows were parsed
     */
    public IngestResult load(Path path) {
        if (!Files.exists(path)) {
            throw new DataIoException(path, "File not found: " + path);
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new DataIoException(path, "File is not readable: " + path);
        }
        SourceFormat format = SourceFormat.fromPath(path)
                .orElseThrow(() -> new DataFormatException(path, "Unsupported file extension: " + path.getFileName()));
        long fileSize = fileSize(path);

        log.info("Loading {} ({} bytes, {})", path.getFileName(), fileSize, format);
        ReadOutcome outcome = switch (format) {
            case DELIMITED_TEXT -> readDelimited(path, fileSize);
            case COLUMNAR, PARQUET -> readColumnar(path, format, fileSize);
        };

        Dataset dataset = normalizeTimeAxis(outcome.dataset());
        if (dataset.rowCount() == 0) {
            throw new EmptyResultException(path);
        }
        IngestResult result = new IngestResult(
                path, format, dataset, outcome.decision(), outcome.truncated(), outcome.chunks(), outcome.elapsed());

        if (result.truncated()) {
            log.warn("Partial read of {}: stopped after {} rows ({} chunks), memory headroom exhausted",
                    path.getFileName(), result.rowsRead(), result.chunksRead());
        }
        log.info("Loaded {}: {} rows, {} columns, timeAxis={}, chunked={}, in {}",
                path.getFileName(), dataset.rowCount(), dataset.columnCount(),
                dataset.timeAxis().map(TimeAxis::name).orElse("none"), result.chunked(),
                DurationFormat.format(result.elapsed()));
        applicationEventPublisher.publishEvent(new FileIngestedEvent(this, result));
        return result;
    }

    /**
     * Promotes a timestamp column to the time axis if the dataset has none.
     */
    public Dataset normalizeTimeAxis(Dataset dataset) {
        return TimeAxisNormalizer.normalize(dataset);
    }

    private ReadOutcome readDelimited(Path path, long fileSize) {
        ProgressTracker tracker = ProgressTracker.byBytes(fileSize, System::nanoTime);
        ChunkingDecision decision = new ChunkingDecision(
                fileSize, memoryGovernor.shouldChunk(fileSize), ingestionConfig.getChunkRowCount());
        try {
            Optional<DelimitedTextReader> opened = DelimitedTextReader.open(path, ingestionConfig.getHeaderSniffLines());
            if (opened.isEmpty()) {
                throw new EmptyResultException(path);
            }
            try (DelimitedTextReader reader = opened.get()) {
                ColumnPlan plan = ColumnPlan.fromHeader(reader.header().fields());
                if (plan.size() == 0) {
                    throw new DataFormatException(path, "No usable columns in header of " + path.getFileName());
                }
                Set<String> datetimeColumns =
                        DatetimeColumnDetector.detect(plan, reader.peek(ingestionConfig.getDatetimeSampleRows()));
                log.debug("Header of {} at line {}, delimiter '{}', columns {}, datetime candidates {}",
                        path.getFileName(), reader.header().lineIndex(), printable(reader.header().delimiter()),
                        plan.names(), datetimeColumns);

                if (!decision.chunked()) {
                    List<String[]> rows = reader.readRows(Integer.MAX_VALUE);
                    NumericColumnScanner scanner = new NumericColumnScanner(plan);
                    scanner.accept(rows);
                    Dataset dataset = ChunkConverter.toDataset(plan, datetimeColumns, scanner.numericColumns(), rows);
                    return new ReadOutcome(dataset, decision, false, 1, tracker.elapsed());
                }

                Set<String> numericColumns = scanNumericColumns(path, plan, decision.chunkRowCount());
                log.debug("Numeric columns of {}: {}", path.getFileName(), numericColumns);
                List<Dataset> chunks = new ArrayList<>();
                long rowsRead = 0;
                boolean truncated = false;
                while (reader.hasMore()) {
                    List<String[]> rows = reader.readRows(decision.chunkRowCount());
                    chunks.add(ChunkConverter.toDataset(plan, datetimeColumns, numericColumns, rows));
                    rowsRead += rows.size();
                    reportProgress(path, tracker.update(rowsRead, reader.bytesRead()), chunks.size());
                    if (shouldStop(chunks.size(), reader.hasMore())) {
                        truncated = true;
                        break;
                    }
                }
                return new ReadOutcome(Dataset.concat(chunks), decision, truncated, chunks.size(), tracker.elapsed());
            }
        } catch (CharacterCodingException e) {
            throw new DataFormatException(path, "File is not valid UTF-8: " + path.getFileName(), e);
        } catch (IOException e) {
            throw new DataIoException(path, "Failed to read " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    // one extra pass over the file; rows are inspected, never kept
    private Set<String> scanNumericColumns(Path path, ColumnPlan plan, int batchRows) throws IOException {
        NumericColumnScanner scanner = new NumericColumnScanner(plan);
        Optional<DelimitedTextReader> opened = DelimitedTextReader.open(path, ingestionConfig.getHeaderSniffLines());
        if (opened.isEmpty()) {
            return scanner.numericColumns();
        }
        try (DelimitedTextReader reader = opened.get()) {
            while (scanner.undecided() && reader.hasMore()) {
                scanner.accept(reader.readRows(batchRows));
            }
        }
        return scanner.numericColumns();
    }

    private ReadOutcome readColumnar(Path path, SourceFormat format, long fileSize) {
        try (RowGroupReader reader = openRowGroups(path, format)) {
            long totalRows = reader.rowCount();
            int chunkRows = ingestionConfig.getChunkRowCount();
            ChunkingDecision decision = new ChunkingDecision(fileSize, totalRows > chunkRows, chunkRows);
            ProgressTracker tracker = ProgressTracker.byRows(totalRows, System::nanoTime);
            if (!decision.chunked()) {
                return new ReadOutcome(reader.readAll(), decision, false, 1, tracker.elapsed());
            }

            log.debug("Streaming {} rows of {} in batches of {}, timeAxis={}",
                    totalRows, path.getFileName(), chunkRows, reader.hasTimeAxis());
            List<Dataset> batches = new ArrayList<>();
            long rowsRead = 0;
            boolean truncated = false;
            while (reader.hasMore()) {
                Dataset batch = reader.readBatch(chunkRows);
                batches.add(batch);
                rowsRead += batch.rowCount();
                reportProgress(path, tracker.update(rowsRead, 0), batches.size());
                if (shouldStop(batches.size(), reader.hasMore())) {
                    truncated = true;
                    break;
                }
            }
            return new ReadOutcome(Dataset.concat(batches), decision, truncated, batches.size(), tracker.elapsed());
        } catch (CorruptColumnarFileException e) {
            throw new DataFormatException(path, "Invalid columnar file " + path.getFileName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DataIoException(path, "Failed to read " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static RowGroupReader openRowGroups(Path path, SourceFormat format) throws IOException {
        return format == SourceFormat.PARQUET ? ParquetRowGroupReader.open(path) : ColumnarFileReader.open(path);
    }

    private boolean shouldStop(int chunksRead, boolean moreData) {
        if (!moreData || chunksRead % ingestionConfig.getHeadroomCheckIntervalChunks() != 0) {
            return false;
        }
        return !memoryGovernor.hasHeadroom();
    }

    private void reportProgress(Path path, Progress progress, int chunksRead) {
        log.debug("{}: chunk {}, {} rows (~{}%), {} rows/s, ETA {}",
                path.getFileName(), chunksRead, progress.rowsRead(), progress.percent(),
                Math.round(progress.rowsPerSecond()), progress.eta().map(DurationFormat::format).orElse("?"));
        if (chunksRead % ingestionConfig.getProgressLogIntervalChunks() == 0) {
            applicationEventPublisher.publishEvent(new IngestionProgressEvent(
                    this, path, progress.rowsRead(), chunksRead, progress.estimatedTotalRows(),
                    progress.eta().orElse(null), progress.rowsPerSecond()));
        }
    }

    private static long fileSize(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new DataIoException(path, "Cannot stat " + path + ": " + e.getMessage(), e);
        }
    }

    private static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }

    private record ReadOutcome(Dataset dataset, ChunkingDecision decision, boolean truncated, int chunks, Duration elapsed) {}
}
