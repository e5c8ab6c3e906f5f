package com.tsingest.resolution;

import com.tsingest.dataset.ColumnRef;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.TextColumn;
import com.tsingest.event.BucketLoadedEvent;
import com.tsingest.exception.BaseException;
import com.tsingest.exception.DataIoException;
import com.tsingest.exception.RepairFailureException;
import com.tsingest.gaps.GapReport;
import com.tsingest.ingest.ChunkedIngestor;
import com.tsingest.ingest.IngestResult;
import com.tsingest.ingest.SourceFormat;
import com.tsingest.memory.MemoryGovernor;
import com.tsingest.repair.GapFiller;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Loads the files of one instrument at several sampling resolutions.
 *
 * <p>Flow: {@link #scan} lists and classifies a directory, the caller picks a base among
 * {@link #baseCandidates}, then {@link #load} ingests the base bucket as-is and every other
 * bucket through gap analysis and repair. A file that fails is logged and skipped; a bucket
 * with no usable file is left out of the result.
 */
@Service
public class ResolutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ResolutionCoordinator.class);

    static final String SOURCE_FILE_COLUMN = "source_file";
    static final String TIMEFRAME_COLUMN = "timeframe";

    private final ChunkedIngestor chunkedIngestor;
    private final GapFiller gapFiller;
    private final MemoryGovernor memoryGovernor;
    private final CoordinatorConfig coordinatorConfig;
    private final ApplicationEventPublisher applicationEventPublisher;

    public ResolutionCoordinator(
            ChunkedIngestor chunkedIngestor,
            GapFiller gapFiller,
            MemoryGovernor memoryGovernor,
            CoordinatorConfig coordinatorConfig,
            ApplicationEventPublisher applicationEventPublisher) {
        this.chunkedIngestor = chunkedIngestor;
        this.gapFiller = gapFiller;
        this.memoryGovernor = memoryGovernor;
        this.coordinatorConfig = coordinatorConfig;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Flat listing of {@code directory}: regular files with a configured extension, not starting
     * with the ignored prefix and, when {@code mask} is given, containing it (any case). Sorted by
     * file name.
     */
    public List<Path> listFiles(Path directory, String mask) {
        if (!Files.isDirectory(directory)) {
            throw new DataIoException(directory, "Not a directory: " + directory);
        }
        Set<String> extensions = coordinatorConfig.getFileExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        String loweredMask = mask == null || mask.isBlank() ? null : mask.toLowerCase(Locale.ROOT);
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> extensions.contains(SourceFormat.extensionOf(p)))
                    .filter(p -> !p.getFileName().toString().startsWith(coordinatorConfig.getIgnoredFilePrefix()))
                    .filter(p -> loweredMask == null
                            || p.getFileName().toString().toLowerCase(Locale.ROOT).contains(loweredMask))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new DataIoException(directory, "Failed to list " + directory + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lists and classifies {@code directory}; the returned scan is ready for base selection.
     */
    public ResolutionScan scan(Path directory, String mask) {
        ResolutionScan scan = new ResolutionScan(directory);
        List<Path> files = listFiles(directory, mask);
        scan.classified(classify(files));
        log.info("Classified {} files in {}: {}", files.size(), directory, describe(scan.getBuckets()));
        return scan;
    }

    /**
     * Partitions {@code paths} by resolution, keeping the given order within each bucket. Only
     * non-empty buckets are present, in canonical order with unclassified last.
     */
    public Map<ResolutionLabel, List<Path>> classify(List<Path> paths) {
        Map<ResolutionLabel, List<Path>> buckets = new EnumMap<>(ResolutionLabel.class);
        for (Path path : paths) {
            ResolutionLabel label = ResolutionClassifier.classify(path.getFileName().toString());
            buckets.computeIfAbsent(label, l -> new ArrayList<>()).add(path);
        }
        return buckets;
    }

    /** Buckets that may serve as base, finest first. Unclassified files never qualify. */
    public List<ResolutionLabel> baseCandidates(Map<ResolutionLabel, List<Path>> buckets) {
        return buckets.entrySet().stream()
                .filter(e -> e.getKey().isClassified() && !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    /** The finest available resolution, as a default for the caller's choice. */
    public Optional<ResolutionLabel> suggestBase(Map<ResolutionLabel, List<Path>> buckets) {
        return baseCandidates(buckets).stream().findFirst();
    }

    /**
     * Records the caller's base choice.
     *
     * @throws IllegalArgumentException when {@code label} is not one of the candidates
     */
    public void selectBase(ResolutionScan scan, ResolutionLabel label) {
        if (!baseCandidates(scan.getBuckets()).contains(label)) {
            throw new IllegalArgumentException("Resolution " + label + " is not a base candidate in " + scan.getDirectory());
        }
        scan.baseSelected(label);
        log.info("Base resolution for {}: {}", scan.getDirectory(), label.getCode());
    }

    /**
     * Loads every bucket of a scan whose base has been selected.
     */
    public LoadedResolutionSet load(ResolutionScan scan) {
        ResolutionLabel base = scan.getBase()
                .orElseThrow(() -> new IllegalStateException("No base selected for " + scan.getDirectory()));
        scan.transitionTo(CoordinatorState.LOADING);
        long start = System.nanoTime();
        LoadedResolutionSet.Builder builder = LoadedResolutionSet.builder(base, memoryGovernor.snapshot());

        BucketResult baseResult = loadBase(base, scan.getBuckets().getOrDefault(base, List.of()));
        builder.baseDatasets(baseResult.datasets()).outcomes(baseResult.outcomes());
        baseResult.combined().ifPresent(d -> builder.bucket(base, d));

        for (Map.Entry<ResolutionLabel, List<Path>> entry : scan.getBuckets().entrySet()) {
            if (entry.getKey() == base) {
                continue;
            }
            BucketResult result = loadBucket(entry.getKey(), entry.getValue());
            builder.outcomes(result.outcomes());
            result.combined().ifPresent(d -> builder.bucket(entry.getKey(), d));
        }

        LoadedResolutionSet loaded = builder.build(Duration.ofNanos(System.nanoTime() - start), memoryGovernor.snapshot());
        scan.transitionTo(CoordinatorState.DONE);
        log.info("Loaded {} buckets from {}", loaded.labels().size(), scan.getDirectory());
        loaded.summaryLines().forEach(line -> log.info("  {}", line));
        return loaded;
    }

    /**
     * Ingests the base files without gap analysis; the base is treated as ground truth.
     */
    public BucketResult loadBase(ResolutionLabel label, List<Path> files) {
        List<TaggedDataset> datasets = new ArrayList<>();
        List<FileOutcome> outcomes = new ArrayList<>();
        for (Path file : files) {
            Optional<IngestResult> ingested = ingest(file, label, outcomes);
            if (ingested.isEmpty()) {
                continue;
            }
            IngestResult result = ingested.get();
            datasets.add(new TaggedDataset(file, label, tag(result.dataset(), file, label), result.truncated()));
            outcomes.add(new FileOutcome(file, label, FileOutcome.Status.LOADED, result.rowsRead(),
                    result.truncated(), 0, null));
        }
        return completeBucket(label, true, datasets, outcomes);
    }

    /**
     * Loads each non-base bucket through gap analysis and repair.
     *
     * @return the combined dataset per bucket; buckets without a usable file are absent
     */
    public Map<ResolutionLabel, Dataset> loadOthers(Map<ResolutionLabel, List<Path>> buckets) {
        Map<ResolutionLabel, Dataset> loaded = new LinkedHashMap<>();
        buckets.forEach((label, files) -> loadBucket(label, files).combined().ifPresent(d -> loaded.put(label, d)));
        return loaded;
    }

    /**
     * Loads one non-base bucket: ingest, find the time column, detect gaps and repair them
     * with the configured algorithm. A failure anywhere after ingestion keeps the unrepaired data.
     */
    public BucketResult loadBucket(ResolutionLabel label, List<Path> files) {
        List<TaggedDataset> datasets = new ArrayList<>();
        List<FileOutcome> outcomes = new ArrayList<>();
        for (Path file : files) {
            Optional<IngestResult> ingested = ingest(file, label, outcomes);
            if (ingested.isEmpty()) {
                continue;
            }
            IngestResult result = ingested.get();
            Repair repair = repair(file, result.dataset());
            Dataset dataset = repair.dataset();
            datasets.add(new TaggedDataset(file, label, tag(dataset, file, label), result.truncated()));
            outcomes.add(new FileOutcome(file, label, repair.status(), dataset.rowCount(), result.truncated(),
                    repair.gapCount(), repair.message()));
        }
        return completeBucket(label, false, datasets, outcomes);
    }

    /**
     * Finds the time column, detects gaps and repairs them. Any failure of the gap filler keeps
     * the unrepaired dataset and marks the file {@code REPAIR_FAILED}.
     */
    private Repair repair(Path file, Dataset dataset) {
        String algorithm = coordinatorConfig.getFillAlgorithm();
        int gapCount = 0;
        try {
            Optional<ColumnRef> timeColumn = gapFiller.findTimestampColumn(dataset);
            if (timeColumn.isEmpty()) {
                String message = "no time column, gap analysis skipped";
                log.warn("{}: {}", file.getFileName(), message);
                return new Repair(dataset, FileOutcome.Status.LOADED, 0, message);
            }
            GapReport report = gapFiller.detectGaps(dataset, timeColumn.get());
            gapCount = report.gapCount();
            if (!report.hasGaps()) {
                return new Repair(dataset, FileOutcome.Status.LOADED, 0, null);
            }
            Dataset repaired = gapFiller.applyAlgorithm(dataset, algorithm, report);
            if (repaired == null) {
                throw new RepairFailureException(algorithm, "Gap filler returned no dataset");
            }
            log.info("{}: {} gaps repaired with {}", file.getFileName(), gapCount, algorithm);
            return new Repair(repaired, FileOutcome.Status.REPAIRED, gapCount, null);
        } catch (RuntimeException e) {
            log.warn("Gap repair of {} failed, keeping original data: {}", file.getFileName(), e.getMessage());
            return new Repair(dataset, FileOutcome.Status.REPAIR_FAILED, gapCount, String.valueOf(e.getMessage()));
        }
    }

    private Optional<IngestResult> ingest(Path file, ResolutionLabel label, List<FileOutcome> outcomes) {
        try {
            return Optional.of(chunkedIngestor.load(file));
        } catch (BaseException e) {
            log.error("Skipping {} ({}): {}", file.getFileName(), e.getErrorCode(), e.getMessage());
            outcomes.add(FileOutcome.failed(file, label, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Skipping {}: unexpected failure", file.getFileName(), e);
            outcomes.add(FileOutcome.failed(file, label, String.valueOf(e.getMessage())));
        }
        return Optional.empty();
    }

    private BucketResult completeBucket(
            ResolutionLabel label, boolean base, List<TaggedDataset> datasets, List<FileOutcome> outcomes) {
        Optional<Dataset> combined = Optional.empty();
        if (!datasets.isEmpty()) {
            List<Dataset> parts = datasets.stream().map(TaggedDataset::dataset).toList();
            long footprint = parts.stream().mapToLong(memoryGovernor::estimateFootprint).sum();
            if (parts.size() > 1 && !memoryGovernor.hasHeadroom(footprint)) {
                log.warn("Combining {} files of {} needs about {} MB, more than is available",
                        parts.size(), label.getCode(), footprint / (1024 * 1024));
            }
            combined = Optional.of(Dataset.concat(parts));
        }
        int rows = combined.map(Dataset::rowCount).orElse(0);
        if (combined.isEmpty()) {
            log.warn("No usable files in bucket {}, leaving it out", label.getCode());
        } else {
            log.info("Bucket {}{}: {} files, {} rows", label.getCode(), base ? " (base)" : "", datasets.size(), rows);
        }
        applicationEventPublisher.publishEvent(new BucketLoadedEvent(this, label, base, rows, outcomes));
        return new BucketResult(label, datasets, combined, outcomes);
    }

    private Dataset tag(Dataset dataset, Path file, ResolutionLabel label) {
        if (!coordinatorConfig.isTagColumns()) {
            return dataset;
        }
        int rows = dataset.rowCount();
        return dataset
                .withColumn(TextColumn.constant(SOURCE_FILE_COLUMN, file.getFileName().toString(), rows))
                .withColumn(TextColumn.constant(TIMEFRAME_COLUMN, label.getCode(), rows));
    }

    private static String describe(Map<ResolutionLabel, List<Path>> buckets) {
        return buckets.entrySet().stream()
                .map(e -> e.getKey().getCode() + "=" + e.getValue().size())
                .collect(Collectors.joining(", "));
    }

    private record Repair(Dataset dataset, FileOutcome.Status status, int gapCount, String message) {}
}
