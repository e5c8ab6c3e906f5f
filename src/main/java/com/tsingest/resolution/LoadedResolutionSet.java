package com.tsingest.resolution;

import com.tsingest.dataset.Dataset;
import com.tsingest.ingest.DurationFormat;
import com.tsingest.memory.MemorySnapshot;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Datasets loaded per resolution, plus the per-file outcome log.
 *
 * <p>Only completed buckets with at least one usable file are present; a bucket whose files
 * all failed is absent rather than empty. Non-base datasets have been through gap repair.
 */
public final class LoadedResolutionSet {

    private final ResolutionLabel base;
    private final List<TaggedDataset> baseDatasets;
    private final Map<ResolutionLabel, Dataset> buckets;
    private final List<FileOutcome> outcomes;
    private final Duration elapsed;
    private final MemorySnapshot memoryBefore;
    private final MemorySnapshot memoryAfter;

    private LoadedResolutionSet(Builder builder, Duration elapsed, MemorySnapshot memoryAfter) {
        this.base = builder.base;
        this.baseDatasets = List.copyOf(builder.baseDatasets);
        this.buckets = Collections.unmodifiableMap(new EnumMap<>(builder.buckets));
        this.outcomes = List.copyOf(builder.outcomes);
        this.elapsed = elapsed;
        this.memoryBefore = builder.memoryBefore;
        this.memoryAfter = memoryAfter;
    }

    public ResolutionLabel getBase() {
        return base;
    }

    /** Base files one by one, in enumeration order. */
    public List<TaggedDataset> getBaseDatasets() {
        return baseDatasets;
    }

    public Optional<Dataset> get(ResolutionLabel label) {
        return Optional.ofNullable(buckets.get(label));
    }

    public boolean contains(ResolutionLabel label) {
        return buckets.containsKey(label);
    }

    public Set<ResolutionLabel> labels() {
        return buckets.keySet();
    }

    public Map<ResolutionLabel, Dataset> asMap() {
        return buckets;
    }

    public List<FileOutcome> getOutcomes() {
        return outcomes;
    }

    public List<FileOutcome> getFailures() {
        return outcomes.stream().filter(o -> o.status() == FileOutcome.Status.FAILED).toList();
    }

    public List<FileOutcome> getTruncated() {
        return outcomes.stream().filter(FileOutcome::truncated).toList();
    }

    public boolean hasTruncatedFiles() {
        return outcomes.stream().anyMatch(FileOutcome::truncated);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public MemorySnapshot getMemoryBefore() {
        return memoryBefore;
    }

    public MemorySnapshot getMemoryAfter() {
        return memoryAfter;
    }

    /** One line per bucket with its size, then the totals. */
    public List<String> summaryLines() {
        List<String> lines = new ArrayList<>();
        buckets.forEach((label, dataset) -> lines.add(String.format("%-4s%s %d rows x %d columns",
                label.getCode(), label == base ? "*" : " ", dataset.rowCount(), dataset.columnCount())));
        long loaded = outcomes.stream().filter(FileOutcome::isUsable).count();
        lines.add(String.format("%d/%d files loaded, %d truncated, %d failed, in %s",
                loaded, outcomes.size(), getTruncated().size(), getFailures().size(), DurationFormat.format(elapsed)));
        if (memoryBefore.known() && memoryAfter.known()) {
            lines.add(String.format("memory used %.1f%% -> %.1f%%", memoryBefore.percentUsed(), memoryAfter.percentUsed()));
        }
        return lines;
    }

    static Builder builder(ResolutionLabel base, MemorySnapshot memoryBefore) {
        return new Builder(base, memoryBefore);
    }

    static final class Builder {

        private final ResolutionLabel base;
        private final MemorySnapshot memoryBefore;
        private final List<TaggedDataset> baseDatasets = new ArrayList<>();
        private final Map<ResolutionLabel, Dataset> buckets = new EnumMap<>(ResolutionLabel.class);
        private final List<FileOutcome> outcomes = new ArrayList<>();

        private Builder(ResolutionLabel base, MemorySnapshot memoryBefore) {
            this.base = base;
            this.memoryBefore = memoryBefore;
        }

        Builder baseDatasets(List<TaggedDataset> datasets) {
            baseDatasets.addAll(datasets);
            return this;
        }

        Builder bucket(ResolutionLabel label, Dataset dataset) {
            buckets.put(label, dataset);
            return this;
        }

        Builder outcomes(List<FileOutcome> fileOutcomes) {
            outcomes.addAll(fileOutcomes);
            return this;
        }

        LoadedResolutionSet build(Duration elapsed, MemorySnapshot memoryAfter) {
            return new LoadedResolutionSet(this, elapsed, memoryAfter);
        }
    }
}
