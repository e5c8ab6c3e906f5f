package com.tsingest.resolution;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pass of the coordinator over a directory: the classified buckets, the chosen base and
 * the current {@link CoordinatorState}. Not thread-safe; a scan belongs to one caller.
 */
public class ResolutionScan {

    private static final Logger log = LoggerFactory.getLogger(ResolutionScan.class);

    private final Path directory;
    private CoordinatorState state = CoordinatorState.SCANNING;
    private Map<ResolutionLabel, List<Path>> buckets = Map.of();
    private ResolutionLabel base;

    public ResolutionScan(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public CoordinatorState getState() {
        return state;
    }

    /** Buckets in canonical order, unclassified last. */
    public Map<ResolutionLabel, List<Path>> getBuckets() {
        return buckets;
    }

    public Optional<ResolutionLabel> getBase() {
        return Optional.ofNullable(base);
    }

    public int fileCount() {
        return buckets.values().stream().mapToInt(List::size).sum();
    }

    void classified(Map<ResolutionLabel, List<Path>> classifiedBuckets) {
        transitionTo(CoordinatorState.CLASSIFIED);
        EnumMap<ResolutionLabel, List<Path>> copy = new EnumMap<>(ResolutionLabel.class);
        classifiedBuckets.forEach((label, files) -> copy.put(label, List.copyOf(files)));
        this.buckets = Collections.unmodifiableMap(copy);
    }

    void baseSelected(ResolutionLabel label) {
        transitionTo(CoordinatorState.BASE_SELECTED);
        this.base = label;
    }

    void transitionTo(CoordinatorState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Cannot move scan of " + directory + " from " + state + " to " + target);
        }
        log.debug("Scan of {}: {} -> {}", directory, state, target);
        state = target;
    }
}
