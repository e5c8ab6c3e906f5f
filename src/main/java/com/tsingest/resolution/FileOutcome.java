package com.tsingest.resolution;

import java.nio.file.Path;

/**
 * What happened to one file during a coordinated load.
 *
 * @param gapCount gaps found before repair; 0 for base files, which are not analyzed
 * @param message  failure or repair detail, null when there is nothing to add
 */
public record FileOutcome(
        Path path,
        ResolutionLabel label,
        Status status,
        int rows,
        boolean truncated,
        int gapCount,
        String message) {

    public enum Status {
        /** Loaded as-is. */
        LOADED,
        /** Gaps were found and the gap filler returned a repaired dataset. */
        REPAIRED,
        /** The gap filler failed; the unrepaired dataset was kept. */
        REPAIR_FAILED,
        /** The file could not be loaded and was skipped. */
        FAILED
    }

    public boolean isUsable() {
        return status != Status.FAILED;
    }

    static FileOutcome failed(Path path, ResolutionLabel label, String message) {
        return new FileOutcome(path, label, Status.FAILED, 0, false, 0, message);
    }
}
