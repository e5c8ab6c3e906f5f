package com.tsingest.resolution;

import com.tsingest.dataset.Dataset;
import java.util.List;
import java.util.Optional;

/**
 * One bucket after loading: each usable file, their concatenation in enumeration order and the
 * outcome of every file. {@code combined} is empty when no file was usable.
 */
public record BucketResult(
        ResolutionLabel label,
        List<TaggedDataset> datasets,
        Optional<Dataset> combined,
        List<FileOutcome> outcomes) {

    public BucketResult {
        datasets = List.copyOf(datasets);
        outcomes = List.copyOf(outcomes);
    }
}
