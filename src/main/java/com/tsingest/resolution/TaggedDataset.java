package com.tsingest.resolution;

import com.tsingest.dataset.Dataset;
import java.nio.file.Path;

/**
 * A loaded file together with where it came from.
 */
public record TaggedDataset(Path source, ResolutionLabel label, Dataset dataset, boolean truncated) {

    public String sourceFileName() {
        return source.getFileName().toString();
    }
}
