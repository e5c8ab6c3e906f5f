package com.tsingest.ingest;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * File formats the ingestor reads, recognised by extension.
 */
@Getter
@RequiredArgsConstructor
public enum SourceFormat {
    DELIMITED_TEXT(List.of("csv", "txt", "tsv")),
    COLUMNAR(List.of("tscol")),
    PARQUET(List.of("parquet"));

    private final List<String> extensions;

    public static Optional<SourceFormat> fromPath(Path path) {
        String extension = extensionOf(path);
        return Arrays.stream(values())
                .filter(f -> f.extensions.contains(extension))
                .findFirst();
    }

    /** Lower-cased extension without the dot, or empty. */
    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
