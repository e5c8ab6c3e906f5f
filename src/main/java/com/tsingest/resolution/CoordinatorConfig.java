package com.tsingest.resolution;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for multi-resolution loading, bound to {@code tsingest.coordinator.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "tsingest.coordinator")
@Validated
@Getter
@Setter
public class CoordinatorConfig {

    /** Extensions (without dot, case-insensitive) picked up when listing a directory. */
    @NotEmpty
    private List<String> fileExtensions = new ArrayList<>(List.of("csv", "txt", "tsv", "parquet", "tscol"));

    /** Files whose name starts with this prefix are skipped. */
    private String ignoredFilePrefix = "tmp";

    /** Strategy name handed to the gap filler. */
    @NotBlank
    private String fillAlgorithm = "auto";

    /** Whether loaded datasets get {@code source_file} and {@code timeframe} columns. */
    private boolean tagColumns = true;
}
