package com.tsingest.gaps;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for gap analysis, bound to {@code tsingest.gaps.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "tsingest.gaps")
@Validated
@Getter
@Setter
public class GapAnalysisConfig {

    /** Gap threshold as a multiple of the inferred frequency. */
    @DecimalMin("1.0")
    private double gapThresholdMultiplier = 1.5;

    /** Standard deviations added to the median when no canonical frequency is known. */
    @DecimalMin("0.0")
    private double fallbackSigmaMultiplier = 2.0;

    /** Canonical sampling periods, ascending. */
    private List<Duration> canonicalFrequencyLadder = new ArrayList<>(FrequencyLadder.DEFAULT_RUNGS);

    /** Leading non-null values that must all parse for a column to count as a time column. */
    @Min(1)
    private int timeColumnSampleSize = 10;
}
