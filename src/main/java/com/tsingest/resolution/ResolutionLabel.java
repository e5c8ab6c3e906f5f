package com.tsingest.resolution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Sampling resolutions a file can be classified into, finest first.
 */
@Getter
public enum ResolutionLabel {
    M1("M1", "1M", Duration.ofMinutes(1)),
    M5("M5", "5M", Duration.ofMinutes(5)),
    M15("M15", "15M", Duration.ofMinutes(15)),
    M30("M30", "30M", Duration.ofMinutes(30)),
    H1("H1", "1H", Duration.ofHours(1)),
    H4("H4", "4H", Duration.ofHours(4)),
    D1("D1", "1D", Duration.ofDays(1), "_DAILY_"),
    W1("W1", "1W", Duration.ofDays(7), "_WEEKLY_"),
    MN1("MN1", "1MN", Duration.ofDays(30), "_MONTHLY_"),
    UNCLASSIFIED("UNKNOWN", null, null);

    private final String code;
    private final Duration period;
    /** Upper-case file-name fragments that identify this resolution. */
    private final List<String> markers;

    ResolutionLabel(String code, String reversedCode, Duration period, String... extraMarkers) {
        this.code = code;
        this.period = period;
        List<String> all = new ArrayList<>();
        if (reversedCode != null) {
            all.add("_" + code + "_");
            all.add("_" + code + ".");
            all.add("PERIOD_" + code);
            all.add("_" + reversedCode + "_");
            all.add("_" + reversedCode + ".");
        }
        all.addAll(List.of(extraMarkers));
        this.markers = List.copyOf(all);
    }

    /** Whether {@code upperCaseName} contains any of this label's markers. */
    public boolean matches(String upperCaseName) {
        return markers.stream().anyMatch(upperCaseName::contains);
    }

    public boolean isClassified() {
        return this != UNCLASSIFIED;
    }
}
