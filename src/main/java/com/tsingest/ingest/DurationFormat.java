package com.tsingest.ingest;

import java.time.Duration;
import java.util.Locale;

/**
 * Short human-readable durations for progress logs: {@code 12.3s}, {@code 4m 5s}, {@code 1h 2m}.
 */
public final class DurationFormat {

    private DurationFormat() {}

    public static String format(Duration duration) {
        double seconds = duration.toMillis() / 1000.0;
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1fs", seconds);
        }
        long total = duration.getSeconds();
        if (total < 3600) {
            return (total / 60) + "m " + (total % 60) + "s";
        }
        return (total / 3600) + "h " + ((total % 3600) / 60) + "m";
    }
}
