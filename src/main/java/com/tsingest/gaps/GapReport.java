package com.tsingest.gaps;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Result of gap analysis over one time column. Immutable.
 */
public final class GapReport {

    private final List<Gap> gaps;
    private final Duration expectedFrequency;
    private final Duration threshold;
    private final int validTimestamps;

    public GapReport(List<Gap> gaps, Duration expectedFrequency, Duration threshold, int validTimestamps) {
        this.gaps = List.copyOf(gaps);
        this.expectedFrequency = expectedFrequency;
        this.threshold = threshold;
        this.validTimestamps = validTimestamps;
    }

    /** Report for data too short to analyze. */
    public static GapReport empty(int validTimestamps) {
        return new GapReport(List.of(), null, Duration.ZERO, validTimestamps);
    }

    public boolean hasGaps() {
        return !gaps.isEmpty();
    }

    public int gapCount() {
        return gaps.size();
    }

    /** Raw gap durations in time order. */
    public List<Duration> gapDurations() {
        return gaps.stream().map(Gap::duration).toList();
    }

    public List<Gap> gaps() {
        return gaps;
    }

    public Optional<Duration> expectedFrequency() {
        return Optional.ofNullable(expectedFrequency);
    }

    public Duration threshold() {
        return threshold;
    }

    /** Non-null timestamps the analysis ran on. */
    public int validTimestamps() {
        return validTimestamps;
    }

    public Optional<Gap> largestGap() {
        return gaps.stream().max(Comparator.comparing(Gap::duration));
    }

    public Duration totalGapTime() {
        return gaps.stream().map(Gap::duration).reduce(Duration.ZERO, Duration::plus);
    }

    public long totalMissingSamples() {
        return gaps.stream().mapToLong(Gap::missingSamples).sum();
    }

    @Override
    public String toString() {
        return "GapReport[gaps=" + gaps.size()
                + ", expectedFrequency=" + expectedFrequency
                + ", threshold=" + threshold
                + ", totalGapTime=" + totalGapTime() + "]";
    }
}
