package com.tsingest.gaps;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Canonical sampling periods used to round a noisy median delta to a clean frequency.
 */
public final class FrequencyLadder {

    public static final List<Duration> DEFAULT_RUNGS = List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofHours(1),
            Duration.ofHours(4),
            Duration.ofDays(1),
            Duration.ofDays(7),
            Duration.ofDays(30),
            Duration.ofDays(365));

    private final List<Duration> rungs;

    public FrequencyLadder(List<Duration> rungs) {
        List<Duration> sorted = new ArrayList<>(rungs);
        sorted.sort(Comparator.naturalOrder());
        this.rungs = List.copyOf(sorted);
    }

    public static FrequencyLadder defaults() {
        return new FrequencyLadder(DEFAULT_RUNGS);
    }

    /**
     * The first rung at or above {@code median}; the top rung when the median exceeds them all.
     *
     * @return empty only for a ladder without rungs
     */
    public Optional<Duration> roundUp(Duration median) {
        for (Duration rung : rungs) {
            if (rung.compareTo(median) >= 0) {
                return Optional.of(rung);
            }
        }
        return rungs.isEmpty() ? Optional.empty() : Optional.of(rungs.get(rungs.size() - 1));
    }

    public List<Duration> rungs() {
        return rungs;
    }
}
