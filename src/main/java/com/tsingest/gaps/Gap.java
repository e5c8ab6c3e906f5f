package com.tsingest.gaps;

import java.time.Duration;
import java.time.Instant;

/**
 * An interval between two consecutive valid samples that exceeds the gap threshold.
 *
 * @param missingSamples {@code floor(duration / frequency) - 1} when a frequency is known, else 0
 */
public record Gap(Instant start, Instant end, Duration duration, long missingSamples) {}
