package com.tsingest.gaps;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.ColumnRef;
import com.tsingest.dataset.ColumnType;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TimestampColumn;
import com.tsingest.ingest.TimestampParser;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Infers a dataset's sampling frequency and finds the intervals that exceed it.
 *
 * <p>The frequency is the median delta between sorted valid timestamps, rounded up to the
 * {@link FrequencyLadder}. A delta is a gap when it exceeds {@code multiplier x frequency};
 * without a frequency the threshold falls back to {@code median + sigma x stddev} of the
 * deltas. Fewer than two valid timestamps give an empty report, never an exception.
 */
@Service
public class GapAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GapAnalyzer.class);

    static final Set<String> TIME_COLUMN_NAMES = Set.of("timestamp", "time", "date", "datetime", "dt", "ts");

    private final GapAnalysisConfig gapAnalysisConfig;

    public GapAnalyzer(GapAnalysisConfig gapAnalysisConfig) {
        this.gapAnalysisConfig = gapAnalysisConfig;
    }

    /**
     * The time axis if the dataset has one, else a column named like a timestamp, else the first
     * column whose leading non-null values all parse as timestamps.
     */
    public Optional<ColumnRef> findTimeColumn(Dataset dataset) {
        if (dataset.hasTimeAxis()) {
            return dataset.timeAxis().map(axis -> ColumnRef.axis(axis.name()));
        }
        for (Column column : dataset.columns()) {
            if (TIME_COLUMN_NAMES.contains(column.name().toLowerCase(Locale.ROOT))) {
                return Optional.of(ColumnRef.column(column.name()));
            }
        }
        for (Column column : dataset.columns()) {
            if (leadingValuesParse(column)) {
                return Optional.of(ColumnRef.column(column.name()));
            }
        }
        return Optional.empty();
    }

    public Optional<Duration> inferFrequency(Dataset dataset, ColumnRef timeColumn) {
        long[] sorted = sortedValidMillis(dataset, timeColumn);
        if (sorted.length < 2) {
            return Optional.empty();
        }
        return inferFrequency(deltas(sorted));
    }

    public GapReport analyze(Dataset dataset, ColumnRef timeColumn) {
        long[] sorted = sortedValidMillis(dataset, timeColumn);
        if (sorted.length < 2) {
            log.debug("Only {} valid timestamps in {}, skipping gap analysis", sorted.length, timeColumn.name());
            return GapReport.empty(sorted.length);
        }
        long[] deltas = deltas(sorted);
        Optional<Duration> frequency = inferFrequency(deltas);
        double thresholdMillis = frequency
                .map(f -> f.toMillis() * gapAnalysisConfig.getGapThresholdMultiplier())
                .orElseGet(() -> median(deltas) + gapAnalysisConfig.getFallbackSigmaMultiplier() * stddev(deltas));

        List<Gap> gaps = new ArrayList<>();
        for (int i = 0; i < deltas.length; i++) {
            if (deltas[i] > thresholdMillis) {
                Duration duration = Duration.ofMillis(deltas[i]);
                long missing = frequency
                        .map(f -> f.toMillis() > 0 ? Math.max(0L, duration.toMillis() / f.toMillis() - 1) : 0L)
                        .orElse(0L);
                gaps.add(new Gap(Instant.ofEpochMilli(sorted[i]), Instant.ofEpochMilli(sorted[i + 1]), duration, missing));
            }
        }
        GapReport report = new GapReport(
                gaps, frequency.orElse(null), Duration.ofMillis((long) Math.floor(thresholdMillis)), sorted.length);
        log.debug("Gap analysis on {}: {}", timeColumn.name(), report);
        return report;
    }

    private Optional<Duration> inferFrequency(long[] deltas) {
        FrequencyLadder ladder = new FrequencyLadder(gapAnalysisConfig.getCanonicalFrequencyLadder());
        return ladder.roundUp(Duration.ofMillis(Math.round(median(deltas))));
    }

    private boolean leadingValuesParse(Column column) {
        int wanted = gapAnalysisConfig.getTimeColumnSampleSize();
        int checked = 0;
        TimestampParser parser = new TimestampParser();
        for (int i = 0; i < column.size() && checked < wanted; i++) {
            if (column.isNull(i)) {
                continue;
            }
            checked++;
            boolean parses = switch (column.type()) {
                case TIMESTAMP -> true;
                case NUMERIC -> TimestampParser.fromEpochNumber(((NumericColumn) column).getDouble(i)).isPresent();
                case TEXT -> parser.parse(column.format(i)).isPresent();
            };
            if (!parses) {
                return false;
            }
        }
        return checked > 0;
    }

    private static long[] sortedValidMillis(Dataset dataset, ColumnRef timeColumn) {
        Column column = timeColumn.resolve(dataset)
                .orElseThrow(() -> new IllegalArgumentException("No time column " + timeColumn.name() + " in dataset"));
        TimestampColumn timestamps = column.type() == ColumnType.TIMESTAMP
                ? (TimestampColumn) column
                : TimestampParser.parseColumn(column);
        long[] valid = timestamps.validEpochMillis();
        Arrays.sort(valid);
        return valid;
    }

    private static long[] deltas(long[] sorted) {
        long[] deltas = new long[sorted.length - 1];
        for (int i = 1; i < sorted.length; i++) {
            deltas[i - 1] = sorted[i] - sorted[i - 1];
        }
        return deltas;
    }

    static double median(long[] values) {
        long[] copy = values.clone();
        Arrays.sort(copy);
        int mid = copy.length / 2;
        if (copy.length % 2 == 1) {
            return copy[mid];
        }
        return (copy[mid - 1] + copy[mid]) / 2.0;
    }

    // sample standard deviation, 0 for a single value
    static double stddev(long[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = Arrays.stream(values).average().orElse(0.0);
        double sum = 0.0;
        for (long value : values) {
            double d = value - mean;
            sum += d * d;
        }
        return Math.sqrt(sum / (values.length - 1));
    }
}
