package com.tsingest.unit.gaps;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tsingest.dataset.ColumnRef;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.dataset.TimeAxis;
import com.tsingest.dataset.TimestampColumn;
import com.tsingest.gaps.Gap;
import com.tsingest.gaps.GapAnalysisConfig;
import com.tsingest.gaps.GapAnalyzer;
import com.tsingest.gaps.GapReport;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GapAnalyzer")
class GapAnalyzerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private GapAnalysisConfig config;
    private GapAnalyzer gapAnalyzer;

    @BeforeEach
    void setUp() {
        config = new GapAnalysisConfig();
        gapAnalyzer = new GapAnalyzer(config);
    }

    private static Dataset axisDataset(long... minutes) {
        Instant[] instants = new Instant[minutes.length];
        double[] close = new double[minutes.length];
        for (int i = 0; i < minutes.length; i++) {
            instants[i] = T0.plus(Duration.ofMinutes(minutes[i]));
            close[i] = 1.1 + i * 0.001;
        }
        return Dataset.of(List.of(NumericColumn.of("close", close)),
                new TimeAxis("time", TimestampColumn.of("time", instants)));
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("finds a single gap in minute data")
        void singleGap() {
            Dataset dataset = axisDataset(0, 1, 2, 10, 11);

            GapReport report = gapAnalyzer.analyze(dataset, ColumnRef.axis("time"));

            assertThat(report.expectedFrequency()).contains(Duration.ofMinutes(1));
            assertThat(report.gapCount()).isEqualTo(1);
            assertThat(report.gapDurations()).containsExactly(Duration.ofMinutes(8));
            Gap gap = report.gaps().get(0);
            assertThat(gap.start()).isEqualTo(T0.plus(Duration.ofMinutes(2)));
            assertThat(gap.end()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
            assertThat(gap.missingSamples()).isEqualTo(7);
            assertThat(report.threshold()).isEqualTo(Duration.ofSeconds(90));
            assertThat(report.validTimestamps()).isEqualTo(5);
        }

        @Test
        @DisplayName("reports nothing for uniformly spaced data")
        void uniform() {
            long[] minutes = IntStream.range(0, 100).mapToLong(i -> i * 5L).toArray();

            GapReport report = gapAnalyzer.analyze(axisDataset(minutes), ColumnRef.axis("time"));

            assertThat(report.hasGaps()).isFalse();
            assertThat(report.expectedFrequency()).contains(Duration.ofMinutes(5));
            assertThat(report.totalGapTime()).isEqualTo(Duration.ZERO);
        }

        @Test
        @DisplayName("sorts timestamps before measuring deltas")
        void unsorted() {
            GapReport report = gapAnalyzer.analyze(axisDataset(11, 0, 10, 2, 1), ColumnRef.axis("time"));

            assertThat(report.gapDurations()).containsExactly(Duration.ofMinutes(8));
        }

        @Test
        @DisplayName("returns an empty report with fewer than two valid timestamps")
        void tooFewTimestamps() {
            Dataset dataset = Dataset.of(List.of(TextColumn.of("time", "2024-03-01 00:00", null, "garbage")));

            GapReport report = gapAnalyzer.analyze(dataset, ColumnRef.column("time"));

            assertThat(report.hasGaps()).isFalse();
            assertThat(report.validTimestamps()).isEqualTo(1);
            assertThat(report.expectedFrequency()).isEmpty();
        }

        @Test
        @DisplayName("parses text timestamp columns on the fly")
        void textColumn() {
            Dataset dataset = Dataset.of(List.of(TextColumn.of("Date",
                    "2024-03-01 00:00:00", "2024-03-01 01:00:00", "2024-03-01 02:00:00", "2024-03-01 06:00:00")));

            GapReport report = gapAnalyzer.analyze(dataset, ColumnRef.column("Date"));

            assertThat(report.expectedFrequency()).contains(Duration.ofHours(1));
            assertThat(report.gapDurations()).containsExactly(Duration.ofHours(4));
            assertThat(report.totalMissingSamples()).isEqualTo(3);
        }

        @Test
        @DisplayName("falls back to median plus sigma when no ladder rung applies")
        void fallbackThreshold() {
            config.setCanonicalFrequencyLadder(List.of());

            GapReport report = gapAnalyzer.analyze(axisDataset(0, 1, 2, 3, 4, 14), ColumnRef.axis("time"));

            assertThat(report.expectedFrequency()).isEmpty();
            assertThat(report.gapDurations()).containsExactly(Duration.ofMinutes(10));
            assertThat(report.gaps().get(0).missingSamples()).isZero();
        }

        @Test
        @DisplayName("honours a configured multiplier")
        void multiplier() {
            config.setGapThresholdMultiplier(10.0);

            GapReport report = gapAnalyzer.analyze(axisDataset(0, 1, 2, 10, 11), ColumnRef.axis("time"));

            assertThat(report.hasGaps()).isFalse();
        }

        @Test
        @DisplayName("rejects a reference to a missing column")
        void missingColumn() {
            assertThatThrownBy(() -> gapAnalyzer.analyze(axisDataset(0, 1), ColumnRef.column("nope")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("findTimeColumn")
    class FindTimeColumn {

        @Test
        @DisplayName("prefers the time axis")
        void axis() {
            assertThat(gapAnalyzer.findTimeColumn(axisDataset(0, 1))).contains(ColumnRef.axis("time"));
        }

        @Test
        @DisplayName("matches conventional names case-insensitively")
        void byName() {
            Dataset dataset = Dataset.of(List.of(NumericColumn.of("close", 1, 2), TextColumn.of("DateTime", "x", "y")));

            assertThat(gapAnalyzer.findTimeColumn(dataset)).contains(ColumnRef.column("DateTime"));
        }

        @Test
        @DisplayName("falls back to the first column whose values parse")
        void byContent() {
            Dataset dataset = Dataset.of(List.of(
                    TextColumn.of("symbol", "EURUSD", "EURUSD"),
                    TextColumn.of("stamp", "2024-03-01 00:00", "2024-03-01 00:01")));

            assertThat(gapAnalyzer.findTimeColumn(dataset)).contains(ColumnRef.column("stamp"));
        }

        @Test
        @DisplayName("is empty when nothing looks like time")
        void none() {
            Dataset dataset = Dataset.of(List.of(TextColumn.of("symbol", "EURUSD")));

            assertThat(gapAnalyzer.findTimeColumn(dataset)).isEmpty();
        }
    }
}
