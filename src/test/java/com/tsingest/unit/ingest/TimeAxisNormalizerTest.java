package com.tsingest.unit.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.dataset.TimeAxis;
import com.tsingest.dataset.TimestampColumn;
import com.tsingest.ingest.TimeAxisNormalizer;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TimeAxisNormalizer")
class TimeAxisNormalizerTest {

    @Test
    @DisplayName("leaves a dataset with a time axis unchanged")
    void existingAxis() {
        Dataset dataset = Dataset.of(
                List.of(TextColumn.of("date", "2023-01-01")),
                new TimeAxis("ts", TimestampColumn.of("ts", Instant.EPOCH)));

        assertThat(TimeAxisNormalizer.normalize(dataset)).isSameAs(dataset);
    }

    @Nested
    @DisplayName("named time column")
    class NamedColumn {

        @Test
        @DisplayName("promotes a literal name and keeps its case")
        void promotesLiteralName() {
            Dataset dataset = Dataset.of(List.of(
                    NumericColumn.of("close", 1.0, 2.0),
                    TextColumn.of("Date", "2023-01-02", "2023-01-03")));

            Dataset normalized = TimeAxisNormalizer.normalize(dataset);

            assertThat(normalized.timeAxis()).map(TimeAxis::name).contains("Date");
            assertThat(normalized.columnNames()).containsExactly("close");
            assertThat(normalized.timeAxis().get().values().get(1)).isEqualTo(Instant.parse("2023-01-03T00:00:00Z"));
        }

        @Test
        @DisplayName("prefers an exact-case match over a case-insensitive one")
        void exactCaseFirst() {
            Dataset dataset = Dataset.of(List.of(
                    TextColumn.of("TIME", "2023-01-02 00:00"),
                    TextColumn.of("time", "2023-01-02 00:05")));

            Dataset normalized = TimeAxisNormalizer.normalize(dataset);

            assertThat(normalized.timeAxis()).map(TimeAxis::name).contains("time");
            assertThat(normalized.columnNames()).containsExactly("TIME");
        }

        @Test
        @DisplayName("promotes even when values do not parse, keeping rows as not-a-time")
        void unparseableNamedColumn() {
            Dataset dataset = Dataset.of(List.of(
                    TextColumn.of("timestamp", "x", "2023-01-02"),
                    NumericColumn.of("v", 1, 2)));

            Dataset normalized = TimeAxisNormalizer.normalize(dataset);

            assertThat(normalized.rowCount()).isEqualTo(2);
            assertThat(normalized.timeAxis().get().values().isNull(0)).isTrue();
        }
    }

    @Test
    @DisplayName("leaves OHLCV data without a timestamp-like column alone")
    void ohlcvWithoutTimestamp() {
        Dataset dataset = Dataset.of(List.of(
                NumericColumn.of("bar", 1672628645, 1672628705),
                NumericColumn.of("open", 1.1, 1.2),
                NumericColumn.of("close", 1.2, 1.3)));

        assertThat(TimeAxisNormalizer.normalize(dataset).hasTimeAxis()).isFalse();
    }

    @Nested
    @DisplayName("first column fallback")
    class FirstColumn {

        @Test
        @DisplayName("promotes the first column when a value parses")
        void promotesFirstColumn() {
            Dataset dataset = Dataset.of(List.of(
                    TextColumn.of("stamp", "2023-01-02 00:00", "junk"),
                    NumericColumn.of("value", 1, 2)));

            Dataset normalized = TimeAxisNormalizer.normalize(dataset);

            assertThat(normalized.timeAxis()).map(TimeAxis::name).contains("stamp");
            assertThat(normalized.timeAxis().get().values().validCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("leaves the dataset unchanged when nothing parses")
        void nothingParses() {
            Dataset dataset = Dataset.of(List.of(TextColumn.of("label", "a", "b"), NumericColumn.of("value", 1, 2)));

            assertThat(TimeAxisNormalizer.normalize(dataset)).isSameAs(dataset);
        }
    }
}
