package com.tsingest.unit.ingest.parquet;

import static com.tsingest.unit.ingest.parquet.ParquetFixtures.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.tsingest.dataset.ColumnType;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.dataset.TimeAxis;
import com.tsingest.dataset.TimestampColumn;
import com.tsingest.ingest.columnar.CorruptColumnarFileException;
import com.tsingest.ingest.parquet.ParquetRowGroupReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for ParquetRowGroupReader: footer metadata, type mapping, batching and rejects.
 */
class ParquetRowGroupReaderTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Metadata")
    class Metadata {

        @Test
        @DisplayName("row count comes from the footer before any row is read")
        void footerRowCount() throws IOException {
            Path file = ParquetFixtures.writeBars(tempDir.resolve("bars.parquet"), 42);

            try (ParquetRowGroupReader reader = ParquetRowGroupReader.open(file)) {
                assertThat(reader.rowCount()).isEqualTo(42);
                assertThat(reader.rowGroupCount()).isGreaterThanOrEqualTo(1);
                assertThat(reader.hasMore()).isTrue();
            }
        }

        @Test
        @DisplayName("pandas index metadata selects the time axis")
        void pandasIndex() throws IOException {
            Path file = ParquetFixtures.writeBars(tempDir.resolve("bars.parquet"), 3);

            try (ParquetRowGroupReader reader = ParquetRowGroupReader.open(file)) {
                assertThat(reader.hasTimeAxis()).isTrue();
                Dataset dataset = reader.readAll();

                TimeAxis axis = dataset.timeAxis().orElseThrow();
                assertThat(axis.name()).isEqualTo("time");
                assertThat(axis.values().get(2)).isEqualTo(START.plusSeconds(120));
                assertThat(dataset.columnNames()).containsExactly("close", "price", "active", "symbol", "session");
            }
        }

        @Test
        @DisplayName("without pandas metadata the timestamp stays an ordinary column")
        void noIndexMetadata() throws IOException {
            Path file = ParquetFixtures.writeBars(tempDir.resolve("bars.parquet"), 3, Map.of());

            try (ParquetRowGroupReader reader = ParquetRowGroupReader.open(file)) {
                assertThat(reader.hasTimeAxis()).isFalse();
                Dataset dataset = reader.readAll();

                assertThat(dataset.hasTimeAxis()).isFalse();
                assertThat(dataset.column("time").orElseThrow().type()).isEqualTo(ColumnType.TIMESTAMP);
            }
        }
    }

    @Nested
    @DisplayName("Type mapping")
    class TypeMapping {

        @Test
        @DisplayName("decimals, booleans, dates and optional strings map to column types")
        void logicalTypes() throws IOException {
            Path file = ParquetFixtures.writeBars(tempDir.resolve("bars.parquet"), 2);

            try (ParquetRowGroupReader reader = ParquetRowGroupReader.open(file)) {
                Dataset dataset = reader.readAll();

                NumericColumn close = (NumericColumn) dataset.column("close").orElseThrow();
                NumericColumn price = (NumericColumn) dataset.column("price").orElseThrow();
                NumericColumn active = (NumericColumn) dataset.column("active").orElseThrow();
                TextColumn symbol = (TextColumn) dataset.column("symbol").orElseThrow();
                TimestampColumn session = (TimestampColumn) dataset.column("session").orElseThrow();

                assertThat(close.getDouble(1)).isEqualTo(1.11, offset(1e-9));
                assertThat(price.getDouble(0)).isEqualTo(1.25);
                assertThat(price.getDouble(1)).isEqualTo(1.26);
                assertThat(active.getDouble(0)).isEqualTo(1.0);
                assertThat(active.getDouble(1)).isEqualTo(0.0);
                assertThat(symbol.get(0)).isEqualTo("EURUSD");
                assertThat(symbol.isNull(1)).isTrue();
                assertThat(session.get(0)).isEqualTo(Instant.parse("2023-01-02T00:00:00Z"));
            }
        }
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("batches keep file order and add up to the footer row count")
        void fixedSizeBatches() throws IOException {
            Path file = ParquetFixtures.writeBars(tempDir.resolve("bars.parquet"), 25);

            Dataset whole;
            try (ParquetRowGroupReader reader = ParquetRowGroupReader.open(file)) {
                whole = reader.readAll();
            }

            List<Integer> sizes = new ArrayList<>();
            List<Dataset> batches = new ArrayList<>();
            try (ParquetRowGroupReader reader = ParquetRowGroupReader.open(file)) {
                while (reader.hasMore()) {
                    Dataset batch = reader.readBatch(10);
                    sizes.add(batch.rowCount());
                    batches.add(batch);
                }
            }

            assertThat(sizes).containsExactly(10, 10, 5);
            Dataset joined = Dataset.concat(batches);
            assertThat(joined.timeAxis()).isEqualTo(whole.timeAxis());
            assertThat(joined.columns()).isEqualTo(whole.columns());
        }
    }

    @Nested
    @DisplayName("Rejects")
    class Rejects {

        @Test
        @DisplayName("a file without the Parquet footer is corrupt")
        void notParquet() throws IOException {
            Path file = tempDir.resolve("bars.parquet");
            Files.writeString(file, "time,close\n2023-01-02,1.1\n", StandardCharsets.UTF_8);

            assertThatThrownBy(() -> ParquetRowGroupReader.open(file))
                    .isInstanceOf(CorruptColumnarFileException.class);
        }
    }
}
