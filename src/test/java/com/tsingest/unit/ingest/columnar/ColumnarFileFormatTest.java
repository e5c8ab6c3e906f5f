package com.tsingest.unit.ingest.columnar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tsingest.dataset.ColumnType;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.dataset.TimeAxis;
import com.tsingest.dataset.TimestampColumn;
import com.tsingest.ingest.columnar.ColumnarFileFormat;
import com.tsingest.ingest.columnar.ColumnarFileFormat.ColumnSpec;
import com.tsingest.ingest.columnar.ColumnarFileReader;
import com.tsingest.ingest.columnar.ColumnarFileWriter;
import com.tsingest.ingest.columnar.CorruptColumnarFileException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for the columnar file header, the writer and the batch-slicing reader.
 */
@DisplayName("ColumnarFileFormat")
class ColumnarFileFormatTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Header")
    class HeaderTests {

        @Test
        @DisplayName("writes a 48-byte header that reads back")
        void header() throws IOException {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            DataOutputStream dos = new DataOutputStream(baos);

            ColumnarFileFormat.writeHeader(dos, new ColumnarFileFormat.FileHeader(
                    ColumnarFileFormat.VERSION, 3, 42, 2, 0, 1234L, 99L));
            dos.flush();

            byte[] bytes = baos.toByteArray();
            assertThat(bytes).hasSize(ColumnarFileFormat.HEADER_SIZE);
            ColumnarFileFormat.FileHeader header =
                    ColumnarFileFormat.readHeader(new DataInputStream(new ByteArrayInputStream(bytes)));
            assertThat(header.rowCount()).isEqualTo(42);
            assertThat(header.rowGroupCount()).isEqualTo(2);
            assertThat(header.hasTimeAxis()).isTrue();
            assertThat(header.crc32()).isEqualTo(99L);
        }

        @Test
        @DisplayName("rejects a bad magic number")
        void badMagic() throws IOException {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            DataOutputStream dos = new DataOutputStream(baos);
            dos.writeLong(0xDEADBEEFL);
            dos.write(new byte[40]);
            dos.flush();

            DataInputStream dis = new DataInputStream(new ByteArrayInputStream(baos.toByteArray()));
            assertThatThrownBy(() -> ColumnarFileFormat.readHeader(dis))
                    .isInstanceOf(CorruptColumnarFileException.class)
                    .hasMessageContaining("bad magic");
        }

        @Test
        @DisplayName("rejects an unsupported version")
        void unsupportedVersion() throws IOException {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            DataOutputStream dos = new DataOutputStream(baos);
            dos.writeLong(ColumnarFileFormat.MAGIC);
            dos.writeInt(7);
            dos.write(new byte[36]);
            dos.flush();

            DataInputStream dis = new DataInputStream(new ByteArrayInputStream(baos.toByteArray()));
            assertThatThrownBy(() -> ColumnarFileFormat.readHeader(dis))
                    .isInstanceOf(CorruptColumnarFileException.class)
                    .hasMessageContaining("version");
        }
    }

    @Nested
    @DisplayName("Reader")
    class ReaderTests {

        @Test
        @DisplayName("exposes metadata before any row is read")
        void metadata() throws IOException {
            Path file = write(sample(10), 4);

            try (ColumnarFileReader reader = ColumnarFileReader.open(file)) {
                assertThat(reader.rowCount()).isEqualTo(10);
                assertThat(reader.header().rowGroupCount()).isEqualTo(3);
                assertThat(reader.hasTimeAxis()).isTrue();
                assertThat(reader.schema()).containsExactly(
                        new ColumnSpec("time", ColumnType.TIMESTAMP),
                        new ColumnSpec("close", ColumnType.NUMERIC),
                        new ColumnSpec("note", ColumnType.TEXT));
            }
        }

        @Test
        @DisplayName("re-slices row groups into batches of the requested size")
        void batches() throws IOException {
            Dataset original = sample(10);
            Path file = write(original, 4);

            try (ColumnarFileReader reader = ColumnarFileReader.open(file)) {
                Dataset first = reader.readBatch(3);
                Dataset second = reader.readBatch(6);
                Dataset rest = reader.readBatch(6);

                assertThat(first.rowCount()).isEqualTo(3);
                assertThat(second.rowCount()).isEqualTo(6);
                assertThat(rest.rowCount()).isEqualTo(1);
                assertThat(reader.hasMore()).isFalse();
                assertThat(Dataset.concat(List.of(first, second, rest)).columns()).isEqualTo(original.columns());
            }
        }

        @Test
        @DisplayName("keeps a dataset without time axis as plain columns")
        void noTimeAxis() throws IOException {
            Dataset original = Dataset.of(List.of(NumericColumn.of("v", 1, 2, 3)));
            Path file = write(original, 2);

            try (ColumnarFileReader reader = ColumnarFileReader.open(file)) {
                Dataset read = reader.readAll();
                assertThat(read.hasTimeAxis()).isFalse();
                assertThat(read.columns()).isEqualTo(original.columns());
            }
        }

        @Test
        @DisplayName("detects corrupted data through the checksum")
        void checksumMismatch() throws IOException {
            Path file = write(sample(10), 4);
            // header, schema (9 + 10 + 9 bytes), row count, then the low byte of the first timestamp
            long offset = ColumnarFileFormat.HEADER_SIZE + 28 + 4 + 7;
            try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
                raf.seek(offset);
                int value = raf.read();
                raf.seek(offset);
                raf.write(value ^ 0xFF);
            }

            try (ColumnarFileReader reader = ColumnarFileReader.open(file)) {
                assertThatThrownBy(reader::readAll)
                        .isInstanceOf(CorruptColumnarFileException.class)
                        .hasMessageContaining("Checksum mismatch");
            }
        }

        @Test
        @DisplayName("reports a truncated file as corrupt")
        void truncatedFile() throws IOException {
            Path file = write(sample(10), 4);
            byte[] bytes = Files.readAllBytes(file);
            Files.write(file, Arrays.copyOf(bytes, bytes.length - 20));

            try (ColumnarFileReader reader = ColumnarFileReader.open(file)) {
                assertThatThrownBy(reader::readAll)
                        .isInstanceOf(CorruptColumnarFileException.class)
                        .hasMessageContaining("truncated");
            }
        }
    }

    private Path write(Dataset dataset, int rowGroupSize) throws IOException {
        Path file = tempDir.resolve("data.tscol");
        ColumnarFileWriter.write(file, dataset, rowGroupSize);
        return file;
    }

    private static Dataset sample(int rows) {
        Instant[] times = new Instant[rows];
        double[] close = new double[rows];
        String[] notes = new String[rows];
        for (int i = 0; i < rows; i++) {
            times[i] = i == 5 ? null : Instant.parse("2023-01-02T00:00:00Z").plusSeconds(60L * i);
            close[i] = i == 3 ? Double.NaN : 100 + i;
            notes[i] = i % 2 == 0 ? "n" + i : null;
        }
        return Dataset.of(
                List.of(NumericColumn.of("close", close), TextColumn.of("note", notes)),
                new TimeAxis("time", TimestampColumn.of("time", times)));
    }
}
