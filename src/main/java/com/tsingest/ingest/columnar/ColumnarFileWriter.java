package com.tsingest.ingest.columnar;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.TimeAxis;
import com.tsingest.ingest.columnar.ColumnarFileFormat.ColumnSpec;
import com.tsingest.ingest.columnar.ColumnarFileFormat.FileHeader;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;

/**
 * Writes a {@link Dataset} as a columnar file. A time axis is stored as schema column 0 and
 * flagged in the header.
 */
public final class ColumnarFileWriter {

    private ColumnarFileWriter() {}

    public static void write(Path path, Dataset dataset, int rowGroupSize) throws IOException {
        if (rowGroupSize < 1) {
            throw new IllegalArgumentException("rowGroupSize must be positive: " + rowGroupSize);
        }
        List<Column> columns = new ArrayList<>(dataset.columnCount() + 1);
        dataset.timeAxis().map(TimeAxis::values).ifPresent(columns::add);
        columns.addAll(dataset.columns());

        int rows = dataset.rowCount();
        int rowGroups = (rows + rowGroupSize - 1) / rowGroupSize;
        FileHeader header = new FileHeader(
                ColumnarFileFormat.VERSION,
                columns.size(),
                rows,
                rowGroups,
                dataset.hasTimeAxis() ? 0 : ColumnarFileFormat.NO_TIME_AXIS,
                System.currentTimeMillis(),
                0L);

        CRC32 crc = new CRC32();
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            DataOutputStream headerOut = new DataOutputStream(out);
            ColumnarFileFormat.writeHeader(headerOut, header);
            headerOut.flush();

            DataOutputStream body = new DataOutputStream(new CheckedOutputStream(out, crc));
            for (Column column : columns) {
                ColumnarFileFormat.writeSchema(body, new ColumnSpec(column.name(), column.type()));
            }
            for (int from = 0; from < rows; from += rowGroupSize) {
                int to = Math.min(rows, from + rowGroupSize);
                body.writeInt(to - from);
                for (Column column : columns) {
                    ColumnarFileFormat.writeValues(body, column.slice(from, to));
                }
            }
            body.flush();
        }
        updateCrc(path, crc.getValue());
    }

    private static void updateCrc(Path path, long crc32) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "rw")) {
            raf.seek(ColumnarFileFormat.CRC_OFFSET);
            raf.writeLong(crc32);
        }
    }
}
