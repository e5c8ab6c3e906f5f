package com.tsingest.ingest.columnar;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.ColumnType;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.TimeAxis;
import com.tsingest.dataset.TimestampColumn;
import com.tsingest.ingest.columnar.ColumnarFileFormat.ColumnSpec;
import com.tsingest.ingest.columnar.ColumnarFileFormat.FileHeader;
import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;

/**
 * Sequential reader over a columnar file.
 *
 * <p>Metadata is available right after opening. The checksum is verified once the last row
 * group has been consumed.
 */
public final class ColumnarFileReader extends RowGroupReader {

    private final InputStream in;
    private final DataInputStream body;
    private final CRC32 crc = new CRC32();
    private final FileHeader header;
    private final List<ColumnSpec> schema;
    private int rowGroupsRead;

    private ColumnarFileReader(InputStream in) throws IOException {
        this.in = in;
        this.header = ColumnarFileFormat.readHeader(new DataInputStream(in));
        this.body = new DataInputStream(new CheckedInputStream(in, crc));
        List<ColumnSpec> specs = new ArrayList<>(header.columnCount());
        for (int i = 0; i < header.columnCount(); i++) {
            specs.add(ColumnarFileFormat.readSchema(body));
        }
        if (header.hasTimeAxis() && specs.get(header.timeAxisIndex()).type() != ColumnType.TIMESTAMP) {
            throw new CorruptColumnarFileException("Time axis column is not a timestamp column");
        }
        this.schema = List.copyOf(specs);
    }

    public static ColumnarFileReader open(Path path) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        try {
            return new ColumnarFileReader(in);
        } catch (EOFException e) {
            in.close();
            throw new CorruptColumnarFileException("Columnar file is truncated");
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    public FileHeader header() {
        return header;
    }

    public List<ColumnSpec> schema() {
        return schema;
    }

    @Override
    public long rowCount() {
        return header.rowCount();
    }

    @Override
    public boolean hasTimeAxis() {
        return header.hasTimeAxis();
    }

    @Override
    protected boolean hasMoreRowGroups() {
        return rowGroupsRead < header.rowGroupCount();
    }

    @Override
    protected Dataset readRowGroup() throws IOException {
        try {
            int rows = body.readInt();
            if (rows < 0) {
                throw new CorruptColumnarFileException("Negative row group size: " + rows);
            }
            List<Column> columns = new ArrayList<>(schema.size());
            TimeAxis axis = null;
            for (int i = 0; i < schema.size(); i++) {
                Column column = ColumnarFileFormat.readValues(body, schema.get(i), rows);
                if (i == header.timeAxisIndex()) {
                    axis = new TimeAxis(column.name(), (TimestampColumn) column);
                } else {
                    columns.add(column);
                }
            }
            rowGroupsRead++;
            if (rowGroupsRead == header.rowGroupCount()) {
                verifyChecksum();
            }
            return Dataset.of(columns, axis);
        } catch (EOFException e) {
            throw new CorruptColumnarFileException("Columnar file is truncated in row group " + rowGroupsRead);
        }
    }

    @Override
    protected Dataset emptyWithSchema() throws IOException {
        verifyChecksum();
        List<Column> columns = new ArrayList<>(schema.size());
        TimeAxis axis = null;
        DataInputStream none = new DataInputStream(InputStream.nullInputStream());
        for (int i = 0; i < schema.size(); i++) {
            Column column = ColumnarFileFormat.readValues(none, schema.get(i), 0);
            if (i == header.timeAxisIndex()) {
                axis = new TimeAxis(column.name(), (TimestampColumn) column);
            } else {
                columns.add(column);
            }
        }
        return Dataset.of(columns, axis);
    }

    private void verifyChecksum() throws IOException {
        if (crc.getValue() != header.crc32()) {
            throw new CorruptColumnarFileException(String.format(
                    "Checksum mismatch: header %08x, data %08x", header.crc32(), crc.getValue()));
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
