package com.tsingest.ingest.columnar;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.ColumnType;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.dataset.TimestampColumn;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Binary columnar file format ({@code .tscol}).
 *
 * <p>Header layout (48 bytes):
 * <ul>
 *   <li>magic(8): 0x5453434F4C554D4E ("TSCOLUMN" in ASCII)</li>
 *   <li>version(4): format version (currently 1)</li>
 *   <li>columnCount(4)</li>
 *   <li>rowCount(8): total rows over all row groups</li>
 *   <li>rowGroupCount(4)</li>
 *   <li>timeAxisIndex(4): schema index of the time axis, -1 when there is none</li>
 *   <li>createdAtEpochMs(8)</li>
 *   <li>crc32(8): CRC32 of everything after the header</li>
 * </ul>
 *
 * <p>The schema follows: per column a type code byte and a UTF-8 name. Then each row group:
 * its row count (4) and every column's values in schema order. Numeric values are 8-byte
 * doubles (NaN is missing), timestamps 8-byte epoch millis, text a 4-byte length (-1 is
 * missing) plus UTF-8 bytes.
 */
public final class ColumnarFileFormat {

    public static final long MAGIC = 0x5453434F4C554D4EL; // "TSCOLUMN"
    public static final int VERSION = 1;
    public static final int HEADER_SIZE = 48;
    public static final int CRC_OFFSET = 40;
    public static final int NO_TIME_AXIS = -1;
    public static final String EXTENSION = "tscol";

    private ColumnarFileFormat() {}

    /**
     * Writes the file header. CRC32 is initially 0 and is patched once the body is written.
     */
    public static void writeHeader(DataOutputStream dos, FileHeader header) throws IOException {
        dos.writeLong(MAGIC);
        dos.writeInt(VERSION);
        dos.writeInt(header.columnCount());
        dos.writeLong(header.rowCount());
        dos.writeInt(header.rowGroupCount());
        dos.writeInt(header.timeAxisIndex());
        dos.writeLong(header.createdAtEpochMs());
        dos.writeLong(header.crc32());
    }

    /**
     * Validates and reads the file header.
     *
     * @throws CorruptColumnarFileException on a bad magic number, version or count
     */
    public static FileHeader readHeader(DataInputStream dis) throws IOException {
        long magic = dis.readLong();
        if (magic != MAGIC) {
            throw new CorruptColumnarFileException("Invalid columnar file: bad magic number");
        }
        int version = dis.readInt();
        if (version != VERSION) {
            throw new CorruptColumnarFileException("Unsupported columnar file version: " + version);
        }
        int columnCount = dis.readInt();
        long rowCount = dis.readLong();
        int rowGroupCount = dis.readInt();
        int timeAxisIndex = dis.readInt();
        long createdAtMs = dis.readLong();
        long crc32 = dis.readLong();
        if (columnCount < 0 || rowCount < 0 || rowCount > Integer.MAX_VALUE || rowGroupCount < 0
                || timeAxisIndex < NO_TIME_AXIS || timeAxisIndex >= columnCount) {
            throw new CorruptColumnarFileException("Invalid columnar file header counts");
        }
        return new FileHeader(version, columnCount, rowCount, rowGroupCount, timeAxisIndex, createdAtMs, crc32);
    }

    public static void writeSchema(DataOutputStream dos, ColumnSpec spec) throws IOException {
        dos.writeByte(spec.type().getCode());
        writeString(dos, spec.name());
    }

    public static ColumnSpec readSchema(DataInputStream dis) throws IOException {
        byte code = dis.readByte();
        ColumnType type;
        try {
            type = ColumnType.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new CorruptColumnarFileException("Unknown column type code: " + code);
        }
        String name = readString(dis);
        if (name == null) {
            throw new CorruptColumnarFileException("Column without a name");
        }
        return new ColumnSpec(name, type);
    }

    public static void writeValues(DataOutputStream dos, Column column) throws IOException {
        int rows = column.size();
        switch (column.type()) {
            case NUMERIC -> {
                NumericColumn numeric = (NumericColumn) column;
                for (int i = 0; i < rows; i++) {
                    dos.writeDouble(numeric.getDouble(i));
                }
            }
            case TIMESTAMP -> {
                TimestampColumn timestamps = (TimestampColumn) column;
                for (int i = 0; i < rows; i++) {
                    dos.writeLong(timestamps.getEpochMillis(i));
                }
            }
            case TEXT -> {
                for (int i = 0; i < rows; i++) {
                    writeString(dos, column.format(i));
                }
            }
        }
    }

    public static Column readValues(DataInputStream dis, ColumnSpec spec, int rows) throws IOException {
        return switch (spec.type()) {
            case NUMERIC -> {
                double[] values = new double[rows];
                for (int i = 0; i < rows; i++) {
                    values[i] = dis.readDouble();
                }
                yield new NumericColumn(spec.name(), values);
            }
            case TIMESTAMP -> {
                long[] values = new long[rows];
                for (int i = 0; i < rows; i++) {
                    values[i] = dis.readLong();
                }
                yield new TimestampColumn(spec.name(), values);
            }
            case TEXT -> {
                String[] values = new String[rows];
                for (int i = 0; i < rows; i++) {
                    values[i] = readString(dis);
                }
                yield new TextColumn(spec.name(), values);
            }
        };
    }

    // Helper: length-prefixed UTF-8, -1 for null
    private static void writeString(DataOutputStream dos, String value) throws IOException {
        if (value == null) {
            dos.writeInt(-1);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        dos.writeInt(bytes.length);
        dos.write(bytes);
    }

    private static String readString(DataInputStream dis) throws IOException {
        int length = dis.readInt();
        if (length == -1) {
            return null;
        }
        if (length < -1) {
            throw new CorruptColumnarFileException("Negative string length: " + length);
        }
        byte[] bytes = dis.readNBytes(length);
        if (bytes.length != length) {
            throw new CorruptColumnarFileException("Truncated string value");
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Parsed file header.
     */
    public record FileHeader(
            int version,
            int columnCount,
            long rowCount,
            int rowGroupCount,
            int timeAxisIndex,
            long createdAtEpochMs,
            long crc32) {

        public boolean hasTimeAxis() {
            return timeAxisIndex != NO_TIME_AXIS;
        }
    }

    /**
     * One schema entry.
     */
    public record ColumnSpec(String name, ColumnType type) {}
}
