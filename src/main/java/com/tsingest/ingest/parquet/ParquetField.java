package com.tsingest.ingest.parquet;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.dataset.TimestampColumn;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Optional;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.DateLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.DecimalLogicalTypeAnnotation;
import org.apache.parquet.schema.LogicalTypeAnnotation.TimestampLogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

/**
 * One top-level Parquet field mapped onto a dataset column type.
 *
 * <p>Timestamps (INT64 with a timestamp annotation, INT96, INT32 dates) become timestamp
 * columns in epoch millis. Integers, floats, decimals and booleans become numeric columns.
 * Byte arrays without a decimal annotation are read as UTF-8 text.
 */
final class ParquetField {

    private static final long MILLIS_PER_DAY = 86_400_000L;
    private static final int JULIAN_EPOCH_DAY = 2_440_588;

    enum Kind {
        NUMBER,
        TIMESTAMP,
        TEXT
    }

    @FunctionalInterface
    private interface NumberValue {
        double read(Group record, int field);
    }

    @FunctionalInterface
    private interface TimeValue {
        long read(Group record, int field);
    }

    private final int index;
    private final String name;
    private final Kind kind;
    private final NumberValue number;
    private final TimeValue time;

    private ParquetField(int index, String name, Kind kind, NumberValue number, TimeValue time) {
        this.index = index;
        this.name = name;
        this.kind = kind;
        this.number = number;
        this.time = time;
    }

    /**
     * Mapping for the field at {@code index}, or empty when the field is nested, repeated or of a
     * physical type with no column counterpart.
     */
    static Optional<ParquetField> of(int index, Type type) {
        if (!type.isPrimitive() || type.isRepetition(Type.Repetition.REPEATED)) {
            return Optional.empty();
        }
        PrimitiveType primitive = type.asPrimitiveType();
        LogicalTypeAnnotation annotation = primitive.getLogicalTypeAnnotation();
        String name = primitive.getName();

        if (annotation instanceof DecimalLogicalTypeAnnotation decimal) {
            return decimalField(index, name, primitive, decimal.getScale());
        }
        return switch (primitive.getPrimitiveTypeName()) {
            case INT64 -> {
                if (annotation instanceof TimestampLogicalTypeAnnotation timestamp) {
                    yield Optional.of(timeField(index, name, int64Timestamp(timestamp.getUnit())));
                }
                yield Optional.of(numberField(index, name, (r, f) -> r.getLong(f, 0)));
            }
            case INT32 -> {
                if (annotation instanceof DateLogicalTypeAnnotation) {
                    yield Optional.of(timeField(index, name, (r, f) -> r.getInteger(f, 0) * MILLIS_PER_DAY));
                }
                yield Optional.of(numberField(index, name, (r, f) -> r.getInteger(f, 0)));
            }
            case INT96 -> Optional.of(timeField(index, name, (r, f) -> int96ToMillis(r.getInt96(f, 0))));
            case DOUBLE -> Optional.of(numberField(index, name, (r, f) -> r.getDouble(f, 0)));
            case FLOAT -> Optional.of(numberField(index, name, (r, f) -> r.getFloat(f, 0)));
            case BOOLEAN -> Optional.of(numberField(index, name, (r, f) -> r.getBoolean(f, 0) ? 1.0 : 0.0));
            case BINARY -> Optional.of(new ParquetField(index, name, Kind.TEXT, null, null));
            case FIXED_LEN_BYTE_ARRAY -> Optional.empty();
        };
    }

    String name() {
        return name;
    }

    Kind kind() {
        return kind;
    }

    /** Values of this field across {@code records}; absent values become the column's missing marker. */
    Column decode(List<Group> records) {
        int rows = records.size();
        return switch (kind) {
            case NUMBER -> {
                double[] values = new double[rows];
                for (int r = 0; r < rows; r++) {
                    Group record = records.get(r);
                    values[r] = present(record) ? number.read(record, index) : Double.NaN;
                }
                yield new NumericColumn(name, values);
            }
            case TIMESTAMP -> {
                long[] values = new long[rows];
                for (int r = 0; r < rows; r++) {
                    Group record = records.get(r);
                    values[r] = present(record) ? time.read(record, index) : TimestampColumn.NOT_A_TIME;
                }
                yield new TimestampColumn(name, values);
            }
            case TEXT -> {
                String[] values = new String[rows];
                for (int r = 0; r < rows; r++) {
                    Group record = records.get(r);
                    values[r] = present(record) ? record.getBinary(index, 0).toStringUsingUTF8() : null;
                }
                yield new TextColumn(name, values);
            }
        };
    }

    private boolean present(Group record) {
        return record.getFieldRepetitionCount(index) > 0;
    }

    private static ParquetField numberField(int index, String name, NumberValue number) {
        return new ParquetField(index, name, Kind.NUMBER, number, null);
    }

    private static ParquetField timeField(int index, String name, TimeValue time) {
        return new ParquetField(index, name, Kind.TIMESTAMP, null, time);
    }

    private static Optional<ParquetField> decimalField(int index, String name, PrimitiveType type, int scale) {
        NumberValue number = switch (type.getPrimitiveTypeName()) {
            case INT32 -> (r, f) -> BigDecimal.valueOf(r.getInteger(f, 0), scale).doubleValue();
            case INT64 -> (r, f) -> BigDecimal.valueOf(r.getLong(f, 0), scale).doubleValue();
            case BINARY, FIXED_LEN_BYTE_ARRAY ->
                    (r, f) -> new BigDecimal(new BigInteger(r.getBinary(f, 0).getBytes()), scale).doubleValue();
            default -> null;
        };
        return number == null ? Optional.empty() : Optional.of(numberField(index, name, number));
    }

    private static TimeValue int64Timestamp(LogicalTypeAnnotation.TimeUnit unit) {
        return switch (unit) {
            case MILLIS -> (r, f) -> r.getLong(f, 0);
            case MICROS -> (r, f) -> Math.floorDiv(r.getLong(f, 0), 1_000L);
            case NANOS -> (r, f) -> Math.floorDiv(r.getLong(f, 0), 1_000_000L);
        };
    }

    // 8 bytes nanos of day then 4 bytes julian day, little-endian
    static long int96ToMillis(Binary value) {
        ByteBuffer buffer = value.toByteBuffer().order(ByteOrder.LITTLE_ENDIAN);
        long nanosOfDay = buffer.getLong();
        int julianDay = buffer.getInt();
        return (julianDay - JULIAN_EPOCH_DAY) * MILLIS_PER_DAY + nanosOfDay / 1_000_000L;
    }
}
