package com.tsingest.dataset;

import java.util.Arrays;
import java.util.List;

/**
 * Static helpers for building and joining columns.
 */
public final class Columns {

    private Columns() {}

    /** A column of {@code rows} missing values. */
    public static Column nulls(String name, ColumnType type, int rows) {
        return switch (type) {
            case NUMERIC -> {
                double[] values = new double[rows];
                Arrays.fill(values, Double.NaN);
                yield new NumericColumn(name, values);
            }
            case TEXT -> new TextColumn(name, new String[rows]);
            case TIMESTAMP -> {
                long[] values = new long[rows];
                Arrays.fill(values, TimestampColumn.NOT_A_TIME);
                yield new TimestampColumn(name, values);
            }
        };
    }

    /**
     * Appends {@code parts} in order under {@code name}. Parts of one type keep it; mixed types
     * fall back to text built from each value's text form.
     */
    public static Column concat(String name, List<Column> rawParts) {
        ColumnType type = unifiedType(rawParts);
        List<Column> parts = rawParts.stream()
                .map(p -> p.type() == type || type == ColumnType.TEXT ? p : nulls(name, type, p.size()))
                .toList();
        int total = parts.stream().mapToInt(Column::size).sum();
        return switch (type) {
            case NUMERIC -> {
                double[] values = new double[total];
                int offset = 0;
                for (Column part : parts) {
                    NumericColumn numeric = (NumericColumn) part;
                    for (int i = 0; i < numeric.size(); i++) {
                        values[offset++] = numeric.getDouble(i);
                    }
                }
                yield new NumericColumn(name, values);
            }
            case TIMESTAMP -> {
                long[] values = new long[total];
                int offset = 0;
                for (Column part : parts) {
                    TimestampColumn timestamps = (TimestampColumn) part;
                    for (int i = 0; i < timestamps.size(); i++) {
                        values[offset++] = timestamps.getEpochMillis(i);
                    }
                }
                yield new TimestampColumn(name, values);
            }
            case TEXT -> {
                String[] values = new String[total];
                int offset = 0;
                for (Column part : parts) {
                    for (int i = 0; i < part.size(); i++) {
                        values[offset++] = part.format(i);
                    }
                }
                yield new TextColumn(name, values);
            }
        };
    }

    private static ColumnType unifiedType(List<Column> parts) {
        ColumnType type = null;
        for (Column part : parts) {
            // all-null parts do not vote
            if (part.nullCount() == part.size() && parts.size() > 1) {
                continue;
            }
            if (type == null) {
                type = part.type();
            } else if (type != part.type()) {
                return ColumnType.TEXT;
            }
        }
        if (type == null) {
            return parts.isEmpty() ? ColumnType.TEXT : parts.get(0).type();
        }
        return type;
    }
}
