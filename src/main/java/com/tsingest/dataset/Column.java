package com.tsingest.dataset;

/**
 * A named, homogeneous sequence of values. Missing values are kept in place as nulls
 * (NaN for numeric columns, not-a-time for timestamp columns), never dropped.
 */
public interface Column {

    String name();

    ColumnType type();

    int size();

    boolean isNull(int row);

    /** Boxed value: {@link Double}, {@link String} or {@link java.time.Instant}; null when missing. */
    Object get(int row);

    /** Text form of the value, or null when missing. */
    String format(int row);

    Column rename(String newName);

    /** Rows {@code [from, to)} as a new column. */
    Column slice(int from, int to);

    default int nullCount() {
        int count = 0;
        for (int i = 0; i < size(); i++) {
            if (isNull(i)) {
                count++;
            }
        }
        return count;
    }
}
