package com.tsingest.dataset;

import java.time.Instant;
import java.util.Arrays;

/**
 * Timestamps as epoch milliseconds (UTC). Unparseable values are stored as
 * {@link #NOT_A_TIME} so the row survives.
 */
public final class TimestampColumn implements Column {

    public static final long NOT_A_TIME = Long.MIN_VALUE;

    private final String name;
    private final long[] epochMillis;

    public TimestampColumn(String name, long[] epochMillis) {
        this.name = name;
        this.epochMillis = epochMillis;
    }

    public static TimestampColumn of(String name, Instant... instants) {
        long[] millis = new long[instants.length];
        for (int i = 0; i < instants.length; i++) {
            millis[i] = instants[i] != null ? instants[i].toEpochMilli() : NOT_A_TIME;
        }
        return new TimestampColumn(name, millis);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ColumnType type() {
        return ColumnType.TIMESTAMP;
    }

    @Override
    public int size() {
        return epochMillis.length;
    }

    @Override
    public boolean isNull(int row) {
        return epochMillis[row] == NOT_A_TIME;
    }

    @Override
    public Instant get(int row) {
        return isNull(row) ? null : Instant.ofEpochMilli(epochMillis[row]);
    }

    public long getEpochMillis(int row) {
        return epochMillis[row];
    }

    @Override
    public String format(int row) {
        return isNull(row) ? null : Instant.ofEpochMilli(epochMillis[row]).toString();
    }

    public int validCount() {
        return size() - nullCount();
    }

    /** Valid timestamps in row order, nulls removed. */
    public long[] validEpochMillis() {
        return Arrays.stream(epochMillis).filter(v -> v != NOT_A_TIME).toArray();
    }

    @Override
    public TimestampColumn rename(String newName) {
        return new TimestampColumn(newName, epochMillis);
    }

    @Override
    public TimestampColumn slice(int from, int to) {
        return new TimestampColumn(name, Arrays.copyOfRange(epochMillis, from, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimestampColumn other)) {
            return false;
        }
        return name.equals(other.name) && Arrays.equals(epochMillis, other.epochMillis);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(epochMillis);
    }

    @Override
    public String toString() {
        return "TimestampColumn[" + name + ", " + epochMillis.length + " rows]";
    }
}
