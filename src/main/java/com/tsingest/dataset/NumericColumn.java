package com.tsingest.dataset;

import java.util.Arrays;

public final class NumericColumn implements Column {

    private final String name;
    private final double[] values;

    public NumericColumn(String name, double[] values) {
        this.name = name;
        this.values = values;
    }

    public static NumericColumn of(String name, double... values) {
        return new NumericColumn(name, values.clone());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ColumnType type() {
        return ColumnType.NUMERIC;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isNull(int row) {
        return Double.isNaN(values[row]);
    }

    @Override
    public Double get(int row) {
        return isNull(row) ? null : values[row];
    }

    public double getDouble(int row) {
        return values[row];
    }

    @Override
    public String format(int row) {
        if (isNull(row)) {
            return null;
        }
        double value = values[row];
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public NumericColumn rename(String newName) {
        return new NumericColumn(newName, values);
    }

    @Override
    public NumericColumn slice(int from, int to) {
        return new NumericColumn(name, Arrays.copyOfRange(values, from, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumericColumn other)) {
            return false;
        }
        return name.equals(other.name) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "NumericColumn[" + name + ", " + values.length + " rows]";
    }
}
