package com.tsingest.dataset;

import java.util.Arrays;

public final class TextColumn implements Column {

    private final String name;
    private final String[] values;

    public TextColumn(String name, String[] values) {
        this.name = name;
        this.values = values;
    }

    public static TextColumn of(String name, String... values) {
        return new TextColumn(name, values.clone());
    }

    /** A column holding the same value on every row. */
    public static TextColumn constant(String name, String value, int rows) {
        String[] values = new String[rows];
        Arrays.fill(values, value);
        return new TextColumn(name, values);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ColumnType type() {
        return ColumnType.TEXT;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isNull(int row) {
        return values[row] == null;
    }

    @Override
    public String get(int row) {
        return values[row];
    }

    @Override
    public String format(int row) {
        return values[row];
    }

    @Override
    public TextColumn rename(String newName) {
        return new TextColumn(newName, values);
    }

    @Override
    public TextColumn slice(int from, int to) {
        return new TextColumn(name, Arrays.copyOfRange(values, from, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TextColumn other)) {
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
        return "TextColumn[" + name + ", " + values.length + " rows]";
    }
}
