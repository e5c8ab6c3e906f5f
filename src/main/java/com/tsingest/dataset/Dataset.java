package com.tsingest.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, column-addressable table with an optional {@link TimeAxis}.
 *
 * <p>Every column, and the time axis when present, holds exactly {@link #rowCount()} values.
 * Instances are immutable: renaming, promotion and repair produce new datasets, so a dataset
 * handed to another component can never be changed underneath its previous owner.
 */
public final class Dataset {

    private static final Dataset EMPTY = new Dataset(List.of(), null, 0);

    private final List<Column> columns;
    private final Map<String, Column> byName;
    private final TimeAxis timeAxis;
    private final int rowCount;

    private Dataset(List<Column> columns, TimeAxis timeAxis, int rowCount) {
        Map<String, Column> index = new LinkedHashMap<>();
        for (Column column : columns) {
            if (column.size() != rowCount) {
                throw new IllegalArgumentException(String.format(
                        "Column %s has %d values, expected %d", column.name(), column.size(), rowCount));
            }
            if (index.put(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
        }
        if (timeAxis != null && timeAxis.size() != rowCount) {
            throw new IllegalArgumentException(String.format(
                    "Time axis %s has %d values, expected %d", timeAxis.name(), timeAxis.size(), rowCount));
        }
        this.columns = List.copyOf(columns);
        this.byName = Collections.unmodifiableMap(index);
        this.timeAxis = timeAxis;
        this.rowCount = rowCount;
    }

    public static Dataset empty() {
        return EMPTY;
    }

    public static Dataset of(List<? extends Column> columns) {
        return of(columns, null);
    }

    public static Dataset of(List<? extends Column> columns, TimeAxis timeAxis) {
        int rows;
        if (timeAxis != null) {
            rows = timeAxis.size();
        } else {
            rows = columns.isEmpty() ? 0 : columns.get(0).size();
        }
        return new Dataset(new ArrayList<>(columns), timeAxis, rows);
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    public Optional<Column> column(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<TimeAxis> timeAxis() {
        return Optional.ofNullable(timeAxis);
    }

    public boolean hasTimeAxis() {
        return timeAxis != null;
    }

    /**
     * Moves {@code columnName} out of the regular columns and makes {@code parsed} the time axis,
     * named after the original column.
     */
    public Dataset promoteToTimeAxis(String columnName, TimestampColumn parsed) {
        if (!byName.containsKey(columnName)) {
            throw new IllegalArgumentException("No such column: " + columnName);
        }
        List<Column> remaining = columns.stream()
                .filter(c -> !c.name().equals(columnName))
                .toList();
        return new Dataset(remaining, new TimeAxis(columnName, parsed), rowCount);
    }

    /** Replaces the column of the same name, or appends it. */
    public Dataset withColumn(Column column) {
        List<Column> updated = new ArrayList<>(columns.size() + 1);
        boolean replaced = false;
        for (Column existing : columns) {
            if (existing.name().equals(column.name())) {
                updated.add(column);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(column);
        }
        int rows = columns.isEmpty() && timeAxis == null ? column.size() : rowCount;
        return new Dataset(updated, timeAxis, rows);
    }

    /** Puts the time axis back as the first regular column. */
    public Dataset demoteTimeAxis() {
        if (timeAxis == null) {
            return this;
        }
        List<Column> updated = new ArrayList<>(columns.size() + 1);
        updated.add(timeAxis.values());
        updated.addAll(columns);
        return new Dataset(updated, null, rowCount);
    }

    /** Rows {@code [from, to)}. */
    public Dataset slice(int from, int to) {
        if (from < 0 || to > rowCount || from > to) {
            throw new IndexOutOfBoundsException("Slice [" + from + ", " + to + ") of " + rowCount + " rows");
        }
        List<Column> sliced = columns.stream().map(c -> c.slice(from, to)).toList();
        return new Dataset(sliced, timeAxis != null ? timeAxis.slice(from, to) : null, to - from);
    }

    /**
     * Stacks {@code parts} in order. Columns are matched by name in order of first appearance;
     * a part lacking a column contributes missing values. The time axis is kept only when every
     * part has one, otherwise each axis goes back to being a regular column first.
     */
    public static Dataset concat(List<Dataset> parts) {
        if (parts.isEmpty()) {
            return EMPTY;
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        boolean allHaveAxis = parts.stream().allMatch(Dataset::hasTimeAxis);
        List<Dataset> aligned = allHaveAxis ? parts : parts.stream().map(Dataset::demoteTimeAxis).toList();

        Map<String, ColumnType> schema = new LinkedHashMap<>();
        for (Dataset part : aligned) {
            for (Column column : part.columns) {
                schema.putIfAbsent(column.name(), column.type());
            }
        }

        List<Column> joined = new ArrayList<>(schema.size());
        for (Map.Entry<String, ColumnType> entry : schema.entrySet()) {
            List<Column> pieces = new ArrayList<>(aligned.size());
            for (Dataset part : aligned) {
                pieces.add(part.column(entry.getKey())
                        .orElseGet(() -> Columns.nulls(entry.getKey(), entry.getValue(), part.rowCount)));
            }
            joined.add(Columns.concat(entry.getKey(), pieces));
        }

        TimeAxis axis = null;
        if (allHaveAxis) {
            String axisName = aligned.get(0).timeAxis.name();
            List<Column> axisPieces = aligned.stream()
                    .map(d -> (Column) d.timeAxis.values())
                    .toList();
            axis = new TimeAxis(axisName, (TimestampColumn) Columns.concat(axisName, axisPieces));
        }
        int rows = aligned.stream().mapToInt(Dataset::rowCount).sum();
        return new Dataset(joined, axis, rows);
    }

    @Override
    public String toString() {
        return "Dataset[" + rowCount + " rows, columns=" + columnNames()
                + (timeAxis != null ? ", timeAxis=" + timeAxis.name() : "") + "]";
    }
}
