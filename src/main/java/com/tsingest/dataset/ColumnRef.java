package com.tsingest.dataset;

import java.util.Optional;

/**
 * Points at the timestamps of a dataset: either its time axis or a regular column.
 */
public record ColumnRef(String name, boolean timeAxis) {

    public static ColumnRef axis(String name) {
        return new ColumnRef(name, true);
    }

    public static ColumnRef column(String name) {
        return new ColumnRef(name, false);
    }

    public Optional<Column> resolve(Dataset dataset) {
        if (timeAxis) {
            return dataset.timeAxis()
                    .filter(axis -> axis.name().equals(name))
                    .map(TimeAxis::values);
        }
        return dataset.column(name);
    }
}
