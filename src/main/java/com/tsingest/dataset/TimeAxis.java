package com.tsingest.dataset;

import java.util.Objects;

/**
 * The timestamp column promoted to be the dataset's ordering key. {@code name} keeps the
 * original column name, case preserved.
 */
public record TimeAxis(String name, TimestampColumn values) {

    public TimeAxis {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(values, "values");
        if (!name.equals(values.name())) {
            values = values.rename(name);
        }
    }

    public int size() {
        return values.size();
    }

    public TimeAxis slice(int from, int to) {
        return new TimeAxis(name, values.slice(from, to));
    }
}
