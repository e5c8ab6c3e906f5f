package com.tsingest.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Which source fields become columns, and under which normalized names. Built once from the
 * header and reused for every chunk so all chunks share one schema.
 */
record ColumnPlan(int[] sourceIndexes, List<String> names) {

    static ColumnPlan fromHeader(String[] fields) {
        List<String> raw = new ArrayList<>(fields.length);
        for (int i = 0; i < fields.length; i++) {
            raw.add(fields[i].isBlank() ? ColumnNameNormalizer.placeholder(i) : fields[i]);
        }
        List<String> normalized = ColumnNameNormalizer.normalizeAll(raw);
        List<Integer> kept = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < normalized.size(); i++) {
            if (!ColumnNameNormalizer.isDiscarded(normalized.get(i))) {
                kept.add(i);
                names.add(normalized.get(i));
            }
        }
        return new ColumnPlan(kept.stream().mapToInt(Integer::intValue).toArray(), List.copyOf(names));
    }

    int size() {
        return names.size();
    }

    /** Raw value of planned column {@code column} in {@code row}; null past the end of a short row. */
    String value(String[] row, int column) {
        int index = sourceIndexes[column];
        return index < row.length ? row[index] : null;
    }
}
