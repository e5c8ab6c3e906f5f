package com.tsingest.ingest;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.dataset.TimestampColumn;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds a typed {@link Dataset} from raw rows.
 *
 * <p>Datetime candidates become timestamp columns, with unparseable values kept as
 * not-a-time. Columns the caller decided are numeric become numbers; the rest stay text exactly
 * as read. Types come from the caller so that every chunk of a file is typed the same way.
 */
final class ChunkConverter {

    private ChunkConverter() {}

    static Dataset toDataset(
            ColumnPlan plan, Set<String> datetimeColumns, Set<String> numericColumns, List<String[]> rows) {
        List<Column> columns = new ArrayList<>(plan.size());
        for (int c = 0; c < plan.size(); c++) {
            String name = plan.names().get(c);
            String[] values = new String[rows.size()];
            for (int r = 0; r < values.length; r++) {
                values[r] = plan.value(rows.get(r), c);
            }
            if (datetimeColumns.contains(name)) {
                columns.add(toTimestamps(name, values));
            } else if (numericColumns.contains(name)) {
                columns.add(toNumbers(name, values));
            } else {
                columns.add(toText(name, values));
            }
        }
        return Dataset.of(columns);
    }

    private static TimestampColumn toTimestamps(String name, String[] values) {
        TimestampParser parser = new TimestampParser();
        long[] millis = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            millis[i] = parser.parseEpochMillis(values[i]);
        }
        return new TimestampColumn(name, millis);
    }

    private static NumericColumn toNumbers(String name, String[] values) {
        double[] numbers = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            numbers[i] = MissingValues.isMissing(values[i]) ? Double.NaN : Double.parseDouble(values[i].trim());
        }
        return new NumericColumn(name, numbers);
    }

    private static TextColumn toText(String name, String[] values) {
        String[] text = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            text[i] = MissingValues.isMissing(values[i]) ? null : values[i];
        }
        return new TextColumn(name, text);
    }
}
