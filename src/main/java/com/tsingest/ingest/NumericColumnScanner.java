package com.tsingest.ingest;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which columns of a delimited file are numeric, over every row the file holds.
 *
 * <p>A column stays numeric while each present value is a number. The decision is made once per
 * file, before any chunk is typed, so a chunked load types its columns exactly like a direct one.
 */
final class NumericColumnScanner {

    private final ColumnPlan plan;
    private final boolean[] numeric;
    private int remaining;

    NumericColumnScanner(ColumnPlan plan) {
        this.plan = plan;
        this.numeric = new boolean[plan.size()];
        Arrays.fill(numeric, true);
        this.remaining = plan.size();
    }

    void accept(List<String[]> rows) {
        for (int c = 0; c < numeric.length && remaining > 0; c++) {
            if (!numeric[c]) {
                continue;
            }
            for (String[] row : rows) {
                String value = plan.value(row, c);
                if (!MissingValues.isMissing(value) && !TimestampParser.isNumber(value)) {
                    numeric[c] = false;
                    remaining--;
                    break;
                }
            }
        }
    }

    /** False once every column has met a non-numeric value; further rows cannot change the result. */
    boolean undecided() {
        return remaining > 0;
    }

    Set<String> numericColumns() {
        Set<String> names = new LinkedHashSet<>();
        for (int c = 0; c < numeric.length; c++) {
            if (numeric[c]) {
                names.add(plan.names().get(c));
            }
        }
        return names;
    }
}
