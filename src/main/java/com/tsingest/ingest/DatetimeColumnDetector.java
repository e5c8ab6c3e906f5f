package com.tsingest.ingest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks the columns to parse as timestamps from a sample of leading rows.
 *
 * <p>A text column qualifies when every present sample value parses. A purely numeric column
 * qualifies only when its name suggests time and every value is a plausible epoch, so prices
 * and volumes are never read as dates.
 */
final class DatetimeColumnDetector {

    private DatetimeColumnDetector() {}

    static Set<String> detect(ColumnPlan plan, List<String[]> sample) {
        Set<String> candidates = new LinkedHashSet<>();
        for (int c = 0; c < plan.size(); c++) {
            String name = plan.names().get(c);
            List<String> present = new ArrayList<>();
            for (String[] row : sample) {
                String value = plan.value(row, c);
                if (!MissingValues.isMissing(value)) {
                    present.add(value.trim());
                }
            }
            if (present.isEmpty()) {
                continue;
            }
            boolean numeric = present.stream().allMatch(TimestampParser::isNumber);
            if (numeric && !hasTimeName(name)) {
                continue;
            }
            TimestampParser parser = new TimestampParser();
            if (present.stream().allMatch(v -> parser.parse(v).isPresent())) {
                candidates.add(name);
            }
        }
        return candidates;
    }

    static boolean hasTimeName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.contains("time") || lower.contains("date") || lower.equals("dt") || lower.equals("ts");
    }
}
