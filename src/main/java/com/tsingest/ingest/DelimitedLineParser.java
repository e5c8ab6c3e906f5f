package com.tsingest.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line of delimited text. Double quotes group a field and {@code ""} inside quotes
 * is a literal quote. Fields are trimmed.
 */
final class DelimitedLineParser {

    static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};

    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    private DelimitedLineParser() {}

    static String[] parse(String line, char delimiter) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == QUOTE) {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                    current.append(QUOTE);
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields.toArray(new String[0]);
    }

    /** Delimiters outside quoted sections. */
    static int countDelimiters(String line, char delimiter) {
        int count = 0;
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
            } else if (c == delimiter && !inQuotes) {
                count++;
            }
        }
        return count;
    }

    static String stripBom(String line) {
        if (line != null && !line.isEmpty() && line.charAt(0) == BOM) {
            return line.substring(1);
        }
        return line;
    }
}
