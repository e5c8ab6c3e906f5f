package com.tsingest.ingest;

import java.util.Set;

/**
 * Tokens read as missing values in delimited text.
 */
final class MissingValues {

    private static final Set<String> TOKENS =
            Set.of("", "NA", "N/A", "#N/A", "NaN", "nan", "-nan", "null", "NULL", "None", "NaT");

    private MissingValues() {}

    static boolean isMissing(String value) {
        return value == null || TOKENS.contains(value.trim());
    }
}
