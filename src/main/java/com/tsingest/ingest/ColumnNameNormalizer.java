package com.tsingest.ingest;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw header text into identifier-safe column names.
 *
 * <p>A name is trimmed, spaces, dots and dashes become underscores, every other character
 * outside {@code [A-Za-z0-9_]} is removed, and {@code col_} is prefixed when the result is
 * empty or starts with a digit. Applying it to an already normalized name is a no-op.
 */
public final class ColumnNameNormalizer {

    /** Prefix given to header cells that were blank in the source. */
    public static final String PLACEHOLDER_PREFIX = "Unnamed: ";

    private static final Pattern SEPARATORS = Pattern.compile("[\\s.\\-]");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_]");

    private ColumnNameNormalizer() {}

    public static String normalize(String raw) {
        String name = raw == null ? "" : raw.trim();
        name = SEPARATORS.matcher(name).replaceAll("_");
        name = DISALLOWED.matcher(name).replaceAll("");
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
            name = "col_" + name;
        }
        return name;
    }

    /**
     * Normalizes every name and makes the results unique by appending {@code _1}, {@code _2}
     * to repeats, in order.
     */
    public static List<String> normalizeAll(List<String> raw) {
        List<String> result = new ArrayList<>(raw.size());
        Set<String> seen = new HashSet<>();
        for (String name : raw) {
            String normalized = normalize(name);
            String candidate = normalized;
            int suffix = 1;
            while (!seen.add(candidate)) {
                candidate = normalized + "_" + suffix++;
            }
            result.add(candidate);
        }
        return result;
    }

    /** Names that do not identify real data: empty, or a placeholder for a blank header cell. */
    public static boolean isDiscarded(String normalizedName) {
        return normalizedName.isEmpty() || normalizedName.toLowerCase(Locale.ROOT).startsWith("unnamed");
    }

    static String placeholder(int index) {
        return PLACEHOLDER_PREFIX + index;
    }
}
