package com.tsingest.resolution;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a file name into a {@link ResolutionLabel}.
 *
 * <p>Markers such as {@code _M15_}, {@code PERIOD_M15} or {@code _15M.} are checked in a fixed
 * order. A label is skipped when a marker of a label that textually contains it also matches:
 * M1 yields to M5, M15 and M30; M5 yields to M15 and M30; H1 yields to H4. Names without any
 * marker fall back to keywords (MINUTE, HOUR, DAY, WEEK, MONTH) next to a number.
 */
public final class ResolutionClassifier {

    private static final List<ResolutionLabel> MATCH_ORDER = List.of(
            ResolutionLabel.M15, ResolutionLabel.M30, ResolutionLabel.M5, ResolutionLabel.M1,
            ResolutionLabel.H4, ResolutionLabel.H1,
            ResolutionLabel.D1, ResolutionLabel.W1, ResolutionLabel.MN1);

    private static final Map<ResolutionLabel, Set<ResolutionLabel>> SUPPRESSED_BY = Map.of(
            ResolutionLabel.M1, EnumSet.of(ResolutionLabel.M5, ResolutionLabel.M15, ResolutionLabel.M30),
            ResolutionLabel.M5, EnumSet.of(ResolutionLabel.M15, ResolutionLabel.M30),
            ResolutionLabel.H1, EnumSet.of(ResolutionLabel.H4));

    private static final Pattern MINUTE = keyword("MINUTES?|MINS?");
    private static final Pattern HOUR = keyword("HOURS?|HRS?");
    private static final Pattern DAY = keyword("DAYS?|DAILY");
    private static final Pattern WEEK = keyword("WEEKS?|WEEKLY");
    private static final Pattern MONTH = keyword("MONTHS?|MONTHLY");

    private ResolutionClassifier() {}

    public static ResolutionLabel classify(String fileName) {
        String upper = fileName.toUpperCase(Locale.ROOT);
        for (ResolutionLabel label : MATCH_ORDER) {
            if (label.matches(upper) && !isSuppressed(label, upper)) {
                return label;
            }
        }
        return classifyByKeyword(upper);
    }

    private static boolean isSuppressed(ResolutionLabel label, String upper) {
        return SUPPRESSED_BY.getOrDefault(label, Set.of()).stream().anyMatch(l -> l.matches(upper));
    }

    private static ResolutionLabel classifyByKeyword(String upper) {
        Integer minutes = adjacentNumber(MINUTE, upper);
        if (minutes != null) {
            ResolutionLabel byMinutes = switch (minutes) {
                case 1 -> ResolutionLabel.M1;
                case 5 -> ResolutionLabel.M5;
                case 15 -> ResolutionLabel.M15;
                case 30 -> ResolutionLabel.M30;
                default -> null;
            };
            if (byMinutes != null) {
                return byMinutes;
            }
        }
        Integer hours = adjacentNumber(HOUR, upper);
        if (hours != null) {
            if (hours == 1) {
                return ResolutionLabel.H1;
            }
            if (hours == 4) {
                return ResolutionLabel.H4;
            }
        }
        if (unitKeyword(DAY, upper)) {
            return ResolutionLabel.D1;
        }
        if (unitKeyword(WEEK, upper)) {
            return ResolutionLabel.W1;
        }
        if (unitKeyword(MONTH, upper)) {
            return ResolutionLabel.MN1;
        }
        return ResolutionLabel.UNCLASSIFIED;
    }

    // "15MINUTE", "15_MIN", "MINUTE-15"; longer numbers such as years are not adjacent counts
    private static Pattern keyword(String words) {
        return Pattern.compile(
                "(?:(?<!\\d)(\\d{1,2})[_\\- ]?)?(?<![A-Z])(?:" + words + ")(?![A-Z])(?:[_\\- ]?(\\d{1,2})(?!\\d))?");
    }

    private static Integer adjacentNumber(Pattern pattern, String upper) {
        Matcher matcher = pattern.matcher(upper);
        while (matcher.find()) {
            String digits = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            if (digits != null) {
                return Integer.parseInt(digits);
            }
        }
        return null;
    }

    // daily and coarser: the keyword alone, or with the number 1
    private static boolean unitKeyword(Pattern pattern, String upper) {
        Matcher matcher = pattern.matcher(upper);
        while (matcher.find()) {
            String digits = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            if (digits == null || Integer.parseInt(digits) == 1) {
                return true;
            }
        }
        return false;
    }
}
