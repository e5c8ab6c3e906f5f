package com.tsingest.ingest;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TimestampColumn;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Parses timestamp text into UTC instants.
 *
 * <p>Strategies are tried in a fixed order and the first success wins: ISO instants and
 * offsets, local date-times in common layouts (read as UTC), plain dates (start of day), then
 * epoch seconds or milliseconds for numbers in a plausible range. An instance remembers which
 * strategy last succeeded and tries it first, since one column almost always uses one layout.
 */
public final class TimestampParser {

    private static final Locale LOCALE = Locale.US;
    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    /** Epoch seconds between 2001-09-09 and 5138-11-16. */
    private static final double MIN_EPOCH_SECONDS = 1e9;
    private static final double MAX_EPOCH_SECONDS = 1e11;
    /** Epoch milliseconds over the same span. */
    private static final double MAX_EPOCH_MILLIS = 1e14;

    private static final List<String> DATE_PATTERNS =
            List.of("uuuu-MM-dd", "uuuu.MM.dd", "uuuu/MM/dd", "dd.MM.uuuu", "MM/dd/uuuu", "dd-MM-uuuu");

    private static final List<Function<String, Optional<Instant>>> STRATEGIES = buildStrategies();

    private int lastHit = -1;

    /** Parses one value without remembering the strategy. */
    public static Optional<Instant> parseOnce(String value) {
        return new TimestampParser().parse(value);
    }

    /**
     * @return the instant, or empty when no strategy accepts the value
     */
    public Optional<Instant> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || MissingValues.isMissing(trimmed)) {
            return Optional.empty();
        }
        if (lastHit >= 0) {
            Optional<Instant> cached = STRATEGIES.get(lastHit).apply(trimmed);
            if (cached.isPresent()) {
                return cached;
            }
        }
        for (int i = 0; i < STRATEGIES.size(); i++) {
            if (i == lastHit) {
                continue;
            }
            Optional<Instant> parsed = STRATEGIES.get(i).apply(trimmed);
            if (parsed.isPresent()) {
                lastHit = i;
                return parsed;
            }
        }
        return Optional.empty();
    }

    /** Epoch millis of the value, or {@link TimestampColumn#NOT_A_TIME}. */
    public long parseEpochMillis(String value) {
        return parse(value).map(Instant::toEpochMilli).orElse(TimestampColumn.NOT_A_TIME);
    }

    public static boolean isNumber(String value) {
        return value != null && NUMBER.matcher(value.trim()).matches();
    }

    /** Epoch interpretation of a number: seconds or milliseconds by magnitude. */
    public static Optional<Instant> fromEpochNumber(double value) {
        if (Double.isNaN(value) || value < MIN_EPOCH_SECONDS) {
            return Optional.empty();
        }
        if (value < MAX_EPOCH_SECONDS) {
            return Optional.of(Instant.ofEpochMilli(Math.round(value * 1000.0)));
        }
        if (value < MAX_EPOCH_MILLIS) {
            return Optional.of(Instant.ofEpochMilli(Math.round(value)));
        }
        return Optional.empty();
    }

    /**
     * Converts any column to timestamps. Values that do not parse become not-a-time; the row
     * count never changes.
     */
    public static TimestampColumn parseColumn(Column column) {
        if (column instanceof TimestampColumn timestamps) {
            return timestamps;
        }
        long[] millis = new long[column.size()];
        if (column instanceof NumericColumn numeric) {
            for (int i = 0; i < millis.length; i++) {
                millis[i] = fromEpochNumber(numeric.getDouble(i))
                        .map(Instant::toEpochMilli)
                        .orElse(TimestampColumn.NOT_A_TIME);
            }
        } else {
            TimestampParser parser = new TimestampParser();
            for (int i = 0; i < millis.length; i++) {
                millis[i] = parser.parseEpochMillis(column.format(i));
            }
        }
        return new TimestampColumn(column.name(), millis);
    }

    private static List<Function<String, Optional<Instant>>> buildStrategies() {
        List<Function<String, Optional<Instant>>> strategies = new ArrayList<>();
        strategies.add(TimestampParser::parseIsoInstant);
        strategies.add(TimestampParser::parseIsoOffset);
        for (String datePattern : DATE_PATTERNS) {
            DateTimeFormatter dateTime = dateTimeFormatter(datePattern);
            strategies.add(value -> parseLocalDateTime(value, dateTime));
        }
        for (String datePattern : DATE_PATTERNS) {
            DateTimeFormatter date = DateTimeFormatter.ofPattern(datePattern, LOCALE).withResolverStyle(ResolverStyle.STRICT);
            strategies.add(value -> parseLocalDate(value, date));
        }
        strategies.add(TimestampParser::parseEpoch);
        return List.copyOf(strategies);
    }

    // date, then 'T' or space, then HH:mm with optional seconds and fraction
    private static DateTimeFormatter dateTimeFormatter(String datePattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(datePattern)
                .optionalStart().appendLiteral('T').optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .appendPattern("HH:mm")
                .optionalStart()
                .appendLiteral(':')
                .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                .optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                .optionalEnd()
                .optionalEnd()
                .toFormatter(LOCALE)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static Optional<Instant> parseIsoInstant(String value) {
        if (!value.endsWith("Z") && !value.endsWith("z")) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value.toUpperCase(LOCALE)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseIsoOffset(String value) {
        if (value.length() < 20 || (value.indexOf('+', 10) < 0 && value.lastIndexOf('-') < 10)) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value.replace(' ', 'T')).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseLocalDateTime(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDateTime.parse(value, formatter).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseLocalDate(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(value, formatter).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseEpoch(String value) {
        if (!isNumber(value)) {
            return Optional.empty();
        }
        return fromEpochNumber(Double.parseDouble(value));
    }
}
