package com.tsingest.ingest;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.ColumnType;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.TimestampColumn;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Promotes a timestamp column to the dataset's time axis.
 *
 * <p>Order of preference: an existing axis is kept; a column literally named
 * timestamp/time/date/datetime/dt is promoted (exact case before any case); OHLCV-looking
 * data without a timestamp-like column is left alone; otherwise the first column is promoted
 * when at least one of its values parses.
 */
public final class TimeAxisNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TimeAxisNormalizer.class);

    static final List<String> AXIS_NAMES = List.of("timestamp", "time", "date", "datetime", "dt");
    static final List<String> OHLCV_MARKERS = List.of("open", "high", "low", "close", "volume");

    private TimeAxisNormalizer() {}

    public static Dataset normalize(Dataset dataset) {
        if (dataset.hasTimeAxis()) {
            return dataset;
        }
        Optional<String> named = findNamedAxisColumn(dataset);
        if (named.isPresent()) {
            Column column = dataset.column(named.get()).orElseThrow();
            log.debug("Promoting column {} to time axis", named.get());
            return dataset.promoteToTimeAxis(named.get(), TimestampParser.parseColumn(column));
        }
        if (looksLikeOhlcv(dataset) && !hasTimestampLikeColumn(dataset)) {
            log.debug("OHLCV columns without a timestamp column, leaving dataset without time axis");
            return dataset;
        }
        if (dataset.columnCount() == 0) {
            return dataset;
        }
        Column first = dataset.columns().get(0);
        TimestampColumn parsed = TimestampParser.parseColumn(first);
        if (parsed.validCount() > 0) {
            log.debug("Promoting first column {} to time axis", first.name());
            return dataset.promoteToTimeAxis(first.name(), parsed);
        }
        return dataset;
    }

    static Optional<String> findNamedAxisColumn(Dataset dataset) {
        List<String> names = dataset.columnNames();
        for (String name : names) {
            if (AXIS_NAMES.contains(name)) {
                return Optional.of(name);
            }
        }
        for (String name : names) {
            if (AXIS_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    static boolean looksLikeOhlcv(Dataset dataset) {
        return dataset.columnNames().stream()
                .map(n -> n.toLowerCase(Locale.ROOT))
                .anyMatch(n -> OHLCV_MARKERS.stream().anyMatch(n::contains));
    }

    private static boolean hasTimestampLikeColumn(Dataset dataset) {
        return dataset.columns().stream()
                .anyMatch(c -> c.type() == ColumnType.TIMESTAMP || DatetimeColumnDetector.hasTimeName(c.name()));
    }
}
