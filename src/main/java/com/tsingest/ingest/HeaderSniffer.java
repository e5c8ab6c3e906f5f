package com.tsingest.ingest;

import java.util.List;

/**
 * Locates the header row of a delimited file among its leading lines.
 *
 * <p>The delimiter is the candidate with the most occurrences over the window (comma on
 * ties). The header is the first line carrying the most delimiters, which skips comment and
 * metadata lines that exporters put above the table.
 */
public final class HeaderSniffer {

    /**
     * @param lineIndex index of the header line within the sniffed window
     * @param delimiter field separator for the whole file
     * @param fields    raw header cells
     */
    public record HeaderSniff(int lineIndex, char delimiter, String[] fields) {}

    private HeaderSniffer() {}

    public static HeaderSniff sniff(List<String> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("No lines to sniff");
        }
        char delimiter = detectDelimiter(lines);
        int best = 0;
        int bestCount = -1;
        for (int i = 0; i < lines.size(); i++) {
            int count = DelimitedLineParser.countDelimiters(lines.get(i), delimiter);
            if (count > bestCount) {
                best = i;
                bestCount = count;
            }
        }
        return new HeaderSniff(best, delimiter, DelimitedLineParser.parse(lines.get(best), delimiter));
    }

    public static char detectDelimiter(List<String> lines) {
        char best = DelimitedLineParser.CANDIDATE_DELIMITERS[0];
        int bestCount = 0;
        for (char candidate : DelimitedLineParser.CANDIDATE_DELIMITERS) {
            int count = 0;
            for (String line : lines) {
                count += DelimitedLineParser.countDelimiters(line, candidate);
            }
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }
}
