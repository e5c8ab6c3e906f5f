package com.tsingest.ingest;

import com.tsingest.ingest.HeaderSniffer.HeaderSniff;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Streams the data rows of a UTF-8 delimited file after its sniffed header.
 *
 * <p>Rows read ahead for sampling stay buffered and are handed out first by
 * {@link #readRows(int)}, so sampling never loses or reorders rows. Blank lines are skipped.
 * Quoted fields may not span lines.
 */
final class DelimitedTextReader implements Closeable {

    private final BufferedReader reader;
    private final HeaderSniff header;
    private final Deque<String[]> buffered = new ArrayDeque<>();
    private long charsRead;
    private boolean exhausted;

    private DelimitedTextReader(BufferedReader reader, HeaderSniff header) {
        this.reader = reader;
        this.header = header;
    }

    /**
     * Opens {@code path} and sniffs its header from the first {@code sniffLines} non-blank lines.
     *
     * @return empty when the file holds no non-blank line
     */
    static Optional<DelimitedTextReader> open(Path path, int sniffLines) throws IOException {
        BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        try {
            List<String> window = new ArrayList<>(sniffLines);
            long consumed = 0;
            String line;
            while (window.size() < sniffLines && (line = reader.readLine()) != null) {
                consumed += line.length() + 1;
                if (window.isEmpty()) {
                    line = DelimitedLineParser.stripBom(line);
                }
                if (!line.isBlank()) {
                    window.add(line);
                }
            }
            if (window.isEmpty()) {
                reader.close();
                return Optional.empty();
            }
            DelimitedTextReader result = new DelimitedTextReader(reader, HeaderSniffer.sniff(window));
            result.charsRead = consumed;
            for (int i = result.header.lineIndex() + 1; i < window.size(); i++) {
                result.buffered.addLast(result.split(window.get(i)));
            }
            return Optional.of(result);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    HeaderSniff header() {
        return header;
    }

    /** Up to {@code rows} leading data rows, left in place for {@link #readRows(int)}. */
    List<String[]> peek(int rows) throws IOException {
        while (buffered.size() < rows && readLineIntoBuffer()) {
            // fill
        }
        List<String[]> sample = new ArrayList<>(Math.min(rows, buffered.size()));
        for (String[] row : buffered) {
            if (sample.size() == rows) {
                break;
            }
            sample.add(row);
        }
        return sample;
    }

    /** Next {@code maxRows} data rows, fewer at end of file. */
    List<String[]> readRows(int maxRows) throws IOException {
        List<String[]> rows = new ArrayList<>(Math.min(maxRows, 1 << 16));
        while (rows.size() < maxRows) {
            if (buffered.isEmpty() && !readLineIntoBuffer()) {
                break;
            }
            rows.add(buffered.pollFirst());
        }
        return rows;
    }

    boolean hasMore() throws IOException {
        return !buffered.isEmpty() || readLineIntoBuffer();
    }

    /** Approximate bytes consumed so far (characters plus line terminators). */
    long bytesRead() {
        return charsRead;
    }

    private boolean readLineIntoBuffer() throws IOException {
        if (exhausted) {
            return false;
        }
        String line;
        while ((line = reader.readLine()) != null) {
            charsRead += line.length() + 1;
            if (!line.isBlank()) {
                buffered.addLast(split(line));
                return true;
            }
        }
        exhausted = true;
        return false;
    }

    private String[] split(String line) {
        return DelimitedLineParser.parse(line, header.delimiter());
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
