package com.tsingest.ingest.columnar;

import com.tsingest.dataset.Dataset;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A file stored as a sequence of row groups, read front to back.
 *
 * <p>The row count is known from the file metadata before any data is read. Row groups are
 * decoded on demand and re-sliced into batches of the size the caller asks for.
 */
public abstract class RowGroupReader implements Closeable {

    private Dataset pending = Dataset.empty();

    /** Total rows as recorded in the file metadata. */
    public abstract long rowCount();

    public abstract boolean hasTimeAxis();

    protected abstract boolean hasMoreRowGroups();

    protected abstract Dataset readRowGroup() throws IOException;

    /** Zero-row dataset carrying the file's columns. */
    protected abstract Dataset emptyWithSchema() throws IOException;

    public boolean hasMore() {
        return !pending.isEmpty() || hasMoreRowGroups();
    }

    /** Next {@code maxRows} rows in file order, fewer at the end. */
    public Dataset readBatch(int maxRows) throws IOException {
        List<Dataset> parts = new ArrayList<>();
        int collected = 0;
        while (collected < maxRows && hasMore()) {
            if (pending.isEmpty()) {
                pending = readRowGroup();
                continue;
            }
            int take = Math.min(maxRows - collected, pending.rowCount());
            parts.add(pending.slice(0, take));
            pending = pending.slice(take, pending.rowCount());
            collected += take;
        }
        return Dataset.concat(parts);
    }

    /** Every remaining row. */
    public Dataset readAll() throws IOException {
        List<Dataset> parts = new ArrayList<>();
        if (!pending.isEmpty()) {
            parts.add(pending);
            pending = Dataset.empty();
        }
        while (hasMoreRowGroups()) {
            parts.add(readRowGroup());
        }
        if (parts.isEmpty()) {
            return emptyWithSchema();
        }
        return Dataset.concat(parts);
    }
}
