package com.providersentinel.core.ingest;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed records read from one source, with row accounting.
 *
 * @param <T> record type
 * @since 1.0.0
 */
public final class LoadResult<T> {

    private final String source;
    private final List<T> records;
    private final long rowsRead;
    private final long rowsSkipped;

    public LoadResult(String source, List<T> records, long rowsRead, long rowsSkipped) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.records = Collections.unmodifiableList(Objects.requireNonNull(records, "records must not be null"));
        this.rowsRead = rowsRead;
        this.rowsSkipped = rowsSkipped;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return unmodifiable list of successfully coerced records
     */
    public List<T> getRecords() {
        return records;
    }

    /** Rows encountered, including skipped ones. */
    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsSkipped() {
        return rowsSkipped;
    }

    @Override
    public String toString() {
        return "LoadResult{" +
                "source='" + source + '\'' +
                ", records=" + records.size() +
                ", rowsRead=" + rowsRead +
                ", rowsSkipped=" + rowsSkipped +
                '}';
    }
}
