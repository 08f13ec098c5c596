package com.dataops.loader.parser;

import java.io.IOException;
import java.util.List;

/**
 * A file whose framing has been fully checked. Rows are not held in memory;
 * every call to {@link #rows()} re-reads the file from its first row.
 */
public final class ParsedFile {

    @FunctionalInterface
    interface RowIteratorOpener {
        RowIterator open() throws IOException;
    }

    private final List<String> header;
    private final long rowCount;
    private final int warningCount;
    private final RowIteratorOpener opener;

    ParsedFile(List<String> header, long rowCount, int warningCount, RowIteratorOpener opener) {
        this.header = List.copyOf(header);
        this.rowCount = rowCount;
        this.warningCount = warningCount;
        this.opener = opener;
    }

    /**
     * Field names: the CSV header, or every key seen in a JSON array in first-seen order.
     */
    public List<String> getHeader() {
        return header;
    }

    public long getRowCount() {
        return rowCount;
    }

    /**
     * Framing irregularities that did not reject the file, such as extra CSV fields.
     */
    public int getWarningCount() {
        return warningCount;
    }

    public RowIterator rows() throws IOException {
        return opener.open();
    }
}
