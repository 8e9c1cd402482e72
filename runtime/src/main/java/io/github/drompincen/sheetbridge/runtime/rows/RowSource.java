package io.github.drompincen.sheetbridge.runtime.rows;

import java.util.List;

/**
 * A tabular file that can be read row by row. The header is row 1; data rows follow
 * from a caller-chosen start row. Every call to {@link #open(int)} starts a fresh pass.
 */
public interface RowSource {

    /** File name shown in batch history. */
    String sourceName();

    /** Hex SHA-256 of the file content. */
    String contentHash();

    /** Labels of the header row, in column order. Blank header cells are skipped. */
    List<String> columnLabels();

    /** Number of data rows from {@code dataStartRow} on, or -1 when unknown without a full read. */
    default int estimateRowCount(int dataStartRow) {
        return -1;
    }

    /**
     * Opens a stream positioned at {@code dataStartRow} (1-based, never before row 2).
     * Fully blank rows are skipped.
     */
    RowStream open(int dataStartRow);
}
