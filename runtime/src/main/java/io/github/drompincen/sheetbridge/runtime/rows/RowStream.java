package io.github.drompincen.sheetbridge.runtime.rows;

import java.util.Iterator;

/** Lazy, single-pass sequence of data rows. Closing releases the underlying file. */
public interface RowStream extends Iterator<RawRecord>, AutoCloseable {

    @Override
    void close();
}
