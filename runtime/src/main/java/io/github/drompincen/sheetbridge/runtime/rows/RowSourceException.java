package io.github.drompincen.sheetbridge.runtime.rows;

import io.github.drompincen.sheetbridge.protocol.error.IngestionException;

/** A file could not be opened or read. */
public class RowSourceException extends IngestionException {

    public RowSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
