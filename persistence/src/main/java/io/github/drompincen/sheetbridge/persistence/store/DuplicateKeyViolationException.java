package io.github.drompincen.sheetbridge.persistence.store;

import io.github.drompincen.sheetbridge.protocol.error.IngestionException;

/** A write was refused by a unique index in the document store. */
public class DuplicateKeyViolationException extends IngestionException {

    public DuplicateKeyViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
