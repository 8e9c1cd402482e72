package io.github.drompincen.sheetbridge.protocol.error;

/** The document or metadata store cannot be reached. Fatal to the running batch. */
public class StoreUnavailableException extends IngestionException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
