package io.github.drompincen.sheetbridge.protocol.error;

public class DuplicateResolutionException extends IngestionException {

    public DuplicateResolutionException(String message, Integer rowNumber, Throwable cause) {
        super(message, rowNumber, null, cause);
    }
}
