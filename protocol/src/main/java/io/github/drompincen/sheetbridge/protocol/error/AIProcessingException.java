package io.github.drompincen.sheetbridge.protocol.error;

public class AIProcessingException extends IngestionException {

    public AIProcessingException(String message) {
        super(message);
    }

    public AIProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
