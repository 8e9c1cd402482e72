package io.github.drompincen.sheetbridge.runtime.schema;

import io.github.drompincen.sheetbridge.protocol.error.IngestionException;

import java.util.List;

/** A schema template breaks one or more catalog rules. */
public class SchemaValidationException extends IngestionException {

    private final List<String> errors;

    public SchemaValidationException(List<String> errors) {
        super("Invalid schema: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() { return errors; }
}
