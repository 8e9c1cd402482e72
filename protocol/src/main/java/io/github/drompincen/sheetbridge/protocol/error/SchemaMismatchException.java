package io.github.drompincen.sheetbridge.protocol.error;

import java.util.List;

/** A file cannot be imported under a schema because required fields have no column. */
public class SchemaMismatchException extends IngestionException {

    private final List<String> missingFields;

    public SchemaMismatchException(String message, List<String> missingFields) {
        super(message);
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() { return missingFields; }
}
