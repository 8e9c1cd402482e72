package io.github.drompincen.sheetbridge.protocol.error;

public class DataConversionException extends IngestionException {

    private final String rawValue;

    public DataConversionException(String message, String rawValue) {
        this(message, rawValue, null, null);
    }

    public DataConversionException(String message, String rawValue, Integer rowNumber, String column) {
        super(message, rowNumber, column, null);
        this.rawValue = rawValue;
    }

    public String getRawValue() { return rawValue; }

    public DataConversionException at(int rowNumber, String column) {
        return new DataConversionException(getMessage(), rawValue, rowNumber, column);
    }
}
