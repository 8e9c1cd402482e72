package io.github.drompincen.sheetbridge.protocol.error;

/**
 * Root of every failure raised by the ingestion pipeline. Carries the 1-based source row
 * and the original column label when the failure is row-scoped; both are null otherwise.
 */
public class IngestionException extends RuntimeException {

    private final Integer rowNumber;
    private final String column;

    public IngestionException(String message) {
        this(message, null, null, null);
    }

    public IngestionException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public IngestionException(String message, Integer rowNumber, String column, Throwable cause) {
        super(message, cause);
        this.rowNumber = rowNumber;
        this.column = column;
    }

    public Integer getRowNumber() { return rowNumber; }

    public String getColumn() { return column; }

    /** Message prefixed with row and column when known. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (rowNumber != null) sb.append("Row ").append(rowNumber);
        if (column != null) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append("column '").append(column).append("'");
        }
        if (!sb.isEmpty()) sb.append(": ");
        sb.append(getMessage());
        return sb.toString();
    }
}
