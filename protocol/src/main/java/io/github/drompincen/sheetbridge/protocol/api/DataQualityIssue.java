package io.github.drompincen.sheetbridge.protocol.api;

public record DataQualityIssue(
        int rowNumber,
        String column,
        String field,
        IssueKind kind,
        IssueSeverity severity,
        String rawValue,
        String suggestedFix,
        String message
) {
    /** Row-level text for batch error summaries: row, column and cause. */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        if (rowNumber > 0) sb.append("Row ").append(rowNumber);
        if (column != null) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append("column '").append(column).append("'");
        }
        if (!sb.isEmpty()) sb.append(": ");
        sb.append(message);
        return sb.toString();
    }
}
