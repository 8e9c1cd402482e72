package io.github.drompincen.sheetbridge.persistence.document;

import io.github.drompincen.sheetbridge.protocol.api.DataQualityIssue;
import io.github.drompincen.sheetbridge.protocol.api.IssueKind;
import io.github.drompincen.sheetbridge.protocol.api.IssueSeverity;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.UUID;

@Document(collection = "data_quality_issues")
@CompoundIndex(name = "batch_row", def = "{'batchId': 1, 'rowNumber': 1}")
public class DataQualityIssueDocument {

    @Id
    private String issueId;
    private String batchId;
    private int rowNumber;
    private String column;
    private String field;
    private IssueKind kind;
    private IssueSeverity severity;
    private String rawValue;
    private String suggestedFix;
    private String message;
    private Instant createdAt;

    public DataQualityIssueDocument() {}

    public static DataQualityIssueDocument from(String batchId, DataQualityIssue issue) {
        DataQualityIssueDocument doc = new DataQualityIssueDocument();
        doc.setIssueId(UUID.randomUUID().toString());
        doc.setBatchId(batchId);
        doc.setRowNumber(issue.rowNumber());
        doc.setColumn(issue.column());
        doc.setField(issue.field());
        doc.setKind(issue.kind());
        doc.setSeverity(issue.severity());
        doc.setRawValue(issue.rawValue());
        doc.setSuggestedFix(issue.suggestedFix());
        doc.setMessage(issue.message());
        doc.setCreatedAt(Instant.now());
        return doc;
    }

    public DataQualityIssue toIssue() {
        return new DataQualityIssue(rowNumber, column, field, kind, severity, rawValue, suggestedFix, message);
    }

    public String getIssueId() { return issueId; }
    public void setIssueId(String issueId) { this.issueId = issueId; }

    public String getBatchId() { return batchId; }
    public void setBatchId(String batchId) { this.batchId = batchId; }

    public int getRowNumber() { return rowNumber; }
    public void setRowNumber(int rowNumber) { this.rowNumber = rowNumber; }

    public String getColumn() { return column; }
    public void setColumn(String column) { this.column = column; }

    public String getField() { return field; }
    public void setField(String field) { this.field = field; }

    public IssueKind getKind() { return kind; }
    public void setKind(IssueKind kind) { this.kind = kind; }

    public IssueSeverity getSeverity() { return severity; }
    public void setSeverity(IssueSeverity severity) { this.severity = severity; }

    public String getRawValue() { return rawValue; }
    public void setRawValue(String rawValue) { this.rawValue = rawValue; }

    public String getSuggestedFix() { return suggestedFix; }
    public void setSuggestedFix(String suggestedFix) { this.suggestedFix = suggestedFix; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
