package io.github.drompincen.sheetbridge.persistence.document;

import io.github.drompincen.sheetbridge.protocol.api.AuditOperation;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "audit_log")
@CompoundIndex(name = "batch_seq", def = "{'batchId': 1, 'seq': 1}", unique = true)
public class AuditLogDocument {

    @Id
    private String entryId;
    private String batchId;
    private long seq;
    private AuditOperation operation;
    private String collectionName;
    private String targetId;
    private Map<String, Object> priorState;
    private Map<String, Object> newState;
    private int rowNumber;
    private Instant timestamp;
    /** Written ahead of the store change and cleared once the change is committed. */
    private boolean pending;

    public AuditLogDocument() {}

    public String getEntryId() { return entryId; }
    public void setEntryId(String entryId) { this.entryId = entryId; }

    public String getBatchId() { return batchId; }
    public void setBatchId(String batchId) { this.batchId = batchId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public AuditOperation getOperation() { return operation; }
    public void setOperation(AuditOperation operation) { this.operation = operation; }

    public String getCollectionName() { return collectionName; }
    public void setCollectionName(String collectionName) { this.collectionName = collectionName; }

    public String getTargetId() { return targetId; }
    public void setTargetId(String targetId) { this.targetId = targetId; }

    public Map<String, Object> getPriorState() { return priorState; }
    public void setPriorState(Map<String, Object> priorState) { this.priorState = priorState; }

    public Map<String, Object> getNewState() { return newState; }
    public void setNewState(Map<String, Object> newState) { this.newState = newState; }

    public int getRowNumber() { return rowNumber; }
    public void setRowNumber(int rowNumber) { this.rowNumber = rowNumber; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public boolean isPending() { return pending; }
    public void setPending(boolean pending) { this.pending = pending; }
}
