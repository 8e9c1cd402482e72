package io.github.drompincen.sheetbridge.persistence.document;

import io.github.drompincen.sheetbridge.protocol.api.BatchCounts;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.protocol.api.DuplicateStrategy;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "import_batches")
@CompoundIndex(name = "schema_started", def = "{'schemaId': 1, 'startedAt': -1}")
@CompoundIndex(name = "status_started", def = "{'status': 1, 'startedAt': 1}")
public class ImportBatchDocument {

    @Id
    private String batchId;
    private String schemaId;
    private String schemaName;
    private String sourceName;
    private String sourceHash;
    private int dataStartRow;
    private String collectionName;
    private DuplicateStrategy duplicateStrategy;
    private BatchStatus status;
    private int total;
    private int inserted;
    private int updated;
    private int skipped;
    private int errored;
    @Indexed
    private Instant startedAt;
    private Instant endedAt;
    private List<String> errorSummaries = new ArrayList<>();
    private String failureReason;
    private List<RollbackAttempt> rollbackAttempts = new ArrayList<>();

    public ImportBatchDocument() {}

    public String getBatchId() { return batchId; }
    public void setBatchId(String batchId) { this.batchId = batchId; }

    public String getSchemaId() { return schemaId; }
    public void setSchemaId(String schemaId) { this.schemaId = schemaId; }

    public String getSchemaName() { return schemaName; }
    public void setSchemaName(String schemaName) { this.schemaName = schemaName; }

    public String getSourceName() { return sourceName; }
    public void setSourceName(String sourceName) { this.sourceName = sourceName; }

    public String getSourceHash() { return sourceHash; }
    public void setSourceHash(String sourceHash) { this.sourceHash = sourceHash; }

    public int getDataStartRow() { return dataStartRow; }
    public void setDataStartRow(int dataStartRow) { this.dataStartRow = dataStartRow; }

    public String getCollectionName() { return collectionName; }
    public void setCollectionName(String collectionName) { this.collectionName = collectionName; }

    public DuplicateStrategy getDuplicateStrategy() { return duplicateStrategy; }
    public void setDuplicateStrategy(DuplicateStrategy duplicateStrategy) { this.duplicateStrategy = duplicateStrategy; }

    public BatchStatus getStatus() { return status; }
    public void setStatus(BatchStatus status) { this.status = status; }

    public int getTotal() { return total; }
    public void setTotal(int total) { this.total = total; }

    public int getInserted() { return inserted; }
    public void setInserted(int inserted) { this.inserted = inserted; }

    public int getUpdated() { return updated; }
    public void setUpdated(int updated) { this.updated = updated; }

    public int getSkipped() { return skipped; }
    public void setSkipped(int skipped) { this.skipped = skipped; }

    public int getErrored() { return errored; }
    public void setErrored(int errored) { this.errored = errored; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public List<String> getErrorSummaries() { return errorSummaries; }
    public void setErrorSummaries(List<String> errorSummaries) { this.errorSummaries = errorSummaries; }

    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }

    public List<RollbackAttempt> getRollbackAttempts() { return rollbackAttempts; }
    public void setRollbackAttempts(List<RollbackAttempt> rollbackAttempts) { this.rollbackAttempts = rollbackAttempts; }

    public BatchCounts counts() {
        return new BatchCounts(total, inserted, updated, skipped, errored);
    }

    public void applyCounts(BatchCounts counts) {
        this.total = counts.total();
        this.inserted = counts.inserted();
        this.updated = counts.updated();
        this.skipped = counts.skipped();
        this.errored = counts.errored();
    }
}
