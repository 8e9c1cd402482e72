package io.github.drompincen.sheetbridge.runtime.batch;

import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.persistence.document.SchemaDocument;
import io.github.drompincen.sheetbridge.protocol.api.BatchCounts;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.protocol.api.DataQualityIssue;
import io.github.drompincen.sheetbridge.protocol.api.DuplicateStrategy;
import io.github.drompincen.sheetbridge.protocol.api.ImportProgress;
import io.github.drompincen.sheetbridge.runtime.mapping.ColumnMappingPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one running batch: the schema snapshot, mapping plan, running counts and
 * buffered issues. Owned by a single worker thread; only the cancel flag is shared.
 */
public class ImportContext {

    private final String batchId;
    private final SchemaDocument schema;
    private final DuplicateStrategy strategy;
    private final String collectionName;
    private final int dataStartRow;
    private final ImportProgressListener listener;
    private final AtomicBoolean cancelRequested;
    private final int maxErrorSummaries;
    private final long startedNanos = System.nanoTime();

    private ColumnMappingPlan plan;
    private int estimatedTotalRows = -1;
    private int total;
    private int inserted;
    private int updated;
    private int skipped;
    private int errored;
    private final List<DataQualityIssue> pendingIssues = new ArrayList<>();
    private final List<String> errorSummaries = new ArrayList<>();

    public ImportContext(ImportBatchDocument batch, SchemaDocument schema, ImportProgressListener listener,
                         AtomicBoolean cancelRequested, int maxErrorSummaries) {
        this.batchId = batch.getBatchId();
        this.schema = schema;
        this.strategy = batch.getDuplicateStrategy();
        this.collectionName = batch.getCollectionName();
        this.dataStartRow = batch.getDataStartRow();
        this.listener = listener == null ? ImportProgressListener.NONE : listener;
        this.cancelRequested = cancelRequested == null ? new AtomicBoolean() : cancelRequested;
        this.maxErrorSummaries = maxErrorSummaries;
    }

    public String batchId() { return batchId; }
    public SchemaDocument schema() { return schema; }
    public DuplicateStrategy strategy() { return strategy; }
    public String collectionName() { return collectionName; }
    public int dataStartRow() { return dataStartRow; }
    public ImportProgressListener listener() { return listener; }

    public List<String> duplicateKeyFields() {
        return schema.getDuplicateKeyFields() == null ? List.of() : schema.getDuplicateKeyFields();
    }

    public ColumnMappingPlan plan() { return plan; }
    public void setPlan(ColumnMappingPlan plan) { this.plan = plan; }

    public void setEstimatedTotalRows(int estimatedTotalRows) { this.estimatedTotalRows = estimatedTotalRows; }

    public boolean isCancelled() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }

    public boolean isFirstRow() { return total == 0; }

    public void rowSeen() { total++; }
    public void rowInserted() { inserted++; }
    public void rowUpdated() { updated++; }
    public void rowSkipped() { skipped++; }

    public void rowErrored(String summary) {
        errored++;
        if (errorSummaries.size() < maxErrorSummaries) {
            errorSummaries.add(summary);
        }
    }

    public void addIssues(List<DataQualityIssue> issues) { pendingIssues.addAll(issues); }

    public void addIssue(DataQualityIssue issue) { pendingIssues.add(issue); }

    /** Returns and clears the buffered issues. */
    public List<DataQualityIssue> drainIssues() {
        List<DataQualityIssue> drained = new ArrayList<>(pendingIssues);
        pendingIssues.clear();
        return drained;
    }

    public List<String> errorSummaries() { return List.copyOf(errorSummaries); }

    public BatchCounts counts() {
        return new BatchCounts(total, inserted, updated, skipped, errored);
    }

    public long elapsedMs() {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    public ImportProgress progress(BatchStatus status) {
        long elapsed = elapsedMs();
        long remaining = 0;
        if (estimatedTotalRows > total && total > 0) {
            remaining = elapsed * (estimatedTotalRows - total) / total;
        }
        int estimate = estimatedTotalRows < 0 ? -1 : Math.max(estimatedTotalRows, total);
        return new ImportProgress(batchId, status, total, estimate, counts(), elapsed, remaining);
    }
}
