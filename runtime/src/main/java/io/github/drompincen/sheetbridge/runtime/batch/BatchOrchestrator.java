package io.github.drompincen.sheetbridge.runtime.batch;

import io.github.drompincen.sheetbridge.persistence.document.AuditLogDocument;
import io.github.drompincen.sheetbridge.persistence.document.DataQualityIssueDocument;
import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.persistence.document.SchemaDocument;
import io.github.drompincen.sheetbridge.persistence.repository.DataQualityIssueRepository;
import io.github.drompincen.sheetbridge.persistence.repository.ImportBatchRepository;
import io.github.drompincen.sheetbridge.persistence.store.DocumentStore;
import io.github.drompincen.sheetbridge.persistence.store.DuplicateKeyViolationException;
import io.github.drompincen.sheetbridge.protocol.api.AuditOperation;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.protocol.api.DataQualityIssue;
import io.github.drompincen.sheetbridge.protocol.api.ImportRequest;
import io.github.drompincen.sheetbridge.protocol.api.IssueKind;
import io.github.drompincen.sheetbridge.protocol.api.IssueSeverity;
import io.github.drompincen.sheetbridge.protocol.error.DuplicateResolutionException;
import io.github.drompincen.sheetbridge.protocol.error.IngestionException;
import io.github.drompincen.sheetbridge.protocol.error.SchemaMismatchException;
import io.github.drompincen.sheetbridge.protocol.error.StoreUnavailableException;
import io.github.drompincen.sheetbridge.runtime.dedupe.DuplicateResolver;
import io.github.drompincen.sheetbridge.runtime.dedupe.Resolution;
import io.github.drompincen.sheetbridge.runtime.ledger.AuditLedger;
import io.github.drompincen.sheetbridge.runtime.mapping.ColumnMapper;
import io.github.drompincen.sheetbridge.runtime.mapping.NormalizedRow;
import io.github.drompincen.sheetbridge.runtime.mapping.RowNormalizer;
import io.github.drompincen.sheetbridge.runtime.rows.RawRecord;
import io.github.drompincen.sheetbridge.runtime.rows.RowSource;
import io.github.drompincen.sheetbridge.runtime.rows.RowStream;
import io.github.drompincen.sheetbridge.runtime.schema.SchemaCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one file through one schema. Rows are processed strictly in file order on the calling
 * thread: normalize, resolve against the store, log the mutation ahead in the ledger, then
 * commit it. Row-scoped failures are counted and never stop the batch; an unreachable store or a
 * cancellation fails the batch at once, leaving committed rows in place.
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    public static final String BATCH_ID_FIELD = "_batch_id";
    public static final String SOURCE_ROW_FIELD = "_source_row";
    public static final String IMPORTED_AT_FIELD = "_imported_at";

    private final ImportBatchRepository importBatchRepository;
    private final DataQualityIssueRepository issueRepository;
    private final SchemaCatalogService schemaCatalog;
    private final ColumnMapper columnMapper;
    private final RowNormalizer rowNormalizer;
    private final DuplicateResolver duplicateResolver;
    private final AuditLedger auditLedger;
    private final DocumentStore documentStore;
    private final int flushSize;
    private final int progressInterval;
    private final int maxErrorSummaries;

    public BatchOrchestrator(ImportBatchRepository importBatchRepository,
                             DataQualityIssueRepository issueRepository,
                             SchemaCatalogService schemaCatalog,
                             ColumnMapper columnMapper,
                             RowNormalizer rowNormalizer,
                             DuplicateResolver duplicateResolver,
                             AuditLedger auditLedger,
                             DocumentStore documentStore,
                             @Value("${sheetbridge.import.flush-size:500}") int flushSize,
                             @Value("${sheetbridge.import.progress-interval:100}") int progressInterval,
                             @Value("${sheetbridge.import.max-error-summaries:100}") int maxErrorSummaries) {
        this.importBatchRepository = importBatchRepository;
        this.issueRepository = issueRepository;
        this.schemaCatalog = schemaCatalog;
        this.columnMapper = columnMapper;
        this.rowNormalizer = rowNormalizer;
        this.duplicateResolver = duplicateResolver;
        this.auditLedger = auditLedger;
        this.documentStore = documentStore;
        this.flushSize = Math.max(1, flushSize);
        this.progressInterval = Math.max(1, progressInterval);
        this.maxErrorSummaries = Math.max(0, maxErrorSummaries);
    }

    /** Creates and runs a batch on the calling thread. */
    public ImportBatchDocument runImport(ImportRequest request, RowSource source) {
        return execute(createBatch(request, source), source, ImportProgressListener.NONE, new AtomicBoolean());
    }

    /**
     * Persists a CREATED batch for {@code request}.
     *
     * @throws IllegalArgumentException if the schema does not exist
     */
    public ImportBatchDocument createBatch(ImportRequest request, RowSource source) {
        SchemaDocument schema = schemaCatalog.findDocument(request.schemaId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown schema: " + request.schemaId()));
        int startRow = request.dataStartRow() != null ? request.dataStartRow() : schema.getDataStartRow();
        if (startRow < 1) {
            throw new IllegalArgumentException("Data start row must be at least 1");
        }

        ImportBatchDocument batch = new ImportBatchDocument();
        batch.setBatchId(UUID.randomUUID().toString());
        batch.setSchemaId(schema.getSchemaId());
        batch.setSchemaName(schema.getName());
        batch.setSourceName(source.sourceName());
        batch.setSourceHash(source.contentHash());
        batch.setDataStartRow(startRow);
        batch.setCollectionName(schema.getCollectionName());
        batch.setDuplicateStrategy(request.duplicateStrategy() != null ? request.duplicateStrategy() : schema.getDuplicateStrategy());
        batch.setStatus(BatchStatus.CREATED);
        batch.setStartedAt(Instant.now());
        batch = importBatchRepository.save(batch);
        log.info("Created import batch {} for '{}' under schema '{}' ({})", batch.getBatchId(),
                batch.getSourceName(), batch.getSchemaName(), batch.getDuplicateStrategy().value());
        return batch;
    }

    /**
     * Runs a CREATED batch to completion or failure. Returns the final batch record.
     */
    public ImportBatchDocument execute(ImportBatchDocument batch, RowSource source,
                                       ImportProgressListener listener, AtomicBoolean cancelRequested) {
        Optional<SchemaDocument> schema = schemaCatalog.findDocument(batch.getSchemaId());
        if (schema.isEmpty()) {
            return fail(batch, null, "Schema " + batch.getSchemaId() + " no longer exists");
        }
        ImportContext ctx = new ImportContext(batch, schema.get(), listener, cancelRequested, maxErrorSummaries);
        try {
            checkCancelled(ctx);
            ctx.setPlan(columnMapper.plan(source.columnLabels(), schema.get().attributeMap()));
            schemaCatalog.ensureIndexes(schema.get());
            ctx.setEstimatedTotalRows(source.estimateRowCount(ctx.dataStartRow()));

            try (RowStream rows = source.open(ctx.dataStartRow())) {
                while (rows.hasNext()) {
                    checkCancelled(ctx);
                    RawRecord record = rows.next();
                    if (batch.getStatus() == BatchStatus.CREATED) {
                        BatchLifecycle.transition(batch, BatchStatus.RUNNING);
                        importBatchRepository.save(batch);
                        log.info("Import batch {} running", batch.getBatchId());
                    }
                    processRow(ctx, record);
                    int seen = ctx.counts().total();
                    if (seen % flushSize == 0) flush(ctx, batch);
                    if (seen % progressInterval == 0) ctx.listener().onProgress(ctx.progress(BatchStatus.RUNNING));
                }
            }
            return complete(ctx, batch);
        } catch (SchemaMismatchException e) {
            log.warn("Import batch {} rejected: {}", batch.getBatchId(), e.getMessage());
            return fail(batch, ctx, e.getMessage());
        } catch (CancellationException e) {
            boolean interrupted = Thread.interrupted();
            try {
                return fail(batch, ctx, "Import cancelled after " + ctx.counts().total() + " rows");
            } finally {
                if (interrupted) Thread.currentThread().interrupt();
            }
        } catch (StoreUnavailableException e) {
            log.error("Import batch {} failed, store unavailable: {}", batch.getBatchId(), e.getMessage());
            return fail(batch, ctx, e.getMessage());
        } catch (IngestionException e) {
            log.error("Import batch {} failed: {}", batch.getBatchId(), e.describe());
            return fail(batch, ctx, e.describe());
        } catch (DataAccessException e) {
            log.error("Import batch {} failed on a metadata store error", batch.getBatchId(), e);
            return fail(batch, ctx, "Metadata store error after " + ctx.counts().total() + " rows; see the server log");
        } catch (RuntimeException e) {
            log.error("Import batch {} aborted", batch.getBatchId(), e);
            return fail(batch, ctx, "Unexpected internal error after " + ctx.counts().total() + " rows; see the server log");
        }
    }

    /** Fails a batch that was cancelled before its worker picked it up. */
    public Optional<ImportBatchDocument> markCancelled(String batchId) {
        return importBatchRepository.findById(batchId)
                .filter(b -> b.getStatus() == BatchStatus.CREATED)
                .map(b -> fail(b, null, "Import cancelled before it started"));
    }

    private void processRow(ImportContext ctx, RawRecord record) {
        NormalizedRow row = rowNormalizer.normalize(record, ctx.plan(), ctx.isFirstRow());
        ctx.rowSeen();
        ctx.addIssues(row.issues());
        if (row.isErrored()) {
            ctx.rowErrored(row.firstFatal().map(DataQualityIssue::summary).orElse("Row " + row.rowNumber() + " rejected"));
            log.debug("Row {} errored during validation", row.rowNumber());
            return;
        }
        Map<String, Object> document = new LinkedHashMap<>(row.fields());
        try {
            commit(ctx, row.rowNumber(), document, duplicateResolver.resolve(ctx, document));
        } catch (DuplicateResolutionException e) {
            DataQualityIssue issue = new DataQualityIssue(row.rowNumber(), null, null, IssueKind.DUPLICATE_UNRESOLVED,
                    IssueSeverity.ERROR, null, "check the values of unique fields", e.getMessage());
            ctx.addIssue(issue);
            ctx.rowErrored(issue.summary());
            log.warn("Row {} of batch {} not written: {}", row.rowNumber(), ctx.batchId(), e.getMessage());
        }
    }

    private void commit(ImportContext ctx, int rowNumber, Map<String, Object> fields, Resolution resolution) {
        String collection = ctx.collectionName();
        switch (resolution.outcome()) {
            case INSERT -> {
                String id = UUID.randomUUID().toString();
                Map<String, Object> stored = stamp(ctx, rowNumber, id, fields);
                AuditLogDocument entry = auditLedger.prepare(ctx.batchId(), AuditOperation.INSERT, collection, id,
                        null, stored, rowNumber);
                try {
                    documentStore.insert(collection, stored);
                } catch (DuplicateKeyViolationException e) {
                    auditLedger.discard(entry);
                    Map<String, Object> existing = duplicateResolver
                            .findExisting(collection, ctx.duplicateKeyFields(), fields)
                            .orElseThrow(() -> new DuplicateResolutionException(
                                    "row conflicts with a unique index of " + collection, rowNumber, e));
                    log.debug("Row {} lost an insert race, treating as duplicate", rowNumber);
                    commit(ctx, rowNumber, fields, duplicateResolver.onMatch(ctx.strategy(), existing));
                    return;
                }
                auditLedger.confirm(entry);
                ctx.rowInserted();
            }
            case REPLACE -> {
                String id = resolution.existingId();
                Map<String, Object> stored = stamp(ctx, rowNumber, id, fields);
                AuditLogDocument entry = auditLedger.prepare(ctx.batchId(), AuditOperation.UPDATE, collection, id,
                        resolution.existing(), stored, rowNumber);
                boolean matched;
                try {
                    matched = documentStore.replace(collection, id, stored);
                } catch (DuplicateKeyViolationException e) {
                    auditLedger.discard(entry);
                    throw new DuplicateResolutionException("replacement conflicts with a unique index of " + collection, rowNumber, e);
                }
                if (!matched) {
                    auditLedger.discard(entry);
                    throw new DuplicateResolutionException("matched document " + id + " disappeared before it could be replaced", rowNumber, null);
                }
                auditLedger.confirm(entry);
                ctx.rowUpdated();
            }
            case SKIP -> {
                auditLedger.append(ctx.batchId(), AuditOperation.SKIP, collection, resolution.existingId(), null, null, rowNumber);
                ctx.rowSkipped();
            }
            case REJECT -> {
                DataQualityIssue issue = new DataQualityIssue(rowNumber, null, null, IssueKind.UPDATE_TARGET_MISSING,
                        IssueSeverity.ERROR, null, "import with the upsert strategy to create new documents",
                        "no existing document matches " + ctx.duplicateKeyFields() + "; update never creates documents");
                ctx.addIssue(issue);
                ctx.rowErrored(issue.summary());
            }
        }
    }

    private static Map<String, Object> stamp(ImportContext ctx, int rowNumber, String id, Map<String, Object> fields) {
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put(DocumentStore.ID, id);
        stored.putAll(fields);
        stored.put(BATCH_ID_FIELD, ctx.batchId());
        stored.put(SOURCE_ROW_FIELD, rowNumber);
        stored.put(IMPORTED_AT_FIELD, Instant.now());
        return stored;
    }

    private ImportBatchDocument complete(ImportContext ctx, ImportBatchDocument batch) {
        flush(ctx, batch);
        BatchLifecycle.transition(batch, BatchStatus.COMPLETED);
        batch = importBatchRepository.save(batch);
        schemaCatalog.recordUsage(batch.getSchemaId());
        auditLedger.release(batch.getBatchId());
        ctx.listener().onProgress(ctx.progress(BatchStatus.COMPLETED));
        log.info("Import batch {} completed in {} ms: total={}, inserted={}, updated={}, skipped={}, errored={}",
                batch.getBatchId(), ctx.elapsedMs(), batch.getTotal(), batch.getInserted(), batch.getUpdated(),
                batch.getSkipped(), batch.getErrored());
        if (batch.getErrored() > 0) {
            log.warn("Import batch {} had {} errored rows, first: {}", batch.getBatchId(), batch.getErrored(),
                    batch.getErrorSummaries().isEmpty() ? "-" : batch.getErrorSummaries().get(0));
        }
        return batch;
    }

    private ImportBatchDocument fail(ImportBatchDocument batch, ImportContext ctx, String reason) {
        if (ctx != null) flushIssues(ctx, batch);
        BatchLifecycle.transition(batch, BatchStatus.FAILED);
        batch.setFailureReason(reason);
        batch = importBatchRepository.save(batch);
        auditLedger.release(batch.getBatchId());
        if (ctx != null) ctx.listener().onProgress(ctx.progress(BatchStatus.FAILED));
        log.error("Import batch {} failed after {} rows: {}", batch.getBatchId(), batch.getTotal(), reason);
        return batch;
    }

    private void flush(ImportContext ctx, ImportBatchDocument batch) {
        flushIssues(ctx, batch);
        importBatchRepository.save(batch);
    }

    private void flushIssues(ImportContext ctx, ImportBatchDocument batch) {
        List<DataQualityIssue> issues = ctx.drainIssues();
        if (!issues.isEmpty()) {
            issueRepository.saveAll(issues.stream()
                    .map(issue -> DataQualityIssueDocument.from(batch.getBatchId(), issue))
                    .toList());
        }
        batch.applyCounts(ctx.counts());
        batch.setErrorSummaries(ctx.errorSummaries());
    }

    private static void checkCancelled(ImportContext ctx) {
        if (ctx.isCancelled()) throw new CancellationException("Import " + ctx.batchId() + " cancelled");
    }
}
