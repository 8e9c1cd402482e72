package io.github.drompincen.sheetbridge.gateway.controller;

import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.protocol.api.AuditEntryDto;
import io.github.drompincen.sheetbridge.protocol.api.DataQualityIssue;
import io.github.drompincen.sheetbridge.protocol.api.ImportBatchDto;
import io.github.drompincen.sheetbridge.protocol.api.ImportRequest;
import io.github.drompincen.sheetbridge.protocol.api.PreviewRequest;
import io.github.drompincen.sheetbridge.protocol.api.PreviewResponse;
import io.github.drompincen.sheetbridge.protocol.api.RollbackEligibility;
import io.github.drompincen.sheetbridge.protocol.api.RollbackReport;
import io.github.drompincen.sheetbridge.runtime.batch.BatchWorkerPool;
import io.github.drompincen.sheetbridge.runtime.batch.ImportHistoryService;
import io.github.drompincen.sheetbridge.runtime.batch.ImportPreviewService;
import io.github.drompincen.sheetbridge.runtime.ledger.AuditLedger;
import io.github.drompincen.sheetbridge.runtime.ledger.RollbackService;
import io.github.drompincen.sheetbridge.runtime.rows.RowSource;
import io.github.drompincen.sheetbridge.sources.RowSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/imports")
public class ImportController {

    private static final Logger log = LoggerFactory.getLogger(ImportController.class);

    private final BatchWorkerPool workerPool;
    private final ImportHistoryService history;
    private final ImportPreviewService previewService;
    private final AuditLedger auditLedger;
    private final RollbackService rollbackService;
    private final RowSourceFactory rowSourceFactory;

    public ImportController(BatchWorkerPool workerPool,
                            ImportHistoryService history,
                            ImportPreviewService previewService,
                            AuditLedger auditLedger,
                            RollbackService rollbackService,
                            RowSourceFactory rowSourceFactory) {
        this.workerPool = workerPool;
        this.history = history;
        this.previewService = previewService;
        this.auditLedger = auditLedger;
        this.rollbackService = rollbackService;
        this.rowSourceFactory = rowSourceFactory;
    }

    /** Queues the import and answers 202 with the CREATED batch; poll the batch for its outcome. */
    @PostMapping
    public ResponseEntity<ImportBatchDto> start(@RequestBody ImportRequest request) {
        requireSchemaId(request.schemaId());
        RowSource source = rowSourceFactory.forPath(request.filePath(), request.sheetName());
        ImportBatchDocument batch = workerPool.submit(request, source, progress ->
                log.debug("[{}] {} rows processed ({} inserted, {} updated, {} skipped, {} errored)",
                        progress.batchId(), progress.processedRows(), progress.counts().inserted(),
                        progress.counts().updated(), progress.counts().skipped(), progress.counts().errored()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ImportHistoryService.toDto(batch));
    }

    @PostMapping("/preview")
    public PreviewResponse preview(@RequestBody PreviewRequest request) {
        requireSchemaId(request.schemaId());
        RowSource source = rowSourceFactory.forPath(request.filePath(), request.sheetName());
        return previewService.preview(request.schemaId(), source, request.dataStartRow(), request.rows());
    }

    @GetMapping
    public List<ImportBatchDto> list(@RequestParam(required = false) String schemaId) {
        return history.list(schemaId);
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<ImportBatchDto> get(@PathVariable String batchId) {
        return history.find(batchId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{batchId}/issues")
    public ResponseEntity<List<DataQualityIssue>> issues(@PathVariable String batchId) {
        if (history.find(batchId).isEmpty()) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(history.issues(batchId));
    }

    @GetMapping("/{batchId}/audit")
    public ResponseEntity<List<AuditEntryDto>> audit(@PathVariable String batchId) {
        if (history.find(batchId).isEmpty()) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(history.audit(batchId));
    }

    @GetMapping("/{batchId}/rollback")
    public ResponseEntity<RollbackEligibility> rollbackEligibility(@PathVariable String batchId) {
        if (history.find(batchId).isEmpty()) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(auditLedger.eligibility(batchId));
    }

    /** 200 when every entry was compensated, 207 when some failed and the batch can be retried. */
    @PostMapping("/{batchId}/rollback")
    public ResponseEntity<RollbackReport> rollback(@PathVariable String batchId) {
        if (history.find(batchId).isEmpty()) return ResponseEntity.notFound().build();
        RollbackReport report = rollbackService.rollback(batchId);
        return ResponseEntity.status(report.isComplete() ? HttpStatus.OK : HttpStatus.MULTI_STATUS).body(report);
    }

    @PostMapping("/{batchId}/cancel")
    public ResponseEntity<ImportBatchDto> cancel(@PathVariable String batchId) {
        if (history.find(batchId).isEmpty()) return ResponseEntity.notFound().build();
        if (!workerPool.cancel(batchId)) {
            throw new IllegalStateException("Batch " + batchId + " is not queued or running");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(history.find(batchId).orElseThrow());
    }

    private static void requireSchemaId(String schemaId) {
        if (schemaId == null || schemaId.isBlank()) {
            throw new IllegalArgumentException("A schemaId is required");
        }
    }
}
