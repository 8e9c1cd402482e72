package io.github.drompincen.sheetbridge.runtime.batch;

import io.github.drompincen.sheetbridge.persistence.document.DataQualityIssueDocument;
import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.persistence.repository.DataQualityIssueRepository;
import io.github.drompincen.sheetbridge.persistence.repository.ImportBatchRepository;
import io.github.drompincen.sheetbridge.protocol.api.AuditEntryDto;
import io.github.drompincen.sheetbridge.protocol.api.DataQualityIssue;
import io.github.drompincen.sheetbridge.protocol.api.ImportBatchDto;
import io.github.drompincen.sheetbridge.runtime.ledger.AuditLedger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class ImportHistoryService {

    private final ImportBatchRepository importBatchRepository;
    private final DataQualityIssueRepository issueRepository;
    private final AuditLedger auditLedger;

    public ImportHistoryService(ImportBatchRepository importBatchRepository,
                                DataQualityIssueRepository issueRepository,
                                AuditLedger auditLedger) {
        this.importBatchRepository = importBatchRepository;
        this.issueRepository = issueRepository;
        this.auditLedger = auditLedger;
    }

    /** Batches newest first, optionally for one schema. */
    public List<ImportBatchDto> list(String schemaId) {
        List<ImportBatchDocument> batches = schemaId == null || schemaId.isBlank()
                ? importBatchRepository.findAllByOrderByStartedAtDesc()
                : importBatchRepository.findBySchemaIdOrderByStartedAtDesc(schemaId);
        return batches.stream().map(ImportHistoryService::toDto).toList();
    }

    public Optional<ImportBatchDto> find(String batchId) {
        return importBatchRepository.findById(batchId).map(ImportHistoryService::toDto);
    }

    public List<DataQualityIssue> issues(String batchId) {
        return issueRepository.findByBatchIdOrderByRowNumberAsc(batchId).stream()
                .map(DataQualityIssueDocument::toIssue).toList();
    }

    public List<AuditEntryDto> audit(String batchId) {
        return auditLedger.history(batchId);
    }

    public static ImportBatchDto toDto(ImportBatchDocument doc) {
        return new ImportBatchDto(doc.getBatchId(), doc.getSchemaId(), doc.getSchemaName(), doc.getSourceName(),
                doc.getSourceHash(), doc.getDataStartRow(), doc.getCollectionName(), doc.getDuplicateStrategy(),
                doc.getStatus(), doc.counts(), doc.getStartedAt(), doc.getEndedAt(),
                doc.getErrorSummaries() == null ? List.of() : List.copyOf(doc.getErrorSummaries()),
                doc.getFailureReason(),
                doc.getRollbackAttempts() == null ? 0 : doc.getRollbackAttempts().size());
    }
}
