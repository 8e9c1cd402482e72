package io.github.drompincen.sheetbridge.runtime.batch;

import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.persistence.repository.AuditLogRepository;
import io.github.drompincen.sheetbridge.persistence.repository.DataQualityIssueRepository;
import io.github.drompincen.sheetbridge.persistence.repository.ImportBatchRepository;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.runtime.ledger.AuditLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Deletes finished batches older than the retention window together with their ledger and
 * issues. Imported documents are left alone. Once a batch is purged it can no longer be
 * rolled back.
 */
@Service
public class BatchRetentionService {

    private static final Logger log = LoggerFactory.getLogger(BatchRetentionService.class);

    private final ImportBatchRepository importBatchRepository;
    private final AuditLogRepository auditLogRepository;
    private final DataQualityIssueRepository issueRepository;
    private final AuditLedger auditLedger;
    private final int retentionDays;

    public BatchRetentionService(ImportBatchRepository importBatchRepository,
                                 AuditLogRepository auditLogRepository,
                                 DataQualityIssueRepository issueRepository,
                                 AuditLedger auditLedger,
                                 @Value("${sheetbridge.retention.days:90}") int retentionDays) {
        this.importBatchRepository = importBatchRepository;
        this.auditLogRepository = auditLogRepository;
        this.issueRepository = issueRepository;
        this.auditLedger = auditLedger;
        this.retentionDays = retentionDays;
    }

    @Scheduled(cron = "${sheetbridge.retention.cron:0 30 3 * * *}")
    public void scheduledPurge() {
        int purged = purgeExpired(Instant.now());
        if (purged > 0) {
            log.info("Retention removed {} import batches older than {} days", purged, retentionDays);
        }
    }

    /** @return number of batches removed */
    public int purgeExpired(Instant now) {
        if (retentionDays <= 0) return 0;
        Instant cutoff = now.minus(Duration.ofDays(retentionDays));
        List<ImportBatchDocument> expired = importBatchRepository.findByStatusInAndStartedAtBefore(
                EnumSet.of(BatchStatus.COMPLETED, BatchStatus.FAILED, BatchStatus.ROLLED_BACK), cutoff);
        for (ImportBatchDocument batch : expired) {
            auditLogRepository.deleteByBatchId(batch.getBatchId());
            issueRepository.deleteByBatchId(batch.getBatchId());
            importBatchRepository.delete(batch);
            auditLedger.release(batch.getBatchId());
            log.debug("Purged import batch {} ({})", batch.getBatchId(), batch.getStatus());
        }
        return expired.size();
    }
}
