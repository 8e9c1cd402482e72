package io.github.drompincen.sheetbridge.runtime.ledger;

import io.github.drompincen.sheetbridge.persistence.document.AuditLogDocument;
import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.persistence.document.RollbackAttempt;
import io.github.drompincen.sheetbridge.persistence.repository.ImportBatchRepository;
import io.github.drompincen.sheetbridge.persistence.store.DocumentStore;
import io.github.drompincen.sheetbridge.protocol.api.AuditOperation;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.protocol.api.RollbackEligibility;
import io.github.drompincen.sheetbridge.protocol.api.RollbackReport;
import io.github.drompincen.sheetbridge.protocol.error.IngestionException;
import io.github.drompincen.sheetbridge.protocol.error.RollbackException;
import io.github.drompincen.sheetbridge.runtime.batch.BatchLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Undoes a completed batch by replaying its forward ledger entries newest first.
 * Inserts are deleted, updates are restored to their prior state, skips need nothing.
 * Every compensation is idempotent, so a partially failed rollback can simply be run again.
 */
@Service
public class RollbackService {

    private static final Logger log = LoggerFactory.getLogger(RollbackService.class);

    private final ImportBatchRepository importBatchRepository;
    private final AuditLedger auditLedger;
    private final DocumentStore documentStore;

    public RollbackService(ImportBatchRepository importBatchRepository, AuditLedger auditLedger,
                           DocumentStore documentStore) {
        this.importBatchRepository = importBatchRepository;
        this.auditLedger = auditLedger;
        this.documentStore = documentStore;
    }

    /**
     * @throws IllegalStateException if the batch is not eligible, see {@link AuditLedger#eligibility}
     */
    public RollbackReport rollback(String batchId) {
        RollbackEligibility eligibility = auditLedger.eligibility(batchId);
        if (!eligibility.eligible()) {
            throw new IllegalStateException("Batch " + batchId + " cannot be rolled back: " + eligibility.reason());
        }
        ImportBatchDocument batch = importBatchRepository.findById(batchId)
                .orElseThrow(() -> new IllegalStateException("Batch not found: " + batchId));

        List<AuditLogDocument> forward = new ArrayList<>(auditLedger.entries(batchId).stream()
                .filter(e -> !e.getOperation().isRollback())
                .toList());
        Collections.reverse(forward);

        int restored = 0;
        int skipped = 0;
        List<String> failures = new ArrayList<>();
        for (AuditLogDocument entry : forward) {
            if (entry.getOperation() == AuditOperation.SKIP) {
                skipped++;
                continue;
            }
            try {
                compensate(batchId, entry);
                restored++;
            } catch (RuntimeException e) {
                String why = e instanceof IngestionException ? e.getMessage() : "unexpected store error";
                RollbackException failure = new RollbackException(
                        "could not undo " + entry.getOperation() + " of " + entry.getTargetId() + ": " + why,
                        entry.getSeq(), entry.getRowNumber(), e);
                log.warn("Rollback of batch {} entry {} failed: {}", batchId, entry.getSeq(), failure.getMessage(), e);
                failures.add(failure.describe());
            }
        }
        auditLedger.release(batchId);

        if (failures.isEmpty()) {
            BatchLifecycle.transition(batch, BatchStatus.ROLLED_BACK);
        }
        batch.getRollbackAttempts().add(new RollbackAttempt(Instant.now(), restored, failures.size(), failures));
        importBatchRepository.save(batch);

        log.info("Rollback of batch {} finished: restored={}, failed={}, skipped={}, status={}",
                batchId, restored, failures.size(), skipped, batch.getStatus());
        return new RollbackReport(batchId, restored, failures.size(), skipped, failures, batch.getStatus());
    }

    private void compensate(String batchId, AuditLogDocument entry) {
        String collection = entry.getCollectionName();
        String id = entry.getTargetId();
        if (entry.getOperation() == AuditOperation.INSERT) {
            Optional<Map<String, Object>> current = documentStore.findById(collection, id);
            boolean deleted = documentStore.delete(collection, id);
            log.debug("Rollback delete {} in {} (present={})", id, collection, deleted);
            auditLedger.append(batchId, AuditOperation.ROLLBACK_DELETE, collection, id,
                    current.orElse(entry.getNewState()), Map.of(), entry.getRowNumber());
        } else if (entry.getOperation() == AuditOperation.UPDATE) {
            Map<String, Object> prior = new HashMap<>(entry.getPriorState());
            Optional<Map<String, Object>> current = documentStore.findById(collection, id);
            if (!documentStore.replace(collection, id, prior)) {
                documentStore.insert(collection, prior);
            }
            auditLedger.append(batchId, AuditOperation.ROLLBACK_RESTORE, collection, id,
                    current.orElse(Map.of()), prior, entry.getRowNumber());
        }
    }
}
