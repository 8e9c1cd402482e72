package io.github.drompincen.sheetbridge.runtime.ledger;

import io.github.drompincen.sheetbridge.persistence.document.AuditLogDocument;
import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.persistence.repository.AuditLogRepository;
import io.github.drompincen.sheetbridge.persistence.repository.ImportBatchRepository;
import io.github.drompincen.sheetbridge.protocol.api.AuditEntryDto;
import io.github.drompincen.sheetbridge.protocol.api.AuditOperation;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.protocol.api.RollbackEligibility;
import io.github.drompincen.sheetbridge.protocol.error.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only per-batch log of row mutations. Sequence numbers start at 1 and are contiguous
 * per batch; the counter for a batch is seeded from the highest stored entry.
 * <p>
 * Inserts and updates are logged ahead of the store change: {@link #prepare} saves a pending
 * entry carrying the prior state, {@link #confirm} marks it committed once the change is in,
 * and {@link #discard} removes it when the store refused the change. A store write therefore
 * never exists without its inverse in the ledger.
 */
@Service
public class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    private final AuditLogRepository auditLogRepository;
    private final ImportBatchRepository importBatchRepository;
    private final ConcurrentHashMap<String, AtomicLong> seqCounters = new ConcurrentHashMap<>();

    public AuditLedger(AuditLogRepository auditLogRepository, ImportBatchRepository importBatchRepository) {
        this.auditLogRepository = auditLogRepository;
        this.importBatchRepository = importBatchRepository;
    }

    /** Records a change that needs no write-ahead: skips and rollback compensations. */
    public AuditLogDocument append(String batchId, AuditOperation operation, String collectionName, String targetId,
                                   Map<String, Object> priorState, Map<String, Object> newState, int rowNumber) {
        return write(batchId, operation, collectionName, targetId, priorState, newState, rowNumber, false);
    }

    /** Saves a pending entry before the store change it describes. */
    public AuditLogDocument prepare(String batchId, AuditOperation operation, String collectionName, String targetId,
                                    Map<String, Object> priorState, Map<String, Object> newState, int rowNumber) {
        return write(batchId, operation, collectionName, targetId, priorState, newState, rowNumber, true);
    }

    /** Marks a pending entry committed after its store change succeeded. */
    public AuditLogDocument confirm(AuditLogDocument entry) {
        entry.setPending(false);
        return save(entry, "confirming row " + entry.getRowNumber());
    }

    /**
     * Removes a pending entry whose store change was refused. Only the latest entry of a batch
     * is discarded, so the sequence stays contiguous.
     */
    public void discard(AuditLogDocument entry) {
        try {
            auditLogRepository.delete(entry);
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Audit ledger unavailable while discarding row " + entry.getRowNumber(), e);
        }
        AtomicLong counter = seqCounters.get(entry.getBatchId());
        if (counter != null) counter.compareAndSet(entry.getSeq(), entry.getSeq() - 1);
        log.debug("Discarded pending ledger entry {} of batch {}", entry.getSeq(), entry.getBatchId());
    }

    private AuditLogDocument write(String batchId, AuditOperation operation, String collectionName, String targetId,
                                   Map<String, Object> priorState, Map<String, Object> newState, int rowNumber,
                                   boolean pending) {
        AtomicLong counter;
        try {
            counter = seqCounters.computeIfAbsent(batchId, k -> {
                long last = auditLogRepository.findTopByBatchIdOrderBySeqDesc(batchId)
                        .map(AuditLogDocument::getSeq).orElse(0L);
                return new AtomicLong(last);
            });
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Audit ledger unavailable while recording row " + rowNumber, e);
        }
        long seq = counter.incrementAndGet();

        AuditLogDocument entry = new AuditLogDocument();
        entry.setEntryId(UUID.randomUUID().toString());
        entry.setBatchId(batchId);
        entry.setSeq(seq);
        entry.setOperation(operation);
        entry.setCollectionName(collectionName);
        entry.setTargetId(targetId);
        entry.setPriorState(priorState == null ? Map.of() : priorState);
        entry.setNewState(newState == null ? Map.of() : newState);
        entry.setRowNumber(rowNumber);
        entry.setTimestamp(Instant.now());
        entry.setPending(pending);
        try {
            return save(entry, "recording row " + rowNumber);
        } catch (StoreUnavailableException e) {
            counter.compareAndSet(seq, seq - 1);
            throw e;
        }
    }

    private AuditLogDocument save(AuditLogDocument entry, String action) {
        try {
            return auditLogRepository.save(entry);
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Audit ledger unavailable while " + action, e);
        }
    }

    /** Drops the in-memory counter once a batch stops writing; a later append reseeds it. */
    public void release(String batchId) {
        seqCounters.remove(batchId);
    }

    public List<AuditLogDocument> entries(String batchId) {
        return auditLogRepository.findByBatchIdOrderBySeqAsc(batchId);
    }

    public List<AuditEntryDto> history(String batchId) {
        return entries(batchId).stream().map(AuditLedger::toDto).toList();
    }

    public boolean canRollback(String batchId) {
        return eligibility(batchId).eligible();
    }

    /** Eligibility with the reason a batch cannot be rolled back, if any. */
    public RollbackEligibility eligibility(String batchId) {
        ImportBatchDocument batch = importBatchRepository.findById(batchId).orElse(null);
        if (batch == null) return new RollbackEligibility(batchId, false, "batch not found");
        if (batch.getStatus() != BatchStatus.COMPLETED) {
            return new RollbackEligibility(batchId, false, "batch is " + batch.getStatus());
        }
        List<AuditLogDocument> entries = entries(batchId);
        long forward = 0;
        for (int i = 0; i < entries.size(); i++) {
            AuditLogDocument entry = entries.get(i);
            if (entry.getSeq() != i + 1) {
                return new RollbackEligibility(batchId, false, "ledger gap at sequence " + (i + 1));
            }
            if (entry.isPending()) {
                return new RollbackEligibility(batchId, false, "ledger entry " + entry.getSeq() + " was never confirmed");
            }
            if (!isWellFormed(entry)) {
                return new RollbackEligibility(batchId, false, "malformed ledger entry " + entry.getSeq());
            }
            if (!entry.getOperation().isRollback()) forward++;
        }
        int expected = batch.counts().ledgered();
        if (forward != expected) {
            return new RollbackEligibility(batchId, false,
                    "ledger has " + forward + " entries but batch recorded " + expected + " committed rows");
        }
        return new RollbackEligibility(batchId, true, null);
    }

    static boolean isWellFormed(AuditLogDocument entry) {
        if (entry.getOperation() == null || entry.getTargetId() == null || entry.getTargetId().isBlank()) return false;
        return switch (entry.getOperation()) {
            case INSERT -> entry.getNewState() != null && !entry.getNewState().isEmpty();
            case UPDATE -> entry.getPriorState() != null && !entry.getPriorState().isEmpty();
            case SKIP, ROLLBACK_DELETE, ROLLBACK_RESTORE -> true;
        };
    }

    static AuditEntryDto toDto(AuditLogDocument doc) {
        return new AuditEntryDto(doc.getSeq(), doc.getOperation(), doc.getCollectionName(), doc.getTargetId(),
                doc.getPriorState(), doc.getNewState(), doc.getRowNumber(), doc.getTimestamp(), doc.isPending());
    }
}
