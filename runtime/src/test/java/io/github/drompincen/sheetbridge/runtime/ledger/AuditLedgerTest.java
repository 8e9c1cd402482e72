package io.github.drompincen.sheetbridge.runtime.ledger;

import io.github.drompincen.sheetbridge.persistence.document.AuditLogDocument;
import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.persistence.repository.AuditLogRepository;
import io.github.drompincen.sheetbridge.persistence.repository.ImportBatchRepository;
import io.github.drompincen.sheetbridge.protocol.api.AuditEntryDto;
import io.github.drompincen.sheetbridge.protocol.api.AuditOperation;
import io.github.drompincen.sheetbridge.protocol.api.BatchCounts;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.protocol.api.RollbackEligibility;
import io.github.drompincen.sheetbridge.protocol.error.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuditLedgerTest {

    @Mock
    private AuditLogRepository auditLogRepository;

    @Mock
    private ImportBatchRepository importBatchRepository;

    private AuditLedger ledger;
    private final List<AuditLogDocument> saved = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ledger = new AuditLedger(auditLogRepository, importBatchRepository);
        when(auditLogRepository.save(any(AuditLogDocument.class))).thenAnswer(inv -> {
            AuditLogDocument doc = inv.getArgument(0);
            saved.removeIf(d -> d == doc);
            saved.add(doc);
            return doc;
        });
        when(auditLogRepository.findTopByBatchIdOrderBySeqDesc("b1")).thenReturn(Optional.empty());
        when(auditLogRepository.findByBatchIdOrderBySeqAsc("b1")).thenAnswer(inv -> List.copyOf(saved));
    }

    private ImportBatchDocument batch(BatchStatus status, BatchCounts counts) {
        ImportBatchDocument batch = new ImportBatchDocument();
        batch.setBatchId("b1");
        batch.setStatus(status);
        batch.applyCounts(counts);
        when(importBatchRepository.findById("b1")).thenReturn(Optional.of(batch));
        return batch;
    }

    @Test
    void appendAssignsContiguousSequenceNumbers() {
        ledger.append("b1", AuditOperation.INSERT, "c", "d1", null, Map.of("_id", "d1"), 2);
        ledger.append("b1", AuditOperation.SKIP, "c", "d2", null, null, 3);

        assertThat(saved).extracting(AuditLogDocument::getSeq).containsExactly(1L, 2L);
        assertThat(saved.get(1).getPriorState()).isEmpty();
        assertThat(saved.get(1).getNewState()).isEmpty();
        verify(auditLogRepository, times(1)).findTopByBatchIdOrderBySeqDesc("b1");
    }

    @Test
    void counterIsReseededFromStoredEntriesAfterRelease() {
        AuditLogDocument last = new AuditLogDocument();
        last.setSeq(7);
        when(auditLogRepository.findTopByBatchIdOrderBySeqDesc("b2")).thenReturn(Optional.of(last));

        ledger.release("b2");
        AuditLogDocument next = ledger.append("b2", AuditOperation.ROLLBACK_DELETE, "c", "d1", Map.of(), Map.of(), 2);

        assertThat(next.getSeq()).isEqualTo(8);
    }

    @Test
    void completedBatchWithMatchingLedgerIsEligible() {
        batch(BatchStatus.COMPLETED, new BatchCounts(3, 1, 0, 1, 1));
        ledger.append("b1", AuditOperation.INSERT, "c", "d1", null, Map.of("_id", "d1"), 2);
        ledger.append("b1", AuditOperation.SKIP, "c", "d2", null, null, 3);

        assertThat(ledger.eligibility("b1").eligible()).isTrue();
        assertThat(ledger.canRollback("b1")).isTrue();
    }

    @Test
    void nonCompletedBatchIsNotEligible() {
        batch(BatchStatus.FAILED, BatchCounts.empty());

        RollbackEligibility result = ledger.eligibility("b1");

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo("batch is FAILED");
    }

    @Test
    void unknownBatchIsNotEligible() {
        when(importBatchRepository.findById("zz")).thenReturn(Optional.empty());

        assertThat(ledger.eligibility("zz").reason()).isEqualTo("batch not found");
    }

    @Test
    void gapInSequenceBlocksRollback() {
        batch(BatchStatus.COMPLETED, new BatchCounts(2, 2, 0, 0, 0));
        ledger.append("b1", AuditOperation.INSERT, "c", "d1", null, Map.of("_id", "d1"), 2);
        ledger.append("b1", AuditOperation.INSERT, "c", "d2", null, Map.of("_id", "d2"), 3);
        saved.remove(0);

        assertThat(ledger.eligibility("b1").reason()).isEqualTo("ledger gap at sequence 1");
    }

    @Test
    void countMismatchBlocksRollback() {
        batch(BatchStatus.COMPLETED, new BatchCounts(2, 2, 0, 0, 0));
        ledger.append("b1", AuditOperation.INSERT, "c", "d1", null, Map.of("_id", "d1"), 2);

        assertThat(ledger.eligibility("b1").reason()).contains("ledger has 1 entries");
    }

    @Test
    void updateWithoutPriorStateIsMalformed() {
        batch(BatchStatus.COMPLETED, new BatchCounts(1, 0, 1, 0, 0));
        ledger.append("b1", AuditOperation.UPDATE, "c", "d1", null, Map.of("_id", "d1"), 2);

        assertThat(ledger.eligibility("b1").reason()).isEqualTo("malformed ledger entry 1");
    }

    @Test
    void historyMapsEntriesToDtos() {
        ledger.append("b1", AuditOperation.INSERT, "customers", "d1", null, Map.of("_id", "d1"), 2);

        List<AuditEntryDto> history = ledger.history("b1");

        assertThat(history).singleElement().satisfies(dto -> {
            assertThat(dto.seq()).isEqualTo(1L);
            assertThat(dto.operation()).isEqualTo(AuditOperation.INSERT);
            assertThat(dto.targetId()).isEqualTo("d1");
            assertThat(dto.rowNumber()).isEqualTo(2);
        });
    }

    @Test
    void pendingEntryBlocksRollbackUntilConfirmed() {
        batch(BatchStatus.COMPLETED, new BatchCounts(1, 1, 0, 0, 0));
        AuditLogDocument entry = ledger.prepare("b1", AuditOperation.INSERT, "c", "d1", null, Map.of("_id", "d1"), 2);

        assertThat(entry.isPending()).isTrue();
        assertThat(ledger.eligibility("b1").reason()).isEqualTo("ledger entry 1 was never confirmed");

        ledger.confirm(entry);

        assertThat(entry.isPending()).isFalse();
        assertThat(ledger.eligibility("b1").eligible()).isTrue();
        assertThat(ledger.history("b1")).singleElement().satisfies(dto -> assertThat(dto.pending()).isFalse());
    }

    @Test
    void discardedEntryGivesItsSequenceBack() {
        AuditLogDocument refused = ledger.prepare("b1", AuditOperation.INSERT, "c", "d1", null, Map.of("_id", "d1"), 2);

        ledger.discard(refused);
        AuditLogDocument next = ledger.append("b1", AuditOperation.SKIP, "c", "d0", null, null, 2);

        verify(auditLogRepository).delete(refused);
        assertThat(next.getSeq()).isEqualTo(1L);
    }

    @Test
    void metadataOutageSurfacesAsStoreUnavailable() {
        doThrow(new DataAccessResourceFailureException("Timed out after 30000 ms while waiting for a server"))
                .when(auditLogRepository).save(any(AuditLogDocument.class));

        assertThatThrownBy(() -> ledger.prepare("b1", AuditOperation.UPDATE, "c", "d1", Map.of("_id", "d1"), Map.of("_id", "d1"), 4))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessage("Audit ledger unavailable while recording row 4")
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);

        doAnswer(inv -> inv.getArgument(0)).when(auditLogRepository).save(any(AuditLogDocument.class));
        assertThat(ledger.append("b1", AuditOperation.SKIP, "c", "d1", null, null, 4).getSeq()).isEqualTo(1L);
    }
}
