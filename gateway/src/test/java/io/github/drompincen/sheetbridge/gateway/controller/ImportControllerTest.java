package io.github.drompincen.sheetbridge.gateway.controller;

import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.protocol.api.DuplicateStrategy;
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
import io.github.drompincen.sheetbridge.runtime.rows.RowSourceException;
import io.github.drompincen.sheetbridge.sources.RowSourceFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ImportControllerTest {

    @Mock private BatchWorkerPool workerPool;
    @Mock private ImportHistoryService history;
    @Mock private ImportPreviewService previewService;
    @Mock private AuditLedger auditLedger;
    @Mock private RollbackService rollbackService;
    @Mock private RowSourceFactory rowSourceFactory;
    @Mock private RowSource rowSource;

    private ImportController controller;
    private ImportBatchDocument batch;

    @BeforeEach
    void setUp() {
        controller = new ImportController(workerPool, history, previewService, auditLedger,
                rollbackService, rowSourceFactory);
        batch = new ImportBatchDocument();
        batch.setBatchId("b1");
        batch.setSchemaId("s1");
        batch.setSourceName("customers.csv");
        batch.setDuplicateStrategy(DuplicateStrategy.UPSERT);
        batch.setStatus(BatchStatus.CREATED);
        batch.setStartedAt(Instant.now());
        when(rowSourceFactory.forPath("/data/customers.csv", null)).thenReturn(rowSource);
        when(history.find("b1")).thenAnswer(inv -> Optional.of(ImportHistoryService.toDto(batch)));
        when(history.find("missing")).thenReturn(Optional.empty());
    }

    @Test
    void startQueuesTheBatchAndAnswers202() {
        ImportRequest request = new ImportRequest("s1", "/data/customers.csv", DuplicateStrategy.UPSERT, null);
        when(workerPool.submit(eq(request), eq(rowSource), any())).thenReturn(batch);

        ResponseEntity<ImportBatchDto> response = controller.start(request);

        assertThat(response.getStatusCode().value()).isEqualTo(202);
        assertThat(response.getBody().batchId()).isEqualTo("b1");
        assertThat(response.getBody().status()).isEqualTo(BatchStatus.CREATED);
        assertThat(response.getBody().duplicateStrategy()).isEqualTo(DuplicateStrategy.UPSERT);
    }

    @Test
    void startRejectsMissingSchemaOrUnreadableFile() {
        when(rowSourceFactory.forPath("/nope.csv", null)).thenThrow(new RowSourceException("File not found: /nope.csv", null));

        assertThatThrownBy(() -> controller.start(new ImportRequest(null, "/data/customers.csv", null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> controller.start(new ImportRequest("s1", "/nope.csv", null, null)))
                .isInstanceOf(RowSourceException.class);
        verify(workerPool, never()).submit(any(), any(), any());
    }

    @Test
    void sheetNameReachesTheReader() {
        RowSource sheet = mock(RowSource.class);
        when(rowSourceFactory.forPath("/data/regions.xlsx", "EMEA")).thenReturn(sheet);
        ImportRequest request = new ImportRequest("s1", "/data/regions.xlsx", null, null, "EMEA");
        when(workerPool.submit(eq(request), eq(sheet), any())).thenReturn(batch);
        PreviewResponse preview = new PreviewResponse("s1", List.of(), List.of(), List.of(), List.of());
        when(previewService.preview("s1", sheet, null, null)).thenReturn(preview);

        assertThat(controller.start(request).getStatusCode().value()).isEqualTo(202);
        assertThat(controller.preview(new PreviewRequest("s1", "/data/regions.xlsx", null, null, "EMEA"))).isSameAs(preview);
        verify(rowSourceFactory, times(2)).forPath("/data/regions.xlsx", "EMEA");
    }

    @Test
    void previewPassesOverrides() {
        PreviewResponse preview = new PreviewResponse("s1", List.of(), List.of(), List.of(), List.of());
        when(previewService.preview("s1", rowSource, 3, 5)).thenReturn(preview);

        assertThat(controller.preview(new PreviewRequest("s1", "/data/customers.csv", 3, 5))).isSameAs(preview);
    }

    @Test
    void unknownBatchAnswers404Everywhere() {
        assertThat(controller.get("missing").getStatusCode().value()).isEqualTo(404);
        assertThat(controller.issues("missing").getStatusCode().value()).isEqualTo(404);
        assertThat(controller.audit("missing").getStatusCode().value()).isEqualTo(404);
        assertThat(controller.rollbackEligibility("missing").getStatusCode().value()).isEqualTo(404);
        assertThat(controller.rollback("missing").getStatusCode().value()).isEqualTo(404);
        assertThat(controller.cancel("missing").getStatusCode().value()).isEqualTo(404);
        verifyNoInteractions(rollbackService);
    }

    @Test
    void rollbackAnswers207WhenSomeEntriesFailed() {
        when(rollbackService.rollback("b1"))
                .thenReturn(new RollbackReport("b1", 1, 1, 0, List.of("seq 2: store down"), BatchStatus.COMPLETED))
                .thenReturn(new RollbackReport("b1", 1, 0, 0, List.of(), BatchStatus.ROLLED_BACK));

        ResponseEntity<RollbackReport> partial = controller.rollback("b1");
        ResponseEntity<RollbackReport> done = controller.rollback("b1");

        assertThat(partial.getStatusCode().value()).isEqualTo(207);
        assertThat(done.getStatusCode().value()).isEqualTo(200);
        assertThat(done.getBody().status()).isEqualTo(BatchStatus.ROLLED_BACK);
    }

    @Test
    void eligibilityComesFromTheLedger() {
        when(auditLedger.eligibility("b1")).thenReturn(new RollbackEligibility("b1", false, "batch is CREATED"));

        RollbackEligibility body = controller.rollbackEligibility("b1").getBody();

        assertThat(body.eligible()).isFalse();
        assertThat(body.reason()).isEqualTo("batch is CREATED");
    }

    @Test
    void cancelOfAFinishedBatchIsAConflict() {
        when(workerPool.cancel("b1")).thenReturn(true, false);

        assertThat(controller.cancel("b1").getStatusCode().value()).isEqualTo(202);
        assertThatThrownBy(() -> controller.cancel("b1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not queued or running");
    }

    @Test
    void listFiltersBySchema() {
        when(history.list("s1")).thenReturn(List.of(ImportHistoryService.toDto(batch)));

        assertThat(controller.list("s1")).extracting(ImportBatchDto::batchId).containsExactly("b1");
    }
}
