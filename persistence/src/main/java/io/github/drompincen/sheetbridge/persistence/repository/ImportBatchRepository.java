package io.github.drompincen.sheetbridge.persistence.repository;

import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ImportBatchRepository extends MongoRepository<ImportBatchDocument, String> {
    List<ImportBatchDocument> findAllByOrderByStartedAtDesc();
    List<ImportBatchDocument> findBySchemaIdOrderByStartedAtDesc(String schemaId);
    List<ImportBatchDocument> findByStatus(BatchStatus status);
    List<ImportBatchDocument> findByStatusInAndStartedAtBefore(Collection<BatchStatus> statuses, Instant cutoff);
}
