package io.github.drompincen.sheetbridge.persistence.repository;

import io.github.drompincen.sheetbridge.persistence.document.AuditLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface AuditLogRepository extends MongoRepository<AuditLogDocument, String> {
    List<AuditLogDocument> findByBatchIdOrderBySeqAsc(String batchId);
    Optional<AuditLogDocument> findTopByBatchIdOrderBySeqDesc(String batchId);
    long countByBatchId(String batchId);
    void deleteByBatchId(String batchId);
}
