package io.github.drompincen.sheetbridge.persistence.repository;

import io.github.drompincen.sheetbridge.persistence.document.DataQualityIssueDocument;
import io.github.drompincen.sheetbridge.protocol.api.IssueSeverity;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DataQualityIssueRepository extends MongoRepository<DataQualityIssueDocument, String> {
    List<DataQualityIssueDocument> findByBatchIdOrderByRowNumberAsc(String batchId);
    List<DataQualityIssueDocument> findByBatchIdAndSeverity(String batchId, IssueSeverity severity);
    long countByBatchId(String batchId);
    void deleteByBatchId(String batchId);
}
