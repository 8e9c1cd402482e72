package io.github.drompincen.sheetbridge.persistence.repository;

import io.github.drompincen.sheetbridge.persistence.document.SchemaDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface SchemaRepository extends MongoRepository<SchemaDocument, String> {
    Optional<SchemaDocument> findByName(String name);
    boolean existsByName(String name);
    List<SchemaDocument> findAllByOrderByLastUsedDescCreatedAtDesc();
}
