package io.github.drompincen.sheetbridge.runtime.schema;

import io.github.drompincen.sheetbridge.persistence.document.SchemaDocument;
import io.github.drompincen.sheetbridge.persistence.repository.SchemaRepository;
import io.github.drompincen.sheetbridge.persistence.store.DocumentStore;
import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.CreateSchemaRequest;
import io.github.drompincen.sheetbridge.protocol.api.DuplicateStrategy;
import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;
import io.github.drompincen.sheetbridge.protocol.api.SchemaDto;
import io.github.drompincen.sheetbridge.protocol.api.SchemaProposal;
import io.github.drompincen.sheetbridge.protocol.error.AIProcessingException;
import io.github.drompincen.sheetbridge.runtime.ai.SchemaProposalService;
import io.github.drompincen.sheetbridge.runtime.mapping.ColumnMapper;
import io.github.drompincen.sheetbridge.runtime.mapping.ColumnMappingPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Stores schema templates and picks the template that fits a file. Deleting a template never
 * touches imported documents or batch history.
 */
@Service
public class SchemaCatalogService {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalogService.class);

    public static final int DEFAULT_DATA_START_ROW = 2;

    private final SchemaRepository schemaRepository;
    private final MongoTemplate mongoTemplate;
    private final DocumentStore documentStore;
    private final SchemaValidator validator;
    private final SchemaProposalService proposalService;
    private final ColumnMapper columnMapper;

    public SchemaCatalogService(SchemaRepository schemaRepository, MongoTemplate mongoTemplate,
                                DocumentStore documentStore, SchemaValidator validator,
                                SchemaProposalService proposalService, ColumnMapper columnMapper) {
        this.schemaRepository = schemaRepository;
        this.mongoTemplate = mongoTemplate;
        this.documentStore = documentStore;
        this.validator = validator;
        this.proposalService = proposalService;
        this.columnMapper = columnMapper;
    }

    public SchemaDto create(CreateSchemaRequest draft) {
        CreateSchemaRequest schema = withDefaults(draft);
        validator.check(schema);
        if (schemaRepository.existsByName(schema.name())) {
            throw new SchemaValidationException(List.of("a schema named '" + schema.name() + "' already exists"));
        }
        SchemaDocument doc = new SchemaDocument();
        doc.setSchemaId(UUID.randomUUID().toString());
        apply(doc, schema);
        doc.setUsageCount(0);
        doc.setCreatedAt(Instant.now());
        doc.setUpdatedAt(doc.getCreatedAt());
        doc = schemaRepository.save(doc);
        log.info("Created schema {} '{}' for collection {}", doc.getSchemaId(), doc.getName(), doc.getCollectionName());
        ensureIndexes(doc);
        return toDto(doc);
    }

    /** Asks the advisor for a mapping and returns it as an unsaved draft. */
    public CreateSchemaRequest propose(String name, List<String> columnLabels) {
        SchemaProposal proposal = proposalService.propose(columnLabels);
        Map<String, AttributeDefinition> attributes = new LinkedHashMap<>();
        for (String label : columnLabels) {
            AttributeDefinition attr = proposal.attributes().get(label);
            if (attr == null) {
                throw new AIProcessingException("Proposal has no attribute for column '" + label + "'");
            }
            attributes.put(label, attr);
        }
        String collection = proposal.collectionName() == null || proposal.collectionName().isBlank()
                ? SchemaNames.toCollectionName(name) : SchemaNames.toCollectionName(proposal.collectionName());
        return new CreateSchemaRequest(name, List.copyOf(columnLabels), attributes,
                proposal.indexes() == null ? List.of() : proposal.indexes(),
                proposal.duplicateKeyFields() == null ? List.of() : proposal.duplicateKeyFields(),
                DuplicateStrategy.SKIP, DEFAULT_DATA_START_ROW, collection);
    }

    public SchemaDto createFromLabels(String name, List<String> columnLabels) {
        return create(propose(name, columnLabels));
    }

    public Optional<SchemaDto> update(String schemaId, CreateSchemaRequest edit) {
        Optional<SchemaDocument> existing = schemaRepository.findById(schemaId);
        if (existing.isEmpty()) return Optional.empty();
        SchemaDocument doc = existing.get();
        CreateSchemaRequest schema = withDefaults(edit);
        validator.check(schema);
        Optional<SchemaDocument> sameName = schemaRepository.findByName(schema.name());
        if (sameName.isPresent() && !sameName.get().getSchemaId().equals(schemaId)) {
            throw new SchemaValidationException(List.of("a schema named '" + schema.name() + "' already exists"));
        }
        String oldCollection = doc.getCollectionName();
        List<IndexDefinition> oldIndexes = doc.getIndexes() == null ? List.of() : List.copyOf(doc.getIndexes());
        List<String> oldKey = doc.getDuplicateKeyFields() == null ? List.of() : List.copyOf(doc.getDuplicateKeyFields());
        boolean storageChanged = !Objects.equals(oldCollection, schema.collectionName())
                || !Objects.equals(doc.getIndexes(), schema.indexes())
                || !Objects.equals(doc.getDuplicateKeyFields(), schema.duplicateKeyFields());
        apply(doc, schema);
        if (storageChanged) doc.setIndexesMaterialized(false);
        doc.setUpdatedAt(Instant.now());
        doc = schemaRepository.save(doc);
        log.info("Updated schema {} '{}'", schemaId, doc.getName());
        if (storageChanged && Objects.equals(oldCollection, doc.getCollectionName())) {
            dropStaleIndexes(doc, oldIndexes, oldKey);
        }
        ensureIndexes(doc);
        return Optional.of(toDto(doc));
    }

    public boolean delete(String schemaId) {
        if (!schemaRepository.existsById(schemaId)) return false;
        schemaRepository.deleteById(schemaId);
        log.info("Deleted schema {}", schemaId);
        return true;
    }

    /** Increments the usage counter and stamps last use in one atomic update. */
    public void recordUsage(String schemaId) {
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(schemaId)),
                new Update().inc("usageCount", 1).set("lastUsed", Instant.now()), SchemaDocument.class);
    }

    /** Drops indexes the previous version of a schema created that the edited version no longer declares. */
    private void dropStaleIndexes(SchemaDocument schema, List<IndexDefinition> oldIndexes, List<String> oldKey) {
        String collection = schema.getCollectionName();
        List<IndexDefinition> current = schema.getIndexes() == null ? List.of() : schema.getIndexes();
        for (IndexDefinition old : oldIndexes) {
            boolean kept = current.stream().anyMatch(i -> i.field().equals(old.field()) && i.kind() == old.kind());
            if (!kept) documentStore.dropIndex(collection, old);
        }
        if (!oldKey.isEmpty() && !oldKey.equals(schema.getDuplicateKeyFields())) {
            documentStore.dropUniqueKey(collection, oldKey);
            log.info("Replaced duplicate key {} of schema {} with {}", oldKey, schema.getSchemaId(),
                    schema.getDuplicateKeyFields());
        }
    }

    /** Creates the schema's indexes and duplicate-key index in its collection, once. */
    public void ensureIndexes(SchemaDocument schema) {
        if (schema.isIndexesMaterialized()) return;
        String collection = schema.getCollectionName();
        if (schema.getIndexes() != null) {
            for (IndexDefinition index : schema.getIndexes()) {
                documentStore.ensureIndex(collection, index);
            }
        }
        documentStore.ensureUniqueKey(collection, schema.getDuplicateKeyFields());
        schema.setIndexesMaterialized(true);
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(schema.getSchemaId())),
                new Update().set("indexesMaterialized", true), SchemaDocument.class);
    }

    /**
     * Picks the template for a file's header: a template with exactly the same labels wins;
     * otherwise the one whose mapping covers every required field and the largest share of its
     * attributes. Ties go to the most recently used template.
     */
    public Optional<SchemaDto> resolveForLabels(List<String> fileLabels) {
        List<SchemaDocument> candidates = schemaRepository.findAllByOrderByLastUsedDescCreatedAtDesc();
        Set<String> wanted = trimmed(fileLabels);
        for (SchemaDocument schema : candidates) {
            if (trimmed(schema.getColumnLabels()).equals(wanted)) {
                log.debug("Schema {} matches labels exactly", schema.getSchemaId());
                return Optional.of(toDto(schema));
            }
        }
        SchemaDocument best = null;
        double bestShare = 0;
        for (SchemaDocument schema : candidates) {
            Map<String, AttributeDefinition> attributes = schema.attributeMap();
            if (attributes.isEmpty()) continue;
            ColumnMappingPlan plan = columnMapper.match(fileLabels, attributes);
            boolean requiredCovered = plan.unmapped().stream().noneMatch(m -> m.attribute().required());
            double share = (double) plan.mappedCount() / attributes.size();
            if (requiredCovered && share > bestShare) {
                best = schema;
                bestShare = share;
            }
        }
        return Optional.ofNullable(best).map(SchemaCatalogService::toDto);
    }

    public List<SchemaDto> listByRecency() {
        return schemaRepository.findAllByOrderByLastUsedDescCreatedAtDesc().stream()
                .map(SchemaCatalogService::toDto).toList();
    }

    public Optional<SchemaDto> findById(String schemaId) {
        return schemaRepository.findById(schemaId).map(SchemaCatalogService::toDto);
    }

    public Optional<SchemaDto> findByName(String name) {
        return schemaRepository.findByName(name).map(SchemaCatalogService::toDto);
    }

    public Optional<SchemaDocument> findDocument(String schemaId) {
        return schemaRepository.findById(schemaId);
    }

    private static CreateSchemaRequest withDefaults(CreateSchemaRequest r) {
        String name = r.name() == null ? null : r.name().trim();
        String collection = r.collectionName() == null || r.collectionName().isBlank()
                ? (name == null ? null : SchemaNames.toCollectionName(name)) : r.collectionName().trim();
        return new CreateSchemaRequest(name, r.columnLabels(), r.attributes(),
                r.indexes() == null ? List.of() : r.indexes(),
                r.duplicateKeyFields() == null ? List.of() : r.duplicateKeyFields(),
                r.duplicateStrategy() == null ? DuplicateStrategy.SKIP : r.duplicateStrategy(),
                r.dataStartRow() == null ? DEFAULT_DATA_START_ROW : r.dataStartRow(),
                collection);
    }

    private static void apply(SchemaDocument doc, CreateSchemaRequest schema) {
        doc.setName(schema.name());
        doc.setColumnLabels(new ArrayList<>(schema.columnLabels()));
        Map<String, AttributeDefinition> ordered = new LinkedHashMap<>();
        schema.columnLabels().forEach(label -> ordered.put(label, schema.attributes().get(label)));
        doc.putAttributes(ordered);
        doc.setIndexes(new ArrayList<>(schema.indexes()));
        doc.setDuplicateKeyFields(new ArrayList<>(schema.duplicateKeyFields()));
        doc.setDuplicateStrategy(schema.duplicateStrategy());
        doc.setDataStartRow(schema.dataStartRow());
        doc.setCollectionName(schema.collectionName());
    }

    private static Set<String> trimmed(List<String> labels) {
        Set<String> set = new HashSet<>();
        if (labels != null) labels.forEach(l -> { if (l != null) set.add(l.trim()); });
        return set;
    }

    public static SchemaDto toDto(SchemaDocument doc) {
        return new SchemaDto(doc.getSchemaId(), doc.getName(), doc.getColumnLabels(), doc.attributeMap(),
                doc.getIndexes(), doc.getDuplicateKeyFields(), doc.getDuplicateStrategy(), doc.getDataStartRow(),
                doc.getCollectionName(), doc.getUsageCount(), doc.getLastUsed(), doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
