package io.github.drompincen.sheetbridge.runtime.support;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.sheetbridge.persistence.document.AuditLogDocument;
import io.github.drompincen.sheetbridge.persistence.document.DataQualityIssueDocument;
import io.github.drompincen.sheetbridge.persistence.document.ImportBatchDocument;
import io.github.drompincen.sheetbridge.persistence.document.SchemaDocument;
import io.github.drompincen.sheetbridge.persistence.repository.AuditLogRepository;
import io.github.drompincen.sheetbridge.persistence.repository.DataQualityIssueRepository;
import io.github.drompincen.sheetbridge.persistence.repository.ImportBatchRepository;
import io.github.drompincen.sheetbridge.persistence.repository.SchemaRepository;
import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.BatchStatus;
import io.github.drompincen.sheetbridge.protocol.api.CreateSchemaRequest;
import io.github.drompincen.sheetbridge.protocol.api.DuplicateStrategy;
import io.github.drompincen.sheetbridge.protocol.api.FieldType;
import io.github.drompincen.sheetbridge.protocol.api.ImportRequest;
import io.github.drompincen.sheetbridge.runtime.ai.HeuristicSchemaAdvisor;
import io.github.drompincen.sheetbridge.runtime.ai.SchemaProposalService;
import io.github.drompincen.sheetbridge.runtime.batch.BatchOrchestrator;
import io.github.drompincen.sheetbridge.runtime.dedupe.DuplicateResolver;
import io.github.drompincen.sheetbridge.runtime.ledger.AuditLedger;
import io.github.drompincen.sheetbridge.runtime.ledger.RollbackService;
import io.github.drompincen.sheetbridge.runtime.mapping.ColumnMapper;
import io.github.drompincen.sheetbridge.runtime.mapping.RowNormalizer;
import io.github.drompincen.sheetbridge.runtime.mapping.TypeCoercer;
import io.github.drompincen.sheetbridge.runtime.rows.ListRowSource;
import io.github.drompincen.sheetbridge.runtime.schema.SchemaCatalogService;
import io.github.drompincen.sheetbridge.runtime.schema.SchemaValidator;
import org.bson.Document;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires the ingestion services against map-backed repository mocks and an
 * {@link InMemoryDocumentStore}, so whole batches run without a database.
 */
public class IngestionHarness {

    public static final List<String> CUSTOMER_LABELS = List.of("Email", "Amount");

    public final InMemoryDocumentStore store = new InMemoryDocumentStore();
    public final Map<String, ImportBatchDocument> batches = new LinkedHashMap<>();
    public final List<AuditLogDocument> auditEntries = new ArrayList<>();
    public final List<DataQualityIssueDocument> issues = new ArrayList<>();
    public final Map<String, SchemaDocument> schemas = new LinkedHashMap<>();

    public final ImportBatchRepository batchRepository = mock(ImportBatchRepository.class);
    public final AuditLogRepository auditLogRepository = mock(AuditLogRepository.class);
    public final DataQualityIssueRepository issueRepository = mock(DataQualityIssueRepository.class);
    public final SchemaRepository schemaRepository = mock(SchemaRepository.class);
    public final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
    private Predicate<AuditLogDocument> ledgerOutage;
    private RuntimeException ledgerFailure;

    public final ColumnMapper columnMapper = new ColumnMapper();
    public final RowNormalizer rowNormalizer = new RowNormalizer(new TypeCoercer());
    public final DuplicateResolver duplicateResolver = new DuplicateResolver(store);
    public final AuditLedger auditLedger = new AuditLedger(auditLogRepository, batchRepository);
    public final SchemaCatalogService catalog;
    public final BatchOrchestrator orchestrator;
    public final RollbackService rollbackService;

    public IngestionHarness() {
        this(500);
    }

    public IngestionHarness(int flushSize) {
        wireBatches();
        wireAudit();
        wireIssues();
        wireSchemas();
        catalog = new SchemaCatalogService(schemaRepository, mongoTemplate, store, new SchemaValidator(),
                new SchemaProposalService(new HeuristicSchemaAdvisor(), 1, 0), columnMapper);
        orchestrator = new BatchOrchestrator(batchRepository, issueRepository, catalog, columnMapper, rowNormalizer,
                duplicateResolver, auditLedger, store, flushSize, 1, 100);
        rollbackService = new RollbackService(batchRepository, auditLedger, store);
    }

    /** Schema "customers": Email (required, duplicate key) and Amount (optional number). */
    public String customersSchema(DuplicateStrategy strategy) {
        Map<String, AttributeDefinition> attributes = new LinkedHashMap<>();
        attributes.put("Email", new AttributeDefinition("email", FieldType.STRING, "contact email", true));
        attributes.put("Amount", new AttributeDefinition("amount", FieldType.NUMBER, "order amount", false));
        return catalog.create(new CreateSchemaRequest("Customers", CUSTOMER_LABELS, attributes, List.of(),
                List.of("email"), strategy, 2, "customers")).schemaId();
    }

    public ImportBatchDocument importRows(String schemaId, DuplicateStrategy override, List<List<String>> rows) {
        return importRows(schemaId, override, CUSTOMER_LABELS, rows);
    }

    public ImportBatchDocument importRows(String schemaId, DuplicateStrategy override, List<String> labels,
                                          List<List<String>> rows) {
        return orchestrator.runImport(new ImportRequest(schemaId, null, override, null),
                ListRowSource.ofText("customers.csv", labels, rows));
    }

    public Optional<Map<String, Object>> customer(String email) {
        return store.findOne("customers", Map.of("email", email));
    }

    public List<DataQualityIssueDocument> issuesOf(String batchId) {
        return issues.stream().filter(i -> i.getBatchId().equals(batchId)).toList();
    }

    private void wireBatches() {
        when(batchRepository.save(any(ImportBatchDocument.class))).thenAnswer(inv -> {
            ImportBatchDocument doc = inv.getArgument(0);
            batches.put(doc.getBatchId(), doc);
            return doc;
        });
        when(batchRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(batches.get(inv.<String>getArgument(0))));
        when(batchRepository.findAllByOrderByStartedAtDesc()).thenAnswer(inv -> batches.values().stream()
                .sorted(Comparator.comparing(ImportBatchDocument::getStartedAt).reversed()).toList());
        when(batchRepository.findBySchemaIdOrderByStartedAtDesc(anyString())).thenAnswer(inv -> batches.values().stream()
                .filter(b -> b.getSchemaId().equals(inv.getArgument(0)))
                .sorted(Comparator.comparing(ImportBatchDocument::getStartedAt).reversed()).toList());
        when(batchRepository.findByStatusInAndStartedAtBefore(any(), any())).thenAnswer(inv -> {
            Collection<BatchStatus> statuses = inv.getArgument(0);
            Instant cutoff = inv.getArgument(1);
            return batches.values().stream()
                    .filter(b -> statuses.contains(b.getStatus()) && b.getStartedAt().isBefore(cutoff))
                    .toList();
        });
        doAnswer(inv -> batches.remove(inv.<ImportBatchDocument>getArgument(0).getBatchId()))
                .when(batchRepository).delete(any(ImportBatchDocument.class));
    }

    /** Makes ledger saves matching {@code condition} fail as if the metadata store timed out. */
    public void failLedgerSavesWhen(Predicate<AuditLogDocument> condition) {
        failLedgerSavesWhen(condition, new DataAccessResourceFailureException("Timed out after 30000 ms while waiting for a server"));
    }

    public void failLedgerSavesWhen(Predicate<AuditLogDocument> condition, RuntimeException failure) {
        this.ledgerOutage = condition;
        this.ledgerFailure = failure;
    }

    private void wireAudit() {
        when(auditLogRepository.save(any(AuditLogDocument.class))).thenAnswer(inv -> {
            AuditLogDocument doc = inv.getArgument(0);
            if (ledgerOutage != null && ledgerOutage.test(doc)) {
                throw ledgerFailure;
            }
            auditEntries.removeIf(e -> e.getEntryId().equals(doc.getEntryId()));
            auditEntries.add(copyOf(doc));
            return doc;
        });
        doAnswer(inv -> auditEntries.removeIf(e -> e.getEntryId().equals(inv.<AuditLogDocument>getArgument(0).getEntryId())))
                .when(auditLogRepository).delete(any(AuditLogDocument.class));
        when(auditLogRepository.findByBatchIdOrderBySeqAsc(anyString())).thenAnswer(inv -> auditEntries.stream()
                .filter(e -> e.getBatchId().equals(inv.getArgument(0)))
                .sorted(Comparator.comparingLong(AuditLogDocument::getSeq)).toList());
        when(auditLogRepository.findTopByBatchIdOrderBySeqDesc(anyString())).thenAnswer(inv -> auditEntries.stream()
                .filter(e -> e.getBatchId().equals(inv.getArgument(0)))
                .max(Comparator.comparingLong(AuditLogDocument::getSeq)));
        doAnswer(inv -> auditEntries.removeIf(e -> e.getBatchId().equals(inv.getArgument(0))))
                .when(auditLogRepository).deleteByBatchId(anyString());
    }

    private static AuditLogDocument copyOf(AuditLogDocument doc) {
        AuditLogDocument copy = new AuditLogDocument();
        copy.setEntryId(doc.getEntryId());
        copy.setBatchId(doc.getBatchId());
        copy.setSeq(doc.getSeq());
        copy.setOperation(doc.getOperation());
        copy.setCollectionName(doc.getCollectionName());
        copy.setTargetId(doc.getTargetId());
        copy.setPriorState(doc.getPriorState());
        copy.setNewState(doc.getNewState());
        copy.setRowNumber(doc.getRowNumber());
        copy.setTimestamp(doc.getTimestamp());
        copy.setPending(doc.isPending());
        return copy;
    }

    private void wireIssues() {
        when(issueRepository.saveAll(anyIterable())).thenAnswer(inv -> {
            Iterable<DataQualityIssueDocument> docs = inv.getArgument(0);
            List<DataQualityIssueDocument> saved = new ArrayList<>();
            docs.forEach(saved::add);
            issues.addAll(saved);
            return saved;
        });
        when(issueRepository.findByBatchIdOrderByRowNumberAsc(anyString())).thenAnswer(inv -> issues.stream()
                .filter(i -> i.getBatchId().equals(inv.getArgument(0)))
                .sorted(Comparator.comparingInt(DataQualityIssueDocument::getRowNumber)).toList());
        doAnswer(inv -> issues.removeIf(i -> i.getBatchId().equals(inv.getArgument(0))))
                .when(issueRepository).deleteByBatchId(anyString());
    }

    private void wireSchemas() {
        when(schemaRepository.save(any(SchemaDocument.class))).thenAnswer(inv -> {
            SchemaDocument doc = inv.getArgument(0);
            schemas.put(doc.getSchemaId(), doc);
            return doc;
        });
        when(schemaRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(schemas.get(inv.<String>getArgument(0))));
        when(schemaRepository.existsById(anyString())).thenAnswer(inv -> schemas.containsKey(inv.<String>getArgument(0)));
        when(schemaRepository.existsByName(anyString())).thenAnswer(inv -> schemas.values().stream()
                .anyMatch(s -> s.getName().equals(inv.getArgument(0))));
        when(schemaRepository.findByName(anyString())).thenAnswer(inv -> schemas.values().stream()
                .filter(s -> s.getName().equals(inv.getArgument(0))).findFirst());
        when(schemaRepository.findAllByOrderByLastUsedDescCreatedAtDesc()).thenAnswer(inv -> schemas.values().stream()
                .sorted(Comparator.comparing((SchemaDocument s) -> s.getLastUsed() == null ? Instant.EPOCH : s.getLastUsed())
                        .thenComparing(SchemaDocument::getCreatedAt).reversed())
                .toList());
        doAnswer(inv -> schemas.remove(inv.<String>getArgument(0))).when(schemaRepository).deleteById(anyString());

        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(SchemaDocument.class))).thenAnswer(inv -> {
            Query query = inv.getArgument(0);
            Update update = inv.getArgument(1);
            SchemaDocument schema = schemas.get((String) query.getQueryObject().get("_id"));
            if (schema == null) return UpdateResult.acknowledged(0, 0L, null);
            Document inc = (Document) update.getUpdateObject().get("$inc");
            Document set = (Document) update.getUpdateObject().get("$set");
            if (inc != null && inc.containsKey("usageCount")) {
                schema.setUsageCount(schema.getUsageCount() + ((Number) inc.get("usageCount")).longValue());
            }
            if (set != null && set.containsKey("lastUsed")) schema.setLastUsed((Instant) set.get("lastUsed"));
            if (set != null && set.containsKey("indexesMaterialized")) {
                schema.setIndexesMaterialized((Boolean) set.get("indexesMaterialized"));
            }
            return UpdateResult.acknowledged(1, 1L, null);
        });
    }
}
