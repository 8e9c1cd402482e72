package io.github.drompincen.sheetbridge.persistence.store;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;
import io.github.drompincen.sheetbridge.protocol.error.StoreUnavailableException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.index.TextIndexDefinition;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Component
public class MongoDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoDocumentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<Map<String, Object>> findOne(String collection, Map<String, Object> key) {
        Query query = new Query();
        key.forEach((field, value) -> query.addCriteria(Criteria.where(field).is(toStoreValue(value))));
        Document found = call(collection, () -> mongoTemplate.findOne(query, Document.class, collection));
        return Optional.ofNullable(found).map(MongoDocumentStore::fromStore);
    }

    @Override
    public Optional<Map<String, Object>> findById(String collection, String id) {
        Document found = call(collection, () -> mongoTemplate.findOne(byId(id), Document.class, collection));
        return Optional.ofNullable(found).map(MongoDocumentStore::fromStore);
    }

    @Override
    public void insert(String collection, Map<String, Object> document) {
        call(collection, () -> mongoTemplate.insert(toStore(document), collection));
    }

    @Override
    public boolean replace(String collection, String id, Map<String, Object> document) {
        UpdateResult result = call(collection, () -> mongoTemplate.replace(byId(id), toStore(document), collection));
        return result.getMatchedCount() > 0;
    }

    @Override
    public boolean delete(String collection, String id) {
        DeleteResult result = call(collection, () -> mongoTemplate.remove(byId(id), collection));
        return result.getDeletedCount() > 0;
    }

    @Override
    public void ensureIndex(String collection, IndexDefinition index) {
        org.springframework.data.mongodb.core.index.IndexDefinition definition = switch (index.kind()) {
            case UNIQUE -> new Index().on(index.field(), Sort.Direction.ASC).unique();
            case ASCENDING -> new Index().on(index.field(), Sort.Direction.ASC);
            case DESCENDING -> new Index().on(index.field(), Sort.Direction.DESC);
            case TEXT -> new TextIndexDefinition.TextIndexDefinitionBuilder().onField(index.field()).build();
        };
        String name = call(collection, () -> mongoTemplate.indexOps(collection).ensureIndex(definition));
        log.debug("Ensured {} index {} on {}", index.kind(), name, collection);
    }

    @Override
    public void ensureUniqueKey(String collection, List<String> fields) {
        if (fields == null || fields.isEmpty()) return;
        Index index = new Index().named(uniqueKeyName(fields)).unique();
        List<Criteria> present = new ArrayList<>();
        for (String field : fields) {
            index.on(field, Sort.Direction.ASC);
            present.add(Criteria.where(field).exists(true));
        }
        Criteria filter = present.size() == 1 ? present.get(0) : new Criteria().andOperator(present);
        index.partial(PartialIndexFilter.of(filter));
        call(collection, () -> mongoTemplate.indexOps(collection).ensureIndex(index));
        log.info("Ensured duplicate-key index on {} {}", collection, fields);
    }

    @Override
    public void dropIndex(String collection, IndexDefinition index) {
        String suffix = switch (index.kind()) {
            case UNIQUE, ASCENDING -> "_1";
            case DESCENDING -> "_-1";
            case TEXT -> "_text";
        };
        dropIfPresent(collection, index.field() + suffix);
    }

    @Override
    public void dropUniqueKey(String collection, List<String> fields) {
        if (fields == null || fields.isEmpty()) return;
        dropIfPresent(collection, uniqueKeyName(fields));
    }

    private void dropIfPresent(String collection, String name) {
        IndexOperations ops = mongoTemplate.indexOps(collection);
        boolean present = call(collection, () -> ops.getIndexInfo().stream().anyMatch(i -> name.equals(i.getName())));
        if (!present) return;
        call(collection, () -> {
            ops.dropIndex(name);
            return name;
        });
        log.info("Dropped index {} on {}", name, collection);
    }

    static String uniqueKeyName(List<String> fields) {
        return "dup_key_" + String.join("_", fields);
    }

    @Override
    public long count(String collection) {
        return call(collection, () -> mongoTemplate.count(new Query(), collection));
    }

    private <T> T call(String collection, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DuplicateKeyException e) {
            throw new DuplicateKeyViolationException("Duplicate key in " + collection, e);
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Document store unavailable while accessing " + collection, e);
        }
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where(ID).is(id));
    }

    static Document toStore(Map<String, Object> document) {
        Document bson = new Document();
        document.forEach((field, value) -> bson.put(field, toStoreValue(value)));
        return bson;
    }

    static Map<String, Object> fromStore(Document document) {
        Map<String, Object> map = new LinkedHashMap<>();
        document.forEach((field, value) -> map.put(field, value instanceof Date d ? d.toInstant() : value));
        return map;
    }

    private static Object toStoreValue(Object value) {
        return value instanceof Instant i ? Date.from(i) : value;
    }
}
