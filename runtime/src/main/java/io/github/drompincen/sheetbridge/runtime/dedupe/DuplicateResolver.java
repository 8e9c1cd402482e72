package io.github.drompincen.sheetbridge.runtime.dedupe;

import io.github.drompincen.sheetbridge.persistence.store.DocumentStore;
import io.github.drompincen.sheetbridge.protocol.api.DuplicateStrategy;
import io.github.drompincen.sheetbridge.runtime.batch.ImportContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks an incoming document up by the schema's duplicate key and applies the batch's
 * strategy. A document missing any key field never matches; with no key fields every
 * document is new.
 */
@Component
public class DuplicateResolver {

    private static final Logger log = LoggerFactory.getLogger(DuplicateResolver.class);

    private final DocumentStore documentStore;

    public DuplicateResolver(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public Resolution resolve(ImportContext context, Map<String, Object> document) {
        return resolve(context.collectionName(), context.duplicateKeyFields(), context.strategy(), document);
    }

    public Resolution resolve(String collection, List<String> keyFields, DuplicateStrategy strategy,
                              Map<String, Object> document) {
        Optional<Map<String, Object>> existing = findExisting(collection, keyFields, document);
        Resolution resolution = existing.map(found -> onMatch(strategy, found)).orElseGet(() -> onNoMatch(strategy));
        log.debug("Resolved {} as {} under {}", keyFields.isEmpty() ? "document" : key(keyFields, document),
                resolution.outcome(), strategy);
        return resolution;
    }

    public Optional<Map<String, Object>> findExisting(String collection, List<String> keyFields, Map<String, Object> document) {
        if (keyFields == null || keyFields.isEmpty()) return Optional.empty();
        Map<String, Object> key = key(keyFields, document);
        if (key.size() < keyFields.size()) return Optional.empty();
        return documentStore.findOne(collection, key);
    }

    public Resolution onMatch(DuplicateStrategy strategy, Map<String, Object> existing) {
        return switch (strategy) {
            case SKIP -> Resolution.skip(existing);
            case UPDATE, UPSERT -> Resolution.replace(existing);
        };
    }

    private static Resolution onNoMatch(DuplicateStrategy strategy) {
        return strategy == DuplicateStrategy.UPDATE ? Resolution.reject() : Resolution.insert();
    }

    private static Map<String, Object> key(List<String> keyFields, Map<String, Object> document) {
        Map<String, Object> key = new LinkedHashMap<>();
        for (String field : keyFields) {
            Object value = document.get(field);
            if (value != null) key.put(field, value);
        }
        return key;
    }
}
