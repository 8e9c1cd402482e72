package io.github.drompincen.sheetbridge.persistence.store;

import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Target store for imported documents. Documents are plain maps keyed by field name and
 * always carry a string {@code _id}.
 * <p>
 * Implementations throw {@link DuplicateKeyViolationException} when a unique index rejects a
 * write and {@link io.github.drompincen.sheetbridge.protocol.error.StoreUnavailableException}
 * when the store cannot be reached.
 */
public interface DocumentStore {

    String ID = "_id";

    /** First document whose fields equal every entry of {@code key}. */
    Optional<Map<String, Object>> findOne(String collection, Map<String, Object> key);

    Optional<Map<String, Object>> findById(String collection, String id);

    void insert(String collection, Map<String, Object> document);

    /** @return true if a document with {@code id} existed and was replaced */
    boolean replace(String collection, String id, Map<String, Object> document);

    /** @return true if a document was deleted */
    boolean delete(String collection, String id);

    void ensureIndex(String collection, IndexDefinition index);

    /** Unique composite index over {@code fields}, applied only to documents that have all of them. */
    void ensureUniqueKey(String collection, List<String> fields);

    /** Drops the index {@link #ensureIndex} created for {@code index}, if present. */
    void dropIndex(String collection, IndexDefinition index);

    /** Drops the duplicate-key index over {@code fields}, if present. */
    void dropUniqueKey(String collection, List<String> fields);

    long count(String collection);
}
