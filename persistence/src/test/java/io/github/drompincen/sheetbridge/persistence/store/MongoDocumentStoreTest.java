package io.github.drompincen.sheetbridge.persistence.store;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;
import io.github.drompincen.sheetbridge.protocol.api.IndexKind;
import io.github.drompincen.sheetbridge.protocol.error.StoreUnavailableException;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MongoDocumentStoreTest {

    @Mock private MongoTemplate mongoTemplate;
    @Mock private IndexOperations indexOps;

    private MongoDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDocumentStore(mongoTemplate);
        when(mongoTemplate.indexOps(anyString())).thenReturn(indexOps);
        when(indexOps.ensureIndex(any())).thenReturn("idx");
    }

    @Test
    void insertConvertsInstantsToDates() {
        Instant importedAt = Instant.parse("2024-03-01T10:00:00Z");
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("_id", "d1");
        doc.put("email", "a@x.com");
        doc.put("_imported_at", importedAt);

        store.insert("customers", doc);

        ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
        verify(mongoTemplate).insert(captor.capture(), eq("customers"));
        assertThat(captor.getValue().get("_imported_at")).isEqualTo(Date.from(importedAt));
        assertThat(captor.getValue().getString("email")).isEqualTo("a@x.com");
    }

    @Test
    void findOneQueriesEveryKeyFieldAndConvertsDatesBack() {
        Date stored = new Date(0);
        when(mongoTemplate.findOne(any(Query.class), eq(Document.class), eq("customers")))
                .thenReturn(new Document("_id", "d1").append("email", "a@x.com").append("joined", stored));

        Optional<Map<String, Object>> found = store.findOne("customers", Map.of("email", "a@x.com"));

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).findOne(captor.capture(), eq(Document.class), eq("customers"));
        assertThat(captor.getValue().getQueryObject()).containsEntry("email", "a@x.com");
        assertThat(found).isPresent();
        assertThat(found.get()).containsEntry("joined", Instant.EPOCH);
    }

    @Test
    void duplicateKeyIsTranslated() {
        when(mongoTemplate.insert(any(Document.class), eq("customers")))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key"));

        assertThatThrownBy(() -> store.insert("customers", Map.of("_id", "d1")))
                .isInstanceOf(DuplicateKeyViolationException.class)
                .hasMessageContaining("customers");
    }

    @Test
    void resourceFailureIsStoreUnavailable() {
        when(mongoTemplate.count(any(Query.class), eq("customers")))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatThrownBy(() -> store.count("customers"))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void replaceReportsMatch() {
        when(mongoTemplate.replace(any(Query.class), any(Document.class), eq("customers")))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        assertThat(store.replace("customers", "d1", Map.of("_id", "d1", "amount", 20L))).isTrue();
    }

    @Test
    void deleteReportsAbsentDocument() {
        when(mongoTemplate.remove(any(Query.class), eq("customers"))).thenReturn(DeleteResult.acknowledged(0));

        assertThat(store.delete("customers", "missing")).isFalse();
    }

    @Test
    void uniqueKeyIndexIsPartialOnKeyFields() {
        store.ensureUniqueKey("customers", List.of("email", "region"));

        ArgumentCaptor<Index> captor = ArgumentCaptor.forClass(Index.class);
        verify(indexOps).ensureIndex(captor.capture());
        Document options = captor.getValue().getIndexOptions();
        assertThat(options.getBoolean("unique")).isTrue();
        assertThat(options.get("partialFilterExpression")).isNotNull();
        assertThat(captor.getValue().getIndexKeys().keySet()).containsExactly("email", "region");
    }

    @Test
    void ensureIndexMapsKind() {
        store.ensureIndex("customers", new IndexDefinition("created", IndexKind.DESCENDING, "recency"));

        ArgumentCaptor<Index> captor = ArgumentCaptor.forClass(Index.class);
        verify(indexOps).ensureIndex(captor.capture());
        assertThat(captor.getValue().getIndexKeys()).containsEntry("created", -1);
    }

    @Test
    void dropUniqueKeyRemovesOnlyAnExistingIndex() {
        when(indexOps.getIndexInfo()).thenReturn(List.of(
                IndexInfo.indexInfoOf(new Document("name", "dup_key_email").append("key", new Document("email", 1)))));

        store.dropUniqueKey("customers", List.of("email"));
        store.dropUniqueKey("customers", List.of("email", "region"));

        verify(indexOps).dropIndex("dup_key_email");
        verify(indexOps, never()).dropIndex("dup_key_email_region");
    }

    @Test
    void dropIndexUsesTheDefaultIndexName() {
        when(indexOps.getIndexInfo()).thenReturn(List.of(
                IndexInfo.indexInfoOf(new Document("name", "created_-1").append("key", new Document("created", -1)))));

        store.dropIndex("customers", new IndexDefinition("created", IndexKind.DESCENDING, "recency"));

        verify(indexOps).dropIndex("created_-1");
    }
}
