package io.github.drompincen.sheetbridge.persistence.document;

import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.DuplicateStrategy;
import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Document(collection = "schema_templates")
public class SchemaDocument {

    @Id
    private String schemaId;
    @Indexed(unique = true)
    private String name;
    private List<String> columnLabels;
    private List<SchemaAttribute> attributes;
    private List<IndexDefinition> indexes;
    private List<String> duplicateKeyFields;
    private DuplicateStrategy duplicateStrategy;
    private int dataStartRow;
    private String collectionName;
    private long usageCount;
    @Indexed
    private Instant lastUsed;
    private boolean indexesMaterialized;
    private Instant createdAt;
    private Instant updatedAt;

    public SchemaDocument() {}

    public String getSchemaId() { return schemaId; }
    public void setSchemaId(String schemaId) { this.schemaId = schemaId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<String> getColumnLabels() { return columnLabels; }
    public void setColumnLabels(List<String> columnLabels) { this.columnLabels = columnLabels; }

    public List<SchemaAttribute> getAttributes() { return attributes; }
    public void setAttributes(List<SchemaAttribute> attributes) { this.attributes = attributes; }

    public List<IndexDefinition> getIndexes() { return indexes; }
    public void setIndexes(List<IndexDefinition> indexes) { this.indexes = indexes; }

    public List<String> getDuplicateKeyFields() { return duplicateKeyFields; }
    public void setDuplicateKeyFields(List<String> duplicateKeyFields) { this.duplicateKeyFields = duplicateKeyFields; }

    public DuplicateStrategy getDuplicateStrategy() { return duplicateStrategy; }
    public void setDuplicateStrategy(DuplicateStrategy duplicateStrategy) { this.duplicateStrategy = duplicateStrategy; }

    public int getDataStartRow() { return dataStartRow; }
    public void setDataStartRow(int dataStartRow) { this.dataStartRow = dataStartRow; }

    public String getCollectionName() { return collectionName; }
    public void setCollectionName(String collectionName) { this.collectionName = collectionName; }

    public long getUsageCount() { return usageCount; }
    public void setUsageCount(long usageCount) { this.usageCount = usageCount; }

    public Instant getLastUsed() { return lastUsed; }
    public void setLastUsed(Instant lastUsed) { this.lastUsed = lastUsed; }

    public boolean isIndexesMaterialized() { return indexesMaterialized; }
    public void setIndexesMaterialized(boolean indexesMaterialized) { this.indexesMaterialized = indexesMaterialized; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /** Attributes keyed by original column label, in column order. */
    public Map<String, AttributeDefinition> attributeMap() {
        Map<String, AttributeDefinition> map = new LinkedHashMap<>();
        if (attributes == null) return map;
        for (SchemaAttribute a : attributes) {
            map.put(a.getLabel(), new AttributeDefinition(a.getFieldName(), a.getType(), a.getDescription(), a.isRequired()));
        }
        return map;
    }

    public void putAttributes(Map<String, AttributeDefinition> map) {
        List<SchemaAttribute> list = new ArrayList<>();
        if (map != null) {
            map.forEach((label, def) -> list.add(new SchemaAttribute(
                    label, def.fieldName(), def.type(), def.description(), def.required())));
        }
        this.attributes = list;
    }
}
