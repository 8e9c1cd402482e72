package io.github.drompincen.sheetbridge.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SchemaDto(
        String schemaId,
        String name,
        List<String> columnLabels,
        Map<String, AttributeDefinition> attributes,
        List<IndexDefinition> indexes,
        List<String> duplicateKeyFields,
        DuplicateStrategy duplicateStrategy,
        int dataStartRow,
        String collectionName,
        long usageCount,
        Instant lastUsed,
        Instant createdAt,
        Instant updatedAt
) {}
