package io.github.drompincen.sheetbridge.protocol.api;

import java.util.List;
import java.util.Map;

/**
 * A schema template as authored or edited by a user. {@code columnLabels} keeps the
 * file's column order; every label needs an entry in {@code attributes}.
 */
public record CreateSchemaRequest(
        String name,
        List<String> columnLabels,
        Map<String, AttributeDefinition> attributes,
        List<IndexDefinition> indexes,
        List<String> duplicateKeyFields,
        DuplicateStrategy duplicateStrategy,
        Integer dataStartRow,
        String collectionName
) {}
