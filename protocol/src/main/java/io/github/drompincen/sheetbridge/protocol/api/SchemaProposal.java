package io.github.drompincen.sheetbridge.protocol.api;

import java.util.List;
import java.util.Map;

/** Normalized mapping proposed for a set of raw column labels. */
public record SchemaProposal(
        Map<String, AttributeDefinition> attributes,
        List<IndexDefinition> indexes,
        List<String> duplicateKeyFields,
        String collectionName
) {}
