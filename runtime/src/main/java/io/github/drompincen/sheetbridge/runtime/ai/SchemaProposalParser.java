package io.github.drompincen.sheetbridge.runtime.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.FieldType;
import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;
import io.github.drompincen.sheetbridge.protocol.api.IndexKind;
import io.github.drompincen.sheetbridge.protocol.api.SchemaProposal;
import io.github.drompincen.sheetbridge.protocol.error.AIProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the model's JSON answer into a {@link SchemaProposal}. Surrounding prose and
 * markdown code fences are ignored. Index entries naming several fields become one index per
 * field; a multi-field unique index is kept as plain ascending indexes since uniqueness only
 * held for the combination.
 */
public class SchemaProposalParser {

    private static final Logger log = LoggerFactory.getLogger(SchemaProposalParser.class);

    private final ObjectMapper objectMapper;

    public SchemaProposalParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SchemaProposal parse(String reply, List<String> columnLabels) {
        JsonNode root = readObject(reply);
        JsonNode attrsNode = root.get("normalized_attributes");
        JsonNode indexesNode = root.get("suggested_indexes");
        JsonNode dupNode = root.get("duplicate_detection_columns");
        JsonNode collectionNode = root.get("collection_name");
        if (attrsNode == null || !attrsNode.isObject()
                || indexesNode == null || !indexesNode.isArray()
                || dupNode == null || !dupNode.isArray()
                || collectionNode == null || !collectionNode.isTextual() || collectionNode.asText().isBlank()) {
            throw new AIProcessingException("AI response is missing required sections");
        }

        Map<String, AttributeDefinition> attributes = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String label : columnLabels) {
            JsonNode attr = attrsNode.has(label) ? attrsNode.get(label) : attrsNode.get(label.trim());
            if (attr == null || !attr.isObject()) {
                missing.add(label);
                continue;
            }
            attributes.put(label, readAttribute(label, attr));
        }
        if (!missing.isEmpty()) {
            throw new AIProcessingException("AI response has no attribute for column(s) " + missing);
        }

        Set<String> fieldNames = new LinkedHashSet<>();
        attributes.values().forEach(a -> fieldNames.add(a.fieldName()));

        List<IndexDefinition> indexes = new ArrayList<>();
        for (JsonNode idx : indexesNode) {
            indexes.addAll(readIndex(idx, fieldNames));
        }

        List<String> duplicateKey = new ArrayList<>();
        for (JsonNode f : dupNode) {
            String field = f.asText();
            if (fieldNames.contains(field) && !duplicateKey.contains(field)) {
                duplicateKey.add(field);
            } else {
                log.warn("Ignoring duplicate-detection field '{}' not among proposed fields", field);
            }
        }
        return new SchemaProposal(attributes, indexes, duplicateKey, collectionNode.asText().trim());
    }

    private JsonNode readObject(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new AIProcessingException("AI response is empty");
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new AIProcessingException("AI response contains no JSON object");
        }
        try {
            return objectMapper.readTree(reply.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new AIProcessingException("AI response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private AttributeDefinition readAttribute(String label, JsonNode attr) {
        String fieldName = attr.path("field_name").asText("").trim();
        if (fieldName.isEmpty()) {
            throw new AIProcessingException("AI response has no field name for column '" + label + "'");
        }
        FieldType type;
        try {
            type = FieldType.fromValue(attr.path("data_type").asText("String"));
        } catch (IllegalArgumentException e) {
            throw new AIProcessingException("AI response has an unknown type for column '" + label + "': "
                    + attr.path("data_type").asText(), e);
        }
        String description = attr.path("description").asText(null);
        return new AttributeDefinition(fieldName, type, description, false);
    }

    private List<IndexDefinition> readIndex(JsonNode idx, Set<String> fieldNames) {
        List<String> fields = new ArrayList<>();
        JsonNode names = idx.has("field_names") ? idx.get("field_names") : idx.get("field_name");
        if (names != null && names.isArray()) {
            names.forEach(n -> fields.add(n.asText()));
        } else if (names != null && names.isTextual()) {
            fields.add(names.asText());
        }
        IndexKind kind;
        try {
            kind = IndexKind.fromValue(idx.path("index_type").asText("ascending"));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring index with unknown type '{}'", idx.path("index_type").asText());
            return List.of();
        }
        if (kind == IndexKind.UNIQUE && fields.size() > 1) kind = IndexKind.ASCENDING;
        String reason = idx.path("reason").asText(null);

        List<IndexDefinition> result = new ArrayList<>();
        for (String field : fields) {
            if (fieldNames.contains(field)) {
                result.add(new IndexDefinition(field, kind, reason));
            } else {
                log.warn("Ignoring index on '{}' not among proposed fields", field);
            }
        }
        return result;
    }
}
