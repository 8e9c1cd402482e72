package io.github.drompincen.sheetbridge.runtime.ai;

import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.FieldType;
import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;
import io.github.drompincen.sheetbridge.protocol.api.IndexKind;
import io.github.drompincen.sheetbridge.protocol.api.SchemaProposal;
import io.github.drompincen.sheetbridge.runtime.schema.SchemaNames;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Offline advisor: field names from the labels, types from well-known words. Leaves the
 * collection name to the catalog.
 */
@Service
@ConditionalOnProperty(name = "sheetbridge.ai.provider", havingValue = "heuristic")
public class HeuristicSchemaAdvisor implements SchemaAdvisor {

    private static final Set<String> DATE_WORDS = Set.of("date", "time", "timestamp", "dob", "birthday", "at");
    private static final Set<String> NUMBER_WORDS = Set.of("amount", "amt", "price", "cost", "qty", "quantity", "total",
            "count", "age", "score", "rate", "balance", "salary", "sum", "weight");
    private static final Set<String> BOOLEAN_WORDS = Set.of("active", "enabled", "flag", "paid");
    private static final Set<String> KEY_WORDS = Set.of("id", "email", "sku", "code", "uuid");

    @Override
    public SchemaProposal propose(List<String> columnLabels) {
        Map<String, AttributeDefinition> attributes = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        List<IndexDefinition> indexes = new ArrayList<>();
        List<String> duplicateKey = new ArrayList<>();

        for (String label : columnLabels) {
            String field = unique(SchemaNames.toFieldName(label), used);
            List<String> words = List.of(field.split("_"));
            FieldType type = guessType(words);
            attributes.put(label, new AttributeDefinition(field, type, null, false));

            String last = words.get(words.size() - 1);
            if (duplicateKey.isEmpty() && KEY_WORDS.contains(last)) {
                duplicateKey.add(field);
                indexes.add(new IndexDefinition(field, IndexKind.ASCENDING, "duplicate detection key"));
            } else if (type == FieldType.DATE) {
                indexes.add(new IndexDefinition(field, IndexKind.DESCENDING, "recent-first queries"));
            }
        }
        return new SchemaProposal(attributes, indexes, duplicateKey, null);
    }

    private static FieldType guessType(List<String> words) {
        String first = words.get(0);
        if (first.equals("is") || first.equals("has") || (words.size() == 1 && BOOLEAN_WORDS.contains(first))) {
            return FieldType.BOOLEAN;
        }
        if (words.stream().anyMatch(DATE_WORDS::contains)) return FieldType.DATE;
        if (words.stream().anyMatch(NUMBER_WORDS::contains)) return FieldType.NUMBER;
        return FieldType.STRING;
    }

    private static String unique(String field, Set<String> used) {
        String candidate = field;
        int n = 2;
        while (!used.add(candidate)) {
            candidate = field + "_" + n++;
        }
        return candidate;
    }
}
