package io.github.drompincen.sheetbridge.runtime.schema;

import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.CreateSchemaRequest;
import io.github.drompincen.sheetbridge.protocol.api.IndexDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class SchemaValidator {

    public static final int MAX_COLUMNS = 1000;

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_ -]{1,100}");
    private static final Pattern COLLECTION = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final Pattern FIELD = Pattern.compile("[A-Za-z][A-Za-z0-9_]{0,63}");
    private static final Set<String> RESERVED = Set.of("admin", "root", "system", "default", "null", "undefined");

    /** @throws SchemaValidationException listing every broken rule */
    public void check(CreateSchemaRequest schema) {
        List<String> errors = validate(schema);
        if (!errors.isEmpty()) throw new SchemaValidationException(errors);
    }

    public List<String> validate(CreateSchemaRequest schema) {
        List<String> errors = new ArrayList<>();
        validateName(schema.name(), errors);
        validateCollection(schema.collectionName(), errors);

        List<String> labels = schema.columnLabels() == null ? List.of() : schema.columnLabels();
        Map<String, AttributeDefinition> attributes = schema.attributes() == null ? Map.of() : schema.attributes();
        if (labels.isEmpty()) errors.add("at least one column label is required");
        if (labels.size() > MAX_COLUMNS) errors.add("at most " + MAX_COLUMNS + " columns are allowed");

        Set<String> seenLabels = new HashSet<>();
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                errors.add("column labels must not be blank");
                continue;
            }
            if (!seenLabels.add(label.trim())) errors.add("duplicate column label '" + label + "'");
            if (!attributes.containsKey(label)) errors.add("column '" + label + "' has no attribute");
        }
        for (String label : attributes.keySet()) {
            if (!labels.contains(label)) errors.add("attribute for unknown column '" + label + "'");
        }

        Set<String> fields = new HashSet<>();
        for (Map.Entry<String, AttributeDefinition> e : attributes.entrySet()) {
            AttributeDefinition attr = e.getValue();
            if (attr == null || attr.fieldName() == null || !FIELD.matcher(attr.fieldName()).matches()) {
                errors.add("column '" + e.getKey() + "' needs a field name of letters, digits and underscores starting with a letter");
                continue;
            }
            if (attr.type() == null) errors.add("field " + attr.fieldName() + " has no type");
            if (!fields.add(attr.fieldName())) errors.add("field name " + attr.fieldName() + " is used twice");
        }

        if (schema.duplicateKeyFields() != null) {
            for (String field : schema.duplicateKeyFields()) {
                if (!fields.contains(field)) errors.add("duplicate-key field " + field + " is not a schema field");
            }
        }
        if (schema.indexes() != null) {
            for (IndexDefinition index : schema.indexes()) {
                if (index == null || index.kind() == null) {
                    errors.add("index entries need a field and a kind");
                } else if (!fields.contains(index.field())) {
                    errors.add("index field " + index.field() + " is not a schema field");
                }
            }
        }
        if (schema.dataStartRow() != null && schema.dataStartRow() < 1) {
            errors.add("data start row must be at least 1");
        }
        return errors;
    }

    private static void validateName(String name, List<String> errors) {
        if (name == null || !NAME.matcher(name).matches()) {
            errors.add("name must be 1-100 letters, digits, spaces, hyphens or underscores");
        } else if (RESERVED.contains(name.trim().toLowerCase(Locale.ROOT))) {
            errors.add("name '" + name + "' is reserved");
        }
    }

    private static void validateCollection(String collection, List<String> errors) {
        if (collection == null) return;
        if (!COLLECTION.matcher(collection).matches()) {
            errors.add("collection name must be 1-64 letters, digits, hyphens or underscores");
        } else if (collection.toLowerCase(Locale.ROOT).startsWith("system")) {
            errors.add("collection name must not start with 'system'");
        }
    }
}
