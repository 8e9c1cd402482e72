package io.github.drompincen.sheetbridge.persistence.document;

import io.github.drompincen.sheetbridge.protocol.api.FieldType;

/**
 * One column of a schema template. Stored as a list entry rather than a map value
 * because column labels may contain characters that are not legal in field names.
 */
public class SchemaAttribute {

    private String label;
    private String fieldName;
    private FieldType type;
    private String description;
    private boolean required;

    public SchemaAttribute() {}

    public SchemaAttribute(String label, String fieldName, FieldType type, String description, boolean required) {
        this.label = label;
        this.fieldName = fieldName;
        this.type = type;
        this.description = description;
        this.required = required;
    }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public String getFieldName() { return fieldName; }
    public void setFieldName(String fieldName) { this.fieldName = fieldName; }

    public FieldType getType() { return type; }
    public void setType(FieldType type) { this.type = type; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isRequired() { return required; }
    public void setRequired(boolean required) { this.required = required; }
}
