package io.github.drompincen.sheetbridge.protocol.api;

public record AttributeDefinition(
        String fieldName,
        FieldType type,
        String description,
        boolean required
) {
    public AttributeDefinition withRequired(boolean required) {
        return new AttributeDefinition(fieldName, type, description, required);
    }
}
