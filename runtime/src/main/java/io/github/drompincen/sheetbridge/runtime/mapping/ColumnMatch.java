package io.github.drompincen.sheetbridge.runtime.mapping;

import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.ColumnMatchDto;

/** How one schema attribute is fed from the file. {@code fileLabel} is null when unmapped. */
public record ColumnMatch(
        String schemaLabel,
        AttributeDefinition attribute,
        String fileLabel,
        MatchKind kind,
        double score
) {
    public static ColumnMatch unmapped(String schemaLabel, AttributeDefinition attribute) {
        return new ColumnMatch(schemaLabel, attribute, null, MatchKind.UNMAPPED, 0.0);
    }

    public boolean isMapped() { return kind != MatchKind.UNMAPPED; }

    public String fieldName() { return attribute.fieldName(); }

    public ColumnMatchDto toDto() {
        return new ColumnMatchDto(schemaLabel, attribute.fieldName(), fileLabel, kind.name(), score, attribute.required());
    }
}
