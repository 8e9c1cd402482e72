package io.github.drompincen.sheetbridge.protocol.api;

public record IndexDefinition(
        String field,
        IndexKind kind,
        String reason
) {}
