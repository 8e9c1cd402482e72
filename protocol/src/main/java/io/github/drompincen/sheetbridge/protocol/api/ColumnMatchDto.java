package io.github.drompincen.sheetbridge.protocol.api;

public record ColumnMatchDto(
        String schemaLabel,
        String fieldName,
        String fileLabel,
        String matchKind,
        double score,
        boolean required
) {}
