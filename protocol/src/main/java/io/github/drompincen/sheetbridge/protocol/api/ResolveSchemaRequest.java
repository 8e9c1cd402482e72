package io.github.drompincen.sheetbridge.protocol.api;

import java.util.List;

public record ResolveSchemaRequest(
        List<String> columnLabels,
        String filePath,
        String sheetName
) {
    public ResolveSchemaRequest(List<String> columnLabels, String filePath) {
        this(columnLabels, filePath, null);
    }
}
