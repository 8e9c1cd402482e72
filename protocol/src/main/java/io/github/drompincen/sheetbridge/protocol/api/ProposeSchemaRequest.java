package io.github.drompincen.sheetbridge.protocol.api;

import java.util.List;

public record ProposeSchemaRequest(
        String name,
        List<String> columnLabels,
        String filePath,
        String sheetName
) {
    public ProposeSchemaRequest(String name, List<String> columnLabels, String filePath) {
        this(name, columnLabels, filePath, null);
    }
}
