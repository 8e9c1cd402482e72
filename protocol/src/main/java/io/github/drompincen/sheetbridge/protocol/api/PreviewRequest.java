package io.github.drompincen.sheetbridge.protocol.api;

public record PreviewRequest(
        String schemaId,
        String filePath,
        Integer dataStartRow,
        Integer rows,
        String sheetName
) {
    public PreviewRequest(String schemaId, String filePath, Integer dataStartRow, Integer rows) {
        this(schemaId, filePath, dataStartRow, rows, null);
    }
}
