package io.github.drompincen.sheetbridge.protocol.api;

/**
 * Starts an import of one file under one schema template. {@code duplicateStrategy}
 * and {@code dataStartRow} override the template's defaults when set. {@code sheetName}
 * picks a worksheet of an Excel file; the first sheet is read when it is absent.
 */
public record ImportRequest(
        String schemaId,
        String filePath,
        DuplicateStrategy duplicateStrategy,
        Integer dataStartRow,
        String sheetName
) {
    public ImportRequest(String schemaId, String filePath, DuplicateStrategy duplicateStrategy, Integer dataStartRow) {
        this(schemaId, filePath, duplicateStrategy, dataStartRow, null);
    }
}
