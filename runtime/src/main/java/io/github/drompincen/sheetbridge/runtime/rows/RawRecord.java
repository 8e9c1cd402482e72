package io.github.drompincen.sheetbridge.runtime.rows;

import java.util.Map;

/** One data row: its 1-based row number in the file and its cells keyed by header label, in column order. */
public record RawRecord(int rowNumber, Map<String, CellValue> cells) {

    public CellValue cell(String label) {
        CellValue cell = cells.get(label);
        return cell == null ? CellValue.empty() : cell;
    }

    public boolean isBlank() {
        return cells.values().stream().allMatch(CellValue::isBlank);
    }
}
