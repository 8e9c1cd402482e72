package io.github.drompincen.sheetbridge.sources;

import io.github.drompincen.sheetbridge.runtime.rows.CellValue;
import io.github.drompincen.sheetbridge.runtime.rows.RawRecord;
import io.github.drompincen.sheetbridge.runtime.rows.RowSource;
import io.github.drompincen.sheetbridge.runtime.rows.RowSourceException;
import io.github.drompincen.sheetbridge.runtime.rows.RowStream;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reads one sheet of an .xlsx or .xls workbook. Date-formatted numeric cells become date
 * cells, formulas are read from their cached result, and header cells that are blank are
 * left out together with their column.
 */
public class ExcelRowSource implements RowSource {

    private static final Logger log = LoggerFactory.getLogger(ExcelRowSource.class);

    private final Path file;
    private final String sheetName;
    private List<Header> header;
    private String hash;

    private record Header(int column, String label) {}

    public ExcelRowSource(Path file) {
        this(file, null);
    }

    /** @param sheetName sheet to read, or null for the first sheet */
    public ExcelRowSource(Path file, String sheetName) {
        this.file = file;
        this.sheetName = sheetName;
    }

    @Override
    public String sourceName() {
        return file.getFileName().toString();
    }

    @Override
    public synchronized String contentHash() {
        if (hash == null) hash = ContentHash.sha256(file);
        return hash;
    }

    @Override
    public synchronized List<String> columnLabels() {
        return header().stream().map(Header::label).toList();
    }

    @Override
    public int estimateRowCount(int dataStartRow) {
        try (Workbook workbook = openWorkbook()) {
            Sheet sheet = sheet(workbook);
            return Math.max(0, sheet.getLastRowNum() + 1 - (Math.max(dataStartRow, 2) - 1));
        } catch (IOException e) {
            throw new RowSourceException("Cannot read " + sourceName() + " while counting rows", e);
        }
    }

    @Override
    public RowStream open(int dataStartRow) {
        List<Header> columns = header();
        Workbook workbook = openWorkbook();
        Sheet sheet;
        try {
            sheet = sheet(workbook);
        } catch (RowSourceException e) {
            closeQuietly(workbook);
            throw e;
        }
        int firstIndex = Math.max(dataStartRow, 2) - 1;
        int lastIndex = sheet.getLastRowNum();
        log.debug("Reading {} sheet '{}' rows {}..{}", sourceName(), sheet.getSheetName(), firstIndex + 1, lastIndex + 1);

        return new RowStream() {
            private int index = firstIndex;
            private RawRecord next = advance();

            private RawRecord advance() {
                while (index <= lastIndex) {
                    Row row = sheet.getRow(index++);
                    if (row == null) continue;
                    Map<String, CellValue> cells = new LinkedHashMap<>();
                    boolean blank = true;
                    for (Header h : columns) {
                        CellValue value = toCellValue(row.getCell(h.column(), Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
                        cells.put(h.label(), value);
                        if (!value.isBlank()) blank = false;
                    }
                    if (!blank) return new RawRecord(row.getRowNum() + 1, cells);
                }
                return null;
            }

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public RawRecord next() {
                if (next == null) throw new NoSuchElementException();
                RawRecord current = next;
                next = advance();
                return current;
            }

            @Override
            public void close() {
                closeQuietly(workbook);
            }
        };
    }

    private void closeQuietly(Workbook workbook) {
        try {
            workbook.close();
        } catch (IOException e) {
            log.warn("Failed to close workbook {}: {}", sourceName(), e.getMessage());
        }
    }

    private synchronized List<Header> header() {
        if (header != null) return header;
        try (Workbook workbook = openWorkbook()) {
            Row first = sheet(workbook).getRow(0);
            List<Header> labels = new ArrayList<>();
            if (first != null) {
                for (int c = 0; c < first.getLastCellNum(); c++) {
                    CellValue value = toCellValue(first.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
                    if (!value.isBlank()) labels.add(new Header(c, value.raw().trim()));
                }
            }
            header = List.copyOf(labels);
            return header;
        } catch (IOException e) {
            throw new RowSourceException("Cannot read the header row of " + sourceName(), e);
        }
    }

    private Workbook openWorkbook() {
        try (InputStream in = Files.newInputStream(file)) {
            return WorkbookFactory.create(in);
        } catch (IOException | RuntimeException e) {
            throw new RowSourceException(sourceName() + " is not a readable Excel workbook", e);
        }
    }

    private Sheet sheet(Workbook workbook) {
        Sheet sheet = sheetName != null ? workbook.getSheet(sheetName) : workbook.getSheetAt(0);
        if (sheet == null) {
            throw new RowSourceException("Sheet '" + sheetName + "' not found in " + sourceName(), null);
        }
        return sheet;
    }

    static CellValue toCellValue(Cell cell) {
        if (cell == null) return CellValue.empty();
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> {
                String text = cell.getStringCellValue();
                yield text == null || text.isEmpty() ? CellValue.empty() : CellValue.text(text);
            }
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? CellValue.date(cell.getLocalDateTimeCellValue().toInstant(ZoneOffset.UTC))
                    : CellValue.number(cell.getNumericCellValue());
            case BOOLEAN -> CellValue.bool(cell.getBooleanCellValue());
            case ERROR -> CellValue.text(FormulaError.forInt(cell.getErrorCellValue()).getString());
            default -> CellValue.empty();
        };
    }
}
