package io.github.drompincen.sheetbridge.sources;

import io.github.drompincen.sheetbridge.runtime.rows.RowSource;
import io.github.drompincen.sheetbridge.runtime.rows.RowSourceException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** Picks a reader by file extension. */
@Component
public class RowSourceFactory {

    private final Charset csvCharset;

    public RowSourceFactory(@Value("${sheetbridge.sources.csv-charset:UTF-8}") String csvCharset) {
        this.csvCharset = Charset.forName(csvCharset);
    }

    public RowSource forPath(Path file) {
        return forPath(file, null);
    }

    /**
     * @param sheetName worksheet to read from an Excel file, or null for the first one
     * @throws RowSourceException if the file does not exist, its type is not supported, or a
     *                            sheet is named for a delimited text file
     */
    public RowSource forPath(Path file, String sheetName) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new RowSourceException("File not found: " + file, null);
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean sheetNamed = sheetName != null && !sheetName.isBlank();
        if (name.endsWith(".xlsx") || name.endsWith(".xlsm") || name.endsWith(".xls")) {
            return sheetNamed ? new ExcelRowSource(file, sheetName) : new ExcelRowSource(file);
        }
        if (sheetNamed) {
            throw new RowSourceException("Sheet '" + sheetName + "' was given but " + file.getFileName()
                    + " is not an Excel workbook", null);
        }
        if (name.endsWith(".csv")) {
            return new CsvRowSource(file, csvCharset, ',');
        }
        if (name.endsWith(".tsv") || name.endsWith(".txt")) {
            return new CsvRowSource(file, csvCharset, '\t');
        }
        throw new RowSourceException("Unsupported file type: " + file.getFileName()
                + " (expected .xlsx, .xls, .csv, .tsv or .txt)", null);
    }

    public RowSource forPath(String path) {
        return forPath(path, null);
    }

    public RowSource forPath(String path, String sheetName) {
        if (path == null || path.isBlank()) {
            throw new RowSourceException("A file path is required", null);
        }
        return forPath(Path.of(path), sheetName);
    }
}
