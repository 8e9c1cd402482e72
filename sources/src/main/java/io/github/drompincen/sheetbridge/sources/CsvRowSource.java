package io.github.drompincen.sheetbridge.sources;

import io.github.drompincen.sheetbridge.runtime.rows.CellValue;
import io.github.drompincen.sheetbridge.runtime.rows.RawRecord;
import io.github.drompincen.sheetbridge.runtime.rows.RowSource;
import io.github.drompincen.sheetbridge.runtime.rows.RowSourceException;
import io.github.drompincen.sheetbridge.runtime.rows.RowStream;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reads a delimited text file. Record 1 is the header; a record spanning several lines
 * (quoted line breaks) still counts as one row. Every cell is text.
 */
public class CsvRowSource implements RowSource {

    private static final Logger log = LoggerFactory.getLogger(CsvRowSource.class);

    private final Path file;
    private final Charset charset;
    private final CSVFormat format;
    private List<String> labels;
    private List<Integer> labelColumns;
    private String hash;

    public CsvRowSource(Path file, Charset charset, char delimiter) {
        this.file = file;
        this.charset = charset;
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(false)
                .build();
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
        readHeader();
        return labels;
    }

    @Override
    public int estimateRowCount(int dataStartRow) {
        try (CSVParser parser = parser()) {
            long records = 0;
            for (CSVRecord ignored : parser) records++;
            return (int) Math.max(0, records - (Math.max(dataStartRow, 2) - 1));
        } catch (IOException | UncheckedIOException e) {
            throw new RowSourceException("Cannot read " + sourceName() + " while counting rows", e);
        }
    }

    @Override
    public RowStream open(int dataStartRow) {
        readHeader();
        List<String> names = labels;
        List<Integer> columns = labelColumns;
        int firstRow = Math.max(dataStartRow, 2);
        CSVParser parser;
        try {
            parser = parser();
        } catch (IOException e) {
            throw new RowSourceException("Cannot open " + sourceName() + " for reading", e);
        }
        Iterator<CSVRecord> records = parser.iterator();

        return new RowStream() {
            private RawRecord next = advance();

            private RawRecord advance() {
                try {
                    while (records.hasNext()) {
                        CSVRecord record = records.next();
                        int rowNumber = (int) record.getRecordNumber();
                        if (rowNumber < firstRow) continue;
                        Map<String, CellValue> cells = new LinkedHashMap<>();
                        boolean blank = true;
                        for (int i = 0; i < names.size(); i++) {
                            int column = columns.get(i);
                            String value = column < record.size() ? record.get(column) : "";
                            CellValue cell = value.isEmpty() ? CellValue.empty() : CellValue.text(value);
                            cells.put(names.get(i), cell);
                            if (!cell.isBlank()) blank = false;
                        }
                        if (!blank) return new RawRecord(rowNumber, cells);
                    }
                    return null;
                } catch (UncheckedIOException | IllegalStateException e) {
                    throw new RowSourceException("Malformed CSV in " + sourceName() + " near line " + parser.getCurrentLineNumber(), e);
                }
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
                try {
                    parser.close();
                } catch (IOException e) {
                    log.warn("Failed to close {}: {}", sourceName(), e.getMessage());
                }
            }
        };
    }

    private synchronized void readHeader() {
        if (labels != null) return;
        List<String> names = new ArrayList<>();
        List<Integer> columns = new ArrayList<>();
        try (CSVParser parser = parser()) {
            Iterator<CSVRecord> it = parser.iterator();
            if (it.hasNext()) {
                CSVRecord header = it.next();
                for (int c = 0; c < header.size(); c++) {
                    String label = header.get(c);
                    if (c == 0 && label.startsWith("\uFEFF")) label = label.substring(1);
                    if (label.isBlank()) continue;
                    names.add(label.trim());
                    columns.add(c);
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw new RowSourceException("Cannot read the header row of " + sourceName(), e);
        }
        labels = List.copyOf(names);
        labelColumns = List.copyOf(columns);
    }

    private CSVParser parser() throws IOException {
        Reader reader = Files.newBufferedReader(file, charset);
        return new CSVParser(reader, format);
    }
}
