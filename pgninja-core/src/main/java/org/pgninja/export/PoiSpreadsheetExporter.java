package org.pgninja.export;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes rows to {@code .xlsx} files with Apache POI.
 *
 * <p>The header row holds the column labels of the first row. Numbers become numeric cells, booleans boolean
 * cells, nulls blank cells and everything else (dates included) its {@code toString()}.
 */
public class PoiSpreadsheetExporter implements SpreadsheetExporter {
    private static final Logger log = LoggerFactory.getLogger(PoiSpreadsheetExporter.class);
    static final String SHEET_NAME = "query";

    private final Path directory;
    private final AtomicLong sequence = new AtomicLong();

    public PoiSpreadsheetExporter(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Path export(List<Map<String, Object>> rows) {
        List<Map<String, Object>> data = rows == null ? List.of() : rows;
        Path target = directory.resolve("query-" + System.currentTimeMillis() + "-" + sequence.incrementAndGet() + ".xlsx");
        try {
            Files.createDirectories(directory);
            try (Workbook workbook = new XSSFWorkbook();
                 OutputStream out = Files.newOutputStream(target)) {
                fill(workbook.createSheet(SHEET_NAME), data);
                workbook.write(out);
            }
        } catch (IOException e) {
            throw new ExportException("Failed to write spreadsheet " + target + ": " + e.getMessage(), e);
        }
        log.debug("Exported {} rows to {}", data.size(), target);
        return target;
    }

    private static void fill(Sheet sheet, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return;
        }
        List<String> headers = new ArrayList<>(rows.get(0).keySet());
        Row header = sheet.createRow(0);
        for (int c = 0; c < headers.size(); c++) {
            header.createCell(c).setCellValue(headers.get(c));
        }
        for (int r = 0; r < rows.size(); r++) {
            Row row = sheet.createRow(r + 1);
            Map<String, Object> record = rows.get(r);
            for (int c = 0; c < headers.size(); c++) {
                setValue(row.createCell(c), record.get(headers.get(c)));
            }
        }
    }

    private static void setValue(Cell cell, Object value) {
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof Number n) {
            cell.setCellValue(n.doubleValue());
        } else if (value instanceof Boolean b) {
            cell.setCellValue(b);
        } else {
            cell.setCellValue(value.toString());
        }
    }
}
