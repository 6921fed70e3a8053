package org.pgninja.export;

import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoiSpreadsheetExporterTest {

    @TempDir
    Path dir;

    @Test
    void writesHeaderAndTypedCells() throws Exception {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("id", 1);
        first.put("name", "alpha");
        first.put("active", true);
        first.put("born", LocalDate.of(2020, 1, 2));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("id", 2L);
        second.put("name", null);
        second.put("active", false);
        second.put("born", null);

        Path file = new PoiSpreadsheetExporter(dir.resolve("out")).export(List.of(first, second));

        assertThat(file).exists().hasParent(dir.resolve("out"));
        assertThat(file.getFileName().toString()).startsWith("query-").endsWith(".xlsx");
        try (InputStream in = Files.newInputStream(file); Workbook wb = new XSSFWorkbook(in)) {
            Sheet sheet = wb.getSheet(PoiSpreadsheetExporter.SHEET_NAME);
            assertThat(sheet.getLastRowNum()).isEqualTo(2);

            Row header = sheet.getRow(0);
            assertThat(header.getCell(0).getStringCellValue()).isEqualTo("id");
            assertThat(header.getCell(3).getStringCellValue()).isEqualTo("born");

            Row r1 = sheet.getRow(1);
            assertThat(r1.getCell(0).getNumericCellValue()).isEqualTo(1.0);
            assertThat(r1.getCell(1).getStringCellValue()).isEqualTo("alpha");
            assertThat(r1.getCell(2).getBooleanCellValue()).isTrue();
            assertThat(r1.getCell(3).getStringCellValue()).isEqualTo("2020-01-02");

            Row r2 = sheet.getRow(2);
            assertThat(r2.getCell(0).getNumericCellValue()).isEqualTo(2.0);
            assertThat(r2.getCell(1).getCellType()).isEqualTo(CellType.BLANK);
        }
    }

    @Test
    void emptyRows_stillProduceAWorkbook() {
        Path file = new PoiSpreadsheetExporter(dir).export(List.of());

        assertThat(file).exists();
    }

    @Test
    void consecutiveExports_doNotOverwriteEachOther() {
        PoiSpreadsheetExporter exporter = new PoiSpreadsheetExporter(dir);

        Path a = exporter.export(List.of(Map.of("x", 1)));
        Path b = exporter.export(List.of(Map.of("x", 2)));

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void unwritableDirectory_isExportException() throws Exception {
        Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");

        assertThatThrownBy(() -> new PoiSpreadsheetExporter(blocker.resolve("sub")).export(List.of()))
                .isInstanceOf(ExportException.class);
    }
}
