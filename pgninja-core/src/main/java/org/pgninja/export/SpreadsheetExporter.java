package org.pgninja.export;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Turns query rows into a spreadsheet file.
 */
@FunctionalInterface
public interface SpreadsheetExporter {

    /**
     * @return the written file
     * @throws ExportException if the file cannot be produced
     */
    Path export(List<Map<String, Object>> rows);
}
