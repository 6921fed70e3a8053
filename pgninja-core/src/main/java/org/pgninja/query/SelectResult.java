package org.pgninja.query;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record SelectResult(String command, List<Map<String, Object>> rows, ExportHook hook) implements QueryResult {

    public SelectResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public SelectResult(String command, List<Map<String, Object>> rows) {
        this(command, rows, null);
    }

    @Override
    public long rowCount() {
        return rows.size();
    }

    @Override
    public Optional<ExportHook> exportHook() {
        return Optional.ofNullable(hook);
    }

    public SelectResult withExportHook(ExportHook hook) {
        return new SelectResult(command, rows, hook);
    }
}
