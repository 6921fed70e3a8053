package org.pgninja.query;

import java.util.List;
import java.util.Map;

/**
 * Result of a statement that reported an update count. {@code rows} is only non-empty when the statement
 * also returned data (e.g. {@code UPDATE ... RETURNING} on drivers that report both).
 */
public record MutationResult(String command, long rowCount, List<Map<String, Object>> rows) implements QueryResult {

    public MutationResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public MutationResult(String command, long rowCount) {
        this(command, rowCount, List.of());
    }
}
