package org.pgninja.query;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized outcome of one statement, tagged by command category.
 *
 * <p>{@link SelectResult} for statements that produced a row set, {@link MutationResult} for statements that
 * produced an update count. Failures are never results; they surface as {@link QueryException}.
 */
public interface QueryResult {

    /** Leading keyword of the statement ({@code SELECT}, {@code INSERT}, ...) or {@code null}. */
    String command();

    /** Rows as column label to value, in result order. Never null. */
    List<Map<String, Object>> rows();

    long rowCount();

    /** An absent tag means the statement did not complete as expected. */
    default Optional<String> commandTag() {
        return Optional.ofNullable(command());
    }

    default boolean completed() {
        return command() != null;
    }

    default boolean isSelect() {
        return "SELECT".equals(command());
    }

    default Optional<ExportHook> exportHook() {
        return Optional.empty();
    }
}
