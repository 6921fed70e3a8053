package org.pgninja.query;

import org.pgninja.Futures;
import org.pgninja.connection.ConnectionHandle;
import org.pgninja.export.SpreadsheetExporter;
import org.pgninja.log.QueryLog;
import org.pgninja.log.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one query against the connection handle and normalizes its outcome.
 *
 * <p>Emits exactly one query log event per call: blue on success, yellow on failure. Successful
 * {@code SELECT} results get an {@link ExportHook} bound to the configured {@link SpreadsheetExporter}.
 */
public class QueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final ConnectionHandle handle;
    private final QueryLog queryLog;
    private final SpreadsheetExporter exporter;

    public QueryExecutor(ConnectionHandle handle, QueryLog queryLog, SpreadsheetExporter exporter) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.queryLog = queryLog == null ? QueryLog.NOOP : queryLog;
        this.exporter = exporter;
    }

    /**
     * @return the normalized result; completes exceptionally with {@link QueryException} when the connection
     * reports an error
     */
    public CompletableFuture<QueryResult> execute(Query query) {
        Objects.requireNonNull(query, "query");
        CompletableFuture<QueryResult> raw;
        try {
            raw = handle.query(query.text(), query.params());
        } catch (RuntimeException e) {
            raw = CompletableFuture.failedFuture(e);
        }
        return raw.handle((result, err) -> {
            if (err != null) {
                note("error with query: " + query.text(), Severity.YELLOW);
                throw new QueryException(query, Futures.unwrap(err));
            }
            note("success query: " + query.text(), Severity.BLUE);
            return withExport(result);
        });
    }

    // A failing sink never changes the outcome of the query.
    private void note(String message, Severity severity) {
        try {
            queryLog.log(message, severity);
        } catch (RuntimeException e) {
            log.warn("Query log sink failed for '{}': {}", message, e.toString());
        }
    }

    private QueryResult withExport(QueryResult result) {
        if (exporter != null && result instanceof SelectResult select && select.isSelect()) {
            return select.withExportHook(() -> exporter.export(select.rows()));
        }
        return result;
    }
}
