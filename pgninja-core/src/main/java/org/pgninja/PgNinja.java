package org.pgninja;

import org.pgninja.batch.BatchReport;
import org.pgninja.batch.BatchRequest;
import org.pgninja.batch.BatchRunner;
import org.pgninja.connection.ConnectionException;
import org.pgninja.connection.ConnectionHandle;
import org.pgninja.connection.ConnectionSettings;
import org.pgninja.connection.JdbcConnectionHandle;
import org.pgninja.export.PoiSpreadsheetExporter;
import org.pgninja.export.SpreadsheetExporter;
import org.pgninja.log.QueryLog;
import org.pgninja.log.Severity;
import org.pgninja.log.Slf4jQueryLog;
import org.pgninja.query.Query;
import org.pgninja.query.QueryExecutor;
import org.pgninja.query.QueryResult;
import org.pgninja.tx.TransactionCoordinator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point: one connection handle with a query executor, a transaction coordinator and a batch runner on
 * top of it.
 *
 * <pre>{@code
 * try (PgNinja db = PgNinja.builder().settings(ConnectionSettings.of(url, user, pass)).build()) {
 *     db.connect().join();
 *     QueryResult r = db.query("SELECT * FROM t WHERE id = ?", 1).join();
 *     db.transaction(List.of(Query.of("INSERT INTO t VALUES (?)", 1), Query.of("INSERT INTO t VALUES (?)", 2))).join();
 *     BatchReport report = db.multiQuery(BatchRequest.of(queries, true)).join();
 * }
 * }</pre>
 * Everything runs on the same session. Transactions are serialized among themselves, but a batch or plain
 * query issued while a transaction is open executes inside it.
 */
public class PgNinja implements AutoCloseable {

    private final ConnectionHandle handle;
    private final QueryLog queryLog;
    private final QueryExecutor executor;
    private final TransactionCoordinator transactions;
    private final BatchRunner batches;

    private PgNinja(ConnectionHandle handle, QueryLog queryLog, SpreadsheetExporter exporter) {
        this.handle = handle;
        this.queryLog = queryLog;
        this.executor = new QueryExecutor(handle, queryLog, exporter);
        this.transactions = new TransactionCoordinator(handle, executor, queryLog);
        this.batches = new BatchRunner(executor, queryLog);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Opens the session. Completes exceptionally with {@link ConnectionException}; the failure is not retried.
     */
    public CompletableFuture<Void> connect() {
        return handle.connect().handle((ok, err) -> {
            if (err != null) {
                Throwable cause = Futures.unwrap(err);
                queryLog.log("Error connecting to the database: " + cause.getMessage(), Severity.RED);
                throw cause instanceof ConnectionException ce ? ce : new ConnectionException(cause.getMessage(), cause);
            }
            queryLog.log("successfully connected to the database", Severity.GREEN);
            return null;
        });
    }

    public CompletableFuture<QueryResult> query(String text, Object... params) {
        return executor.execute(Query.of(text, params));
    }

    public CompletableFuture<QueryResult> query(Query query) {
        return executor.execute(query);
    }

    public CompletableFuture<QueryResult> transaction(List<Query> queries) {
        return transactions.run(queries);
    }

    /**
     * Pairs {@code texts[i]} with {@code bodies[i]}; a missing or null body means no parameters.
     */
    public CompletableFuture<QueryResult> transaction(List<String> texts, List<List<Object>> bodies) {
        Objects.requireNonNull(texts, "texts");
        List<Query> queries = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            List<Object> body = bodies != null && i < bodies.size() ? bodies.get(i) : null;
            queries.add(new Query(texts.get(i), body));
        }
        return transactions.run(queries);
    }

    /** Never completes exceptionally; inspect {@link BatchReport#isOverallSuccess()}. */
    public CompletableFuture<BatchReport> multiQuery(BatchRequest request) {
        return batches.run(request);
    }

    public CompletableFuture<BatchReport> multiQuery(List<Query> queries, boolean retainSuccessRows) {
        return batches.run(BatchRequest.of(queries, retainSuccessRows));
    }

    /** Terminates the connection. No further calls are valid afterwards. */
    public void end() {
        handle.end();
    }

    @Override
    public void close() {
        end();
    }

    public static final class Builder {
        private ConnectionHandle handle;
        private ConnectionSettings settings;
        private boolean logEnabled = true;
        private boolean logColors = true;
        private QueryLog queryLog;
        private SpreadsheetExporter exporter;

        private Builder() {}

        public Builder settings(ConnectionSettings settings) {
            this.settings = settings;
            return this;
        }

        /** Use an already constructed handle instead of a {@link JdbcConnectionHandle}. */
        public Builder handle(ConnectionHandle handle) {
            this.handle = handle;
            return this;
        }

        public Builder log(boolean enabled) {
            this.logEnabled = enabled;
            return this;
        }

        public Builder logColors(boolean colors) {
            this.logColors = colors;
            return this;
        }

        /** Replaces the default SLF4J sink; {@link #log(boolean)} is then ignored. */
        public Builder queryLog(QueryLog queryLog) {
            this.queryLog = queryLog;
            return this;
        }

        public Builder exporter(SpreadsheetExporter exporter) {
            this.exporter = exporter;
            return this;
        }

        public Builder exportDirectory(Path directory) {
            this.exporter = new PoiSpreadsheetExporter(directory);
            return this;
        }

        public PgNinja build() {
            ConnectionHandle h = handle;
            if (h == null) {
                h = new JdbcConnectionHandle(Objects.requireNonNull(settings, "settings or handle is required"));
            }
            QueryLog sink = queryLog != null ? queryLog : new Slf4jQueryLog(logEnabled, logColors);
            SpreadsheetExporter ex = exporter != null ? exporter
                    : new PoiSpreadsheetExporter(Path.of(System.getProperty("java.io.tmpdir"), "pgninja-export"));
            return new PgNinja(h, sink, ex);
        }
    }
}
