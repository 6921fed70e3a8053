package org.pgninja.tx;

import org.pgninja.Futures;
import org.pgninja.connection.ConnectionHandle;
import org.pgninja.log.QueryLog;
import org.pgninja.log.Severity;
import org.pgninja.query.Query;
import org.pgninja.query.QueryExecutor;
import org.pgninja.query.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs an ordered list of queries as one atomic unit: {@code BEGIN}, each step strictly after the previous
 * one settled, then {@code COMMIT} or {@code ROLLBACK}.
 *
 * <p>The first step without a command tag rolls back and stops the run; later steps are never sent.
 * Transactions submitted to the same coordinator run one after another.
 */
public class TransactionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    static final String BEGIN = "BEGIN";
    static final String COMMIT = "COMMIT";
    static final String ROLLBACK = "ROLLBACK";

    private final ConnectionHandle handle;
    private final QueryExecutor executor;
    private final QueryLog queryLog;

    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    public TransactionCoordinator(ConnectionHandle handle, QueryExecutor executor, QueryLog queryLog) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.queryLog = queryLog == null ? QueryLog.NOOP : queryLog;
    }

    /**
     * @return the result of the last step once committed; completes exceptionally with
     * {@link TransactionException} otherwise
     * @throws IllegalArgumentException if {@code queries} is empty
     */
    public CompletableFuture<QueryResult> run(List<Query> queries) {
        Objects.requireNonNull(queries, "queries");
        if (queries.isEmpty()) {
            throw new IllegalArgumentException("transaction needs at least one query");
        }
        List<Query> steps = List.copyOf(queries);

        synchronized (this) {
            CompletableFuture<QueryResult> result = tail
                    .handle((ignored, err) -> null)
                    .thenCompose(ignored -> runNow(steps));
            tail = result;
            return result;
        }
    }

    private CompletableFuture<QueryResult> runNow(List<Query> steps) {
        int n = steps.size();
        CompletableFuture<QueryResult> out = new CompletableFuture<>();

        control(BEGIN)
                .thenCompose(begun -> step(steps, 0, null))
                .thenCompose(last -> control(COMMIT).thenApply(committed -> last))
                .whenComplete((last, err) -> {
                    if (err == null) {
                        note("success transaction of " + n + " queries", Severity.BLUE);
                        out.complete(last);
                        return;
                    }
                    Throwable cause = Futures.unwrap(err);
                    if (cause instanceof IncompleteStep incomplete) {
                        rollbackIncomplete(incomplete.index, n, out);
                    } else {
                        rollbackFatal(cause, n, out);
                    }
                });
        return out;
    }

    private CompletableFuture<QueryResult> step(List<Query> steps, int i, QueryResult last) {
        if (i == steps.size()) {
            return CompletableFuture.completedFuture(last);
        }
        return executor.execute(steps.get(i)).thenCompose(result -> {
            if (!result.completed()) {
                return CompletableFuture.failedFuture(new IncompleteStep(i));
            }
            return step(steps, i + 1, result);
        });
    }

    private void rollbackIncomplete(int index, int n, CompletableFuture<QueryResult> out) {
        note("failed transaction of " + n + " queries", Severity.YELLOW);
        control(ROLLBACK).whenComplete((r, rbErr) -> {
            if (rbErr != null) {
                rollbackFatal(Futures.unwrap(rbErr), n, out);
            } else {
                out.completeExceptionally(new TransactionException("transaction failed", index));
            }
        });
    }

    private void rollbackFatal(Throwable cause, int n, CompletableFuture<QueryResult> out) {
        String message = "fatal error with transaction of " + n + " queries: " + cause.getMessage();
        note(message, Severity.RED);
        TransactionException failure = new TransactionException(message, cause);
        control(ROLLBACK).whenComplete((r, rbErr) -> {
            if (rbErr != null) {
                Throwable rb = Futures.unwrap(rbErr);
                log.warn("Rollback after failed transaction also failed: {}", rb.toString());
                failure.addSuppressed(rb);
            }
            out.completeExceptionally(failure);
        });
    }

    // A failing sink must not leave the caller's future pending.
    private void note(String message, Severity severity) {
        try {
            queryLog.log(message, severity);
        } catch (RuntimeException e) {
            log.warn("Query log sink failed for '{}': {}", message, e.toString());
        }
    }

    private CompletableFuture<QueryResult> control(String statement) {
        try {
            return handle.query(statement, List.of());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Step completed without a command tag. Never escapes this class. */
    private static final class IncompleteStep extends RuntimeException {
        final int index;

        IncompleteStep(int index) {
            super("step " + index + " did not complete", null, false, false);
            this.index = index;
        }
    }
}
