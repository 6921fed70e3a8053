package org.pgninja.batch;

import org.pgninja.Futures;
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
import java.util.concurrent.TimeUnit;

/**
 * Dispatches every query of a {@link BatchRequest} without waiting for the others, then joins them into a
 * {@link BatchReport}.
 *
 * <p>A failing item never affects its siblings. Errors in the orchestration itself end up as the report's fatal
 * error: the returned future always completes normally.
 */
public class BatchRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final QueryExecutor executor;
    private final QueryLog queryLog;

    public BatchRunner(QueryExecutor executor, QueryLog queryLog) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.queryLog = queryLog == null ? QueryLog.NOOP : queryLog;
    }

    public CompletableFuture<BatchReport> run(BatchRequest request) {
        int total = request == null ? 0 : request.queries().size();
        BatchReport report = new BatchReport(total);
        try {
            Objects.requireNonNull(request, "request");
            List<Query> queries = request.queries();
            boolean retain = request.retainSuccessRows();

            long start = System.nanoTime();
            CompletableFuture<?>[] items = new CompletableFuture<?>[total];
            for (int i = 0; i < total; i++) {
                items[i] = dispatch(i, queries.get(i), report, retain);
            }

            return CompletableFuture.allOf(items).handle((ignored, err) -> {
                long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                if (err != null) {
                    return fatal(report, Futures.unwrap(err), elapsed);
                }
                try {
                    report.settle(elapsed);
                    queryLog.log("new " + report.getCompletedCount() + "/" + total + " multi-query", Severity.WHITE);
                } catch (RuntimeException e) {
                    return fatal(report, e, elapsed);
                }
                return report;
            });
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(fatal(report, e, 0L));
        }
    }

    private CompletableFuture<Void> dispatch(int index, Query query, BatchReport report, boolean retain) {
        CompletableFuture<QueryResult> fut;
        try {
            fut = executor.execute(query);
        } catch (RuntimeException e) {
            fut = CompletableFuture.failedFuture(e);
        }
        return fut.handle((result, err) -> {
            if (err != null) {
                report.recordFailure(index, query, Futures.unwrap(err));
            } else if (result.rows().isEmpty()) {
                report.recordFailure(index, query, new NoRowsReturnedException(query));
            } else {
                report.recordSuccess(index, result.rows(), retain);
            }
            return null;
        });
    }

    private BatchReport fatal(BatchReport report, Throwable error, long elapsed) {
        report.recordFatal(error);
        report.settle(elapsed);
        try {
            queryLog.log("fatal error of " + report.getTotalCount() + " queries multi-query: " + error.getMessage(), Severity.RED);
        } catch (RuntimeException e) {
            log.warn("Query log sink failed while reporting batch fatal error: {}", e.toString());
        }
        return report;
    }
}
