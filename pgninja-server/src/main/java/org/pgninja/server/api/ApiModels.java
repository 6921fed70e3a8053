package org.pgninja.server.api;

import org.pgninja.batch.BatchReport;
import org.pgninja.query.Query;
import org.pgninja.query.QueryResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON request and response bodies of the {@code /api/v1} endpoints.
 */
public final class ApiModels {
    private ApiModels() {}

    public record SqlRequest(String sql, List<Object> params) {
        Query toQuery() {
            if (sql == null || sql.isBlank()) {
                throw new IllegalArgumentException("sql is required");
            }
            return new Query(sql, params);
        }
    }

    public record TransactionBody(List<SqlRequest> queries) {}

    public record BatchBody(List<SqlRequest> queries, Boolean retainSuccessRows) {}

    public record ResultView(String commandTag, long rowCount, List<Map<String, Object>> rows) {
        static ResultView of(QueryResult r) {
            return new ResultView(r.command(), r.rowCount(), r.rows());
        }
    }

    public record QueryView(String sql, List<Object> params) {
        static QueryView of(Query q) {
            return new QueryView(q.text(), q.params());
        }
    }

    public record BatchReportView(
            int completedCount,
            int totalCount,
            Map<Integer, List<Map<String, Object>>> successByIndex,
            Map<Integer, QueryView> failureByIndex,
            Map<Integer, String> errorByIndex,
            String fatalError,
            long elapsedMillis,
            boolean overallSuccess
    ) {
        static BatchReportView of(BatchReport report) {
            Map<Integer, QueryView> failures = new LinkedHashMap<>();
            report.getFailureByIndex().forEach((i, q) -> failures.put(i, QueryView.of(q)));
            Map<Integer, String> errors = new LinkedHashMap<>();
            report.getErrorByIndex().forEach((i, e) -> errors.put(i, e.getMessage()));
            return new BatchReportView(
                    report.getCompletedCount(),
                    report.getTotalCount(),
                    report.getSuccessByIndex(),
                    failures,
                    errors,
                    report.getFatalError().map(Throwable::toString).orElse(null),
                    report.getElapsedMillis(),
                    report.isOverallSuccess());
        }
    }

    public record ExportView(String file, long rowCount) {}

    public record ErrorView(String error, String cause, Boolean fatal) {}
}
