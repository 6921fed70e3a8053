package org.pgninja.server.api;

import org.pgninja.Futures;
import org.pgninja.PgNinja;
import org.pgninja.batch.BatchReport;
import org.pgninja.batch.BatchRequest;
import org.pgninja.query.ExportHook;
import org.pgninja.query.Query;
import org.pgninja.query.QueryResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@RestController
@RequestMapping(path = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
public class QueryController {

    private final PgNinja db;

    public QueryController(PgNinja db) {
        this.db = Objects.requireNonNull(db);
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ApiModels.ResultView query(@RequestBody ApiModels.SqlRequest req) {
        return ApiModels.ResultView.of(await(db.query(req.toQuery())));
    }

    @PostMapping(path = "/transaction", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ApiModels.ResultView transaction(@RequestBody ApiModels.TransactionBody body) {
        List<Query> queries = body == null || body.queries() == null ? List.of()
                : body.queries().stream().map(ApiModels.SqlRequest::toQuery).toList();
        return ApiModels.ResultView.of(await(db.transaction(queries)));
    }

    /** Always 200; failures are reported inside the body. */
    @PostMapping(path = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ApiModels.BatchReportView batch(@RequestBody ApiModels.BatchBody body) {
        List<Query> queries = body == null || body.queries() == null ? List.of()
                : body.queries().stream().map(ApiModels.SqlRequest::toQuery).toList();
        boolean retain = body != null && Boolean.TRUE.equals(body.retainSuccessRows());
        BatchReport report = db.multiQuery(BatchRequest.of(queries, retain)).join();
        return ApiModels.BatchReportView.of(report);
    }

    @PostMapping(path = "/query/export", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> export(@RequestBody ApiModels.SqlRequest req) {
        QueryResult result = await(db.query(req.toQuery()));
        Optional<ExportHook> hook = result.exportHook();
        if (hook.isEmpty()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new ApiModels.ErrorView("only SELECT results can be exported", null, null));
        }
        Path file = hook.get().export();
        return ResponseEntity.ok(new ApiModels.ExportView(file.toString(), result.rowCount()));
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = Futures.unwrap(e);
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
