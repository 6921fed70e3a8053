package org.pgninja.server.api;

import org.pgninja.connection.ConnectionException;
import org.pgninja.export.ExportException;
import org.pgninja.query.QueryException;
import org.pgninja.tx.TransactionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<ApiModels.ErrorView> query(QueryException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiModels.ErrorView(e.getMessage(), causeOf(e), null));
    }

    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<ApiModels.ErrorView> transaction(TransactionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ApiModels.ErrorView(e.getMessage(), causeOf(e), e.isFatal()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiModels.ErrorView> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiModels.ErrorView(e.getMessage(), null, null));
    }

    @ExceptionHandler({ConnectionException.class, IllegalStateException.class})
    public ResponseEntity<ApiModels.ErrorView> unavailable(RuntimeException e) {
        log.warn("Database session unavailable: {}", e.toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiModels.ErrorView(e.getMessage(), causeOf(e), null));
    }

    @ExceptionHandler(ExportException.class)
    public ResponseEntity<ApiModels.ErrorView> export(ExportException e) {
        log.error("Spreadsheet export failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiModels.ErrorView(e.getMessage(), causeOf(e), null));
    }

    private static String causeOf(Throwable e) {
        return e.getCause() == null ? null : e.getCause().getMessage();
    }
}
