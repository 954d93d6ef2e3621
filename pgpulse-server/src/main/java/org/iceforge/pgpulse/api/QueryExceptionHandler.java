package org.iceforge.pgpulse.api;

import org.iceforge.pgpulse.error.QueryError;
import org.iceforge.pgpulse.error.QueryException;
import org.iceforge.pgpulse.pool.ConnectionException;
import org.iceforge.pgpulse.query.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the executor's failure taxonomy to HTTP: validation 400, rejected statement 422 (body is the
 * {@link QueryError}), connection trouble 503.
 */
@RestControllerAdvice
public class QueryExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(QueryExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<QueryApiModels.ErrorResponse> validation(ValidationException e) {
        return ResponseEntity.badRequest().body(new QueryApiModels.ErrorResponse("validation", e.getMessage()));
    }

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<QueryError> query(QueryException e) {
        return ResponseEntity.unprocessableEntity().body(e.error());
    }

    @ExceptionHandler(ConnectionException.class)
    public ResponseEntity<QueryApiModels.ErrorResponse> connection(ConnectionException e) {
        log.warn("Connection failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new QueryApiModels.ErrorResponse("connection", e.getMessage()));
    }
}
