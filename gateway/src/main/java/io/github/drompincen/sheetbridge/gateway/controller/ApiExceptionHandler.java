package io.github.drompincen.sheetbridge.gateway.controller;

import io.github.drompincen.sheetbridge.protocol.api.ApiError;
import io.github.drompincen.sheetbridge.protocol.error.AIProcessingException;
import io.github.drompincen.sheetbridge.protocol.error.IngestionException;
import io.github.drompincen.sheetbridge.protocol.error.RollbackException;
import io.github.drompincen.sheetbridge.protocol.error.SchemaMismatchException;
import io.github.drompincen.sheetbridge.protocol.error.StoreUnavailableException;
import io.github.drompincen.sheetbridge.runtime.rows.RowSourceException;
import io.github.drompincen.sheetbridge.runtime.schema.SchemaValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps failures to an {@link ApiError} body. Raw exception text never reaches the client. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SchemaMismatchException.class)
    ResponseEntity<ApiError> schemaMismatch(SchemaMismatchException e) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "SCHEMA_MISMATCH", e);
    }

    @ExceptionHandler(SchemaValidationException.class)
    ResponseEntity<ApiError> invalidSchema(SchemaValidationException e) {
        return body(HttpStatus.BAD_REQUEST, "INVALID_SCHEMA", e);
    }

    @ExceptionHandler(RowSourceException.class)
    ResponseEntity<ApiError> unreadableSource(RowSourceException e) {
        return body(HttpStatus.BAD_REQUEST, "UNREADABLE_SOURCE", e);
    }

    @ExceptionHandler(AIProcessingException.class)
    ResponseEntity<ApiError> aiFailure(AIProcessingException e) {
        log.warn("Schema proposal failed: {}", e.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "AI_UNAVAILABLE", e);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    ResponseEntity<ApiError> storeUnavailable(StoreUnavailableException e) {
        log.error("Document store unavailable: {}", e.getMessage(), e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", e);
    }

    @ExceptionHandler(RollbackException.class)
    ResponseEntity<ApiError> rollbackFailure(RollbackException e) {
        return body(HttpStatus.CONFLICT, "ROLLBACK_FAILED", e);
    }

    @ExceptionHandler(IngestionException.class)
    ResponseEntity<ApiError> ingestion(IngestionException e) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "INGESTION_ERROR", e);
    }

    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiError.of("INVALID_STATE", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ApiError.of("INVALID_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> unreadableBody(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body", e);
        return ResponseEntity.badRequest().body(ApiError.of("INVALID_REQUEST", "Request body is not valid JSON for this endpoint"));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> unexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.internalServerError().body(ApiError.of("INTERNAL_ERROR", "Unexpected server error"));
    }

    private static ResponseEntity<ApiError> body(HttpStatus status, String code, IngestionException e) {
        return ResponseEntity.status(status).body(new ApiError(code, e.getMessage(), e.getRowNumber(), e.getColumn()));
    }
}
