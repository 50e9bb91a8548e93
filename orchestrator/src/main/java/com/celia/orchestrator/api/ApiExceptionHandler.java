package com.celia.orchestrator.api;

import com.celia.orchestrator.model.ValidationException;
import com.celia.orchestrator.store.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps exceptions to JSON error bodies of the form {@code {"message": ..., "detail": ...}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> validation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, "Invalid request", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        return body(HttpStatus.BAD_REQUEST, "Invalid request", "Malformed JSON body");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(JobNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "Not found", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> status(ResponseStatusException e) {
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        return body(status, status.getReasonPhrase(), e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> unexpected(Exception e) {
        // Framework errors (unknown route, wrong method, ...) keep their own status.
        if (e instanceof ErrorResponse er) {
            HttpStatus status = HttpStatus.valueOf(er.getStatusCode().value());
            return body(status, status.getReasonPhrase(), e.getMessage());
        }
        log.error("Unhandled error: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error occurred.", String.valueOf(e.getMessage()));
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status).body(Map.of(
                "message", message,
                "detail",  detail == null ? "" : detail));
    }
}
