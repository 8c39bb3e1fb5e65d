package com.flagship.revenue_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the ledger error taxonomy onto HTTP:
 * validation 400, not found 404, missing baseline 412, conflict 409,
 * persistence 503, anything else 500.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage(),
                e.getFieldErrors().isEmpty() ? null : e.getFieldErrors());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        log.warn("Request body validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request body is malformed", null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED",
                "Invalid value for '" + e.getName() + "'", Map.of(e.getName(), "Invalid value"));
    }

    @ExceptionHandler(BaselineNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleMissingBaseline(BaselineNotFoundException e) {
        log.warn("Baseline missing: clientId={}", e.getClientId());
        return respond(HttpStatus.PRECONDITION_FAILED, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrencyFailure(ConcurrencyFailureException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "CONFLICT", "Concurrent modification, retry the request", null);
    }

    @ExceptionHandler(LedgerPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(LedgerPersistenceException e) {
        log.error("Ledger store failure: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                  Map<String, String> details) {
        ErrorResponse error = ErrorResponse.builder()
            .error(code)
            .message(message)
            .details(details)
            .timestamp(clock.instant())
            .build();
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
