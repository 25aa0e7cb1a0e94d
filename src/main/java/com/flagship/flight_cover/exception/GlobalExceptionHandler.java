package com.flagship.flight_cover.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_cover.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps cover ledger failures to consistent REST error responses.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(PolicyException.class)
    public ResponseEntity<ErrorResponse> handlePolicyException(PolicyException e) {
        HttpStatus status = statusFor(e);

        if (e.getCategory() == ErrorCategory.TRANSFER) {
            log.error("Operation failed on funds transfer: code={}, message={}", e.getCode(), e.getMessage());
        } else {
            log.warn("Operation rejected: code={}, message={}", e.getCode(), e.getMessage());
        }

        Long policyId = e instanceof PolicyStateException stateError ? stateError.getPolicyId() : null;
        return respond(status, e.getCategory().name(), e.getCode().name(), e.getMessage(), null, policyId);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        return invalidRequest("Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return invalidRequest("Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        return invalidRequest("Request body could not be parsed", null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(DataIntegrityViolationException e) {
        // Concurrent duplicates (idempotency key, second payout row) end up here.
        log.warn("Database constraint rejected the operation: {}", e.getMostSpecificCause().getMessage());

        return respond(HttpStatus.CONFLICT, ErrorCategory.STATE.name(), "CONFLICT",
            "The operation conflicts with a concurrent change; re-read and retry", null, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", "INTERNAL_ERROR",
            "An unexpected error occurred", null, null);
    }

    private ResponseEntity<ErrorResponse> invalidRequest(String message, Map<String, String> details) {
        return respond(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION.name(), ErrorCode.INVALID_REQUEST.name(),
            message, details, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String code, String message,
                                                  Map<String, String> details, Long policyId) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .code(code)
            .message(message)
            .details(details)
            .policyId(policyId)
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(clock.instant())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    private HttpStatus statusFor(PolicyException e) {
        if (e.getCode() == ErrorCode.POLICY_NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        return switch (e.getCategory()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE -> HttpStatus.CONFLICT;
            case RESOURCE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSFER -> HttpStatus.BAD_GATEWAY;
        };
    }

    /**
     * Error body. {@code correlationId} matches the response header and the log
     * lines of the failed request.
     */
    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        @JsonProperty("policy_id")
        Long policyId;
        @JsonProperty("correlation_id")
        String correlationId;
        Instant timestamp;
    }
}
