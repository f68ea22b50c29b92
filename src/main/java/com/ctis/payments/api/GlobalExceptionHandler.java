package com.ctis.payments.api;

import com.ctis.payments.exception.ConcurrencyConflictException;
import com.ctis.payments.exception.IllegalTransitionException;
import com.ctis.payments.exception.NotFoundException;
import com.ctis.payments.exception.ProviderUnavailableException;
import com.ctis.payments.exception.TransactionExpiredException;
import com.ctis.payments.exception.UnmappedStatusCodeException;
import com.ctis.payments.exception.WebhookSignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP statuses with a {@code {"error", "message"}} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleUnreadable(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request: " + getMessageOrCause(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(IllegalTransitionException.class)
    public ResponseEntity<Map<String, String>> handleIllegalTransition(IllegalTransitionException ex) {
        return error(HttpStatus.CONFLICT, "ILLEGAL_TRANSITION", ex.getMessage());
    }

    @ExceptionHandler(TransactionExpiredException.class)
    public ResponseEntity<Map<String, String>> handleExpired(TransactionExpiredException ex) {
        return error(HttpStatus.CONFLICT, "TRANSACTION_EXPIRED", ex.getMessage());
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<Map<String, String>> handleConcurrency(ConcurrencyConflictException ex) {
        log.warn("Concurrency conflict surfaced to caller: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "CONCURRENT_MODIFICATION", ex.getMessage());
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleProviderUnavailable(ProviderUnavailableException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "PROVIDER_UNAVAILABLE",
                ex.getMessage() != null ? ex.getMessage() : "Payment provider temporarily unavailable. Retry later.");
    }

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<Map<String, String>> handleSignature(WebhookSignatureException ex) {
        return error(HttpStatus.UNAUTHORIZED, "INVALID_SIGNATURE", ex.getMessage());
    }

    @ExceptionHandler(UnmappedStatusCodeException.class)
    public ResponseEntity<Map<String, String>> handleUnmapped(UnmappedStatusCodeException ex) {
        log.error("Unmapped provider status code: gateway={}, code={}", ex.getGatewayType(), ex.getCode());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "UNMAPPED_STATUS_CODE", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", getMessageOrCause(ex));
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity
                .status(status)
                .body(Map.of("error", code, "message", message != null ? message : code));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
