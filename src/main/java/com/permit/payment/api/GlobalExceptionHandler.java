package com.permit.payment.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized error handling for the payment API. Every error is rendered as
 * {@code {"error": CODE, "message": ...}} with the matching status code.
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

    @ExceptionHandler({PaymentValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<Map<String, String>> handleSignature(WebhookSignatureException ex) {
        log.warn("Rejected webhook: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "INVALID_SIGNATURE", "message", "Webhook signature verification failed"));
    }

    /** Risk score and rules stay in the logs; the caller only gets a generic message. */
    @ExceptionHandler(SecurityRejectionException.class)
    public ResponseEntity<Map<String, String>> handleSecurityRejection(SecurityRejectionException ex) {
        log.warn("Payment rejected by velocity check: riskScore={}, violations={}", ex.getRiskScore(), ex.getViolations());
        return ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(Map.of("error", "PAYMENT_REJECTED", "message", SecurityRejectionException.USER_MESSAGE));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, String>> handleRateLimit(RateLimitExceededException ex) {
        long retryAfterSeconds = Math.max(1, ex.getRetryAfter().getSeconds());
        return ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(Map.of("error", "RATE_LIMIT_EXCEEDED", "message", ex.getMessage()));
    }

    @ExceptionHandler(PaymentConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(PaymentConflictException ex) {
        Map<String, String> body = new HashMap<>();
        body.put("error", "PAYMENT_IN_PROGRESS");
        body.put("message", ex.getMessage());
        if (ex.getExistingPaymentIntentId() != null) {
            body.put("paymentIntentId", ex.getExistingPaymentIntentId());
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(PaymentConsistencyException.class)
    public ResponseEntity<Map<String, String>> handleConsistency(PaymentConsistencyException ex) {
        log.error("Payment state conflict surfaced to API: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(Map.of("error", "PAYMENT_STATUS_CONFLICT", "message", ex.getMessage()));
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.warn("Provider unavailable for {}: {}", ex.getOperationClass(), ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "PROVIDER_UNAVAILABLE", "message", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        String message = getMessageOrCause(ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", message));
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
