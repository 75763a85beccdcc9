package com.payment.engine.api;

import com.payment.engine.exception.ErrorCode;
import com.payment.engine.exception.PaymentEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized error handling for the payment API. Each {@link ErrorCode} maps to one
 * HTTP status; the body is always {@code {"error": CODE, "message": ...}}.
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

    @ExceptionHandler(PaymentEngineException.class)
    public ResponseEntity<Map<String, String>> handlePaymentEngine(PaymentEngineException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Payment request failed: errorCode={}, message={}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.warn("Payment request rejected: errorCode={}, message={}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity
                .status(status)
                .body(Map.of("error", ex.getErrorCode().name(), "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case INVALID_REQUEST:
            case INVALID_AMOUNT:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case TOKEN_MISMATCH:
            case INVALID_STATE:
            case ALREADY_REFUNDED:
                return HttpStatus.CONFLICT;
            case REFUND_EXCEEDS_BALANCE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case GATEWAY_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case AUTHENTICATION_ERROR:
            case GATEWAY_ERROR:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
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
