package com.payment.engine.exception;

/**
 * Closed set of failure kinds surfaced by the engine. The API layer maps each to an HTTP status.
 */
public enum ErrorCode {
    INVALID_REQUEST,
    INVALID_AMOUNT,
    TOKEN_MISMATCH,
    NOT_FOUND,
    AUTHENTICATION_ERROR,
    GATEWAY_TIMEOUT,
    GATEWAY_ERROR,
    INVALID_STATE,
    ALREADY_REFUNDED,
    REFUND_EXCEEDS_BALANCE
}
