package com.payment.engine.exception;

/**
 * Missing or invalid orchestrator input. Raised before any record or gateway call.
 */
public class InvalidRequestException extends PaymentEngineException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
