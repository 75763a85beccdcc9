package com.payment.engine.exception;

/**
 * Operation not allowed in the payment's current status.
 */
public class InvalidStateException extends PaymentEngineException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
