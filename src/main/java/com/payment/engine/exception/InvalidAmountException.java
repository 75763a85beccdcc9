package com.payment.engine.exception;

/**
 * Null, negative or out-of-range monetary value at the conversion boundary.
 */
public class InvalidAmountException extends PaymentEngineException {

    public InvalidAmountException(String message) {
        super(ErrorCode.INVALID_AMOUNT, message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(ErrorCode.INVALID_AMOUNT, message, cause);
    }
}
