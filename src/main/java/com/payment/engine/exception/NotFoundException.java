package com.payment.engine.exception;

/**
 * Referenced payment, subscription or gateway charge does not exist.
 */
public class NotFoundException extends PaymentEngineException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, message, cause);
    }
}
