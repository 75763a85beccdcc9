package com.payment.engine.exception;

/**
 * Root of the engine's error taxonomy. Callers only ever see subclasses of this type;
 * raw transport exceptions are translated at the gateway boundary.
 */
public abstract class PaymentEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    protected PaymentEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected PaymentEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
