package com.payment.engine.exception;

/**
 * Gateway rejected our credentials. Operator-actionable; retrying with the same key is pointless.
 */
public class GatewayAuthenticationException extends PaymentEngineException {

    private final int httpStatus;

    public GatewayAuthenticationException(String message, int httpStatus, Throwable cause) {
        super(ErrorCode.AUTHENTICATION_ERROR, message, cause);
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
