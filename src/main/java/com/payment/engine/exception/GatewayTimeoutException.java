package com.payment.engine.exception;

/**
 * Gateway call exceeded its deadline. The outcome at the gateway is unknown; a retry must
 * use a new idempotency key.
 */
public class GatewayTimeoutException extends PaymentEngineException {

    public GatewayTimeoutException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_TIMEOUT, message, cause);
    }
}
