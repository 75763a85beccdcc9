package com.payment.engine.exception;

/**
 * Any other gateway failure. Carries the gateway's message, error type and HTTP status
 * (0 when no response was received).
 */
public class GatewayException extends PaymentEngineException {

    private final String gatewayMessage;
    private final String errorType;
    private final int httpStatus;

    public GatewayException(String gatewayMessage, String errorType, int httpStatus, Throwable cause) {
        super(ErrorCode.GATEWAY_ERROR, "Moyasar Error: " + gatewayMessage, cause);
        this.gatewayMessage = gatewayMessage;
        this.errorType = errorType;
        this.httpStatus = httpStatus;
    }

    public String getGatewayMessage() {
        return gatewayMessage;
    }

    public String getErrorType() {
        return errorType;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
