package com.payment.engine.exception;

/**
 * Supplied token differs from the one stored on the subscription. Always fatal.
 */
public class TokenMismatchException extends PaymentEngineException {

    private final String subscriptionId;

    public TokenMismatchException(String subscriptionId) {
        super(ErrorCode.TOKEN_MISMATCH, "Token mismatch for subscription " + subscriptionId
                + ". Provided token does not match stored payment method.");
        this.subscriptionId = subscriptionId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }
}
