package com.payment.engine.exception;

public class AlreadyRefundedException extends PaymentEngineException {

    public AlreadyRefundedException(String paymentId) {
        super(ErrorCode.ALREADY_REFUNDED, "Payment has already been fully refunded: " + paymentId);
    }
}
