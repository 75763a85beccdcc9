package com.payment.engine.exception;

import java.math.BigDecimal;

/**
 * Requested refund is larger than what is left to refund.
 */
public class RefundExceedsBalanceException extends PaymentEngineException {

    private final BigDecimal requested;
    private final BigDecimal remaining;

    public RefundExceedsBalanceException(BigDecimal requested, BigDecimal remaining, String currency) {
        super(ErrorCode.REFUND_EXCEEDS_BALANCE, String.format("Refund amount %s %s exceeds remaining amount %s %s",
                requested.toPlainString(), currency, remaining.toPlainString(), currency));
        this.requested = requested;
        this.remaining = remaining;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getRemaining() {
        return remaining;
    }
}
