package com.payment.engine.domain;

/**
 * Payment instrument used for a charge. Unknown until the charge is created.
 */
public enum PaymentMethod {
    CARD,
    APPLE_PAY,
    STC_PAY
}
