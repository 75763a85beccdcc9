package com.payment.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One-time charge as requested by checkout. Amount is in the display currency (major unit).
 */
@Value
@Builder
public class ChargeRequest {

    /** Payer account ("business") public id. Required. */
    String businessId;

    /** Subscription the charge belongs to, if any. */
    String subscriptionId;

    /** Amount in major unit (e.g. 99.99 SAR). Must be positive. */
    BigDecimal amount;

    /** ISO 4217 code. */
    @Builder.Default
    String currency = "SAR";

    String description;

    /** 3-D Secure return URL; falls back to the configured default when absent. */
    String callbackUrl;

    /** Card data or token. Required. */
    PaymentSource source;

    /** Checkout session id, echoed back by the gateway and used for fallback lookup. */
    String sessionId;

    @Builder.Default
    PaymentMethod paymentMethod = PaymentMethod.CARD;
}
