package com.payment.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Recurring charge against the token stored on a subscription. The supplied token must
 * equal the stored one; there is no fallback to the stored value.
 */
@Value
@Builder
public class TokenizedChargeRequest {

    String businessId;
    String subscriptionId;
    String token;
    BigDecimal amount;

    @Builder.Default
    String currency = "SAR";

    String description;
    String callbackUrl;
}
