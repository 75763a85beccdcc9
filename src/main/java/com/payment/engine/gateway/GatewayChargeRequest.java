package com.payment.engine.gateway;

import com.payment.engine.domain.PaymentSource;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Body of a create-charge call. {@code givenId} is the idempotency key; the gateway
 * returns the existing charge when it sees the same value twice.
 */
@Value
@Builder
public class GatewayChargeRequest {

    String givenId;
    /** Minor unit. */
    long amount;
    String currency;
    String description;
    String callbackUrl;
    PaymentSource source;
    Map<String, String> metadata;
}
