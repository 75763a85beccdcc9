package com.payment.engine.domain;

import com.payment.engine.gateway.GatewayCharge;
import com.payment.engine.persistence.entity.PaymentEntity;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a charge attempt. {@code success} is true only when the gateway reported the
 * charge as paid; an initiated 3-D Secure charge reports {@code requiresVerification}.
 */
@Value
@Builder
public class PaymentOutcome {

    boolean success;
    PaymentEntity payment;
    GatewayCharge gatewayCharge;
    boolean requiresVerification;
    /** 3-D Secure redirect, present when {@code requiresVerification} is true. */
    String transactionUrl;
    /** Gateway failure message for declined charges. */
    String error;
}
