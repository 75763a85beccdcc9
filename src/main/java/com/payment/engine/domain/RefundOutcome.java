package com.payment.engine.domain;

import com.payment.engine.gateway.GatewayRefund;
import com.payment.engine.persistence.entity.PaymentEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RefundOutcome {

    boolean success;
    PaymentEntity payment;
    /** Major-unit amount recorded by this refund. */
    BigDecimal refundedAmount;
    String currency;
    String description;
    String refundedAt;
    GatewayRefund gatewayRefund;
}
