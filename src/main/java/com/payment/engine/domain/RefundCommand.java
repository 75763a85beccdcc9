package com.payment.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Refund instruction. A null amount refunds the whole remaining balance.
 */
@Value
@Builder
public class RefundCommand {

    /** Major-unit amount for a partial refund; null for a full refund. */
    BigDecimal amount;

    String description;

    public static RefundCommand full() {
        return RefundCommand.builder().build();
    }
}
