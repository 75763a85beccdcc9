package com.payment.engine.api;

import com.payment.engine.domain.RefundCommand;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;

/**
 * REST API request body for refunding a payment.
 */
@Data
public class RefundRequestDto {

    /** Amount to refund. If null, refunds everything not yet refunded. */
    @DecimalMin(value = "0.01", message = "amount must be at least 0.01")
    private BigDecimal amount;

    private String description;

    public RefundCommand toRefundCommand() {
        return RefundCommand.builder()
                .amount(amount)
                .description(description)
                .build();
    }
}
