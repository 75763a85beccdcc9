package com.payment.engine.api;

import com.payment.engine.domain.RefundOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * REST API response for a refund.
 */
@Value
@Builder
public class RefundResponseDto {

    boolean success;
    BigDecimal refundedAmount;
    String currency;
    String description;
    String refundedAt;
    String gatewayRefundId;
    PaymentResponseDto payment;

    public static RefundResponseDto from(RefundOutcome outcome) {
        return RefundResponseDto.builder()
                .success(outcome.isSuccess())
                .refundedAmount(outcome.getRefundedAmount())
                .currency(outcome.getCurrency())
                .description(outcome.getDescription())
                .refundedAt(outcome.getRefundedAt())
                .gatewayRefundId(outcome.getGatewayRefund() != null ? outcome.getGatewayRefund().getId() : null)
                .payment(PaymentResponseDto.from(outcome.getPayment()))
                .build();
    }
}
