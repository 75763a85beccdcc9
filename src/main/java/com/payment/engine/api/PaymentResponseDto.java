package com.payment.engine.api;

import com.payment.engine.domain.PaymentMethod;
import com.payment.engine.domain.PaymentStatus;
import com.payment.engine.persistence.entity.PaymentEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * REST API view of a stored payment. Gateway payloads and tokens are not exposed.
 */
@Value
@Builder
public class PaymentResponseDto {

    String paymentId;
    String gatewayPaymentId;
    String businessId;
    String subscriptionId;
    PaymentStatus status;
    BigDecimal amount;
    String currency;
    BigDecimal refundAmount;
    PaymentMethod paymentMethod;
    Instant paymentDate;
    String failureReason;
    Instant refundedAt;
    int retryCount;
    Instant createdAt;
    Instant updatedAt;

    public static PaymentResponseDto from(PaymentEntity payment) {
        if (payment == null) {
            return null;
        }
        return PaymentResponseDto.builder()
                .paymentId(payment.getPublicId())
                .gatewayPaymentId(payment.getGatewayPaymentId())
                .businessId(payment.getBusinessId())
                .subscriptionId(payment.getSubscriptionId())
                .status(payment.getStatus())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .refundAmount(payment.getRefundAmount())
                .paymentMethod(payment.getPaymentMethod())
                .paymentDate(payment.getPaymentDate())
                .failureReason(payment.getFailureReason())
                .refundedAt(payment.getRefundedAt())
                .retryCount(payment.getRetryCount())
                .createdAt(payment.getCreatedAt())
                .updatedAt(payment.getUpdatedAt())
                .build();
    }
}
