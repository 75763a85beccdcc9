package com.payment.engine.api;

import com.payment.engine.domain.PaymentOutcome;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response for a charge. {@code requiresVerification} means the client must send
 * the payer to {@code transactionUrl} and verify afterwards.
 */
@Value
@Builder
public class ChargeResponseDto {

    boolean success;
    boolean requiresVerification;
    String transactionUrl;
    String error;
    String gatewayStatus;
    PaymentResponseDto payment;

    public static ChargeResponseDto from(PaymentOutcome outcome) {
        return ChargeResponseDto.builder()
                .success(outcome.isSuccess())
                .requiresVerification(outcome.isRequiresVerification())
                .transactionUrl(outcome.getTransactionUrl())
                .error(outcome.getError())
                .gatewayStatus(outcome.getGatewayCharge() != null ? outcome.getGatewayCharge().getStatus() : null)
                .payment(PaymentResponseDto.from(outcome.getPayment()))
                .build();
    }
}
