package com.payment.engine.api;

import com.payment.engine.domain.VerificationDetails;
import com.payment.engine.domain.VerificationResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VerificationResponseDto {

    boolean verified;
    boolean manualReviewRequired;
    List<String> issues;
    String gatewayPaymentId;
    String gatewayStatus;
    VerificationDetails verificationDetails;
    PaymentResponseDto payment;

    public static VerificationResponseDto from(VerificationResult result) {
        return VerificationResponseDto.builder()
                .verified(result.isVerified())
                .manualReviewRequired(result.isManualReviewRequired())
                .issues(result.getIssues())
                .gatewayPaymentId(result.getGatewayCharge() != null ? result.getGatewayCharge().getId() : null)
                .gatewayStatus(result.getGatewayCharge() != null ? result.getGatewayCharge().getStatus() : null)
                .verificationDetails(result.getVerificationDetails())
                .payment(PaymentResponseDto.from(result.getPayment()))
                .build();
    }
}
