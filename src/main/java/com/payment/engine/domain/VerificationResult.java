package com.payment.engine.domain;

import com.payment.engine.gateway.GatewayCharge;
import com.payment.engine.persistence.entity.PaymentEntity;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Reconciliation of a gateway charge against the stored payment. Mismatches are reported
 * as {@code issues}; they are data, not errors.
 */
@Value
@Builder(toBuilder = true)
public class VerificationResult {

    public static final String ISSUE_NOT_FOUND = "Payment record not found in database";
    public static final String ISSUE_GATEWAY_FAILED = "Payment failed at gateway";

    boolean verified;
    /** Local payment, or null when no record matched. */
    PaymentEntity payment;
    GatewayCharge gatewayCharge;
    @Builder.Default
    List<String> issues = List.of();
    /** Null when the payment record was not found. */
    VerificationDetails verificationDetails;
    /**
     * Gateway says paid but local expectations disagree, or the verified outcome cannot be
     * applied to the local record. Never resolved automatically.
     */
    boolean manualReviewRequired;
}
