package com.payment.engine.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Message on the operator alert topic. Every alert needs a human to look at it; none is
 * resolved automatically.
 */
@Value
@Builder
@Jacksonized
public class OperatorAlert {

    public enum AlertType {
        /** Recurring charge attempted with a token other than the stored one. */
        TOKEN_MISMATCH,
        /** Gateway reports paid but amount, currency or local status disagree. */
        PAID_WITH_ISSUES,
        /** Verified gateway outcome cannot be applied to the local record. */
        VERIFICATION_STATE_CONFLICT
    }

    String alertId;
    AlertType type;
    String paymentId;
    String gatewayPaymentId;
    String businessId;
    String subscriptionId;
    String message;
    @Builder.Default
    List<String> issues = List.of();
    Instant timestamp;
}
