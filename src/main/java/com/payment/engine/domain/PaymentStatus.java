package com.payment.engine.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a locally stored payment. FAILED is retryable and therefore
 * not terminal; PAID, REFUNDED and CANCELLED end the charge side of the lifecycle.
 */
public enum PaymentStatus {
    /** Created locally, gateway outcome not yet final (includes 3-D Secure pending). */
    PENDING,
    /** Money collected. */
    PAID,
    /** Declined or failed verification; may be retried. */
    FAILED,
    /** Fully or partially refunded. */
    REFUNDED,
    /** Cancelled before collection. */
    CANCELLED;

    public boolean canTransitionTo(PaymentStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<PaymentStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(PAID, FAILED, CANCELLED);
            case FAILED:
                return EnumSet.of(FAILED, PAID, CANCELLED);
            case PAID:
                return EnumSet.of(PAID, REFUNDED);
            case REFUNDED:
                return EnumSet.of(REFUNDED);
            default:
                return EnumSet.noneOf(PaymentStatus.class);
        }
    }
}
