package com.payment.engine.persistence.entity;

import com.payment.engine.domain.PaymentMetadata;
import com.payment.engine.domain.PaymentMethod;
import com.payment.engine.domain.PaymentStatus;
import com.payment.engine.domain.RetryDecision;
import com.payment.engine.exception.InvalidStateException;
import com.payment.engine.exception.RefundExceedsBalanceException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment as the engine knows it. Created PENDING, moved only through the transition
 * methods below, never deleted.
 */
@Entity
@Table(name = "payments", indexes = {
    @Index(name = "idx_payment_public_id", columnList = "public_id", unique = true),
    @Index(name = "idx_payment_gateway_id", columnList = "gateway_payment_id", unique = true),
    @Index(name = "idx_payment_business_id", columnList = "business_id"),
    @Index(name = "idx_payment_subscription_id", columnList = "subscription_id"),
    @Index(name = "idx_payment_session_id", columnList = "session_id"),
    @Index(name = "idx_payment_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEntity {

    private static final String PUBLIC_ID_PREFIX = "pay_";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "public_id", unique = true, nullable = false, updatable = false, length = 32)
    private String publicId;

    @Column(name = "gateway_payment_id", unique = true)
    private String gatewayPaymentId;

    @Column(name = "business_id", nullable = false)
    private String businessId;

    @Column(name = "subscription_id")
    private String subscriptionId;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "refund_amount", precision = 10, scale = 2)
    private BigDecimal refundAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_date")
    private Instant paymentDate;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Builder.Default
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "last_retry_at")
    private Instant lastRetryAt;

    @Column(name = "session_id")
    private String sessionId;

    @Convert(converter = PaymentMetadataConverter.class)
    @Column(name = "metadata", columnDefinition = "text")
    private PaymentMetadata metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (publicId == null) {
            publicId = newPublicId();
        }
        if (status == null) {
            status = PaymentStatus.PENDING;
        }
        if (metadata == null) {
            metadata = new PaymentMetadata();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /** {@code pay_} followed by 24 lowercase hex characters. */
    public static String newPublicId() {
        return PUBLIC_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    public void markPaid(Instant now) {
        transitionTo(PaymentStatus.PAID);
        if (paymentDate == null) {
            paymentDate = now;
        }
    }

    public void markFailed(String reason) {
        transitionTo(PaymentStatus.FAILED);
        if (reason != null) {
            failureReason = reason;
        }
    }

    public void cancel(String reason) {
        transitionTo(PaymentStatus.CANCELLED);
        if (reason != null) {
            failureReason = reason;
        }
    }

    public RetryDecision incrementRetry(Instant now) {
        retryCount++;
        lastRetryAt = now;
        return RetryDecision.forCount(retryCount);
    }

    /**
     * Adds a refund to the running total and moves the payment to REFUNDED.
     * @param refund major-unit amount, or null for the whole remaining balance
     */
    public void applyRefund(BigDecimal refund, Instant now) {
        BigDecimal remaining = remainingRefundable();
        BigDecimal value = refund != null ? refund.setScale(2, RoundingMode.HALF_UP) : remaining;
        if (value.signum() < 0 || value.compareTo(remaining) > 0) {
            throw new RefundExceedsBalanceException(value, remaining, currency);
        }
        transitionTo(PaymentStatus.REFUNDED);
        refundAmount = refundedSoFar().add(value);
        refundedAt = now;
    }

    public void mergeMetadata(PaymentMetadata patch) {
        metadata = (metadata != null ? metadata : new PaymentMetadata()).mergedWith(patch);
    }

    public BigDecimal refundedSoFar() {
        return refundAmount != null ? refundAmount : BigDecimal.ZERO.setScale(2);
    }

    public BigDecimal remainingRefundable() {
        return amount.subtract(refundedSoFar());
    }

    public boolean isFullyRefunded() {
        return refundedSoFar().compareTo(amount) >= 0;
    }

    private void transitionTo(PaymentStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new InvalidStateException("Payment " + publicId + " cannot move from " + status + " to " + target);
        }
        status = target;
    }
}
