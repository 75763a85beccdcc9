package com.payment.engine.persistence;

import com.payment.engine.domain.PaymentStatus;
import com.payment.engine.domain.RetryDecision;
import com.payment.engine.exception.InvalidStateException;
import com.payment.engine.exception.RefundExceedsBalanceException;
import com.payment.engine.persistence.entity.PaymentEntity;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentEntityTest {

    private static PaymentEntity payment(PaymentStatus status, String amount) {
        return PaymentEntity.builder()
                .publicId("pay_0123456789abcdef01234567")
                .businessId("biz_1")
                .amount(new BigDecimal(amount))
                .currency("SAR")
                .status(status)
                .build();
    }

    @Test
    void publicIdHasPrefixAndTwentyFourHexChars() {
        assertThat(PaymentEntity.newPublicId()).matches("pay_[0-9a-f]{24}");
        assertThat(PaymentEntity.newPublicId()).isNotEqualTo(PaymentEntity.newPublicId());
    }

    @Test
    void markPaidSetsPaymentDateOnceAndIsIdempotent() {
        PaymentEntity entity = payment(PaymentStatus.PENDING, "99.99");
        Instant first = Instant.parse("2026-01-01T10:00:00Z");

        entity.markPaid(first);
        entity.markPaid(Instant.parse("2026-01-02T10:00:00Z"));

        assertThat(entity.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(entity.getPaymentDate()).isEqualTo(first);
    }

    @Test
    void disallowedTransitionLeavesEntityUnchanged() {
        PaymentEntity entity = payment(PaymentStatus.CANCELLED, "50.00");

        assertThatThrownBy(() -> entity.markPaid(Instant.now()))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("CANCELLED");
        assertThat(entity.getStatus()).isEqualTo(PaymentStatus.CANCELLED);
        assertThat(entity.getPaymentDate()).isNull();

        PaymentEntity paid = payment(PaymentStatus.PAID, "50.00");
        assertThatThrownBy(() -> paid.markFailed("late decline")).isInstanceOf(InvalidStateException.class);
        assertThat(paid.getFailureReason()).isNull();
    }

    @Test
    void markFailedKeepsRetryCount() {
        PaymentEntity entity = payment(PaymentStatus.PENDING, "10.00");
        entity.setRetryCount(2);

        entity.markFailed("Insufficient funds");

        assertThat(entity.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(entity.getFailureReason()).isEqualTo("Insufficient funds");
        assertThat(entity.getRetryCount()).isEqualTo(2);
    }

    @Test
    void retriesStopAfterThreeAttempts() {
        PaymentEntity entity = payment(PaymentStatus.FAILED, "10.00");

        entity.incrementRetry(Instant.now());
        entity.incrementRetry(Instant.now());
        RetryDecision third = entity.incrementRetry(Instant.now());

        assertThat(third.getRetryCount()).isEqualTo(3);
        assertThat(third.isRetryAllowed()).isFalse();
        assertThat(entity.getLastRetryAt()).isNotNull();
    }

    @Test
    void refundsAccumulateUntilFullAmount() {
        PaymentEntity entity = payment(PaymentStatus.PAID, "200.00");

        entity.applyRefund(new BigDecimal("80.00"), Instant.now());
        assertThat(entity.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(entity.getRefundAmount()).isEqualByComparingTo("80.00");
        assertThat(entity.remainingRefundable()).isEqualByComparingTo("120.00");
        assertThat(entity.isFullyRefunded()).isFalse();

        entity.applyRefund(null, Instant.now());
        assertThat(entity.getRefundAmount()).isEqualByComparingTo("200.00");
        assertThat(entity.isFullyRefunded()).isTrue();
        assertThat(entity.getRefundedAt()).isNotNull();
    }

    @Test
    void refundAboveRemainingIsRejected() {
        PaymentEntity entity = payment(PaymentStatus.PAID, "100.00");
        entity.applyRefund(new BigDecimal("60.00"), Instant.now());

        assertThatThrownBy(() -> entity.applyRefund(new BigDecimal("40.01"), Instant.now()))
                .isInstanceOf(RefundExceedsBalanceException.class);
        assertThat(entity.getRefundAmount()).isEqualByComparingTo("60.00");
    }

    @Test
    void refundRequiresPaidPayment() {
        PaymentEntity entity = payment(PaymentStatus.PENDING, "100.00");

        assertThatThrownBy(() -> entity.applyRefund(null, Instant.now()))
                .isInstanceOf(InvalidStateException.class);
        assertThat(entity.getRefundAmount()).isNull();
    }

    @Test
    void cancelOnlyFromPendingOrFailed() {
        PaymentEntity pending = payment(PaymentStatus.PENDING, "10.00");
        pending.cancel("checkout abandoned");
        assertThat(pending.getStatus()).isEqualTo(PaymentStatus.CANCELLED);

        PaymentEntity paid = payment(PaymentStatus.PAID, "10.00");
        assertThatThrownBy(() -> paid.cancel(null)).isInstanceOf(InvalidStateException.class);
    }
}
