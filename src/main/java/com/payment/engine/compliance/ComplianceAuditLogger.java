package com.payment.engine.compliance;

import com.payment.engine.domain.PaymentOutcome;
import com.payment.engine.domain.RefundOutcome;
import com.payment.engine.domain.VerificationResult;
import com.payment.engine.persistence.entity.PaymentEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes one {@code [AUDIT]} line per charge, verification and refund. Card data and
 * tokens never reach these lines.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logChargeRequest(PaymentEntity payment, String idempotencyKey, String sourceType) {
        log.info("[AUDIT] CHARGE_REQUEST paymentId={} idempotencyKey={} businessId={} subscriptionId={} amount={} currency={} sourceType={}",
                payment.getPublicId(),
                idempotencyKey,
                payment.getBusinessId(),
                payment.getSubscriptionId(),
                payment.getAmount(),
                payment.getCurrency(),
                sourceType);
    }

    public void logChargeResult(PaymentOutcome outcome) {
        PaymentEntity payment = outcome.getPayment();
        log.info("[AUDIT] CHARGE_RESULT paymentId={} gatewayPaymentId={} status={} success={} requiresVerification={} error={}",
                payment.getPublicId(),
                payment.getGatewayPaymentId(),
                payment.getStatus(),
                outcome.isSuccess(),
                outcome.isRequiresVerification(),
                outcome.getError());
    }

    public void logChargeError(PaymentEntity payment, String errorCode, String message) {
        log.info("[AUDIT] CHARGE_ERROR paymentId={} errorCode={} message={}",
                payment.getPublicId(), errorCode, message);
    }

    public void logVerification(String gatewayPaymentId, VerificationResult result) {
        log.info("[AUDIT] VERIFICATION gatewayPaymentId={} paymentId={} verified={} manualReview={} issues={}",
                gatewayPaymentId,
                result.getPayment() != null ? result.getPayment().getPublicId() : null,
                result.isVerified(),
                result.isManualReviewRequired(),
                result.getIssues().size());
    }

    public void logRefund(RefundOutcome outcome) {
        log.info("[AUDIT] REFUND paymentId={} gatewayPaymentId={} refunded={} currency={} totalRefunded={} status={}",
                outcome.getPayment().getPublicId(),
                outcome.getPayment().getGatewayPaymentId(),
                outcome.getRefundedAmount(),
                outcome.getCurrency(),
                outcome.getPayment().getRefundAmount(),
                outcome.getPayment().getStatus());
    }
}
