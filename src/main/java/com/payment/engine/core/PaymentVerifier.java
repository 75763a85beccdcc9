package com.payment.engine.core;

import com.payment.engine.compliance.ComplianceAuditLogger;
import com.payment.engine.domain.GatewayChargeStatus;
import com.payment.engine.domain.PaymentMetadata;
import com.payment.engine.domain.PaymentStatus;
import com.payment.engine.domain.VerificationResult;
import com.payment.engine.gateway.GatewayCharge;
import com.payment.engine.messaging.OperatorAlertProducer;
import com.payment.engine.persistence.entity.PaymentEntity;
import com.payment.engine.persistence.service.PaymentRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Verification with side effects, used after the 3-D Secure redirect: a verified charge
 * marks the payment paid, a charge failed at the gateway marks it failed. Outcomes the
 * local record cannot take are left for an operator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentVerifier {

    private final VerificationEngine verificationEngine;
    private final PaymentRecordStore recordStore;
    private final OperatorAlertProducer alertProducer;
    private final ComplianceAuditLogger auditLogger;

    public VerificationResult verifyPayment(String gatewayPaymentId) {
        log.debug("Verifying gateway payment with side effects: gatewayPaymentId={}", gatewayPaymentId);
        VerificationResult result = apply(gatewayPaymentId, verificationEngine.getVerificationResult(gatewayPaymentId));
        auditLogger.logVerification(gatewayPaymentId, result);
        return result;
    }

    private VerificationResult apply(String gatewayPaymentId, VerificationResult result) {
        PaymentEntity payment = result.getPayment();
        if (payment == null) {
            return result;
        }
        GatewayCharge charge = result.getGatewayCharge();

        if (result.isVerified()) {
            if (!payment.getStatus().canTransitionTo(PaymentStatus.PAID)) {
                return conflict(gatewayPaymentId, result, PaymentStatus.PAID);
            }
            PaymentEntity updated = recordStore.markPaid(payment.getPublicId(), null, PaymentMetadata.builder()
                    .transactionId(charge.getId())
                    .gatewayCreatedAt(charge.getCreatedAt())
                    .verification(result.getVerificationDetails())
                    .verificationSnapshot(charge.getRaw())
                    .verifiedAt(Instant.now())
                    .build());
            log.info("Payment verified and marked as paid: paymentId={}, gatewayPaymentId={}",
                    updated.getPublicId(), gatewayPaymentId);
            return result.toBuilder().payment(updated).build();
        }

        if (charge.chargeStatus() == GatewayChargeStatus.FAILED) {
            if (!payment.getStatus().canTransitionTo(PaymentStatus.FAILED)) {
                return conflict(gatewayPaymentId, result, PaymentStatus.FAILED);
            }
            String reason = charge.failureMessage() != null
                    ? charge.failureMessage()
                    : VerificationResult.ISSUE_GATEWAY_FAILED;
            PaymentEntity updated = recordStore.markFailed(payment.getPublicId(), reason);
            log.warn("Payment verification failed, payment failed at gateway: paymentId={}, gatewayPaymentId={}, reason={}",
                    updated.getPublicId(), gatewayPaymentId, reason);
            return result.toBuilder().payment(updated).build();
        }

        return result;
    }

    private VerificationResult conflict(String gatewayPaymentId, VerificationResult result, PaymentStatus target) {
        PaymentEntity payment = result.getPayment();
        String message = "Local payment status " + payment.getStatus() + " does not allow transition to " + target;
        log.error("MANUAL_REVIEW_REQUIRED: verified outcome cannot be applied: paymentId={}, gatewayPaymentId={}, localStatus={}, target={}",
                payment.getPublicId(), gatewayPaymentId, payment.getStatus(), target);
        alertProducer.publishStateConflict(payment, gatewayPaymentId, message);

        List<String> issues = new ArrayList<>(result.getIssues());
        issues.add(message);
        return result.toBuilder()
                .verified(false)
                .issues(List.copyOf(issues))
                .manualReviewRequired(true)
                .build();
    }
}
