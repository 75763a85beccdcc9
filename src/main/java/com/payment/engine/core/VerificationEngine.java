package com.payment.engine.core;

import com.payment.engine.domain.GatewayChargeStatus;
import com.payment.engine.domain.VerificationDetails;
import com.payment.engine.domain.VerificationResult;
import com.payment.engine.exception.InvalidRequestException;
import com.payment.engine.gateway.GatewayCharge;
import com.payment.engine.gateway.PaymentGatewayClient;
import com.payment.engine.messaging.OperatorAlertProducer;
import com.payment.engine.persistence.entity.PaymentEntity;
import com.payment.engine.persistence.service.PaymentRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconciles a live gateway charge against the stored payment without changing the
 * payment's status. The only write is linking the gateway id to a record found through
 * the checkout session fallback.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationEngine {

    /** One minor unit; differences up to and including this are accepted. */
    static final BigDecimal AMOUNT_TOLERANCE = new BigDecimal("0.01");
    static final String EXPECTED_STATUS = "paid";

    private final PaymentGatewayClient gatewayClient;
    private final PaymentRecordStore recordStore;
    private final OperatorAlertProducer alertProducer;

    public VerificationResult getVerificationResult(String gatewayPaymentId) {
        if (gatewayPaymentId == null || gatewayPaymentId.isBlank()) {
            throw new InvalidRequestException("Gateway payment ID is required for verification");
        }

        GatewayCharge charge = gatewayClient.fetchCharge(gatewayPaymentId);

        Optional<PaymentEntity> found = recordStore.findByGatewayPaymentId(gatewayPaymentId);
        if (found.isEmpty()) {
            found = fallbackBySession(gatewayPaymentId, charge);
        }
        if (found.isEmpty()) {
            log.warn("Payment not found in database: gatewayPaymentId={}, searchedBy=gateway_payment_id,session_id",
                    gatewayPaymentId);
            return VerificationResult.builder()
                    .verified(false)
                    .gatewayCharge(charge)
                    .issues(List.of(VerificationResult.ISSUE_NOT_FOUND))
                    .build();
        }
        PaymentEntity payment = found.get();

        List<String> issues = new ArrayList<>();
        GatewayChargeStatus status = charge.chargeStatus();
        boolean statusMatch = status == GatewayChargeStatus.PAID;
        if (!statusMatch) {
            issues.add("Payment status is " + charge.getStatus() + ", expected '" + EXPECTED_STATUS + "'");
        }

        BigDecimal expectedAmount = payment.getAmount();
        BigDecimal actualAmount = reportedAmount(charge.getAmount());
        BigDecimal difference = actualAmount.subtract(expectedAmount).abs();
        boolean amountMatch = difference.compareTo(AMOUNT_TOLERANCE) <= 0;
        if (!amountMatch) {
            issues.add(String.format("Amount mismatch: expected %s %s, got %s %s (difference: %s %s)",
                    expectedAmount.toPlainString(), payment.getCurrency(),
                    actualAmount.toPlainString(), charge.getCurrency(),
                    MoneyConverter.normalize(difference).toPlainString(), payment.getCurrency()));
        }

        boolean currencyMatch = Objects.equals(charge.getCurrency(), payment.getCurrency());
        if (!currencyMatch) {
            issues.add("Currency mismatch: expected " + payment.getCurrency() + ", got " + charge.getCurrency());
        }

        VerificationDetails details = VerificationDetails.builder()
                .statusMatch(statusMatch)
                .amountMatch(amountMatch)
                .currencyMatch(currencyMatch)
                .amountDifference(MoneyConverter.normalize(difference))
                .expectedAmount(expectedAmount)
                .actualAmount(actualAmount)
                .expectedCurrency(payment.getCurrency())
                .actualCurrency(charge.getCurrency())
                .expectedStatus(EXPECTED_STATUS)
                .actualStatus(charge.getStatus())
                .build();

        boolean verified = issues.isEmpty() && statusMatch;
        log.info("Payment verification summary: gatewayPaymentId={}, paymentId={}, statusMatch={}, amountMatch={}, currencyMatch={}, issues={}, verified={}",
                gatewayPaymentId, payment.getPublicId(), statusMatch, amountMatch, currencyMatch, issues.size(), verified);

        VerificationResult.VerificationResultBuilder result = VerificationResult.builder()
                .verified(verified)
                .payment(payment)
                .gatewayCharge(charge)
                .verificationDetails(details);

        if (verified) {
            return result.issues(List.of()).build();
        }
        if (status == GatewayChargeStatus.FAILED) {
            List<String> failedIssues = new ArrayList<>();
            failedIssues.add(VerificationResult.ISSUE_GATEWAY_FAILED);
            failedIssues.addAll(issues);
            log.warn("Payment failed at gateway: paymentId={}, gatewayPaymentId={}, reason={}",
                    payment.getPublicId(), gatewayPaymentId, charge.failureMessage());
            return result.issues(List.copyOf(failedIssues)).build();
        }
        if (statusMatch) {
            log.error("MANUAL_REVIEW_REQUIRED: gateway confirmed payment as paid but verification failed: paymentId={}, gatewayPaymentId={}, issues={}",
                    payment.getPublicId(), gatewayPaymentId, issues);
            alertProducer.publishPaidWithIssues(payment, gatewayPaymentId, issues);
            return result.issues(List.copyOf(issues)).manualReviewRequired(true).build();
        }
        if (status == GatewayChargeStatus.INITIATED || status == GatewayChargeStatus.AUTHORIZED) {
            log.debug("Payment in transitional state: gatewayPaymentId={}, status={}", gatewayPaymentId, charge.getStatus());
        }
        log.warn("Payment verification failed: paymentId={}, gatewayPaymentId={}, issues={}",
                payment.getPublicId(), gatewayPaymentId, issues);
        return result.issues(List.copyOf(issues)).build();
    }

    /** Negative gateway amounts are compared as reported and surface as an amount mismatch. */
    private static BigDecimal reportedAmount(long amountMinor) {
        if (amountMinor < 0) {
            return BigDecimal.valueOf(amountMinor).movePointLeft(2);
        }
        return MoneyConverter.toMajorUnit(amountMinor);
    }

    private Optional<PaymentEntity> fallbackBySession(String gatewayPaymentId, GatewayCharge charge) {
        String sessionId = charge.sessionId();
        if (sessionId == null) {
            return Optional.empty();
        }
        log.info("Primary lookup failed, attempting fallback by session_id: gatewayPaymentId={}, sessionId={}",
                gatewayPaymentId, sessionId);
        Optional<PaymentEntity> bySession = recordStore.findBySessionId(sessionId);
        if (bySession.isEmpty()) {
            return Optional.empty();
        }
        PaymentEntity payment = bySession.get();
        if (payment.getGatewayPaymentId() != null && !payment.getGatewayPaymentId().equals(gatewayPaymentId)) {
            log.warn("Session match belongs to another gateway payment: paymentId={}, linkedGatewayPaymentId={}, gatewayPaymentId={}",
                    payment.getPublicId(), payment.getGatewayPaymentId(), gatewayPaymentId);
            return Optional.empty();
        }
        log.info("Payment found via fallback lookup, linking gateway payment id: paymentId={}, gatewayPaymentId={}",
                payment.getPublicId(), gatewayPaymentId);
        return Optional.of(recordStore.linkGatewayPaymentId(payment.getPublicId(), gatewayPaymentId));
    }
}
