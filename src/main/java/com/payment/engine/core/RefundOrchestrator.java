package com.payment.engine.core;

import com.payment.engine.compliance.ComplianceAuditLogger;
import com.payment.engine.domain.PaymentMetadata;
import com.payment.engine.domain.PaymentStatus;
import com.payment.engine.domain.RefundCommand;
import com.payment.engine.domain.RefundOutcome;
import com.payment.engine.exception.AlreadyRefundedException;
import com.payment.engine.exception.InvalidRequestException;
import com.payment.engine.exception.InvalidStateException;
import com.payment.engine.exception.NotFoundException;
import com.payment.engine.exception.RefundExceedsBalanceException;
import com.payment.engine.gateway.GatewayRefund;
import com.payment.engine.gateway.PaymentGatewayClient;
import com.payment.engine.persistence.entity.PaymentEntity;
import com.payment.engine.persistence.service.PaymentRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Orchestrates refunds: balance validation against the running refunded total, the
 * gateway refund call and the store update. Several partial refunds may follow each
 * other until nothing is left.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundOrchestrator {

    static final String DEFAULT_DESCRIPTION = "Refund processed";

    private final PaymentRecordStore recordStore;
    private final PaymentGatewayClient gatewayClient;
    private final ComplianceAuditLogger auditLogger;

    public RefundOutcome refundPayment(String gatewayPaymentId, RefundCommand command) {
        if (gatewayPaymentId == null || gatewayPaymentId.isBlank()) {
            throw new InvalidRequestException("Gateway payment ID is required for refund");
        }
        RefundCommand refund = command != null ? command : RefundCommand.full();
        if (refund.getAmount() != null && MoneyConverter.normalize(refund.getAmount()).signum() <= 0) {
            throw new InvalidRequestException("Refund amount must be a positive number");
        }

        PaymentEntity payment = recordStore.findByGatewayPaymentId(gatewayPaymentId)
                .orElseThrow(() -> new NotFoundException("Payment not found for gateway payment " + gatewayPaymentId));

        log.info("Executing refund: paymentId={}, gatewayPaymentId={}, amount={}, alreadyRefunded={}",
                payment.getPublicId(), gatewayPaymentId,
                refund.getAmount() != null ? refund.getAmount() : "full", payment.refundedSoFar());

        if (payment.getStatus() != PaymentStatus.PAID && payment.getStatus() != PaymentStatus.REFUNDED) {
            log.error("Refund rejected, payment not refundable: paymentId={}, status={}",
                    payment.getPublicId(), payment.getStatus());
            throw new InvalidStateException("Cannot refund payment with status " + payment.getStatus()
                    + ". Only paid payments can be refunded.");
        }
        if (payment.isFullyRefunded()) {
            log.error("Refund rejected, already fully refunded: paymentId={}, refundAmount={}",
                    payment.getPublicId(), payment.getRefundAmount());
            throw new AlreadyRefundedException(payment.getPublicId());
        }

        BigDecimal remaining = payment.remainingRefundable();
        BigDecimal refundValue;
        Long amountMinor;
        if (refund.getAmount() != null) {
            BigDecimal requested = MoneyConverter.normalize(refund.getAmount());
            if (requested.compareTo(remaining) > 0) {
                log.error("Refund exceeds balance: paymentId={}, requested={}, remaining={}",
                        payment.getPublicId(), requested, remaining);
                throw new RefundExceedsBalanceException(requested, remaining, payment.getCurrency());
            }
            refundValue = requested;
            amountMinor = MoneyConverter.toMinorUnit(requested);
        } else {
            refundValue = remaining;
            amountMinor = null;
        }

        String description = refund.getDescription() != null ? refund.getDescription() : DEFAULT_DESCRIPTION;
        GatewayRefund gatewayRefund = gatewayClient.createRefund(gatewayPaymentId, amountMinor, description);

        recordStore.processRefund(payment.getPublicId(), refundValue);
        PaymentEntity updated = recordStore.mergeMetadata(payment.getPublicId(), PaymentMetadata.builder()
                .refundId(gatewayRefund.getId())
                .refundDescription(description)
                .gatewayRefundedAt(gatewayRefund.getRefundedAt())
                .refundResponse(gatewayRefund.getRaw())
                .build());

        log.info("Refund processed: paymentId={}, gatewayPaymentId={}, refunded={}, totalRefunded={}, status={}",
                updated.getPublicId(), gatewayPaymentId, refundValue, updated.getRefundAmount(), updated.getStatus());

        RefundOutcome outcome = RefundOutcome.builder()
                .success(true)
                .payment(updated)
                .refundedAmount(refundValue)
                .currency(updated.getCurrency())
                .description(description)
                .refundedAt(gatewayRefund.getRefundedAt())
                .gatewayRefund(gatewayRefund)
                .build();
        auditLogger.logRefund(outcome);
        return outcome;
    }
}
