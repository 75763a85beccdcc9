package com.payment.engine.persistence.service;

import com.payment.engine.domain.PaymentMetadata;
import com.payment.engine.domain.PaymentMethod;
import com.payment.engine.domain.PaymentStatus;
import com.payment.engine.domain.RetryDecision;
import com.payment.engine.exception.InvalidStateException;
import com.payment.engine.exception.NotFoundException;
import com.payment.engine.gateway.GatewayCharge;
import com.payment.engine.persistence.entity.PaymentEntity;
import com.payment.engine.persistence.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable payment state. Every mutation loads the row with a write lock, applies one
 * state-machine step and saves, all in one transaction; when the caller already has a
 * transaction open the work joins it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentRecordStore {

    private final PaymentRepository paymentRepository;

    @Transactional
    public PaymentEntity createPending(String businessId,
                                       String subscriptionId,
                                       BigDecimal amount,
                                       String currency,
                                       PaymentMethod paymentMethod,
                                       String sessionId,
                                       PaymentMetadata metadata) {
        PaymentEntity entity = PaymentEntity.builder()
                .publicId(PaymentEntity.newPublicId())
                .businessId(businessId)
                .subscriptionId(subscriptionId)
                .amount(amount)
                .currency(currency)
                .status(PaymentStatus.PENDING)
                .paymentMethod(paymentMethod)
                .sessionId(sessionId)
                .metadata(metadata != null ? metadata : new PaymentMetadata())
                .build();
        PaymentEntity saved = paymentRepository.save(entity);
        log.info("Created pending payment: publicId={}, businessId={}, subscriptionId={}, amount={}, currency={}",
                saved.getPublicId(), businessId, subscriptionId, amount, currency);
        return saved;
    }

    /**
     * Stores the gateway id and the raw create-charge response whatever the charge outcome.
     */
    @Transactional
    public PaymentEntity recordGatewayResponse(String publicId, GatewayCharge charge) {
        PaymentEntity entity = lock(publicId);
        if (charge.getId() != null) {
            assignGatewayId(entity, charge.getId());
        }
        entity.mergeMetadata(PaymentMetadata.builder()
                .transactionId(charge.getId())
                .gatewayCreatedAt(charge.getCreatedAt())
                .gatewayResponse(charge.getRaw())
                .build());
        log.debug("Recorded gateway response: publicId={}, gatewayPaymentId={}, gatewayStatus={}",
                publicId, charge.getId(), charge.getStatus());
        return paymentRepository.save(entity);
    }

    /**
     * @param gatewayChargeId linked only when non-null
     * @param metadataPatch merged key-wise, may be null
     */
    @Transactional
    public PaymentEntity markPaid(String publicId, String gatewayChargeId, PaymentMetadata metadataPatch) {
        PaymentEntity entity = lock(publicId);
        PaymentStatus previous = entity.getStatus();
        entity.markPaid(Instant.now());
        if (gatewayChargeId != null) {
            assignGatewayId(entity, gatewayChargeId);
        }
        if (metadataPatch != null) {
            entity.mergeMetadata(metadataPatch);
        }
        log.info("Payment marked paid: publicId={}, previousStatus={}, paymentDate={}",
                publicId, previous, entity.getPaymentDate());
        return paymentRepository.save(entity);
    }

    @Transactional
    public PaymentEntity markFailed(String publicId, String reason) {
        PaymentEntity entity = lock(publicId);
        entity.markFailed(reason);
        log.info("Payment marked failed: publicId={}, reason={}", publicId, reason);
        return paymentRepository.save(entity);
    }

    @Transactional
    public PaymentEntity incrementRetry(String publicId) {
        PaymentEntity entity = lock(publicId);
        entity.incrementRetry(Instant.now());
        log.debug("Payment retry counted: publicId={}, retryCount={}", publicId, entity.getRetryCount());
        return paymentRepository.save(entity);
    }

    /**
     * Marks a renewal attempt as failed and counts it. The decision tells the caller whether
     * another attempt is allowed.
     */
    @Transactional
    public RetryDecision recordFailedAttempt(String publicId, String reason) {
        PaymentEntity entity = lock(publicId);
        entity.markFailed(reason);
        RetryDecision decision = entity.incrementRetry(Instant.now());
        paymentRepository.save(entity);
        if (!decision.isRetryAllowed()) {
            log.warn("Payment retries exhausted: publicId={}, retryCount={}", publicId, decision.getRetryCount());
        } else {
            log.info("Payment attempt failed: publicId={}, retryCount={}, reason={}",
                    publicId, decision.getRetryCount(), reason);
        }
        return decision;
    }

    /**
     * Adds {@code amount} (or the remaining balance when null) to the refunded total.
     * Balance rules beyond {@code refund_amount <= amount} are the caller's job.
     */
    @Transactional
    public PaymentEntity processRefund(String publicId, BigDecimal amount) {
        PaymentEntity entity = lock(publicId);
        entity.applyRefund(amount, Instant.now());
        log.info("Refund recorded: publicId={}, refundAmount={}, totalAmount={}",
                publicId, entity.getRefundAmount(), entity.getAmount());
        return paymentRepository.save(entity);
    }

    @Transactional
    public PaymentEntity mergeMetadata(String publicId, PaymentMetadata patch) {
        PaymentEntity entity = lock(publicId);
        entity.mergeMetadata(patch);
        return paymentRepository.save(entity);
    }

    @Transactional
    public PaymentEntity linkGatewayPaymentId(String publicId, String gatewayPaymentId) {
        PaymentEntity entity = lock(publicId);
        assignGatewayId(entity, gatewayPaymentId);
        log.info("Linked gateway payment id: publicId={}, gatewayPaymentId={}", publicId, gatewayPaymentId);
        return paymentRepository.save(entity);
    }

    @Transactional
    public PaymentEntity cancel(String publicId, String reason) {
        PaymentEntity entity = lock(publicId);
        entity.cancel(reason);
        log.info("Payment cancelled: publicId={}, reason={}", publicId, reason);
        return paymentRepository.save(entity);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentEntity> findByPublicId(String publicId) {
        return paymentRepository.findByPublicId(publicId);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentEntity> findByGatewayPaymentId(String gatewayPaymentId) {
        return paymentRepository.findByGatewayPaymentId(gatewayPaymentId);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentEntity> findBySessionId(String sessionId) {
        return paymentRepository.findFirstBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    private PaymentEntity lock(String publicId) {
        return paymentRepository.findByPublicIdForUpdate(publicId)
                .orElseThrow(() -> new NotFoundException("Payment not found: " + publicId));
    }

    private void assignGatewayId(PaymentEntity entity, String gatewayPaymentId) {
        if (gatewayPaymentId.equals(entity.getGatewayPaymentId())) {
            return;
        }
        paymentRepository.findByGatewayPaymentId(gatewayPaymentId)
                .filter(other -> !other.getPublicId().equals(entity.getPublicId()))
                .ifPresent(other -> {
                    throw new InvalidStateException("Gateway payment " + gatewayPaymentId
                            + " is already linked to payment " + other.getPublicId());
                });
        entity.setGatewayPaymentId(gatewayPaymentId);
    }
}
