package com.payment.engine.core;

import com.payment.engine.compliance.ComplianceAuditLogger;
import com.payment.engine.compliance.SensitiveDataMasker;
import com.payment.engine.domain.ChargeRequest;
import com.payment.engine.domain.PaymentMetadata;
import com.payment.engine.domain.PaymentMethod;
import com.payment.engine.domain.PaymentOutcome;
import com.payment.engine.domain.PaymentSource;
import com.payment.engine.domain.TokenSource;
import com.payment.engine.domain.TokenizedChargeRequest;
import com.payment.engine.exception.GatewayTimeoutException;
import com.payment.engine.exception.InvalidRequestException;
import com.payment.engine.exception.NotFoundException;
import com.payment.engine.exception.PaymentEngineException;
import com.payment.engine.exception.TokenMismatchException;
import com.payment.engine.gateway.GatewayCharge;
import com.payment.engine.gateway.GatewayChargeRequest;
import com.payment.engine.gateway.MoyasarProperties;
import com.payment.engine.gateway.PaymentGatewayClient;
import com.payment.engine.messaging.OperatorAlertProducer;
import com.payment.engine.persistence.entity.PaymentEntity;
import com.payment.engine.persistence.entity.SubscriptionEntity;
import com.payment.engine.persistence.repository.SubscriptionRepository;
import com.payment.engine.persistence.service.PaymentRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Charges through the gateway: validation, pending record, create-charge call and
 * bookkeeping of the outcome. A fresh idempotency key is generated for every call, so a
 * caller retry never collides with an earlier attempt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChargeOrchestrator {

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");
    /** Largest value the payments.amount column (precision 10, scale 2) holds. */
    static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999.99");

    private final PaymentRecordStore recordStore;
    private final SubscriptionRepository subscriptionRepository;
    private final PaymentGatewayClient gatewayClient;
    private final MoyasarProperties moyasarProperties;
    private final OperatorAlertProducer alertProducer;
    private final ComplianceAuditLogger auditLogger;

    /**
     * One-time charge with card data or a wallet token collected at checkout.
     */
    public PaymentOutcome createPayment(ChargeRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Charge request is required");
        }
        requireText(request.getBusinessId(), "Business ID is required");
        BigDecimal amount = requirePositiveAmount(request.getAmount());
        String currency = requireCurrency(request.getCurrency());
        if (request.getSource() == null) {
            throw new InvalidRequestException("Payment source is required");
        }
        String callbackUrl = resolveCallbackUrl(request.getCallbackUrl());
        String description = request.getDescription() != null
                ? request.getDescription()
                : "Subscription payment for business " + request.getBusinessId();

        PaymentMetadata metadata = PaymentMetadata.builder()
                .gateway(PaymentMetadata.GATEWAY_MOYASAR)
                .description(description)
                .callbackUrl(callbackUrl)
                .sessionId(request.getSessionId())
                .build();

        return charge(new ChargeContext(request.getBusinessId(), request.getSubscriptionId(), amount, currency,
                description, callbackUrl, request.getSource(), request.getSessionId(),
                request.getPaymentMethod() != null ? request.getPaymentMethod() : PaymentMethod.CARD, metadata));
    }

    /**
     * Recurring charge against the token stored on the subscription. The supplied token must
     * match the stored one exactly; a mismatch raises an operator alert and creates nothing.
     */
    public PaymentOutcome createTokenizedPayment(TokenizedChargeRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Charge request is required");
        }
        requireText(request.getBusinessId(), "Business ID is required");
        requireText(request.getSubscriptionId(), "Subscription ID is required");
        requireText(request.getToken(), "Payment token is required");
        BigDecimal amount = requirePositiveAmount(request.getAmount());
        String currency = requireCurrency(request.getCurrency());
        String callbackUrl = resolveCallbackUrl(request.getCallbackUrl());

        SubscriptionEntity subscription = subscriptionRepository.findByPublicId(request.getSubscriptionId())
                .orElseThrow(() -> new NotFoundException("Subscription not found: " + request.getSubscriptionId()));

        if (!request.getToken().equals(subscription.getMoyasarToken())) {
            log.error("Token mismatch for subscription: subscriptionId={}, businessId={}, providedToken={}",
                    request.getSubscriptionId(), request.getBusinessId(),
                    SensitiveDataMasker.maskToken(request.getToken()));
            alertProducer.publishTokenMismatch(request.getBusinessId(), request.getSubscriptionId());
            throw new TokenMismatchException(request.getSubscriptionId());
        }

        String description = request.getDescription() != null
                ? request.getDescription()
                : "Recurring subscription payment for business " + request.getBusinessId();

        PaymentMetadata metadata = PaymentMetadata.builder()
                .gateway(PaymentMetadata.GATEWAY_MOYASAR)
                .description(description)
                .callbackUrl(callbackUrl)
                .recurring(Boolean.TRUE)
                .tokenUsed(SensitiveDataMasker.maskToken(request.getToken()))
                .build();

        return charge(new ChargeContext(request.getBusinessId(), request.getSubscriptionId(), amount, currency,
                description, callbackUrl, new TokenSource(request.getToken()), null, PaymentMethod.CARD, metadata));
    }

    private PaymentOutcome charge(ChargeContext ctx) {
        String idempotencyKey = UUID.randomUUID().toString();
        PaymentMetadata metadata = ctx.metadata.mergedWith(PaymentMetadata.builder().givenId(idempotencyKey).build());

        PaymentEntity pending = recordStore.createPending(ctx.businessId, ctx.subscriptionId, ctx.amount,
                ctx.currency, ctx.paymentMethod, ctx.sessionId, metadata);
        auditLogger.logChargeRequest(pending, idempotencyKey, ctx.source.getType());

        GatewayChargeRequest gatewayRequest = GatewayChargeRequest.builder()
                .givenId(idempotencyKey)
                .amount(MoneyConverter.toMinorUnit(ctx.amount))
                .currency(ctx.currency)
                .description(ctx.description)
                .callbackUrl(ctx.callbackUrl)
                .source(ctx.source)
                .metadata(gatewayMetadata(pending))
                .build();

        GatewayCharge charge;
        try {
            charge = gatewayClient.createCharge(gatewayRequest);
        } catch (PaymentEngineException e) {
            handleGatewayError(pending, e);
            throw e;
        }

        PaymentEntity payment = recordStore.recordGatewayResponse(pending.getPublicId(), charge);
        PaymentOutcome outcome;
        switch (charge.chargeStatus()) {
            case PAID:
                payment = recordStore.markPaid(payment.getPublicId(), null, null);
                outcome = PaymentOutcome.builder()
                        .success(true)
                        .payment(payment)
                        .gatewayCharge(charge)
                        .requiresVerification(false)
                        .build();
                break;
            case INITIATED:
                log.info("Charge requires 3-D Secure: paymentId={}, gatewayPaymentId={}",
                        payment.getPublicId(), charge.getId());
                outcome = PaymentOutcome.builder()
                        .success(false)
                        .payment(payment)
                        .gatewayCharge(charge)
                        .requiresVerification(true)
                        .transactionUrl(charge.transactionUrl())
                        .build();
                break;
            case FAILED:
                String reason = charge.failureMessage() != null ? charge.failureMessage() : "Payment failed at gateway";
                payment = recordStore.markFailed(payment.getPublicId(), reason);
                payment = recordStore.mergeMetadata(payment.getPublicId(), PaymentMetadata.builder()
                        .gatewayFailure(charge.getSource())
                        .build());
                log.warn("Charge declined: paymentId={}, gatewayPaymentId={}, reason={}",
                        payment.getPublicId(), charge.getId(), reason);
                outcome = PaymentOutcome.builder()
                        .success(false)
                        .payment(payment)
                        .gatewayCharge(charge)
                        .requiresVerification(false)
                        .error(reason)
                        .build();
                break;
            default:
                log.info("Charge left pending: paymentId={}, gatewayPaymentId={}, gatewayStatus={}",
                        payment.getPublicId(), charge.getId(), charge.getStatus());
                outcome = PaymentOutcome.builder()
                        .success(false)
                        .payment(payment)
                        .gatewayCharge(charge)
                        .requiresVerification(false)
                        .build();
                break;
        }

        auditLogger.logChargeResult(outcome);
        return outcome;
    }

    /**
     * A timeout leaves the record pending since the gateway may still have charged. Any
     * other gateway error is definite and fails the record.
     */
    private void handleGatewayError(PaymentEntity pending, PaymentEngineException e) {
        auditLogger.logChargeError(pending, e.getErrorCode().name(), e.getMessage());
        if (e instanceof GatewayTimeoutException) {
            log.warn("Charge outcome unknown after timeout, leaving pending: paymentId={}", pending.getPublicId());
            return;
        }
        log.error("Charge failed at gateway: paymentId={}, errorCode={}, message={}",
                pending.getPublicId(), e.getErrorCode(), e.getMessage());
        recordStore.markFailed(pending.getPublicId(), e.getMessage());
    }

    private Map<String, String> gatewayMetadata(PaymentEntity payment) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("payment_id", payment.getPublicId());
        metadata.put("business_id", payment.getBusinessId());
        if (payment.getSubscriptionId() != null) {
            metadata.put("subscription_id", payment.getSubscriptionId());
        }
        if (payment.getSessionId() != null) {
            metadata.put(GatewayCharge.SESSION_ID_KEY, payment.getSessionId());
        }
        return metadata;
    }

    private String resolveCallbackUrl(String callbackUrl) {
        String resolved = callbackUrl != null && !callbackUrl.isBlank()
                ? callbackUrl
                : moyasarProperties.getDefaultCallbackUrl();
        return requireText(resolved, "Callback URL is required");
    }

    private static BigDecimal requirePositiveAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidRequestException("Amount must be a positive number");
        }
        BigDecimal normalized = MoneyConverter.normalize(amount);
        if (normalized.compareTo(MAX_AMOUNT) > 0) {
            throw new InvalidRequestException("Amount must not exceed " + MAX_AMOUNT.toPlainString());
        }
        if (normalized.signum() == 0) {
            throw new InvalidRequestException("Amount must be at least 0.01");
        }
        return normalized;
    }

    private static String requireCurrency(String currency) {
        String value = requireText(currency, "Currency is required").toUpperCase(Locale.ROOT);
        if (!CURRENCY.matcher(value).matches()) {
            throw new InvalidRequestException("Currency must be a 3-letter ISO 4217 code");
        }
        return value;
    }

    private static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(message);
        }
        return value;
    }

    private static final class ChargeContext {
        final String businessId;
        final String subscriptionId;
        final BigDecimal amount;
        final String currency;
        final String description;
        final String callbackUrl;
        final PaymentSource source;
        final String sessionId;
        final PaymentMethod paymentMethod;
        final PaymentMetadata metadata;

        ChargeContext(String businessId, String subscriptionId, BigDecimal amount, String currency,
                      String description, String callbackUrl, PaymentSource source, String sessionId,
                      PaymentMethod paymentMethod, PaymentMetadata metadata) {
            this.businessId = businessId;
            this.subscriptionId = subscriptionId;
            this.amount = amount;
            this.currency = currency;
            this.description = description;
            this.callbackUrl = callbackUrl;
            this.source = source;
            this.sessionId = sessionId;
            this.paymentMethod = paymentMethod;
            this.metadata = metadata;
        }
    }
}
