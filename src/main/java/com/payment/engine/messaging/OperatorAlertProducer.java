package com.payment.engine.messaging;

import com.payment.engine.persistence.entity.PaymentEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes operator alerts to Kafka. Publishing never fails the payment path: send
 * errors are logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatorAlertProducer {

    private final KafkaTemplate<String, OperatorAlert> kafkaTemplate;

    @Value("${payment.kafka.topic.alerts:payment-alerts}")
    private String topic;

    public void publishTokenMismatch(String businessId, String subscriptionId) {
        OperatorAlert alert = OperatorAlert.builder()
                .alertId(UUID.randomUUID().toString())
                .type(OperatorAlert.AlertType.TOKEN_MISMATCH)
                .businessId(businessId)
                .subscriptionId(subscriptionId)
                .message("Provided token does not match the stored payment method")
                .timestamp(Instant.now())
                .build();
        send(subscriptionId != null ? subscriptionId : businessId, alert);
    }

    public void publishPaidWithIssues(PaymentEntity payment, String gatewayPaymentId, List<String> issues) {
        send(gatewayPaymentId, paymentAlert(OperatorAlert.AlertType.PAID_WITH_ISSUES, payment, gatewayPaymentId,
                "Payment is paid at the gateway but failed verification", issues));
    }

    public void publishStateConflict(PaymentEntity payment, String gatewayPaymentId, String message) {
        send(gatewayPaymentId, paymentAlert(OperatorAlert.AlertType.VERIFICATION_STATE_CONFLICT, payment,
                gatewayPaymentId, message, List.of()));
    }

    private OperatorAlert paymentAlert(OperatorAlert.AlertType type, PaymentEntity payment, String gatewayPaymentId,
                                       String message, List<String> issues) {
        return OperatorAlert.builder()
                .alertId(UUID.randomUUID().toString())
                .type(type)
                .paymentId(payment != null ? payment.getPublicId() : null)
                .gatewayPaymentId(gatewayPaymentId)
                .businessId(payment != null ? payment.getBusinessId() : null)
                .subscriptionId(payment != null ? payment.getSubscriptionId() : null)
                .message(message)
                .issues(issues != null ? List.copyOf(issues) : List.of())
                .timestamp(Instant.now())
                .build();
    }

    private void send(String key, OperatorAlert alert) {
        log.warn("Publishing operator alert: key={}, alertId={}, type={}, paymentId={}",
                key, alert.getAlertId(), alert.getType(), alert.getPaymentId());
        try {
            CompletableFuture<SendResult<String, OperatorAlert>> future = kafkaTemplate.send(topic, key, alert);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish operator alert key={} alertId={}", key, alert.getAlertId(), ex);
                } else {
                    log.info("Published operator alert: key={}, alertId={}, partition={}, offset={}",
                            key, alert.getAlertId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (RuntimeException e) {
            log.error("Operator alert not sent: key={}, alertId={}, type={}", key, alert.getAlertId(), alert.getType(), e);
        }
    }
}
