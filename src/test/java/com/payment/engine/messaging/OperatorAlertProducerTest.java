package com.payment.engine.messaging;

import com.payment.engine.domain.PaymentStatus;
import com.payment.engine.persistence.entity.PaymentEntity;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OperatorAlertProducerTest {

    private static final String TOPIC = "payment-alerts";

    @Mock
    private KafkaTemplate<String, OperatorAlert> kafkaTemplate;

    private OperatorAlertProducer producer;

    @BeforeEach
    void setUp() {
        producer = new OperatorAlertProducer(kafkaTemplate);
        ReflectionTestUtils.setField(producer, "topic", TOPIC);
    }

    private static CompletableFuture<SendResult<String, OperatorAlert>> acked(String key, OperatorAlert alert) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(TOPIC, key, alert), metadata));
    }

    @Test
    void paidWithIssuesAlertIsKeyedByGatewayPaymentId() {
        PaymentEntity payment = PaymentEntity.builder()
                .publicId("pay_1").businessId("biz_1").subscriptionId("sub_1")
                .amount(new BigDecimal("100.00")).currency("SAR").status(PaymentStatus.PENDING)
                .build();
        when(kafkaTemplate.send(eq(TOPIC), eq("gw_1"), any(OperatorAlert.class)))
                .thenAnswer(inv -> acked("gw_1", inv.getArgument(2)));

        producer.publishPaidWithIssues(payment, "gw_1", List.of("Currency mismatch: expected SAR, got USD"));

        ArgumentCaptor<OperatorAlert> alert = ArgumentCaptor.forClass(OperatorAlert.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("gw_1"), alert.capture());
        assertThat(alert.getValue().getType()).isEqualTo(OperatorAlert.AlertType.PAID_WITH_ISSUES);
        assertThat(alert.getValue().getPaymentId()).isEqualTo("pay_1");
        assertThat(alert.getValue().getBusinessId()).isEqualTo("biz_1");
        assertThat(alert.getValue().getIssues()).containsExactly("Currency mismatch: expected SAR, got USD");
        assertThat(alert.getValue().getAlertId()).isNotBlank();
        assertThat(alert.getValue().getTimestamp()).isNotNull();
    }

    @Test
    void tokenMismatchAlertIsKeyedBySubscription() {
        when(kafkaTemplate.send(eq(TOPIC), eq("sub_9"), any(OperatorAlert.class)))
                .thenAnswer(inv -> acked("sub_9", inv.getArgument(2)));

        producer.publishTokenMismatch("biz_9", "sub_9");

        ArgumentCaptor<OperatorAlert> alert = ArgumentCaptor.forClass(OperatorAlert.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("sub_9"), alert.capture());
        assertThat(alert.getValue().getType()).isEqualTo(OperatorAlert.AlertType.TOKEN_MISMATCH);
        assertThat(alert.getValue().getPaymentId()).isNull();
    }

    @Test
    void failedSendDoesNotPropagate() {
        when(kafkaTemplate.send(anyString(), anyString(), any(OperatorAlert.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatCode(() -> producer.publishStateConflict(null, "gw_2", "conflict")).doesNotThrowAnyException();
    }

    @Test
    void synchronousSendErrorDoesNotPropagate() {
        when(kafkaTemplate.send(anyString(), anyString(), any(OperatorAlert.class)))
                .thenThrow(new IllegalStateException("producer closed"));

        assertThatCode(() -> producer.publishTokenMismatch("biz_1", "sub_1")).doesNotThrowAnyException();
    }
}
