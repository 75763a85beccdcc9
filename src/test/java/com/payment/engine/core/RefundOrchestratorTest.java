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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefundOrchestratorTest {

    @Mock private PaymentRecordStore recordStore;
    @Mock private PaymentGatewayClient gatewayClient;
    @Mock private ComplianceAuditLogger auditLogger;

    private RefundOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new RefundOrchestrator(recordStore, gatewayClient, auditLogger);
    }

    private static PaymentEntity payment(PaymentStatus status) {
        return PaymentEntity.builder()
                .publicId("pay_r")
                .businessId("biz_1")
                .gatewayPaymentId("gw_r")
                .amount(new BigDecimal("200.00"))
                .currency("SAR")
                .status(status)
                .build();
    }

    private static GatewayRefund refund(long refundedMinor) {
        return GatewayRefund.builder()
                .id("gw_r").status("refunded").amount(20000).refunded(refundedMinor)
                .refundedAt("2026-02-01T08:00:00.000Z").currency("SAR")
                .build();
    }

    /** Store backed by a real entity so balances accumulate across calls. */
    private void storeBackedBy(PaymentEntity entity) {
        when(recordStore.findByGatewayPaymentId("gw_r")).thenReturn(Optional.of(entity));
        lenient().when(recordStore.processRefund(eq("pay_r"), any())).thenAnswer(inv -> {
            entity.applyRefund(inv.getArgument(1), Instant.now());
            return entity;
        });
        lenient().when(recordStore.mergeMetadata(eq("pay_r"), any())).thenAnswer(inv -> {
            entity.mergeMetadata(inv.getArgument(1, PaymentMetadata.class));
            return entity;
        });
    }

    @Test
    void partialRefundsAccumulateUntilFullyRefunded() {
        PaymentEntity entity = payment(PaymentStatus.PAID);
        storeBackedBy(entity);
        when(gatewayClient.createRefund("gw_r", 8000L, "Damaged item")).thenReturn(refund(8000));
        when(gatewayClient.createRefund("gw_r", 12000L, RefundOrchestrator.DEFAULT_DESCRIPTION)).thenReturn(refund(20000));

        RefundOutcome first = orchestrator.refundPayment("gw_r", RefundCommand.builder()
                .amount(new BigDecimal("80")).description("Damaged item").build());

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.getRefundedAmount()).isEqualByComparingTo("80.00");
        assertThat(entity.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(entity.getRefundAmount()).isEqualByComparingTo("80.00");
        assertThat(entity.getMetadata().getRefundDescription()).isEqualTo("Damaged item");

        RefundOutcome second = orchestrator.refundPayment("gw_r", RefundCommand.builder()
                .amount(new BigDecimal("120.00")).build());

        assertThat(second.getRefundedAmount()).isEqualByComparingTo("120.00");
        assertThat(second.getDescription()).isEqualTo("Refund processed");
        assertThat(entity.getRefundAmount()).isEqualByComparingTo("200.00");
        assertThat(entity.isFullyRefunded()).isTrue();

        assertThatThrownBy(() -> orchestrator.refundPayment("gw_r", RefundCommand.builder()
                .amount(BigDecimal.ONE).build()))
                .isInstanceOf(AlreadyRefundedException.class);
        assertThat(entity.getRefundAmount()).isEqualByComparingTo("200.00");
        verify(gatewayClient, times(2)).createRefund(anyString(), any(), anyString());
        verify(auditLogger, times(2)).logRefund(any());
    }

    @Test
    void fullRefundSendsNoAmount() {
        PaymentEntity entity = payment(PaymentStatus.PAID);
        storeBackedBy(entity);
        when(gatewayClient.createRefund(eq("gw_r"), isNull(), eq("Refund processed"))).thenReturn(refund(20000));

        RefundOutcome outcome = orchestrator.refundPayment("gw_r", null);

        assertThat(outcome.getRefundedAmount()).isEqualByComparingTo("200.00");
        assertThat(outcome.getRefundedAt()).isEqualTo("2026-02-01T08:00:00.000Z");
        assertThat(entity.getMetadata().getRefundId()).isEqualTo("gw_r");
        assertThat(entity.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
    }

    @Test
    void refundAboveRemainingBalanceIsRejected() {
        PaymentEntity entity = payment(PaymentStatus.REFUNDED);
        entity.setRefundAmount(new BigDecimal("150.00"));
        when(recordStore.findByGatewayPaymentId("gw_r")).thenReturn(Optional.of(entity));

        assertThatThrownBy(() -> orchestrator.refundPayment("gw_r", RefundCommand.builder()
                .amount(new BigDecimal("60.00")).build()))
                .isInstanceOf(RefundExceedsBalanceException.class)
                .hasMessage("Refund amount 60.00 SAR exceeds remaining amount 50.00 SAR");
        verifyNoInteractions(gatewayClient);
        verify(recordStore, never()).processRefund(anyString(), any());
    }

    @Test
    void nonPositiveRefundAmountIsInvalidRequest() {
        assertThatThrownBy(() -> orchestrator.refundPayment("gw_r", RefundCommand.builder()
                .amount(BigDecimal.ZERO).build()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Refund amount must be a positive number");
        assertThatThrownBy(() -> orchestrator.refundPayment("gw_r", RefundCommand.builder()
                .amount(new BigDecimal("-5.00")).build()))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(recordStore, gatewayClient);
    }

    @Test
    void unpaidPaymentCannotBeRefunded() {
        when(recordStore.findByGatewayPaymentId("gw_r")).thenReturn(Optional.of(payment(PaymentStatus.PENDING)));

        assertThatThrownBy(() -> orchestrator.refundPayment("gw_r", RefundCommand.full()))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("PENDING");
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void unknownGatewayPaymentIsNotFound() {
        when(recordStore.findByGatewayPaymentId("gw_missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.refundPayment("gw_missing", RefundCommand.full()))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void blankIdIsRejected() {
        assertThatThrownBy(() -> orchestrator.refundPayment("", RefundCommand.full()))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(recordStore, gatewayClient);
    }
}
