package com.payment.engine.api;

import com.payment.engine.core.ChargeOrchestrator;
import com.payment.engine.core.PaymentVerifier;
import com.payment.engine.core.RefundOrchestrator;
import com.payment.engine.core.VerificationEngine;
import com.payment.engine.domain.PaymentOutcome;
import com.payment.engine.domain.RefundCommand;
import com.payment.engine.domain.RefundOutcome;
import com.payment.engine.domain.VerificationResult;
import com.payment.engine.exception.NotFoundException;
import com.payment.engine.persistence.service.PaymentRecordStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for charges, verification and refunds against Moyasar.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Charge, verify and refund Moyasar payments")
public class PaymentController {

    private final ChargeOrchestrator chargeOrchestrator;
    private final VerificationEngine verificationEngine;
    private final PaymentVerifier paymentVerifier;
    private final RefundOrchestrator refundOrchestrator;
    private final PaymentRecordStore recordStore;

    @PostMapping
    @Operation(
            summary = "Create one-time charge",
            description = "Charges a card or wallet token collected at checkout. Amount is in SAR (major unit). "
                    + "When the gateway asks for 3-D Secure the response has requiresVerification=true and a transactionUrl; "
                    + "redirect the payer there and call POST /{gatewayPaymentId}/verify on return. "
                    + "A declined card returns 200 with success=false and error.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Charge processed. Check body.success / body.requiresVerification.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ChargeResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed. Body: { \"error\": \"VALIDATION_FAILED\"|\"INVALID_REQUEST\", ... }"),
            @ApiResponse(responseCode = "502", description = "Gateway error or rejected credentials. Body: { \"error\": \"GATEWAY_ERROR\"|\"AUTHENTICATION_ERROR\", \"message\": \"...\" }"),
            @ApiResponse(responseCode = "504", description = "Gateway timeout; the payment stays PENDING. Verify before charging again.")
    })
    public ResponseEntity<ChargeResponseDto> createPayment(@Valid @RequestBody ChargeRequestDto dto) {
        log.debug("Charge requested: businessId={}, amount={}, currency={}, sourceType={}",
                dto.getBusinessId(), dto.getAmount(), dto.getCurrency(), dto.getSource().getType());
        PaymentOutcome outcome = chargeOrchestrator.createPayment(dto.toChargeRequest());
        return ResponseEntity.ok(ChargeResponseDto.from(outcome));
    }

    @PostMapping("/tokenized")
    @Operation(
            summary = "Create recurring charge",
            description = "Charges the token stored on a subscription. The supplied token must match the stored one; "
                    + "a mismatch returns 409 TOKEN_MISMATCH and nothing is charged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Charge processed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ChargeResponseDto.class))),
            @ApiResponse(responseCode = "404", description = "Subscription not found. Body: { \"error\": \"NOT_FOUND\", ... }"),
            @ApiResponse(responseCode = "409", description = "Token mismatch. Body: { \"error\": \"TOKEN_MISMATCH\", ... }")
    })
    public ResponseEntity<ChargeResponseDto> createTokenizedPayment(@Valid @RequestBody TokenizedChargeRequestDto dto) {
        log.debug("Recurring charge requested: businessId={}, subscriptionId={}, amount={}",
                dto.getBusinessId(), dto.getSubscriptionId(), dto.getAmount());
        PaymentOutcome outcome = chargeOrchestrator.createTokenizedPayment(dto.toTokenizedChargeRequest());
        return ResponseEntity.ok(ChargeResponseDto.from(outcome));
    }

    @GetMapping("/{gatewayPaymentId}/verification")
    @Operation(
            summary = "Reconcile without side effects",
            description = "Fetches the charge from Moyasar and compares status, amount (tolerance 0.01) and currency "
                    + "with the stored payment. The payment status is not changed.")
    public ResponseEntity<VerificationResponseDto> getVerification(@PathVariable String gatewayPaymentId) {
        VerificationResult result = verificationEngine.getVerificationResult(gatewayPaymentId);
        return ResponseEntity.ok(VerificationResponseDto.from(result));
    }

    @PostMapping("/{gatewayPaymentId}/verify")
    @Operation(
            summary = "Verify and apply",
            description = "Verifies the charge and marks the payment PAID or FAILED accordingly. "
                    + "Paid charges with mismatches are flagged for manual review and never corrected automatically.")
    public ResponseEntity<VerificationResponseDto> verify(@PathVariable String gatewayPaymentId) {
        VerificationResult result = paymentVerifier.verifyPayment(gatewayPaymentId);
        return ResponseEntity.ok(VerificationResponseDto.from(result));
    }

    @PostMapping("/{gatewayPaymentId}/refund")
    @Operation(
            summary = "Refund a payment",
            description = "Refunds the given amount, or everything not yet refunded when amount is omitted. "
                    + "Partial refunds may be repeated until the payment is fully refunded.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Refund processed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = RefundResponseDto.class))),
            @ApiResponse(responseCode = "409", description = "Payment not refundable or already fully refunded."),
            @ApiResponse(responseCode = "422", description = "Amount exceeds the remaining refundable balance.")
    })
    public ResponseEntity<RefundResponseDto> refund(@PathVariable String gatewayPaymentId,
                                                    @Valid @RequestBody(required = false) RefundRequestDto dto) {
        RefundCommand command = dto != null ? dto.toRefundCommand() : RefundCommand.full();
        RefundOutcome outcome = refundOrchestrator.refundPayment(gatewayPaymentId, command);
        return ResponseEntity.ok(RefundResponseDto.from(outcome));
    }

    @GetMapping("/{paymentId}")
    @Operation(summary = "Get payment", description = "Looks up a payment by its public id (pay_...).")
    public ResponseEntity<PaymentResponseDto> getPayment(@PathVariable String paymentId) {
        return recordStore.findByPublicId(paymentId)
                .map(PaymentResponseDto::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("Payment not found: " + paymentId));
    }
}
