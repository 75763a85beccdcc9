package com.payment.engine.api;

import com.payment.engine.domain.ChargeRequest;
import com.payment.engine.domain.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.math.BigDecimal;

/**
 * REST API request body for a one-time charge.
 */
@Data
public class ChargeRequestDto {

    @NotBlank(message = "businessId is required")
    private String businessId;

    private String subscriptionId;

    /** Major unit, e.g. 99.99. */
    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be at least 0.01")
    private BigDecimal amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "currency must be a 3-letter ISO 4217 code")
    private String currency = "SAR";

    private String description;

    /** Optional; the configured default is used when absent. */
    private String callbackUrl;

    private String sessionId;

    private PaymentMethod paymentMethod;

    @Valid
    @NotNull(message = "source is required")
    private PaymentSourceDto source;

    public ChargeRequest toChargeRequest() {
        return ChargeRequest.builder()
                .businessId(businessId)
                .subscriptionId(subscriptionId)
                .amount(amount)
                .currency(currency)
                .description(description)
                .callbackUrl(callbackUrl)
                .sessionId(sessionId)
                .paymentMethod(paymentMethod != null ? paymentMethod : PaymentMethod.CARD)
                .source(source.toPaymentSource())
                .build();
    }
}
