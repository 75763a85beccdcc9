package com.payment.engine.api;

import com.payment.engine.domain.TokenizedChargeRequest;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.math.BigDecimal;

/**
 * REST API request body for a recurring charge against a subscription's stored token.
 */
@Data
public class TokenizedChargeRequestDto {

    @NotBlank(message = "businessId is required")
    private String businessId;

    @NotBlank(message = "subscriptionId is required")
    private String subscriptionId;

    @NotBlank(message = "token is required")
    private String token;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be at least 0.01")
    private BigDecimal amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "currency must be a 3-letter ISO 4217 code")
    private String currency = "SAR";

    private String description;
    private String callbackUrl;

    public TokenizedChargeRequest toTokenizedChargeRequest() {
        return TokenizedChargeRequest.builder()
                .businessId(businessId)
                .subscriptionId(subscriptionId)
                .token(token)
                .amount(amount)
                .currency(currency)
                .description(description)
                .callbackUrl(callbackUrl)
                .build();
    }

    @Override
    public String toString() {
        return "TokenizedChargeRequestDto(businessId=" + businessId + ", subscriptionId=" + subscriptionId
                + ", amount=" + amount + ", currency=" + currency + ")";
    }
}
