package com.payment.engine.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Per-check breakdown of a verification, kept for audit display and stored in payment metadata.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VerificationDetails {

    boolean statusMatch;
    boolean amountMatch;
    boolean currencyMatch;
    BigDecimal amountDifference;
    BigDecimal expectedAmount;
    BigDecimal actualAmount;
    String expectedCurrency;
    String actualCurrency;
    String expectedStatus;
    String actualStatus;
}
