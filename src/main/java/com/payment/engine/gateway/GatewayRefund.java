package com.payment.engine.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Response of {@code POST /payments/{id}/refund}: the refunded charge with its running
 * refunded total (minor unit).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GatewayRefund {

    String id;
    String status;
    long amount;
    long refunded;
    String refundedAt;
    String currency;

    @JsonIgnore
    Map<String, Object> raw;
}
