package com.payment.engine.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.payment.engine.domain.GatewayChargeStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Charge as returned by {@code POST /payments} and {@code GET /payments/{id}}.
 * Amounts are in the minor unit. The untouched response body is kept in {@code raw}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GatewayCharge {

    public static final String SESSION_ID_KEY = "session_id";
    public static final String SESSION_ID_KEY_CAMEL = "sessionId";

    String id;
    /** Raw gateway status; see {@link #chargeStatus()}. */
    String status;
    long amount;
    String currency;
    String description;
    Long refunded;
    String refundedAt;
    String callbackUrl;
    String createdAt;
    GatewayChargeSource source;
    Map<String, Object> metadata;

    @JsonIgnore
    Map<String, Object> raw;

    public GatewayChargeStatus chargeStatus() {
        return GatewayChargeStatus.fromGatewayValue(status);
    }

    /** Gateway's human-readable message, set on failed charges. */
    public String failureMessage() {
        return source != null ? source.getMessage() : null;
    }

    /** 3-D Secure redirect for initiated charges. */
    public String transactionUrl() {
        return source != null ? source.getTransactionUrl() : null;
    }

    /**
     * Checkout session id echoed back in metadata. Producers disagree on casing, so both
     * {@code session_id} and {@code sessionId} are honoured.
     */
    public String sessionId() {
        if (metadata == null) {
            return null;
        }
        Object value = metadata.get(SESSION_ID_KEY);
        if (value == null || value.toString().isBlank()) {
            value = metadata.get(SESSION_ID_KEY_CAMEL);
        }
        return value != null && !value.toString().isBlank() ? value.toString() : null;
    }
}
