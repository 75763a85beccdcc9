package com.payment.engine.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.payment.engine.gateway.GatewayChargeSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway correlation data stored with a payment (JSON column). Known keys are typed;
 * anything else the gateway or an older writer put there is kept in {@code extra}.
 * Instances are replaced, not mutated in place, so JPA sees every change.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentMetadata {

    public static final String GATEWAY_MOYASAR = "moyasar";

    private String gateway;
    /** Idempotency key sent to the gateway as {@code given_id}. */
    private String givenId;
    private String description;
    private String callbackUrl;
    private String sessionId;
    private Boolean recurring;
    /** Masked token, never the full value. */
    private String tokenUsed;

    private String transactionId;
    private String gatewayCreatedAt;
    /** Raw create-charge response. */
    private Map<String, Object> gatewayResponse;
    /** Gateway source block of a failed charge. */
    private GatewayChargeSource gatewayFailure;

    private VerificationDetails verification;
    /** Raw charge as fetched during verification. */
    private Map<String, Object> verificationSnapshot;
    private Instant verifiedAt;

    private String refundId;
    private String refundDescription;
    private String gatewayRefundedAt;
    private Map<String, Object> refundResponse;

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> anyExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(key, value);
    }

    /**
     * Returns a new instance with every non-null field of {@code patch} laid over this one.
     * Keys absent from the patch are kept.
     */
    public PaymentMetadata mergedWith(PaymentMetadata patch) {
        Map<String, Object> mergedExtra = new LinkedHashMap<>();
        if (extra != null) {
            mergedExtra.putAll(extra);
        }
        if (patch == null) {
            return toBuilder().extra(mergedExtra).build();
        }
        if (patch.extra != null) {
            mergedExtra.putAll(patch.extra);
        }
        return PaymentMetadata.builder()
                .gateway(pick(patch.gateway, gateway))
                .givenId(pick(patch.givenId, givenId))
                .description(pick(patch.description, description))
                .callbackUrl(pick(patch.callbackUrl, callbackUrl))
                .sessionId(pick(patch.sessionId, sessionId))
                .recurring(pick(patch.recurring, recurring))
                .tokenUsed(pick(patch.tokenUsed, tokenUsed))
                .transactionId(pick(patch.transactionId, transactionId))
                .gatewayCreatedAt(pick(patch.gatewayCreatedAt, gatewayCreatedAt))
                .gatewayResponse(pick(patch.gatewayResponse, gatewayResponse))
                .gatewayFailure(pick(patch.gatewayFailure, gatewayFailure))
                .verification(pick(patch.verification, verification))
                .verificationSnapshot(pick(patch.verificationSnapshot, verificationSnapshot))
                .verifiedAt(pick(patch.verifiedAt, verifiedAt))
                .refundId(pick(patch.refundId, refundId))
                .refundDescription(pick(patch.refundDescription, refundDescription))
                .gatewayRefundedAt(pick(patch.gatewayRefundedAt, gatewayRefundedAt))
                .refundResponse(pick(patch.refundResponse, refundResponse))
                .extra(mergedExtra)
                .build();
    }

    private static <T> T pick(T patchValue, T current) {
        return patchValue != null ? patchValue : current;
    }
}
