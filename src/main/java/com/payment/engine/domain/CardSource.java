package com.payment.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Card-present data for a one-time charge. Never persisted or logged.
 */
@Value
@Builder
public class CardSource implements PaymentSource {

    public static final String TYPE = "creditcard";

    String name;
    String number;
    String cvc;
    Integer month;
    Integer year;
    /** Set to false for manual 3-D Secure handling; the gateway defaults to true. */
    Boolean threeDSecure;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> toGatewayPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", TYPE);
        payload.put("name", name);
        payload.put("number", number);
        payload.put("cvc", cvc);
        payload.put("month", month);
        payload.put("year", year);
        if (threeDSecure != null) {
            payload.put("3ds", threeDSecure);
        }
        return payload;
    }

    @Override
    public String toString() {
        return "CardSource(type=" + TYPE + ")";
    }
}
