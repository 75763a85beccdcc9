package com.payment.engine.domain;

import com.payment.engine.compliance.SensitiveDataMasker;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored gateway token used for recurring (merchant-initiated) charges.
 */
@Value
public class TokenSource implements PaymentSource {

    public static final String TYPE = "token";

    String token;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> toGatewayPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", TYPE);
        payload.put("token", token);
        return payload;
    }

    @Override
    public String toString() {
        return "TokenSource(token=" + SensitiveDataMasker.maskToken(token) + ")";
    }
}
