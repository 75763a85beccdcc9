package com.payment.engine.domain;

import java.util.Map;

/**
 * Where the money comes from: raw card data collected at checkout, or a stored gateway
 * token for recurring charges. Each variant renders the gateway's {@code source} object.
 */
public interface PaymentSource {

    /** Gateway source type, e.g. "creditcard" or "token". */
    String getType();

    /** JSON-ready {@code source} object for the create-charge request body. */
    Map<String, Object> toGatewayPayload();
}
