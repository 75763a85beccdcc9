package com.payment.engine.gateway;

/**
 * Boundary to the external payment processor. Implementations authenticate every call,
 * never retry on their own, and translate every failure into the engine's error taxonomy.
 */
public interface PaymentGatewayClient {

    /**
     * Creates a charge.
     * @param request charge body including the idempotency key
     * @return the charge as the gateway reports it (paid, initiated, failed, ...)
     */
    GatewayCharge createCharge(GatewayChargeRequest request);

    /**
     * Fetches the live state of a charge.
     * @throws com.payment.engine.exception.NotFoundException if the gateway answers 404
     */
    GatewayCharge fetchCharge(String chargeId);

    /**
     * Refunds a charge.
     * @param amountMinor amount in minor unit, or null to refund everything outstanding
     */
    GatewayRefund createRefund(String chargeId, Long amountMinor, String description);
}
