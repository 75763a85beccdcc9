package com.payment.engine.domain;

/**
 * Charge status as reported by the gateway. The gateway's status field is open-ended,
 * so anything unrecognised maps to {@link #UNKNOWN} and must be treated as non-terminal.
 * Matching is exact: the gateway reports lowercase values only.
 * The raw value is kept on {@link com.payment.engine.gateway.GatewayCharge}.
 */
public enum GatewayChargeStatus {
    /** Captured; money moved. */
    PAID,
    /** Waiting for the 3-D Secure step at the transaction URL. */
    INITIATED,
    /** Declined or errored at the gateway. */
    FAILED,
    /** Authorized but not yet captured. */
    AUTHORIZED,
    /** Any value not listed above. */
    UNKNOWN;

    public static GatewayChargeStatus fromGatewayValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        switch (value) {
            case "paid":
                return PAID;
            case "initiated":
                return INITIATED;
            case "failed":
                return FAILED;
            case "authorized":
                return AUTHORIZED;
            default:
                return UNKNOWN;
        }
    }
}
