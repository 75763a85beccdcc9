package com.payment.engine.domain;

import lombok.Value;

/**
 * Retry bookkeeping after a failed attempt. Callers stop retrying once
 * {@code retryCount} reaches {@link #MAX_RETRIES}.
 */
@Value
public class RetryDecision {

    public static final int MAX_RETRIES = 3;

    int retryCount;
    boolean retryAllowed;

    public static RetryDecision forCount(int retryCount) {
        return new RetryDecision(retryCount, retryCount < MAX_RETRIES);
    }
}
