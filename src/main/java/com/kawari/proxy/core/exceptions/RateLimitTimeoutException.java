package com.kawari.proxy.core.exceptions;

import java.time.Duration;

/**
 * Thrown when a caller would have to wait longer than the configured maximum at the rate gate.
 */
public class RateLimitTimeoutException extends ProxyException {
    private final Duration requiredWait;

    public RateLimitTimeoutException(Duration requiredWait, Duration maxWait) {
        super("Rate limit wait of " + requiredWait.toMillis() + " ms exceeds maximum of "
                + maxWait.toMillis() + " ms");
        this.requiredWait = requiredWait;
    }

    public Duration getRequiredWait() {
        return requiredWait;
    }
}
