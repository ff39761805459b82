package com.kawari.proxy.core.rotation;

import java.time.Instant;

/**
 * Point-in-time copy of a backend's health record.
 */
public record BackendStatus(BackendDescriptor backend, boolean healthy, Instant unhealthySince,
        int consecutiveFailures, long totalFailures, long totalSuccesses) {
}
