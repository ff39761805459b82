package com.kawari.proxy.core.rotation;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable health record of one backend. Only {@link BackendRegistry} touches it,
 * always while holding the registry lock.
 * Invariant: {@code !healthy} implies {@code unhealthySince != null}.
 */
final class BackendHealth {
    private boolean healthy = true;
    private Instant unhealthySince;
    private int consecutiveFailures;
    private long totalFailures;
    private long totalSuccesses;

    void recordSuccess() {
        healthy = true;
        unhealthySince = null;
        consecutiveFailures = 0;
        totalSuccesses++;
    }

    /**
     * @return true if this failure moved the backend into quarantine.
     */
    boolean recordFailure(int threshold, Instant now) {
        consecutiveFailures++;
        totalFailures++;
        if (healthy && consecutiveFailures >= threshold) {
            healthy = false;
            unhealthySince = now;
            return true;
        }
        return false;
    }

    /**
     * Lifts the quarantine once the recovery window has elapsed. Keeps the failure run.
     *
     * @return true if the backend was re-admitted.
     */
    boolean recoverIfDue(Duration recoveryWindow, Instant now) {
        if (!healthy && Duration.between(unhealthySince, now).compareTo(recoveryWindow) >= 0) {
            healthy = true;
            unhealthySince = null;
            return true;
        }
        return false;
    }

    boolean isHealthy() {
        return healthy;
    }

    BackendStatus toStatus(BackendDescriptor descriptor) {
        return new BackendStatus(descriptor, healthy, unhealthySince, consecutiveFailures, totalFailures,
                totalSuccesses);
    }
}
