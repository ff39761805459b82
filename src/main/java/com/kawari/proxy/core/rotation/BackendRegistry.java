package com.kawari.proxy.core.rotation;

import com.kawari.proxy.core.constants.RotationStrategy;
import com.kawari.proxy.core.exceptions.NoHealthyBackendException;
import com.kawari.proxy.core.selection.Selectors;
import com.kawari.proxy.spi.SelectionStrategy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe set of upstream backends with per-backend health and quarantine.
 * A backend is quarantined after {@code failureThreshold} consecutive failures and
 * re-admitted on the next success through it or once {@code recoveryWindow} has elapsed.
 * No method blocks on I/O while holding the lock.
 */
public class BackendRegistry {
    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    /** Default time a failed backend stays out of rotation. */
    public static final Duration DEFAULT_RECOVERY_WINDOW = Duration.ofMinutes(5);

    private final Object lock = new Object();
    private final Map<BackendDescriptor, BackendHealth> backends = new LinkedHashMap<>();
    private final Map<RotationStrategy, SelectionStrategy<BackendDescriptor>> selectors =
            new EnumMap<>(RotationStrategy.class);
    private final int failureThreshold;
    private final Duration recoveryWindow;
    private final Clock clock;

    /**
     * Registry quarantining on the first failure for five minutes.
     */
    public BackendRegistry() {
        this(1, DEFAULT_RECOVERY_WINDOW, Clock.systemUTC());
    }

    /**
     * @param failureThreshold consecutive failures that quarantine a backend, at least 1.
     * @param recoveryWindow   quarantine duration before automatic re-admission.
     * @param clock            time source for quarantine stamps.
     */
    public BackendRegistry(int failureThreshold, Duration recoveryWindow, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1");
        }
        if (recoveryWindow == null || recoveryWindow.isNegative()) {
            throw new IllegalArgumentException("Recovery window must be zero or positive");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryWindow = recoveryWindow;
        this.clock = clock;
        for (RotationStrategy strategy : RotationStrategy.values()) {
            selectors.put(strategy, Selectors.forStrategy(strategy));
        }
    }

    /**
     * Adds a backend. Registering a known backend is a no-op.
     *
     * @param descriptor the backend.
     * @return true if the backend was new.
     */
    public boolean register(BackendDescriptor descriptor) {
        synchronized (lock) {
            if (backends.containsKey(descriptor)) {
                return false;
            }
            backends.put(descriptor, new BackendHealth());
            return true;
        }
    }

    /**
     * Registers every backend in iteration order.
     *
     * @param descriptors the backends.
     * @return how many were new.
     */
    public int registerAll(Collection<BackendDescriptor> descriptors) {
        int added = 0;
        for (BackendDescriptor descriptor : descriptors) {
            if (register(descriptor)) {
                added++;
            }
        }
        return added;
    }

    public BackendDescriptor select(RotationStrategy strategy) {
        return selectExcluding(strategy, Set.of());
    }

    /**
     * Selects a healthy backend not in {@code excluded}. When the exclusions would
     * leave nothing but healthy backends remain, those are used instead.
     *
     * @param strategy selection algorithm.
     * @param excluded backends to avoid, typically the ones that already failed in this dispatch.
     * @return the selected backend.
     * @throws NoHealthyBackendException if no backend is healthy.
     */
    public BackendDescriptor selectExcluding(RotationStrategy strategy, Set<BackendDescriptor> excluded) {
        synchronized (lock) {
            Instant now = clock.instant();
            List<BackendDescriptor> healthy = new ArrayList<>(backends.size());
            List<BackendDescriptor> candidates = new ArrayList<>(backends.size());
            for (Map.Entry<BackendDescriptor, BackendHealth> entry : backends.entrySet()) {
                BackendHealth health = entry.getValue();
                if (health.recoverIfDue(recoveryWindow, now)) {
                    log.info("Backend {} re-admitted after recovery window", entry.getKey());
                }
                if (health.isHealthy()) {
                    healthy.add(entry.getKey());
                    if (!excluded.contains(entry.getKey())) {
                        candidates.add(entry.getKey());
                    }
                }
            }
            if (healthy.isEmpty()) {
                throw new NoHealthyBackendException(
                        "No healthy backend available (" + backends.size() + " registered)");
            }
            return selectors.get(strategy).select(candidates.isEmpty() ? healthy : candidates);
        }
    }

    /**
     * Records a successful exchange: the backend becomes healthy and its failure run resets.
     *
     * @param descriptor a registered backend.
     */
    public void markSuccess(BackendDescriptor descriptor) {
        synchronized (lock) {
            BackendHealth health = require(descriptor);
            if (!health.isHealthy()) {
                log.info("Backend {} recovered after successful request", descriptor);
            }
            health.recordSuccess();
        }
    }

    /**
     * Records a connection-level failure.
     *
     * @param descriptor a registered backend.
     * @return true if this failure quarantined the backend.
     */
    public boolean markFailure(BackendDescriptor descriptor) {
        synchronized (lock) {
            boolean quarantined = require(descriptor).recordFailure(failureThreshold, clock.instant());
            if (quarantined) {
                log.warn("Backend {} quarantined for {} s", descriptor, recoveryWindow.toSeconds());
            }
            return quarantined;
        }
    }

    /**
     * Counts backends, applying due recoveries first.
     *
     * @return total and healthy counts from one consistent view.
     */
    public RegistrySnapshot snapshot() {
        synchronized (lock) {
            Instant now = clock.instant();
            int healthy = 0;
            for (BackendHealth health : backends.values()) {
                health.recoverIfDue(recoveryWindow, now);
                if (health.isHealthy()) {
                    healthy++;
                }
            }
            return new RegistrySnapshot(backends.size(), healthy);
        }
    }

    /**
     * @param descriptor a registered backend.
     * @return a copy of its health record.
     */
    public BackendStatus status(BackendDescriptor descriptor) {
        synchronized (lock) {
            BackendHealth health = require(descriptor);
            health.recoverIfDue(recoveryWindow, clock.instant());
            return health.toStatus(descriptor);
        }
    }

    /**
     * @return copies of every health record, in registration order.
     */
    public List<BackendStatus> statuses() {
        synchronized (lock) {
            Instant now = clock.instant();
            List<BackendStatus> result = new ArrayList<>(backends.size());
            backends.forEach((descriptor, health) -> {
                health.recoverIfDue(recoveryWindow, now);
                result.add(health.toStatus(descriptor));
            });
            return result;
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return backends.isEmpty();
        }
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryWindow() {
        return recoveryWindow;
    }

    private BackendHealth require(BackendDescriptor descriptor) {
        BackendHealth health = backends.get(descriptor);
        if (health == null) {
            throw new IllegalArgumentException("Unknown backend: " + descriptor);
        }
        return health;
    }
}
