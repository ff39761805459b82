package com.kawari.proxy.core.rotation;

import com.kawari.proxy.core.constants.HeaderConstants;
import com.kawari.proxy.core.exceptions.DispatchFailureException;
import com.kawari.proxy.core.exceptions.NoHealthyBackendException;
import com.kawari.proxy.core.transport.TransportRequest;
import com.kawari.proxy.core.transport.TransportResponse;
import com.kawari.proxy.spi.HttpTransport;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates one dispatch: rate gate, identity and backend selection, transport call,
 * health bookkeeping and retries with linear backoff.
 * Thread-safe; one instance is shared by all concurrent dispatches.
 */
public class RotationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RotationEngine.class);

    private final RotationConfig config;
    private final IdentityPool identities;
    private final BackendRegistry registry;
    private final HttpTransport transport;
    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();

    private final Counter requests;
    private final Counter attempts;
    private final Counter retries;
    private final Counter connectFailures;
    private final Counter exhausted;
    private final Counter noBackend;
    private final Counter quarantines;
    private final List<Meter> gauges = new ArrayList<>();

    /**
     * @param config        immutable engine settings.
     * @param identities    identity pool; its strategy and rotation flag are the caller's responsibility.
     * @param registry      backend registry; ignored when backend rotation is disabled.
     * @param transport     performs the actual HTTP exchanges; closed with the engine.
     * @param meterRegistry Micrometer registry for dispatch meters.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RotationEngine(RotationConfig config, IdentityPool identities, BackendRegistry registry,
            HttpTransport transport, MeterRegistry meterRegistry) {
        this.config = config;
        this.identities = identities;
        this.registry = registry;
        this.transport = transport;
        this.meterRegistry = meterRegistry;
        this.rateLimiter = new RateLimiter(config.getRateLimit(), config.getRateLimitMaxWait());

        this.requests = Counter.builder("kawari.dispatch.requests")
                .description("Dispatches started")
                .register(meterRegistry);
        this.attempts = Counter.builder("kawari.dispatch.attempts")
                .description("Transport attempts made")
                .register(meterRegistry);
        this.retries = Counter.builder("kawari.dispatch.retries")
                .description("Attempts made after a failed attempt")
                .register(meterRegistry);
        this.connectFailures = Counter.builder("kawari.dispatch.failures")
                .tag("outcome", "attempt")
                .description("Attempts that failed at the connection level")
                .register(meterRegistry);
        this.exhausted = Counter.builder("kawari.dispatch.failures")
                .tag("outcome", "exhausted")
                .description("Dispatches that ran out of retries")
                .register(meterRegistry);
        this.noBackend = Counter.builder("kawari.dispatch.failures")
                .tag("outcome", "no_backend")
                .description("Dispatches stopped because no backend was healthy")
                .register(meterRegistry);
        this.quarantines = Counter.builder("kawari.backends.quarantined")
                .description("Backends moved into quarantine")
                .register(meterRegistry);
        // A replacement engine takes over the gauges of the one it replaces.
        meterRegistry.find("kawari.backends.total").gauges().forEach(meterRegistry::remove);
        meterRegistry.find("kawari.backends.healthy").gauges().forEach(meterRegistry::remove);
        gauges.add(Gauge.builder("kawari.backends.total", registry, r -> r.snapshot().total())
                .description("Registered backends")
                .register(meterRegistry));
        gauges.add(Gauge.builder("kawari.backends.healthy", registry, r -> r.snapshot().healthy())
                .description("Backends currently selectable")
                .register(meterRegistry));
    }

    /**
     * Dispatches a request.
     *
     * @param request what to send.
     * @return the upstream response, whatever its status code.
     * @throws NoHealthyBackendException if backend rotation is on and no backend is selectable.
     * @throws DispatchFailureException  if every attempt failed at the connection level.
     * @throws com.kawari.proxy.core.exceptions.RateLimitTimeoutException if the rate gate wait is bounded
     *                                   and exceeded.
     * @throws InterruptedException      if the caller is interrupted; recorded health changes stay.
     * @throws IllegalStateException     if the engine was closed before the call.
     */
    public DispatchResponse execute(DispatchRequest request) throws InterruptedException {
        // Counted before the closed check, so close() never releases the transport under a running dispatch.
        inFlight.incrementAndGet();
        try {
            if (closed.get()) {
                throw new IllegalStateException("Engine is closed");
            }
            return dispatch(request);
        } finally {
            if (inFlight.decrementAndGet() == 0 && closed.get()) {
                release();
            }
        }
    }

    private DispatchResponse dispatch(DispatchRequest request) throws InterruptedException {
        rateLimiter.acquire();
        requests.increment();

        Set<BackendDescriptor> excluded = new HashSet<>();
        List<DispatchAttempt> history = new ArrayList<>();
        IOException lastError = null;
        int maxAttempts = config.getMaxRetries() + 1;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String identity = identities.next();
            BackendDescriptor backend = null;
            if (config.isRotateBackend()) {
                try {
                    backend = registry.selectExcluding(config.getStrategy(), excluded);
                } catch (NoHealthyBackendException e) {
                    noBackend.increment();
                    throw new NoHealthyBackendException(e.getMessage(), history.size(), identity, lastError);
                }
            }

            TransportRequest transportRequest = new TransportRequest(request.method(), request.resolvedTarget(),
                    mergeHeaders(identity, request.headers()), request.body(), backend, config.isVerifyTls(),
                    config.getRequestTimeout(), config.getMaxRedirects());

            attempts.increment();
            if (attempt > 1) {
                retries.increment();
            }
            try {
                TransportResponse response = transport.send(transportRequest);
                if (backend != null) {
                    registry.markSuccess(backend);
                }
                log.debug("{} {} -> {} via {} (attempt {})", request.method(), request.target(),
                        response.statusCode(), backend != null ? backend : "direct", attempt);
                return new DispatchResponse(response.statusCode(), response.headers(), response.body(), identity,
                        backend, attempt);
            } catch (IOException e) {
                lastError = e;
                connectFailures.increment();
                history.add(new DispatchAttempt(attempt, identity, backend, e.toString()));
                if (backend != null) {
                    if (registry.markFailure(backend)) {
                        quarantines.increment();
                    }
                    excluded.add(backend);
                }
                log.warn("Attempt {}/{} for {} via {} failed: {}", attempt, maxAttempts, request.target(),
                        backend != null ? backend : "direct", e.toString());
                if (attempt < maxAttempts) {
                    backoff(config.getBaseRetryDelay().multipliedBy(attempt));
                }
            }
        }

        exhausted.increment();
        throw new DispatchFailureException(history, lastError);
    }

    /**
     * Waits between a failed attempt and the next one; holds no registry lock.
     *
     * @param delay base delay times the number of the attempt that failed.
     * @throws InterruptedException if interrupted while waiting.
     */
    void backoff(Duration delay) throws InterruptedException {
        TimeUnit.NANOSECONDS.sleep(delay.toNanos());
    }

    /**
     * Layers default headers, then the identity, then caller headers; later layers win.
     */
    private Map<String, String> mergeHeaders(String identity, Map<String, String> callerHeaders) {
        Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        merged.putAll(config.getDefaultHeaders());
        merged.put(HeaderConstants.USER_AGENT.getValue(), identity);
        merged.putAll(callerHeaders);
        return merged;
    }

    /**
     * @return counts recomputed from the current registry and pool.
     */
    public EngineStats stats() {
        RegistrySnapshot snapshot = registry.snapshot();
        return new EngineStats(snapshot.total(), snapshot.healthy(), identities.size(),
                config.getStrategy().getLabel(), config.getRateLimit());
    }

    public RotationConfig getConfig() {
        return config;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public BackendRegistry getRegistry() {
        return registry;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public IdentityPool getIdentities() {
        return identities;
    }

    /**
     * Stops accepting dispatches and unregisters the engine's gauges. Dispatches already
     * running keep the transport and finish normally; it is closed once the last of them
     * returns. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closing rotation engine ({} dispatches in flight)", inFlight.get());
            // Meters compare by id; only remove gauges a replacement engine has not re-registered.
            for (Meter gauge : gauges) {
                boolean stillOurs = meterRegistry.find(gauge.getId().getName()).meters().stream()
                        .anyMatch(m -> m == gauge);
                if (stillOurs) {
                    meterRegistry.remove(gauge);
                }
            }
            if (inFlight.get() == 0) {
                release();
            }
        }
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            log.debug("Releasing transport of closed rotation engine");
            transport.close();
        }
    }

    /**
     * @return dispatches currently running on this engine.
     */
    int inFlight() {
        return inFlight.get();
    }

    /**
     * @return whether the transport has been closed.
     */
    boolean isReleased() {
        return released.get();
    }
}
