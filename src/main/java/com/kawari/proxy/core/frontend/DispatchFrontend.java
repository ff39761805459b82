package com.kawari.proxy.core.frontend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kawari.proxy.core.constants.HeaderConstants;
import com.kawari.proxy.core.exceptions.DispatchFailureException;
import com.kawari.proxy.core.exceptions.InvalidTargetException;
import com.kawari.proxy.core.exceptions.InvalidTargetException.Reason;
import com.kawari.proxy.core.exceptions.NoHealthyBackendException;
import com.kawari.proxy.core.exceptions.ProxyException;
import com.kawari.proxy.core.exceptions.RateLimitTimeoutException;
import com.kawari.proxy.core.rotation.BackendDescriptor;
import com.kawari.proxy.core.rotation.DispatchRequest;
import com.kawari.proxy.core.rotation.DispatchResponse;
import com.kawari.proxy.core.rotation.EngineStats;
import com.kawari.proxy.core.rotation.RotationEngine;
import com.kawari.proxy.core.utils.HeaderUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for dispatches, used by the socket server and by library
 * callers alike. Validates the request, runs it through the {@link RotationEngine}
 * and maps every outcome to a {@link FrontendResponse}.
 */
public class DispatchFrontend {
    private static final Logger log = LoggerFactory.getLogger(DispatchFrontend.class);

    public static final String SERVICE_NAME = "Kawari Rotating Proxy";
    public static final String VERSION = "1.0.0";
    public static final long DEFAULT_MAX_BODY_BYTES = 10L * 1024 * 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "HEAD", "OPTIONS",
            "PATCH");

    /** Never forwarded upstream. */
    private static final Set<String> DROPPED_REQUEST_HEADERS;

    /** Never returned to the caller; the server frames the body itself. */
    private static final Set<String> DROPPED_RESPONSE_HEADERS;

    static {
        Set<String> request = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        request.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.PROXY_CONNECTION.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.UPGRADE.getValue(),
                HeaderConstants.TE.getValue(),
                HeaderConstants.TRAILERS.getValue(),
                HeaderConstants.PROXY_AUTHORIZATION.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue()));
        DROPPED_REQUEST_HEADERS = Collections.unmodifiableSet(request);

        Set<String> response = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        response.addAll(List.of(
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue()));
        DROPPED_RESPONSE_HEADERS = Collections.unmodifiableSet(response);
    }

    private final RotationEngine engine;
    private final AddressPolicy addressPolicy;
    private final long maxBodyBytes;

    /**
     * @param engine        engine that performs dispatches; owned by the caller.
     * @param addressPolicy internal-address check applied to every target.
     * @param maxBodyBytes  largest accepted request body.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public DispatchFrontend(RotationEngine engine, AddressPolicy addressPolicy, long maxBodyBytes) {
        if (maxBodyBytes < 0) {
            throw new IllegalArgumentException("maxBodyBytes must be >= 0");
        }
        this.engine = engine;
        this.addressPolicy = addressPolicy;
        this.maxBodyBytes = maxBodyBytes;
    }

    public DispatchFrontend(RotationEngine engine) {
        this(engine, new AddressPolicy(false), DEFAULT_MAX_BODY_BYTES);
    }

    /**
     * Handles one request.
     *
     * @param method    inbound method.
     * @param rawTarget path-embedded or absolute target.
     * @param headers   inbound headers.
     * @param body      inbound body, may be {@code null}.
     * @return the response to send; never {@code null}.
     * @throws InterruptedException if interrupted while waiting at the rate gate, in backoff or on I/O.
     */
    public FrontendResponse handle(String method, String rawTarget, Map<String, String> headers, byte[] body)
            throws InterruptedException {
        URI target;
        try {
            target = validate(method, rawTarget, headers, body);
        } catch (InvalidTargetException e) {
            log.debug("Rejected {} {}: {}", method, rawTarget, e.getMessage());
            return error(e.getReason().getStatus(), e.getMessage(), null, null, null, 0);
        }

        DispatchRequest request = DispatchRequest.of(method, target, forwardableHeaders(headers), body);
        try {
            DispatchResponse response = engine.execute(request);
            return new FrontendResponse(response.statusCode(), passThroughHeaders(response.headers()),
                    response.body(), response.identity(), response.backend(), response.attempts());
        } catch (NoHealthyBackendException e) {
            log.warn("No healthy backend for {}: {}", target, e.getMessage());
            return error(503, e.getMessage(), e.getAttempts(), e.getLastIdentity(), null, e.getAttempts());
        } catch (RateLimitTimeoutException e) {
            return error(429, e.getMessage(), null, null, null, 0);
        } catch (DispatchFailureException e) {
            int status = e.isTimeout() ? 504 : 502;
            log.warn("Dispatch to {} failed with {}: {}", target, status, e.getMessage());
            return error(status, e.getMessage(), e.getAttempts(), e.getLastIdentity(), e.getLastBackend(),
                    e.getAttempts());
        }
    }

    /**
     * Runs the checks that precede any dispatch, in order: method, body size, target, address, headers.
     */
    private URI validate(String method, String rawTarget, Map<String, String> headers, byte[] body) {
        if (method == null || !ALLOWED_METHODS.contains(method.toUpperCase(Locale.ROOT))) {
            throw new InvalidTargetException(Reason.METHOD_NOT_ALLOWED, "Method not allowed: " + method);
        }
        if (body != null && body.length > maxBodyBytes) {
            throw bodyTooLarge();
        }
        URI target = TargetParser.parse(rawTarget);
        addressPolicy.check(target);
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                try {
                    HeaderUtils.requireValid(header.getKey(), header.getValue());
                } catch (IllegalArgumentException e) {
                    throw new InvalidTargetException(Reason.MALFORMED, e.getMessage(), e);
                }
            }
        }
        return target;
    }

    /**
     * @return the rejection used for bodies above the limit, also by the server for declared lengths.
     */
    public InvalidTargetException bodyTooLarge() {
        return new InvalidTargetException(Reason.BODY_TOO_LARGE,
                "Request body too large. Maximum size: " + maxBodyBytes + " bytes");
    }

    private Map<String, String> forwardableHeaders(Map<String, String> headers) {
        Map<String, String> forwarded = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers == null) {
            return forwarded;
        }
        boolean dropUserAgent = engine.getConfig().isRotateIdentity();
        headers.forEach((k, v) -> {
            if (DROPPED_REQUEST_HEADERS.contains(k)) {
                return;
            }
            if (dropUserAgent && HeaderConstants.USER_AGENT.getValue().equalsIgnoreCase(k)) {
                return;
            }
            forwarded.put(k, v);
        });
        return forwarded;
    }

    private static Map<String, List<String>> passThroughHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        headers.forEach((k, v) -> {
            if (!DROPPED_RESPONSE_HEADERS.contains(k)) {
                out.put(k, v);
            }
        });
        return out;
    }

    /**
     * @return liveness payload; independent of backend health.
     */
    public HealthStatus health() {
        return new HealthStatus("healthy", SERVICE_NAME, VERSION);
    }

    public EngineStats stats() {
        return engine.stats();
    }

    public FrontendResponse healthResponse() {
        return FrontendResponse.json(200, toJson(health()), null, null, 0);
    }

    public FrontendResponse statsResponse() {
        return FrontendResponse.json(200, toJson(stats()), null, null, 0);
    }

    /**
     * Builds a JSON error response outside of dispatch, e.g. for protocol errors.
     *
     * @param status  HTTP status.
     * @param message error message.
     * @return the response.
     */
    public static FrontendResponse errorResponse(int status, String message) {
        return error(status, message, null, null, null, 0);
    }

    private static FrontendResponse error(int status, String message, Integer attemptsField, String identity,
            BackendDescriptor backend, int attempts) {
        return FrontendResponse.json(status, toJson(new ErrorBody(message, status, attemptsField)), identity,
                backend, attempts);
    }

    static byte[] toJson(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ProxyException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RotationEngine getEngine() {
        return engine;
    }

    public long getMaxBodyBytes() {
        return maxBodyBytes;
    }
}
