package com.kawari.proxy.core.frontend;

import com.kawari.proxy.core.rotation.BackendDescriptor;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What the frontend hands back to its caller, for dispatched and rejected requests alike.
 *
 * @param status   HTTP status to send.
 * @param headers  response headers, hop-by-hop ones already removed.
 * @param body     response body.
 * @param identity identity used for the final attempt, or {@code null}.
 * @param backend  backend used for the final attempt, or {@code null} when direct or not dispatched.
 * @param attempts attempts made, {@code 0} when the request never reached the engine.
 */
public record FrontendResponse(int status, Map<String, List<String>> headers, byte[] body, String identity,
        BackendDescriptor backend, int attempts) {

    public FrontendResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body;
    }

    static FrontendResponse json(int status, byte[] json, String identity, BackendDescriptor backend,
            int attempts) {
        return new FrontendResponse(status, Map.of("Content-Type", List.of("application/json")), json, identity,
                backend, attempts);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
