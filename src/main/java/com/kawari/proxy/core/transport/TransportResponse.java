package com.kawari.proxy.core.transport;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fully buffered upstream response.
 *
 * @param statusCode upstream status, passed through verbatim.
 * @param headers    response headers, case-insensitive, in received order per name.
 * @param body       response body.
 * @param finalUri   URI that produced this response after redirects.
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, byte[] body, URI finalUri) {

    public TransportResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body;
    }

    public Optional<String> firstHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }
}
