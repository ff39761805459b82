package com.kawari.proxy.core.rotation;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Response of a completed dispatch. Any upstream status counts as completed.
 *
 * @param statusCode upstream status.
 * @param headers    upstream headers, case-insensitive.
 * @param body       buffered upstream body.
 * @param identity   identity presented on the successful attempt.
 * @param backend    backend that carried it, {@code null} when sent direct.
 * @param attempts   attempts used, including the successful one.
 */
public record DispatchResponse(int statusCode, Map<String, List<String>> headers, byte[] body, String identity,
        BackendDescriptor backend, int attempts) {

    public Optional<String> firstHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
