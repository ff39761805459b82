package com.kawari.proxy.core.frontend;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON liveness payload.
 */
public record HealthStatus(
        @JsonProperty("status") String status,
        @JsonProperty("service") String service,
        @JsonProperty("version") String version) {
}
