package com.kawari.proxy.core.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Statistics derived on demand from the registry and identity pool.
 */
public record EngineStats(
        @JsonProperty("total_proxies") int totalProxies,
        @JsonProperty("healthy_proxies") int healthyProxies,
        @JsonProperty("total_user_agents") int totalUserAgents,
        @JsonProperty("rotation_strategy") String rotationStrategy,
        @JsonProperty("rate_limit") Double rateLimit) {
}
