package com.kawari.proxy.core.rotation;

import com.kawari.proxy.core.constants.RotationStrategy;
import com.kawari.proxy.core.exceptions.ConfigException;
import com.kawari.proxy.core.utils.HeaderUtils;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings of one {@link RotationEngine}. Validated once by {@link Builder#build()};
 * a different configuration requires a new engine.
 */
public final class RotationConfig {
    private final boolean rotateIdentity;
    private final boolean rotateBackend;
    private final RotationStrategy strategy;
    private final boolean verifyTls;
    private final Duration requestTimeout;
    private final int maxRetries;
    private final Duration baseRetryDelay;
    private final Double rateLimit;
    private final Duration rateLimitMaxWait;
    private final Map<String, String> defaultHeaders;
    private final int failureThreshold;
    private final Duration recoveryWindow;
    private final int maxRedirects;

    private RotationConfig(Builder b) {
        this.rotateIdentity = b.rotateIdentity;
        this.rotateBackend = b.rotateBackend;
        this.strategy = b.strategy;
        this.verifyTls = b.verifyTls;
        this.requestTimeout = b.requestTimeout;
        this.maxRetries = b.maxRetries;
        this.baseRetryDelay = b.baseRetryDelay;
        this.rateLimit = b.rateLimit;
        this.rateLimitMaxWait = b.rateLimitMaxWait;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(b.defaultHeaders));
        this.failureThreshold = b.failureThreshold;
        this.recoveryWindow = b.recoveryWindow;
        this.maxRedirects = b.maxRedirects;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RotationConfig defaults() {
        return builder().build();
    }

    /**
     * @return a builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .rotateIdentity(rotateIdentity)
                .rotateBackend(rotateBackend)
                .strategy(strategy)
                .verifyTls(verifyTls)
                .requestTimeout(requestTimeout)
                .maxRetries(maxRetries)
                .baseRetryDelay(baseRetryDelay)
                .rateLimit(rateLimit)
                .rateLimitMaxWait(rateLimitMaxWait)
                .defaultHeaders(defaultHeaders)
                .failureThreshold(failureThreshold)
                .recoveryWindow(recoveryWindow)
                .maxRedirects(maxRedirects);
    }

    public boolean isRotateIdentity() {
        return rotateIdentity;
    }

    public boolean isRotateBackend() {
        return rotateBackend;
    }

    public RotationStrategy getStrategy() {
        return strategy;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBaseRetryDelay() {
        return baseRetryDelay;
    }

    /**
     * @return requests per second, or {@code null} when unlimited.
     */
    public Double getRateLimit() {
        return rateLimit;
    }

    /**
     * @return longest wait at the rate gate, or {@code null} to wait indefinitely.
     */
    public Duration getRateLimitMaxWait() {
        return rateLimitMaxWait;
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryWindow() {
        return recoveryWindow;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RotationConfig that = (RotationConfig) o;
        return rotateIdentity == that.rotateIdentity
                && rotateBackend == that.rotateBackend
                && verifyTls == that.verifyTls
                && maxRetries == that.maxRetries
                && failureThreshold == that.failureThreshold
                && maxRedirects == that.maxRedirects
                && strategy == that.strategy
                && requestTimeout.equals(that.requestTimeout)
                && baseRetryDelay.equals(that.baseRetryDelay)
                && Objects.equals(rateLimit, that.rateLimit)
                && Objects.equals(rateLimitMaxWait, that.rateLimitMaxWait)
                && defaultHeaders.equals(that.defaultHeaders)
                && recoveryWindow.equals(that.recoveryWindow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rotateIdentity, rotateBackend, strategy, verifyTls, requestTimeout, maxRetries,
                baseRetryDelay, rateLimit, rateLimitMaxWait, defaultHeaders, failureThreshold, recoveryWindow,
                maxRedirects);
    }

    @Override
    public String toString() {
        return "RotationConfig{rotateIdentity=" + rotateIdentity
                + ", rotateBackend=" + rotateBackend
                + ", strategy=" + strategy.getLabel()
                + ", verifyTls=" + verifyTls
                + ", requestTimeout=" + requestTimeout
                + ", maxRetries=" + maxRetries
                + ", baseRetryDelay=" + baseRetryDelay
                + ", rateLimit=" + rateLimit
                + ", failureThreshold=" + failureThreshold
                + ", recoveryWindow=" + recoveryWindow + "}";
    }

    /**
     * Mutable builder; every option starts at its documented default.
     */
    public static final class Builder {
        private boolean rotateIdentity = true;
        private boolean rotateBackend = true;
        private RotationStrategy strategy = RotationStrategy.RANDOM;
        private boolean verifyTls = true;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration baseRetryDelay = Duration.ofSeconds(1);
        private Double rateLimit;
        private Duration rateLimitMaxWait;
        private Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private int failureThreshold = 1;
        private Duration recoveryWindow = BackendRegistry.DEFAULT_RECOVERY_WINDOW;
        private int maxRedirects = 5;

        private Builder() {
        }

        public Builder rotateIdentity(boolean rotateIdentity) {
            this.rotateIdentity = rotateIdentity;
            return this;
        }

        public Builder rotateBackend(boolean rotateBackend) {
            this.rotateBackend = rotateBackend;
            return this;
        }

        public Builder strategy(RotationStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseRetryDelay(Duration baseRetryDelay) {
            this.baseRetryDelay = baseRetryDelay;
            return this;
        }

        public Builder rateLimit(Double rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder rateLimitMaxWait(Duration rateLimitMaxWait) {
            this.rateLimitMaxWait = rateLimitMaxWait;
            return this;
        }

        public Builder defaultHeaders(Map<String, String> defaultHeaders) {
            this.defaultHeaders = defaultHeaders == null ? new LinkedHashMap<>() : new LinkedHashMap<>(defaultHeaders);
            return this;
        }

        public Builder defaultHeader(String name, String value) {
            this.defaultHeaders.put(name, value);
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder recoveryWindow(Duration recoveryWindow) {
            this.recoveryWindow = recoveryWindow;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.maxRedirects = maxRedirects;
            return this;
        }

        /**
         * Validates and freezes the configuration.
         *
         * @return the immutable configuration.
         * @throws ConfigException if any option is out of range.
         */
        public RotationConfig build() {
            if (strategy == null) {
                throw new ConfigException("Rotation strategy must be set");
            }
            if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new ConfigException("Request timeout must be positive");
            }
            if (maxRetries < 0) {
                throw new ConfigException("maxRetries must not be negative: " + maxRetries);
            }
            if (baseRetryDelay == null || baseRetryDelay.isNegative()) {
                throw new ConfigException("Base retry delay must be zero or positive");
            }
            if (rateLimit != null && (rateLimit.isNaN() || rateLimit <= 0)) {
                throw new ConfigException("Rate limit must be positive when set: " + rateLimit);
            }
            if (rateLimitMaxWait != null && rateLimitMaxWait.isNegative()) {
                throw new ConfigException("Rate limit max wait must not be negative");
            }
            if (failureThreshold < 1) {
                throw new ConfigException("Failure threshold must be at least 1: " + failureThreshold);
            }
            if (recoveryWindow == null || recoveryWindow.isNegative()) {
                throw new ConfigException("Recovery window must be zero or positive");
            }
            if (maxRedirects < 0) {
                throw new ConfigException("maxRedirects must not be negative: " + maxRedirects);
            }
            for (Map.Entry<String, String> header : defaultHeaders.entrySet()) {
                if (header.getKey() == null || header.getKey().isBlank() || header.getValue() == null) {
                    throw new ConfigException("Default headers must have a name and a value");
                }
                try {
                    HeaderUtils.requireValid(header.getKey(), header.getValue());
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("Invalid default header: " + e.getMessage(), e);
                }
            }
            return new RotationConfig(this);
        }
    }
}
