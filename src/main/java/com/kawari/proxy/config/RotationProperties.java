package com.kawari.proxy.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML view of the rotation settings. Converted once into
 * {@link com.kawari.proxy.core.rotation.RotationConfig}, which validates it.
 * Durations are in milliseconds.
 */
public class RotationProperties {
    private boolean rotateIdentity = true;
    private boolean rotateBackend = true;

    /** {@code random} or {@code round-robin}. */
    private String strategy = "random";

    private boolean verifyTls = true;
    private long requestTimeout = 30000;
    private int maxRetries = 3;
    private long baseRetryDelay = 1000;

    /** Requests per second across all callers. Unset means unlimited. */
    private Double rateLimit;

    /** Longest a caller waits at the rate gate. Unset means no bound. */
    private Long rateLimitMaxWait;

    private int failureThreshold = 1;
    private long recoveryWindow = 300000;
    private int maxRedirects = 5;

    /** User-Agent strings. Empty means the built-in list. */
    private List<String> identities = new ArrayList<>();

    /** Identity used when identity rotation is off. Defaults to the first one. */
    private String fixedIdentity;

    private Map<String, String> defaultHeaders = new LinkedHashMap<>();

    public boolean isRotateIdentity() {
        return rotateIdentity;
    }

    public void setRotateIdentity(boolean rotateIdentity) {
        this.rotateIdentity = rotateIdentity;
    }

    public boolean isRotateBackend() {
        return rotateBackend;
    }

    public void setRotateBackend(boolean rotateBackend) {
        this.rotateBackend = rotateBackend;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    public void setVerifyTls(boolean verifyTls) {
        this.verifyTls = verifyTls;
    }

    public long getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(long requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBaseRetryDelay() {
        return baseRetryDelay;
    }

    public void setBaseRetryDelay(long baseRetryDelay) {
        this.baseRetryDelay = baseRetryDelay;
    }

    public Double getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(Double rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Long getRateLimitMaxWait() {
        return rateLimitMaxWait;
    }

    public void setRateLimitMaxWait(Long rateLimitMaxWait) {
        this.rateLimitMaxWait = rateLimitMaxWait;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getRecoveryWindow() {
        return recoveryWindow;
    }

    public void setRecoveryWindow(long recoveryWindow) {
        this.recoveryWindow = recoveryWindow;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public void setMaxRedirects(int maxRedirects) {
        this.maxRedirects = maxRedirects;
    }

    public List<String> getIdentities() {
        return identities == null ? null : Collections.unmodifiableList(identities);
    }

    public void setIdentities(List<String> identities) {
        this.identities = identities == null ? null : new ArrayList<>(identities);
    }

    public String getFixedIdentity() {
        return fixedIdentity;
    }

    public void setFixedIdentity(String fixedIdentity) {
        this.fixedIdentity = fixedIdentity;
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders == null ? null : Collections.unmodifiableMap(defaultHeaders);
    }

    public void setDefaultHeaders(Map<String, String> defaultHeaders) {
        this.defaultHeaders = defaultHeaders == null ? null : new LinkedHashMap<>(defaultHeaders);
    }
}
