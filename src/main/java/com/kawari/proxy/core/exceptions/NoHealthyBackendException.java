package com.kawari.proxy.core.exceptions;

/**
 * Signals that backend rotation is enabled but no backend is currently selectable.
 * Retrying cannot help, so a dispatch that hits this stops immediately.
 */
public class NoHealthyBackendException extends ProxyException {
    private final int attempts;
    private final String lastIdentity;

    /**
     * Raised by the registry itself, outside any dispatch.
     *
     * @param message the detail message.
     */
    public NoHealthyBackendException(String message) {
        this(message, 0, null, null);
    }

    /**
     * Raised by the engine while dispatching.
     *
     * @param message      the detail message.
     * @param attempts     transport attempts completed before the registry ran dry.
     * @param lastIdentity identity selected for the attempt that could not proceed.
     * @param lastError    the transport error of the previous attempt, if any.
     */
    public NoHealthyBackendException(String message, int attempts, String lastIdentity, Throwable lastError) {
        super(message, lastError);
        this.attempts = attempts;
        this.lastIdentity = lastIdentity;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastIdentity() {
        return lastIdentity;
    }
}
