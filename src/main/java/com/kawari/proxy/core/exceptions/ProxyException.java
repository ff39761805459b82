package com.kawari.proxy.core.exceptions;

/**
 * Root of the unchecked exceptions raised by the proxy. The frontend maps the
 * dispatch-related subclasses to HTTP statuses.
 */
public class ProxyException extends RuntimeException {
    public ProxyException(String message) {
        super(message);
    }

    /**
     * @param message what failed.
     * @param cause   underlying failure, kept for logs.
     */
    public ProxyException(String message, Throwable cause) {
        super(message, cause);
    }
}
