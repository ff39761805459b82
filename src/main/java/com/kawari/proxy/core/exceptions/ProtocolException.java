package com.kawari.proxy.core.exceptions;

/**
 * Thrown when an inbound client violates the HTTP/1.1 framing the server accepts.
 */
public class ProtocolException extends ProxyException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
