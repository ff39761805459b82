package com.kawari.proxy.core.exceptions;

/**
 * A configuration value is missing, malformed or out of range. Fatal at start-up;
 * during a reload the running engine is kept.
 */
public class ConfigException extends ProxyException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
