package com.kawari.proxy.core.constants;

import java.util.Locale;

/**
 * Protocol spoken to an upstream proxy backend.
 */
public enum BackendScheme {
    /** Plain HTTP proxy (absolute-form requests, CONNECT for TLS targets). */
    HTTP(false),
    /** HTTP proxy reached over TLS. */
    HTTPS(false),
    /** SOCKS4a proxy. */
    SOCKS4(true),
    /** SOCKS5 proxy, optionally with username/password authentication. */
    SOCKS5(true);

    private final boolean socks;

    BackendScheme(boolean socks) {
        this.socks = socks;
    }

    public boolean isSocks() {
        return socks;
    }

    /**
     * URL scheme form, e.g. {@code socks5}.
     *
     * @return lower-case scheme name.
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a scheme name case-insensitively.
     *
     * @param value the scheme, e.g. {@code "SOCKS5"} or {@code "http"}.
     * @return the matching scheme.
     * @throws IllegalArgumentException if the scheme is unsupported.
     */
    public static BackendScheme parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Backend scheme must not be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported backend scheme: " + value, e);
        }
    }
}
