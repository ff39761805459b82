package com.kawari.proxy.core.rotation;

import com.kawari.proxy.core.constants.BackendScheme;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Immutable identity of an upstream egress backend. Two descriptors with the same
 * host and port but a different scheme or credentials are different backends.
 *
 * @param host     proxy host name or address.
 * @param port     proxy port.
 * @param scheme   protocol spoken to the proxy.
 * @param username optional user name.
 * @param password optional password, only meaningful with a user name.
 */
public record BackendDescriptor(String host, int port, BackendScheme scheme, String username, String password) {

    public BackendDescriptor {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Backend host must not be empty");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Backend port out of range: " + port);
        }
        if (scheme == null) {
            throw new IllegalArgumentException("Backend scheme must not be null");
        }
        if (username == null && password != null) {
            throw new IllegalArgumentException("Backend password given without a username");
        }
    }

    /**
     * Unauthenticated backend.
     */
    public BackendDescriptor(String host, int port, BackendScheme scheme) {
        this(host, port, scheme, null, null);
    }

    /**
     * Parses {@code scheme://[user[:pass]@]host:port}.
     *
     * @param url the backend URL.
     * @return the descriptor.
     * @throws IllegalArgumentException if the URL is malformed or the scheme unsupported.
     */
    public static BackendDescriptor fromUrl(String url) {
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed backend URL: " + url, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null || uri.getPort() == -1) {
            throw new IllegalArgumentException("Backend URL must look like scheme://host:port, got: " + url);
        }
        String user = null;
        String pass = null;
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null) {
            int idx = userInfo.indexOf(':');
            user = decode(idx == -1 ? userInfo : userInfo.substring(0, idx));
            pass = idx == -1 ? null : decode(userInfo.substring(idx + 1));
        }
        return new BackendDescriptor(uri.getHost(), uri.getPort(), BackendScheme.parse(uri.getScheme()), user, pass);
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    public boolean hasCredentials() {
        return username != null;
    }

    /**
     * {@code host:port} of the proxy itself.
     *
     * @return the authority string.
     */
    public String authority() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }

    /**
     * URL form with the password masked, safe for logs and error messages.
     */
    @Override
    public String toString() {
        String creds = username == null ? "" : username + (password != null ? ":****" : "") + "@";
        return scheme.getValue() + "://" + creds + authority();
    }
}
