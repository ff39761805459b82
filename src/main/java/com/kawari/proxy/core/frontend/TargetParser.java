package com.kawari.proxy.core.frontend;

import com.kawari.proxy.core.exceptions.InvalidTargetException;
import com.kawari.proxy.core.exceptions.InvalidTargetException.Reason;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Turns the raw request target into an absolute forwarding URI. Accepts the
 * path-embedded form ({@code /http://host/path?q}) and the absolute form.
 */
public final class TargetParser {
    static final String USAGE = "Invalid URL. Format: http://proxy-host:port/http://target-url";

    private TargetParser() {
        // Utility class
    }

    /**
     * Parses a target.
     *
     * @param rawTarget request target as received.
     * @return absolute http or https URI with a host.
     * @throws InvalidTargetException if the target is not a usable http(s) URL.
     */
    public static URI parse(String rawTarget) {
        if (rawTarget == null || rawTarget.isBlank()) {
            throw new InvalidTargetException(Reason.MALFORMED, USAGE);
        }
        String target = rawTarget.startsWith("/") ? rawTarget.substring(1) : rawTarget;
        String lower = target.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            if (lower.matches("^[a-z][a-z0-9+.-]*://.*")) {
                throw new InvalidTargetException(Reason.UNSUPPORTED_SCHEME,
                        "Unsupported scheme in target: " + target.substring(0, target.indexOf(':')));
            }
            throw new InvalidTargetException(Reason.MALFORMED, USAGE);
        }

        URI uri;
        try {
            uri = new URI(target);
        } catch (URISyntaxException e) {
            throw new InvalidTargetException(Reason.MALFORMED, "Invalid URL format", e);
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new InvalidTargetException(Reason.MALFORMED, "Invalid URL format: missing host");
        }
        if (uri.getPort() != -1 && (uri.getPort() < 1 || uri.getPort() > 65535)) {
            throw new InvalidTargetException(Reason.MALFORMED, "Invalid URL format: port " + uri.getPort());
        }
        return uri;
    }
}
