package com.kawari.proxy.core.frontend;

import com.kawari.proxy.core.exceptions.InvalidTargetException;
import com.kawari.proxy.core.exceptions.InvalidTargetException.Reason;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks targets on loopback, link-local, private and other internal ranges.
 * Names that do not resolve locally are let through since the backend resolves them.
 */
public class AddressPolicy {
    private static final Logger log = LoggerFactory.getLogger(AddressPolicy.class);

    static final String FORBIDDEN = "Access to internal networks is forbidden";

    /**
     * Name resolution seam.
     */
    @FunctionalInterface
    public interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final HostResolver resolver;
    private final boolean allowPrivate;

    public AddressPolicy(HostResolver resolver, boolean allowPrivate) {
        this.resolver = resolver;
        this.allowPrivate = allowPrivate;
    }

    public AddressPolicy(boolean allowPrivate) {
        this(InetAddress::getAllByName, allowPrivate);
    }

    /**
     * Rejects internal targets.
     *
     * @param target parsed target URI.
     * @throws InvalidTargetException with {@link Reason#FORBIDDEN_ADDRESS}.
     */
    public void check(URI target) {
        if (allowPrivate) {
            return;
        }
        String host = target.getHost();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        String lower = host.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".")) {
            lower = lower.substring(0, lower.length() - 1);
        }
        if ("localhost".equals(lower) || lower.endsWith(".localhost")) {
            throw new InvalidTargetException(Reason.FORBIDDEN_ADDRESS, FORBIDDEN);
        }

        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            log.debug("Target host {} does not resolve locally; leaving it to the backend", host);
            return;
        }
        for (InetAddress address : addresses) {
            if (isInternal(address)) {
                log.debug("Rejected target {} resolving to {}", host, address.getHostAddress());
                throw new InvalidTargetException(Reason.FORBIDDEN_ADDRESS, FORBIDDEN);
            }
        }
    }

    /**
     * @param address a resolved address.
     * @return whether the address belongs to a range that must not be reached through the proxy.
     */
    static boolean isInternal(InetAddress address) {
        if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] raw = address.getAddress();
        if (address instanceof Inet4Address) {
            // 0.0.0.0/8
            return raw[0] == 0;
        }
        if (address instanceof Inet6Address) {
            // fc00::/7 unique local
            return (raw[0] & 0xFE) == 0xFC;
        }
        return false;
    }
}
