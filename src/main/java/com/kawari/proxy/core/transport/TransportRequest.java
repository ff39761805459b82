package com.kawari.proxy.core.transport;

import com.kawari.proxy.core.rotation.BackendDescriptor;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One exchange handed to an {@link com.kawari.proxy.spi.HttpTransport}.
 *
 * @param method       HTTP method.
 * @param uri          absolute target URI including the query string.
 * @param headers      request headers, case-insensitive.
 * @param body         request body, empty for none.
 * @param backend      upstream proxy to route through, {@code null} for a direct request.
 * @param verifyTls    whether target (and HTTPS proxy) certificates are verified.
 * @param timeout      hard upper bound for the attempt.
 * @param maxRedirects redirects to follow before returning the 3xx response as-is.
 */
public record TransportRequest(String method, URI uri, Map<String, String> headers, byte[] body,
        BackendDescriptor backend, boolean verifyTls, Duration timeout, int maxRedirects) {

    public TransportRequest {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body;
    }

    /**
     * Same request against another URI, used when following redirects.
     *
     * @param newMethod method for the follow-up request.
     * @param newUri    redirect location.
     * @param newBody   body for the follow-up request.
     * @return the derived request.
     */
    public TransportRequest redirectTo(String newMethod, URI newUri, byte[] newBody) {
        return new TransportRequest(newMethod, newUri, headers, newBody, backend, verifyTls, timeout, maxRedirects);
    }
}
