package com.kawari.proxy.core.rotation;

import com.kawari.proxy.core.utils.HeaderUtils;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Caller request handed to {@link RotationEngine#execute(DispatchRequest)}.
 *
 * @param method      HTTP method, upper-cased.
 * @param target      absolute target URI.
 * @param headers     caller headers; they win over defaults and the rotated identity. Names must be
 *                    HTTP tokens and values must not contain line breaks.
 * @param body        request body, empty for none.
 * @param queryParams extra query parameters appended to the target.
 */
public record DispatchRequest(String method, URI target, Map<String, String> headers, byte[] body,
        Map<String, String> queryParams) {

    public DispatchRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("Method must not be empty");
        }
        if (target == null || !target.isAbsolute()) {
            throw new IllegalArgumentException("Target must be an absolute URI: " + target);
        }
        method = method.toUpperCase(Locale.ROOT);
        Map<String, String> headerCopy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach(HeaderUtils::requireValid);
            headerCopy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(headerCopy);
        body = body == null ? new byte[0] : body;
        queryParams = queryParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
    }

    public static DispatchRequest get(String url) {
        return new DispatchRequest("GET", URI.create(url), null, null, null);
    }

    public static DispatchRequest of(String method, URI target, Map<String, String> headers, byte[] body) {
        return new DispatchRequest(method, target, headers, body, null);
    }

    /**
     * Target with {@link #queryParams()} URL-encoded and appended to any existing query.
     *
     * @return the URI sent upstream.
     */
    public URI resolvedTarget() {
        if (queryParams.isEmpty()) {
            return target;
        }
        StringBuilder sb = new StringBuilder(target.toString());
        int fragment = sb.indexOf("#");
        String tail = "";
        if (fragment >= 0) {
            tail = sb.substring(fragment);
            sb.setLength(fragment);
        }
        char sep = target.getRawQuery() == null ? '?' : '&';
        for (Map.Entry<String, String> param : queryParams.entrySet()) {
            sb.append(sep)
                    .append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(param.getValue() == null ? "" : param.getValue(),
                            StandardCharsets.UTF_8));
            sep = '&';
        }
        return URI.create(sb.append(tail).toString());
    }
}
