package com.kawari.proxy.core.proxy;

import com.kawari.proxy.config.ServerConfig;
import com.kawari.proxy.core.constants.HeaderConstants;
import com.kawari.proxy.core.exceptions.ProtocolException;
import com.kawari.proxy.core.exceptions.ProxyException;
import com.kawari.proxy.core.frontend.DispatchFrontend;
import com.kawari.proxy.core.frontend.FrontendResponse;
import com.kawari.proxy.core.services.LoggingService;
import com.kawari.proxy.core.services.LoggingService.AccessRecord;
import com.kawari.proxy.core.utils.HeaderUtils;
import com.kawari.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP/1.1 listener in front of a {@link DispatchFrontend}. Serves {@code /health} and
 * {@code /stats} itself and hands every other request target to the frontend,
 * either path-embedded ({@code /http://host/path}) or in absolute form.
 */
public class RotatingProxyServer extends AbstractProxyServer {

    private static final int MAX_HTTP_HEADERS = 100;

    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(100, "Continue"), Map.entry(200, "OK"), Map.entry(201, "Created"),
            Map.entry(202, "Accepted"), Map.entry(204, "No Content"), Map.entry(206, "Partial Content"),
            Map.entry(301, "Moved Permanently"), Map.entry(302, "Found"), Map.entry(303, "See Other"),
            Map.entry(304, "Not Modified"), Map.entry(307, "Temporary Redirect"),
            Map.entry(308, "Permanent Redirect"), Map.entry(400, "Bad Request"),
            Map.entry(401, "Unauthorized"), Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
            Map.entry(413, "Payload Too Large"), Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

    private final AtomicReference<DispatchFrontend> frontend;
    private final Counter requestsTotal;

    /**
     * @param config           listener configuration.
     * @param certificatesPath directory for relative keystore paths.
     * @param frontend         initial frontend; can be swapped with {@link #replaceFrontend}.
     * @param loggingService   access log.
     * @param registry         meter registry.
     */
    public RotatingProxyServer(ServerConfig config, String certificatesPath, DispatchFrontend frontend,
            LoggingService loggingService, MeterRegistry registry) {
        super(config, certificatesPath, loggingService, registry);
        this.frontend = new AtomicReference<>(frontend);
        this.requestsTotal = Counter.builder("kawari.http.requests.total")
                .description("Total number of HTTP requests")
                .register(registry);
    }

    /**
     * Atomically installs a new frontend. Requests already running finish on the old one.
     *
     * @param replacement the new frontend.
     * @return the frontend that was replaced.
     */
    public DispatchFrontend replaceFrontend(DispatchFrontend replacement) {
        return frontend.getAndSet(replacement);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public DispatchFrontend getFrontend() {
        return frontend.get();
    }

    @Override
    protected String getProxyName() {
        return "HTTP";
    }

    @Override
    protected void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try (client) {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream());
            while (!client.isClosed() && processNextRequest(in, out, remoteAddr)) {
                // keep-alive: serve the next request on the same connection
            }
        } catch (ProtocolException e) {
            log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
        } catch (ProxyException e) {
            log.error("Proxy error for {}: {}", remoteAddr, e.getMessage());
        } catch (IOException e) {
            log.debug("Connection from {} ended: {}", remoteAddr, e.getMessage());
        }
    }

    /**
     * Reads and answers one request.
     *
     * @return whether the connection stays open for another request.
     */
    private boolean processNextRequest(InputStream in, OutputStream out, String remoteAddr) throws IOException {
        String requestLine = IoUtils.readLine(in);
        if (requestLine == null || requestLine.isEmpty()) {
            return false;
        }
        requestsTotal.increment();

        String[] parts = requestLine.split(" ");
        if (parts.length != 3 || !parts[2].startsWith("HTTP/")) {
            respond(out, DispatchFrontend.errorResponse(400, "Malformed request line"), false, true);
            logAccess(remoteAddr, "-", requestLine, 400, 0, null);
            return false;
        }
        String method = parts[0].toUpperCase(Locale.ROOT);
        String target = parts[1];
        String version = parts[2];

        Map<String, String> headers;
        try {
            headers = readHeaders(in);
        } catch (ProtocolException e) {
            log.warn("Rejected request from {}: {}", remoteAddr, e.getMessage());
            respond(out, DispatchFrontend.errorResponse(400, e.getMessage()), false, true);
            logAccess(remoteAddr, method, target, 400, 0, null);
            return false;
        }
        boolean keepAlive = wantsKeepAlive(version, headers);
        boolean head = "HEAD".equals(method);

        if ("CONNECT".equals(method)) {
            respond(out, DispatchFrontend.errorResponse(405,
                    "CONNECT tunnels are not supported; send the target URL in the request path"), false, true);
            logAccess(remoteAddr, method, target, 405, 0, null);
            return false;
        }

        DispatchFrontend current = frontend.get();
        byte[] body;
        try {
            body = readBody(in, headers, current.getMaxBodyBytes());
        } catch (IoUtils.LimitExceededException e) {
            FrontendResponse rejected = DispatchFrontend.errorResponse(413, current.bodyTooLarge().getMessage());
            respond(out, rejected, head, true);
            logAccess(remoteAddr, method, target, 413, rejected.body().length, null);
            return false;
        } catch (ProtocolException e) {
            respond(out, DispatchFrontend.errorResponse(400, e.getMessage()), head, true);
            logAccess(remoteAddr, method, target, 400, 0, null);
            return false;
        }

        FrontendResponse response;
        String path = target.indexOf('?') >= 0 ? target.substring(0, target.indexOf('?')) : target;
        if ("/health".equals(path) && ("GET".equals(method) || head)) {
            response = current.healthResponse();
        } else if ("/stats".equals(path) && ("GET".equals(method) || head)) {
            response = current.statsResponse();
        } else {
            try {
                response = current.handle(method, target, headers, body);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                respond(out, DispatchFrontend.errorResponse(503, "Server is shutting down"), head, true);
                logAccess(remoteAddr, method, target, 503, 0, null);
                return false;
            }
        }

        respond(out, response, head, !keepAlive);
        logAccess(remoteAddr, method, target, response.status(), head ? 0 : response.body().length, response);
        return keepAlive;
    }

    private boolean wantsKeepAlive(String version, Map<String, String> headers) {
        if (!config.isKeepAlive()) {
            return false;
        }
        String connection = headers.get(HeaderConstants.CONNECTION.getValue());
        if ("HTTP/1.0".equals(version)) {
            return "keep-alive".equalsIgnoreCase(connection);
        }
        return !"close".equalsIgnoreCase(connection);
    }

    private Map<String, String> readHeaders(InputStream in) throws IOException {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String line;
        int headerCount = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx <= 0) {
                continue;
            }
            String name = line.substring(0, idx);
            String value = line.substring(idx + 1).trim();
            if (!HeaderUtils.isToken(name)) {
                throw new ProtocolException("Invalid header name: \"" + name + "\"");
            }
            if (!HeaderUtils.isSafeValue(value)) {
                throw new ProtocolException("Invalid value for header " + name);
            }
            headers.merge(name, value, (a, b) -> a + ", " + b);
        }
        return headers;
    }

    /**
     * Reads the request body by Content-Length or chunked coding. A declared length over
     * the limit is rejected without reading it.
     */
    private static byte[] readBody(InputStream in, Map<String, String> headers, long maxBytes) throws IOException {
        String transferEncoding = headers.get(HeaderConstants.TRANSFER_ENCODING.getValue());
        if (transferEncoding != null && transferEncoding.toLowerCase(Locale.ROOT).contains("chunked")) {
            return IoUtils.readChunked(in, maxBytes);
        }
        String contentLength = headers.get(HeaderConstants.CONTENT_LENGTH.getValue());
        if (contentLength == null) {
            return new byte[0];
        }
        long length;
        try {
            length = Long.parseLong(contentLength.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + contentLength, e);
        }
        if (length < 0) {
            throw new ProtocolException("Invalid Content-Length: " + contentLength);
        }
        if (length > maxBytes) {
            throw new IoUtils.LimitExceededException("Declared body of " + length + " bytes exceeds " + maxBytes);
        }
        return IoUtils.readFully(in, (int) length);
    }

    private static void respond(OutputStream out, FrontendResponse response, boolean head, boolean close)
            throws IOException {
        int status = response.status();
        StringBuilder sb = new StringBuilder(256);
        sb.append("HTTP/1.1 ").append(status).append(' ')
                .append(REASON_PHRASES.getOrDefault(status, "Unknown")).append("\r\n");
        for (Map.Entry<String, List<String>> header : response.headers().entrySet()) {
            for (String value : header.getValue()) {
                sb.append(header.getKey()).append(": ").append(value).append("\r\n");
            }
        }
        sb.append("Content-Length: ").append(response.body().length).append("\r\n");
        if (close) {
            sb.append("Connection: close\r\n");
        }
        sb.append("\r\n");
        out.write(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
        if (!head) {
            out.write(response.body());
        }
        out.flush();
    }

    private void logAccess(String remoteAddr, String method, String target, int status, long bytes,
            FrontendResponse response) {
        String identity = response != null ? response.identity() : null;
        String backend = response != null && response.backend() != null ? response.backend().toString() : null;
        int attempts = response != null ? response.attempts() : 0;
        loggingService.logRequest(new AccessRecord(remoteAddr, method, target, status, bytes, identity, backend,
                attempts));
    }

    @Override
    public void stop() {
        super.stop();
        registry.remove(requestsTotal);
    }
}
