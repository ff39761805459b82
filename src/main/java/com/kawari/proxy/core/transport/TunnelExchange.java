package com.kawari.proxy.core.transport;

import com.kawari.proxy.core.constants.HeaderConstants;
import com.kawari.proxy.core.proxy.UpstreamConnector;
import com.kawari.proxy.core.utils.HeaderUtils;
import com.kawari.proxy.core.utils.IoUtils;
import com.kawari.proxy.core.utils.SslUtils;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * HTTP/1.1 exchange over a raw tunnel opened by {@link UpstreamConnector}. Used for
 * backends the JDK client cannot route through (SOCKS and TLS-fronted proxies).
 * One connection per exchange, closed afterwards.
 */
class TunnelExchange {
    private static final int MAX_RESPONSE_HEADERS = 200;
    private static final long MAX_RESPONSE_BYTES = Integer.MAX_VALUE - 8L;

    /** Headers this class writes itself. */
    private static final Set<String> FRAMING_HEADERS;

    static {
        Set<String> framing = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        framing.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue()));
        FRAMING_HEADERS = framing;
    }

    TransportResponse exchange(TransportRequest request) throws IOException {
        URI uri = request.uri();
        boolean tls = "https".equalsIgnoreCase(uri.getScheme());
        int port = uri.getPort() != -1 ? uri.getPort() : (tls ? 443 : 80);
        long deadline = System.nanoTime() + request.timeout().toNanos();
        int connectTimeout = (int) Math.max(1, Math.min(Integer.MAX_VALUE, request.timeout().toMillis()));

        Socket socket = UpstreamConnector.connect(uri.getHost(), port, request.backend(), connectTimeout,
                request.verifyTls());
        try {
            if (tls) {
                socket = SslUtils.wrapClient(socket, uri.getHost(), port, request.verifyTls());
            }
            OutputStream out = socket.getOutputStream();
            out.write(requestHead(request, uri, port, tls));
            out.write(request.body());
            out.flush();

            InputStream in = new BufferedInputStream(new DeadlineInputStream(socket, deadline));
            return readResponse(in, request.method(), uri);
        } finally {
            IoUtils.closeQuietly(socket, "tunnel socket");
        }
    }

    private static byte[] requestHead(TransportRequest request, URI uri, int port, boolean tls) {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path += "?" + uri.getRawQuery();
        }
        boolean defaultPort = (tls && port == 443) || (!tls && port == 80);
        StringBuilder sb = new StringBuilder(256);
        sb.append(request.method()).append(' ').append(path).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(uri.getHost()).append(defaultPort ? "" : ":" + port).append("\r\n");
        request.headers().forEach((k, v) -> {
            if (!FRAMING_HEADERS.contains(k)) {
                HeaderUtils.requireValid(k, v);
                sb.append(k).append(": ").append(v).append("\r\n");
            }
        });
        if (request.body().length > 0 || !isBodyless(request.method())) {
            sb.append("Content-Length: ").append(request.body().length).append("\r\n");
        }
        sb.append("Connection: close\r\n\r\n");
        return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    private static TransportResponse readResponse(InputStream in, String method, URI uri) throws IOException {
        String statusLine = IoUtils.readLine(in);
        int status;
        Map<String, List<String>> headers;
        do {
            if (statusLine == null) {
                throw new IOException("Connection closed before response from " + uri.getHost());
            }
            status = parseStatus(statusLine);
            headers = readHeaders(in);
            // Skip interim 1xx responses
        } while (status >= 100 && status < 200 && (statusLine = IoUtils.readLine(in)) != null);

        byte[] body;
        if ("HEAD".equals(method) || status == 204 || status == 304) {
            body = new byte[0];
        } else if (isChunked(headers)) {
            body = IoUtils.readChunked(in, MAX_RESPONSE_BYTES);
        } else if (headers.containsKey(HeaderConstants.CONTENT_LENGTH.getValue())) {
            long length = parseLength(headers.get(HeaderConstants.CONTENT_LENGTH.getValue()).get(0));
            body = IoUtils.readFully(in, (int) length);
        } else {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            in.transferTo(buf);
            body = buf.toByteArray();
        }
        return new TransportResponse(status, headers, body, uri);
    }

    private static Map<String, List<String>> readHeaders(InputStream in) throws IOException {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        String line;
        int count = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++count > MAX_RESPONSE_HEADERS) {
                throw new IOException("Too many response headers");
            }
            int idx = line.indexOf(':');
            if (idx > 0) {
                String name = line.substring(0, idx).trim();
                String existing = findKey(headers, name);
                headers.computeIfAbsent(existing != null ? existing : name, k -> new ArrayList<>())
                        .add(line.substring(idx + 1).trim());
            }
        }
        return headers;
    }

    private static String findKey(Map<String, List<String>> headers, String name) {
        for (String key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return key;
            }
        }
        return null;
    }

    private static boolean isChunked(Map<String, List<String>> headers) {
        String key = findKey(headers, HeaderConstants.TRANSFER_ENCODING.getValue());
        return key != null && headers.get(key).stream()
                .anyMatch(v -> v.toLowerCase(Locale.ROOT).contains("chunked"));
    }

    private static int parseStatus(String statusLine) throws IOException {
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2 || !parts[0].startsWith("HTTP/")) {
            throw new IOException("Malformed status line: " + statusLine);
        }
        try {
            return Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IOException("Malformed status line: " + statusLine, e);
        }
    }

    private static long parseLength(String value) throws IOException {
        try {
            long length = Long.parseLong(value.trim());
            if (length < 0 || length > MAX_RESPONSE_BYTES) {
                throw new IOException("Unsupported Content-Length: " + value);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new IOException("Invalid Content-Length: " + value, e);
        }
    }

    private static boolean isBodyless(String method) {
        return "GET".equals(method) || "HEAD".equals(method) || "OPTIONS".equals(method)
                || "DELETE".equals(method);
    }

    /**
     * Applies the remaining time of the attempt as the socket read timeout before every read.
     */
    private static final class DeadlineInputStream extends FilterInputStream {
        private final Socket socket;
        private final long deadline;

        DeadlineInputStream(Socket socket, long deadline) throws IOException {
            super(socket.getInputStream());
            this.socket = socket;
            this.deadline = deadline;
        }

        private void arm() throws IOException {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                throw new SocketTimeoutException("Request timed out");
            }
            socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, remainingMillis));
        }

        @Override
        public int read() throws IOException {
            arm();
            return super.read();
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            arm();
            return super.read(b, off, len);
        }
    }
}
