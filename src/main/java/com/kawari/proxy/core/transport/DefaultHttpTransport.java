package com.kawari.proxy.core.transport;

import com.kawari.proxy.core.constants.BackendScheme;
import com.kawari.proxy.core.constants.HeaderConstants;
import com.kawari.proxy.core.rotation.BackendDescriptor;
import com.kawari.proxy.core.utils.SslUtils;
import com.kawari.proxy.spi.HttpTransport;
import java.io.IOException;
import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default transport. Direct requests and plain HTTP backends go through the JDK
 * {@link HttpClient}; SOCKS backends, TLS-fronted backends and authenticated CONNECT
 * tunnels go through a raw {@link TunnelExchange}. Redirects are followed manually so
 * every hop keeps the same route.
 */
public class DefaultHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(DefaultHttpTransport.class);

    private static final String LOCATION_HEADER = HeaderConstants.LOCATION.getValue();

    /** Headers the JDK client refuses or computes itself. */
    private static final Set<String> RESTRICTED_HEADERS;

    static {
        Set<String> restricted = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        restricted.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.UPGRADE.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                "Expect"));
        RESTRICTED_HEADERS = Collections.unmodifiableSet(restricted);
    }

    private record ClientKey(BackendDescriptor backend, boolean verifyTls) {
    }

    private final Map<ClientKey, HttpClient> clients = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final TunnelExchange tunnel = new TunnelExchange();
    private final Duration connectTimeout;
    private volatile boolean closed;

    /**
     * @param connectTimeout connect timeout applied to every client, {@code null} for the JDK default.
     */
    public DefaultHttpTransport(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "kawari-transport-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public DefaultHttpTransport() {
        this(null);
    }

    @Override
    public TransportResponse send(TransportRequest request) throws IOException, InterruptedException {
        if (closed) {
            throw new IOException("Transport is closed");
        }
        long deadline = System.nanoTime() + request.timeout().toNanos();
        TransportRequest current = request;
        int redirects = 0;
        while (true) {
            TransportResponse response = sendOnce(current, deadline);
            String location = response.firstHeader(LOCATION_HEADER).orElse(null);
            if (!isRedirect(response.statusCode()) || location == null || redirects >= request.maxRedirects()) {
                return response;
            }
            URI next;
            try {
                next = current.uri().resolve(location);
            } catch (IllegalArgumentException e) {
                log.debug("Not following malformed redirect location '{}'", location);
                return response;
            }
            if (next.getScheme() == null
                    || !("http".equalsIgnoreCase(next.getScheme()) || "https".equalsIgnoreCase(next.getScheme()))) {
                return response;
            }
            redirects++;
            log.debug("Following {} redirect {} of {} to {}", response.statusCode(), redirects,
                    request.maxRedirects(), next);
            if (switchesToGet(response.statusCode(), current.method())) {
                current = current.redirectTo("GET", next, new byte[0]);
            } else {
                current = current.redirectTo(current.method(), next, current.body());
            }
        }
    }

    private TransportResponse sendOnce(TransportRequest request, long deadline)
            throws IOException, InterruptedException {
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
            throw new HttpTimeoutException("Request timed out");
        }
        Duration remaining = Duration.ofNanos(remainingNanos);
        TransportRequest bounded = new TransportRequest(request.method(), request.uri(), request.headers(),
                request.body(), request.backend(), request.verifyTls(), remaining, request.maxRedirects());

        if (requiresTunnel(bounded)) {
            return tunnel.exchange(bounded);
        }
        HttpClient client = clients.computeIfAbsent(new ClientKey(bounded.backend(), bounded.verifyTls()),
                this::buildClient);
        HttpResponse<byte[]> response = client.send(buildRequest(bounded), HttpResponse.BodyHandlers.ofByteArray());
        return new TransportResponse(response.statusCode(), response.headers().map(), response.body(),
                response.uri());
    }

    /**
     * The JDK client only speaks plain HTTP to a proxy and will not send Basic
     * credentials on a CONNECT, so those routes use the raw tunnel instead.
     */
    static boolean requiresTunnel(TransportRequest request) {
        BackendDescriptor backend = request.backend();
        if (backend == null) {
            return false;
        }
        if (backend.scheme() != BackendScheme.HTTP) {
            return true;
        }
        return backend.hasCredentials() && "https".equalsIgnoreCase(request.uri().getScheme());
    }

    private HttpClient buildClient(ClientKey key) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .executor(executor)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .sslContext(SslUtils.clientContext(key.verifyTls()));
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }

        BackendDescriptor backend = key.backend();
        if (backend != null) {
            builder.proxy(ProxySelector.of(InetSocketAddress.createUnresolved(backend.host(), backend.port())));
            if (backend.hasCredentials()) {
                builder.authenticator(new Authenticator() {
                    @Override
                    protected PasswordAuthentication getPasswordAuthentication() {
                        if (getRequestorType() != RequestorType.PROXY) {
                            return null;
                        }
                        String password = backend.password() != null ? backend.password() : "";
                        return new PasswordAuthentication(backend.username(), password.toCharArray());
                    }
                });
            }
        }
        log.debug("Created HTTP client for {} (verifyTls={})", backend != null ? backend : "direct",
                key.verifyTls());
        return builder.build();
    }

    private static HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.BodyPublisher body = request.body().length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());
        HttpRequest.Builder rb = HttpRequest.newBuilder()
                .uri(request.uri())
                .version(HttpClient.Version.HTTP_1_1)
                .timeout(request.timeout())
                .method(request.method(), body);
        request.headers().forEach((k, v) -> {
            if (!RESTRICTED_HEADERS.contains(k)) {
                rb.header(k, v);
            }
        });
        return rb.build();
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static boolean switchesToGet(int status, String method) {
        if (status == 303) {
            return !"HEAD".equals(method);
        }
        return (status == 301 || status == 302) && "POST".equals(method);
    }

    /**
     * Number of cached clients, one per distinct route and TLS mode.
     *
     * @return cached client count.
     */
    int cachedClients() {
        return clients.size();
    }

    @Override
    public void close() {
        closed = true;
        clients.clear();
        executor.shutdownNow();
    }
}
