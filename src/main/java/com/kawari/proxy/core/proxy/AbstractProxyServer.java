package com.kawari.proxy.core.proxy;

import com.kawari.proxy.config.ServerConfig;
import com.kawari.proxy.core.services.LoggingService;
import com.kawari.proxy.core.utils.IoUtils;
import com.kawari.proxy.core.utils.SslUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Socket listener skeleton. Owns the listening socket (plain or TLS), the accept loop,
 * the cap on concurrent connections and the connection meters. Subclasses implement
 * {@link #handleClient(Socket)}.
 */
public abstract class AbstractProxyServer implements ProxyServer {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private static final int DEFAULT_CLIENT_TIMEOUT_MS = 60_000;
    private static final long DRAIN_SECONDS = 5;

    protected final ServerConfig config;
    protected final LoggingService loggingService;
    protected final MeterRegistry registry;

    private final String certificatesPath;
    private final ExecutorService workers;
    private final Semaphore slots;
    private final Set<Socket> openClients = ConcurrentHashMap.newKeySet();

    private final Counter accepted;
    private final Counter failures;
    private final List<Meter> meters;

    private final CountDownLatch bound = new CountDownLatch(1);
    private volatile boolean listening;
    private volatile ServerSocket listener;

    /**
     * @param config           listener configuration.
     * @param certificatesPath directory for relative keystore paths, {@code null} for {@code certificates}.
     * @param loggingService   access log.
     * @param registry         meter registry.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    protected AbstractProxyServer(ServerConfig config, String certificatesPath, LoggingService loggingService,
            MeterRegistry registry) {
        this.config = config;
        this.certificatesPath = certificatesPath != null ? certificatesPath : "certificates";
        this.loggingService = loggingService;
        this.registry = registry;
        this.slots = new Semaphore(config.getMaxConnections());

        String name = getProxyName().toLowerCase(Locale.ROOT);
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "kawari-" + name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.accepted = Counter.builder("kawari.connections.total")
                .tag("name", name)
                .description("Accepted client connections")
                .register(registry);
        this.failures = Counter.builder("kawari.connections.errors")
                .tag("name", name)
                .description("Listener and connection errors")
                .register(registry);
        Gauge open = Gauge.builder("kawari.connections.active", openClients, Set::size)
                .tag("name", name)
                .description("Open client connections")
                .register(registry);
        this.meters = List.of(accepted, failures, open);
    }

    /**
     * Binds and serves until {@link #stop()} closes the listener. Bind failures are
     * logged and reported through {@link #awaitBind}.
     */
    @Override
    public void start() {
        ServerSocket socket;
        try {
            socket = openListener();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            failures.increment();
            log.error("{} could not listen on {}:{}: {}", getProxyName(), config.getHost(), config.getPort(),
                    e.getMessage(), e);
            bound.countDown();
            return;
        }
        listener = socket;
        listening = true;
        bound.countDown();
        log.info("{} listening on {}:{} (TLS: {})", getProxyName(), config.getHost(), getPort(),
                config.isTlsEnabled());

        while (!socket.isClosed()) {
            try {
                admit(socket.accept());
            } catch (SocketException e) {
                if (socket.isClosed()) {
                    break;
                }
                failures.increment();
                log.warn("{} accept failed: {}", getProxyName(), e.getMessage());
            } catch (IOException e) {
                failures.increment();
                log.warn("{} I/O error while accepting: {}", getProxyName(), e.getMessage());
            }
        }
    }

    private ServerSocket openListener() throws IOException, GeneralSecurityException {
        if (config.isTlsEnabled()) {
            return SslUtils.createSslFactory(config, certificatesPath).createServerSocket();
        }
        return new ServerSocket();
    }

    /**
     * Waits until the listener is bound or has failed to bind.
     *
     * @param timeout maximum time to wait.
     * @param unit    unit of the timeout.
     * @return whether the listener is bound.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bound.await(timeout, unit) && listening;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return the bound port once listening, otherwise the configured one.
     */
    public int getPort() {
        ServerSocket socket = listener;
        return socket != null && socket.isBound() ? socket.getLocalPort() : config.getPort();
    }

    private void admit(Socket client) {
        accepted.increment();
        tune(client);
        if (!slots.tryAcquire()) {
            log.warn("{} rejected {}: {} connections open", getProxyName(),
                    client.getInetAddress().getHostAddress(), config.getMaxConnections());
            IoUtils.closeQuietly(client, "rejected client socket");
            return;
        }
        openClients.add(client);
        workers.submit(() -> serve(client));
    }

    private void tune(Socket client) {
        try {
            client.setTcpNoDelay(true);
            client.setKeepAlive(config.isKeepAlive());
            client.setSoTimeout(config.getTimeout() > 0 ? config.getTimeout() : DEFAULT_CLIENT_TIMEOUT_MS);
        } catch (SocketException e) {
            log.debug("{} could not tune client socket: {}", getProxyName(), e.getMessage());
        }
    }

    private void serve(Socket client) {
        try {
            handleClient(client);
        } catch (RuntimeException e) {
            failures.increment();
            log.error("{} failed serving {}: {}", getProxyName(), client.getInetAddress().getHostAddress(),
                    e.getMessage(), e);
        } finally {
            openClients.remove(client);
            slots.release();
            IoUtils.closeQuietly(client, "client socket");
        }
    }

    /**
     * Closes the listener and every open connection, drains workers and removes the
     * connection meters.
     */
    @Override
    public void stop() {
        log.info("Stopping {} listener on port {}", getProxyName(), getPort());
        ServerSocket socket = listener;
        if (socket != null) {
            IoUtils.closeQuietly(socket, "listener socket");
        }
        openClients.forEach(IoUtils::closeQuietly);
        openClients.clear();
        meters.forEach(registry::remove);

        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(DRAIN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("{} workers still running {} s after stop", getProxyName(), DRAIN_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getConfig() {
        return config;
    }

    /**
     * @return short protocol name for logs, thread names and meter tags.
     */
    protected abstract String getProxyName();

    /**
     * Serves one connection on a worker thread. The socket is closed when this returns.
     *
     * @param client accepted client socket.
     */
    protected abstract void handleClient(Socket client);
}
