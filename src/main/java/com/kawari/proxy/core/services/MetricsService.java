package com.kawari.proxy.core.services;

import com.kawari.proxy.config.AdminConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the Prometheus meter registry and the loopback admin server exposing
 * {@code /health} and {@code /metrics}.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;
    private AdminConfig config;

    public MetricsService(AdminConfig config) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = config;
        startAdminServer();
    }

    private void startAdminServer() {
        if (!config.isEnabled()) {
            return;
        }
        try {
            adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);
            adminServer.createContext("/health", exchange -> respond(exchange, "OK", "text/plain"));
            adminServer.createContext("/metrics", exchange -> respond(exchange, registry.scrape(),
                    "text/plain; version=0.0.4; charset=utf-8"));

            adminExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "kawari-admin");
                t.setDaemon(true);
                return t;
            });
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on {}:{} (/health, /metrics)", config.getBindAddress(), getPort());
        } catch (IOException e) {
            log.error("Failed to start admin server on {}:{}: {}", config.getBindAddress(), config.getPort(),
                    e.getMessage());
            adminServer = null;
        }
    }

    private static void respond(HttpExchange exchange, String body, String contentType) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @return the bound admin port, or {@code -1} when the admin server is not running.
     */
    public int getPort() {
        return adminServer != null ? adminServer.getAddress().getPort() : -1;
    }

    /**
     * Restarts the admin server if its address or enablement changed.
     *
     * @param newConfig new admin settings.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void updateConfig(AdminConfig newConfig) {
        if (newConfig.isEnabled() != config.isEnabled() || newConfig.getPort() != config.getPort()
                || !Objects.equals(newConfig.getBindAddress(), config.getBindAddress())) {
            shutdown();
            config = newConfig;
            startAdminServer();
        }
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
