package com.kawari.proxy;

import com.kawari.proxy.config.KawariProperties;
import com.kawari.proxy.config.ServerConfig;
import com.kawari.proxy.core.exceptions.ConfigException;
import com.kawari.proxy.core.exceptions.ProxyException;
import com.kawari.proxy.core.frontend.AddressPolicy;
import com.kawari.proxy.core.frontend.DispatchFrontend;
import com.kawari.proxy.core.proxy.RotatingProxyServer;
import com.kawari.proxy.core.rotation.EngineFactory;
import com.kawari.proxy.core.rotation.EngineStats;
import com.kawari.proxy.core.rotation.RotationEngine;
import com.kawari.proxy.core.services.LoggingService;
import com.kawari.proxy.core.services.MetricsService;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Scanner;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Entry point of the rotating proxy. Loads the configuration, assembles the engine and
 * runs the listener until stopped.
 */
@Command(name = "kawari-proxy", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "HTTP forwarding proxy rotating User-Agent identities and upstream proxies.")
public class KawariProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(KawariProxyApplication.class);

    private static final long BIND_TIMEOUT_SECONDS = 10;

    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)",
            defaultValue = "application.yml")
    private String configPath;

    @Option(names = "--host", description = "Listen address, overrides server.host")
    private String host;

    @Option(names = "--port", description = "Listen port, overrides server.port")
    private Integer port;

    @Option(names = "--free-proxies", description = "Fetch backends from public proxy lists at start-up")
    private boolean freeProxies;

    @Option(names = "--max-proxies", description = "Maximum number of discovered backends")
    private Integer maxProxies;

    @Option(names = "--strategy", description = "Rotation strategy: random or round-robin")
    private String strategy;

    @Option(names = "--rate-limit", description = "Maximum dispatches per second")
    private Double rateLimit;

    private LoggingService loggingService;
    private MetricsService metricsService;
    private volatile RotatingProxyServer server;
    private KawariProperties properties;

    /** Blocks the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private final AtomicBoolean running = new AtomicBoolean(true);

    private Thread shutdownHook;

    public static void main(String[] args) {
        System.exit(new CommandLine(new KawariProxyApplication()).execute(args));
    }

    /**
     * Starts the proxy and blocks until {@link #stop()} is called.
     *
     * @return 0 on a clean run, 1 on configuration or fatal errors.
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Kawari Proxy...");

            this.properties = loadConfig(configPath);
            this.metricsService = new MetricsService(properties.getAdmin());
            this.loggingService = new LoggingService(properties.getLogging());

            RotationEngine engine = EngineFactory.create(properties, metricsService.getRegistry());
            RotatingProxyServer proxyServer = new RotatingProxyServer(properties.getServer(),
                    properties.getCertificatesPath(), createFrontend(engine, properties), loggingService,
                    metricsService.getRegistry());
            this.server = proxyServer;

            Thread serverThread = new Thread(proxyServer::start, "kawari-server");
            serverThread.setDaemon(true);
            serverThread.start();
            if (!proxyServer.awaitBind(BIND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new ProxyException("Failed to bind " + properties.getServer().getHost() + ":"
                        + properties.getServer().getPort());
            }
            log.info("Kawari Proxy listening on {}:{}", properties.getServer().getHost(), proxyServer.getPort());

            if (System.getProperty("kawari.no-command-listener") == null) {
                startCommandListener();
            }
            if (System.getProperty("kawari.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal proxy error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (RuntimeException e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    private static DispatchFrontend createFrontend(RotationEngine engine, KawariProperties props) {
        ServerConfig serverConfig = props.getServer();
        return new DispatchFrontend(engine, new AddressPolicy(serverConfig.isAllowPrivateTargets()),
                serverConfig.getMaxBodyBytes());
    }

    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'help' for available commands.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // until input closes or stop is signaled
                }
            } catch (IllegalStateException e) {
                if (running.get()) {
                    log.warn("Command listener stopped: {}", e.getMessage());
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine().trim().toLowerCase(Locale.ROOT));
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    /**
     * Runs one console command.
     *
     * @param command lower-cased command.
     */
    void processCommand(String command) {
        if (command.isEmpty()) {
            return;
        }
        switch (command) {
            case "reload" -> reloadConfiguration();
            case "stats" -> logStats();
            case "stop", "exit", "quit" -> stop();
            case "help" -> log.info("Available commands: reload, stats, stop, exit, quit, help");
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    private void logStats() {
        RotatingProxyServer current = server;
        if (current == null) {
            log.info("Proxy is not running");
            return;
        }
        EngineStats stats = current.getFrontend().stats();
        log.info("Backends: {} total, {} healthy; {} identities; strategy {}; rate limit {}",
                stats.totalProxies(), stats.healthyProxies(), stats.totalUserAgents(), stats.rotationStrategy(),
                stats.rateLimit() != null ? stats.rateLimit() + "/s" : "none");
    }

    /**
     * Rebuilds the engine from disk and swaps it in. Requests already running finish on the
     * old engine. Listener address changes need a restart.
     */
    void reloadConfiguration() {
        RotatingProxyServer current = server;
        if (current == null) {
            return;
        }
        try {
            log.info("Reloading configuration from {}...", configPath);
            KawariProperties newProps = loadConfig(configPath);
            RotationEngine engine = EngineFactory.create(newProps, metricsService.getRegistry());
            DispatchFrontend previous = current.replaceFrontend(createFrontend(engine, newProps));
            previous.getEngine().close();

            loggingService.updateConfig(newProps.getLogging());
            metricsService.updateConfig(newProps.getAdmin());
            ServerConfig oldServer = properties.getServer();
            ServerConfig newServer = newProps.getServer();
            if (!Objects.equals(oldServer.getHost(), newServer.getHost()) || oldServer.getPort() != newServer.getPort()
                    || oldServer.isTlsEnabled() != newServer.isTlsEnabled()) {
                log.warn("Listener settings changed; restart to apply them");
            }
            this.properties = newProps;
            log.info("Configuration reloaded successfully.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reload interrupted");
        } catch (ProxyException e) {
            log.error("Failed to reload configuration: {}", e.getMessage());
        }
    }

    /**
     * Stops the listener, closes the engine and shuts down services. Idempotent.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Kawari Proxy...");
            unregisterShutdownHook();

            RotatingProxyServer current = server;
            if (current != null) {
                current.stop();
                current.getFrontend().getEngine().close();
            }
            if (loggingService != null) {
                loggingService.shutdown();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            shutdownLatch.countDown();
        }
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress");
            }
        }
    }

    /**
     * @return the running listener, or {@code null} before start-up.
     */
    RotatingProxyServer getServer() {
        return server;
    }

    /**
     * Loads the configuration from a file, falling back to the classpath, and applies
     * command-line overrides.
     *
     * @param path file path or classpath resource.
     * @return loaded properties.
     * @throws ConfigException if the configuration cannot be loaded.
     */
    KawariProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(KawariProperties.class, new LoaderOptions()));

        KawariProperties loaded = tryLoadFromFile(yaml, path);
        if (loaded == null) {
            loaded = tryLoadFromClasspath(yaml, path);
        }
        if (loaded == null) {
            throw new ConfigException("Configuration file not found: " + path);
        }
        applyOverrides(loaded);
        return loaded;
    }

    private void applyOverrides(KawariProperties props) {
        if (host != null) {
            props.getServer().setHost(host);
        }
        if (port != null) {
            props.getServer().setPort(port);
        }
        if (freeProxies) {
            props.getDiscovery().setEnabled(true);
        }
        if (maxProxies != null) {
            props.getDiscovery().setMaxProxies(maxProxies);
        }
        if (strategy != null) {
            props.getRotation().setStrategy(strategy);
        }
        if (rateLimit != null) {
            props.getRotation().setRateLimit(rateLimit);
        }
    }

    private KawariProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (!file.exists()) {
            return null;
        }
        try (InputStream is = new FileInputStream(file)) {
            return orDefaults(yaml.load(is));
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Error reading config file: " + path, e);
        }
    }

    private KawariProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    /** An empty document loads as {@code null}. */
    private static KawariProperties orDefaults(KawariProperties loaded) {
        return loaded != null ? loaded : new KawariProperties();
    }
}
