package com.kawari.proxy.core.proxy;

import com.kawari.proxy.config.ServerConfig;

/**
 * A listening server whose lifecycle is driven by the application.
 */
public interface ProxyServer {
    /**
     * Binds and runs the accept loop. Blocks until {@link #stop()} is called.
     */
    void start();

    /**
     * Closes the listener and every active connection.
     */
    void stop();

    /**
     * @return the listener configuration.
     */
    ServerConfig getConfig();
}
