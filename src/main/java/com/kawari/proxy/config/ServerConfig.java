package com.kawari.proxy.config;

/**
 * Listener settings for the rotating proxy server.
 */
public class ServerConfig {
    /** Host to bind. {@code 0.0.0.0} means all interfaces. */
    private String host = "0.0.0.0";

    /** Port to listen on. */
    private int port = 8080;

    /** Whether to use TCP keep-alive on client sockets. */
    private boolean keepAlive = true;

    /** Client socket read timeout in milliseconds. Default is 60s. */
    private int timeout = 60000;

    /** Maximum concurrent client connections. */
    private int maxConnections = 10000;

    /** Largest accepted request body in bytes. Default is 10 MB. */
    private long maxBodyBytes = 10L * 1024 * 1024;

    /** Skips the private-address check on targets. Only for trusted deployments. */
    private boolean allowPrivateTargets = false;

    /** Whether to serve TLS on the listener. */
    private boolean tlsEnabled = false;

    /** Path to the PKCS12 keystore file. */
    private String keystorePath;

    /** Password for the keystore. */
    private String keystorePassword;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public long getMaxBodyBytes() {
        return maxBodyBytes;
    }

    public void setMaxBodyBytes(long maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    public boolean isAllowPrivateTargets() {
        return allowPrivateTargets;
    }

    public void setAllowPrivateTargets(boolean allowPrivateTargets) {
        this.allowPrivateTargets = allowPrivateTargets;
    }

    public boolean isTlsEnabled() {
        return tlsEnabled;
    }

    public void setTlsEnabled(boolean tlsEnabled) {
        this.tlsEnabled = tlsEnabled;
    }

    public String getKeystorePath() {
        return keystorePath;
    }

    public void setKeystorePath(String keystorePath) {
        this.keystorePath = keystorePath;
    }

    public String getKeystorePassword() {
        return keystorePassword;
    }

    public void setKeystorePassword(String keystorePassword) {
        this.keystorePassword = keystorePassword;
    }
}
