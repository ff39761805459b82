package com.kawari.proxy.config;

/**
 * Loopback admin endpoint exposing {@code /health} and Prometheus {@code /metrics}.
 * Separate from the proxy listener, whose own {@code /health} and {@code /stats} are
 * always served.
 */
public class AdminConfig {
    private boolean enabled = true;

    /** {@code 0} picks a free port. */
    private int port = 9090;

    private String bindAddress = "127.0.0.1";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }
}
