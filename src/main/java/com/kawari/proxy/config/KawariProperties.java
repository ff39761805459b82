package com.kawari.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root configuration object. Maps to the top-level structure of application.yml.
 */
public class KawariProperties {
    private ServerConfig server = new ServerConfig();

    private RotationProperties rotation = new RotationProperties();

    /** Statically configured upstream proxies. */
    private List<BackendConfig> backends = new ArrayList<>();

    private DiscoveryConfig discovery = new DiscoveryConfig();

    private AdminConfig admin = new AdminConfig();

    /**
     * Access log configuration.
     */
    private LoggingConfig logging = new LoggingConfig();

    /**
     * Directory containing certificates (e.g. keystores).
     */
    private String certificatesPath = "certificates";

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getServer() {
        return server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setServer(ServerConfig server) {
        this.server = server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RotationProperties getRotation() {
        return rotation;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setRotation(RotationProperties rotation) {
        this.rotation = rotation;
    }

    public List<BackendConfig> getBackends() {
        return backends == null ? null : Collections.unmodifiableList(backends);
    }

    public void setBackends(List<BackendConfig> backends) {
        this.backends = backends == null ? null : new ArrayList<>(backends);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public DiscoveryConfig getDiscovery() {
        return discovery;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setDiscovery(DiscoveryConfig discovery) {
        this.discovery = discovery;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    public String getCertificatesPath() {
        return certificatesPath;
    }

    public void setCertificatesPath(String certificatesPath) {
        this.certificatesPath = certificatesPath;
    }
}
