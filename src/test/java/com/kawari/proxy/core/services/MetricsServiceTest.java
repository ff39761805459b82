package com.kawari.proxy.core.services;

import com.kawari.proxy.config.AdminConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private final HttpClient client = HttpClient.newHttpClient();

    private MetricsService metricsService;
    private int adminPort;

    @BeforeEach
    void setUp() throws Exception {
        adminPort = freePort();
        metricsService = new MetricsService(adminConfig(true, adminPort));
    }

    @AfterEach
    void tearDown() {
        if (metricsService != null) metricsService.shutdown();
    }

    private static int freePort() throws Exception {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private static AdminConfig adminConfig(boolean enabled, int port) {
        AdminConfig config = new AdminConfig();
        config.setEnabled(enabled);
        config.setBindAddress("127.0.0.1");
        config.setPort(port);
        return config;
    }

    private HttpResponse<String> fetch(int port, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + path))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_returnsOk() throws Exception {
        HttpResponse<String> response = fetch(adminPort, "/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("OK");
        assertThat(metricsService.getPort()).isEqualTo(adminPort);
    }

    @Test
    void metrics_returnsPrometheusData() throws Exception {
        metricsService.getRegistry().counter("kawari.test.counter").increment();

        HttpResponse<String> response = fetch(adminPort, "/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                v -> assertThat(v).startsWith("text/plain"));
        assertThat(response.body()).contains("kawari_test_counter_total 1.0");
    }

    @Test
    void disabled_startsNoServer() {
        metricsService.shutdown();
        metricsService = new MetricsService(adminConfig(false, 0));

        assertThat(metricsService.getPort()).isEqualTo(-1);
        assertThat(metricsService.getRegistry()).isNotNull();
    }

    @Test
    void updateConfig_restartsServerOnPortChange() throws Exception {
        int newPort = freePort();

        metricsService.updateConfig(adminConfig(true, newPort));

        assertThat(metricsService.getPort()).isEqualTo(newPort);
        assertThat(fetch(newPort, "/health").statusCode()).isEqualTo(200);
    }

    @Test
    void updateConfig_disablingStopsServer() {
        metricsService.updateConfig(adminConfig(false, adminPort));

        assertThat(metricsService.getPort()).isEqualTo(-1);
    }

    @Test
    void updateConfig_unchangedKeepsServer() {
        metricsService.updateConfig(adminConfig(true, adminPort));

        assertThat(metricsService.getPort()).isEqualTo(adminPort);
    }
}
