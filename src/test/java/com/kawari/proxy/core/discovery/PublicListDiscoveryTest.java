package com.kawari.proxy.core.discovery;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.kawari.proxy.config.DiscoveryConfig;
import com.kawari.proxy.core.constants.BackendScheme;
import com.kawari.proxy.core.rotation.BackendDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.ServerSocket;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

class PublicListDiscoveryTest {

    private WireMockServer lists;

    @BeforeEach
    void setUp() {
        lists = new WireMockServer(wireMockConfig().dynamicPort());
        lists.start();
    }

    @AfterEach
    void tearDown() {
        if (lists != null) lists.stop();
    }

    private String source(String path) {
        return "http://127.0.0.1:" + lists.port() + path;
    }

    private void serveList(String path, String body) {
        lists.stubFor(get(urlEqualTo(path)).willReturn(aResponse().withStatus(200).withBody(body)));
    }

    private PublicListDiscovery discovery(String... sources) {
        DiscoveryConfig config = new DiscoveryConfig();
        config.setSources(List.of(sources));
        config.setFetchTimeout(5000);
        config.setVerifyTimeout(2000);
        config.setUserAgent("kawari-test");
        return new PublicListDiscovery(config);
    }

    private static BackendDescriptor http(String host, int port) {
        return new BackendDescriptor(host, port, BackendScheme.HTTP);
    }

    @Test
    void discover_mergesSourcesInOrderWithoutDuplicates() throws Exception {
        serveList("/a.txt", "203.0.113.1:8080\n203.0.113.2:3128\n");
        serveList("/b.txt", "203.0.113.2:3128\r\n198.51.100.7:80\r\n");

        List<BackendDescriptor> found = discovery(source("/a.txt"), source("/b.txt")).discover(0, false);

        assertThat(found).containsExactly(
                http("203.0.113.1", 8080), http("203.0.113.2", 3128), http("198.51.100.7", 80));
        lists.verify(getRequestedFor(urlEqualTo("/a.txt")).withHeader("User-Agent", equalTo("kawari-test")));
    }

    @Test
    void discover_stopsAtLimit() throws Exception {
        serveList("/a.txt", "203.0.113.1:1\n203.0.113.2:2\n203.0.113.3:3\n");
        serveList("/b.txt", "203.0.113.4:4\n");

        List<BackendDescriptor> found = discovery(source("/a.txt"), source("/b.txt")).discover(2, false);

        assertThat(found).containsExactly(http("203.0.113.1", 1), http("203.0.113.2", 2));
    }

    @Test
    void discover_skipsFailingSources() throws Exception {
        lists.stubFor(get(urlEqualTo("/down.txt")).willReturn(aResponse().withStatus(500)));
        serveList("/ok.txt", "203.0.113.9:8080\n");
        int deadPort;
        try (ServerSocket s = new ServerSocket(0)) {
            deadPort = s.getLocalPort();
        }

        List<BackendDescriptor> found = discovery(source("/down.txt"), "http://127.0.0.1:" + deadPort + "/x.txt",
                "not a url", source("/ok.txt")).discover(0, false);

        assertThat(found).containsExactly(http("203.0.113.9", 8080));
    }

    @Test
    void discover_verifyKeepsOnlyWorkingBackends() throws Exception {
        lists.stubFor(get(urlEqualTo("/ip")).withHost(equalTo("verify.test"))
                .willReturn(aResponse().withStatus(200).withBody("{\"origin\":\"1.2.3.4\"}")));
        int deadPort;
        try (ServerSocket s = new ServerSocket(0)) {
            deadPort = s.getLocalPort();
        }
        serveList("/list.txt", "127.0.0.1:" + lists.port() + "\n127.0.0.1:" + deadPort + "\n");

        DiscoveryConfig config = new DiscoveryConfig();
        config.setSources(List.of(source("/list.txt")));
        config.setVerifyUrl("http://verify.test/ip");
        config.setVerifyTimeout(2000);
        List<BackendDescriptor> found = new PublicListDiscovery(config).discover(0, true);

        assertThat(found).containsExactly(http("127.0.0.1", lists.port()));
    }

    @Test
    void parse_skipsCommentsBlanksAndGarbage() {
        String body = String.join("\n",
                "# header",
                "",
                "203.0.113.1:8080",
                "  proxy-1.example.com:3128  ",
                "203.0.113.2",
                "203.0.113.3:notaport",
                "203.0.113.4:0",
                "203.0.113.5:70000",
                "300.1.1.1:80",
                "bad_host!:80",
                "203.0.113.6:8080:extra");

        assertThat(PublicListDiscovery.parse(body)).containsExactly(
                http("203.0.113.1", 8080), http("proxy-1.example.com", 3128), http("203.0.113.6", 8080));
    }

    @Test
    void parse_nullBody() {
        assertThat(PublicListDiscovery.parse(null)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = { "1.2.3.4", "255.255.255.255", "proxy.example.com", "my-proxy", "10.0.0" })
    void isValidHost_accepts(String host) {
        assertThat(PublicListDiscovery.isValidHost(host)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "256.1.1.1", "1.2.3.-1", "host_name", "host name", "[::1]" })
    void isValidHost_rejects(String host) {
        assertThat(PublicListDiscovery.isValidHost(host)).isFalse();
    }

    @Test
    void isValidHost_rejectsNullAndOverlong() {
        assertThat(PublicListDiscovery.isValidHost(null)).isFalse();
        assertThat(PublicListDiscovery.isValidHost("a".repeat(254))).isFalse();
    }
}
