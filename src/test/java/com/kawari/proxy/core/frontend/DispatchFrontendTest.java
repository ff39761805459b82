package com.kawari.proxy.core.frontend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kawari.proxy.core.constants.BackendScheme;
import com.kawari.proxy.core.constants.RotationStrategy;
import com.kawari.proxy.core.rotation.BackendDescriptor;
import com.kawari.proxy.core.rotation.BackendRegistry;
import com.kawari.proxy.core.rotation.IdentityPool;
import com.kawari.proxy.core.rotation.RotationConfig;
import com.kawari.proxy.core.rotation.RotationEngine;
import com.kawari.proxy.core.transport.TransportRequest;
import com.kawari.proxy.core.transport.TransportResponse;
import com.kawari.proxy.spi.HttpTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.net.InetAddress;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispatchFrontendTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final BackendDescriptor p1 = new BackendDescriptor("203.0.113.1", 8080, BackendScheme.HTTP);
    private final BackendDescriptor p2 = new BackendDescriptor("203.0.113.2", 8080, BackendScheme.HTTP);
    private final BackendDescriptor p3 = new BackendDescriptor("203.0.113.3", 1080, BackendScheme.SOCKS5);

    /** Every name resolves to a public address. */
    private final AddressPolicy publicOnly = new AddressPolicy(
            host -> new InetAddress[] { InetAddress.getByAddress(host, new byte[] { 93, (byte) 184, (byte) 216, 34 }) },
            false);

    @Mock
    private HttpTransport transport;

    private RotationEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private DispatchFrontend frontend(RotationConfig config, List<String> identities, long maxBody,
            BackendDescriptor... backends) {
        BackendRegistry registry = new BackendRegistry(1, Duration.ofMinutes(5), Clock.systemUTC());
        registry.registerAll(List.of(backends));
        engine = new RotationEngine(config,
                new IdentityPool(identities, config.getStrategy(), config.isRotateIdentity(), null), registry,
                transport, new SimpleMeterRegistry());
        return new DispatchFrontend(engine, publicOnly, maxBody);
    }

    private static RotationConfig.Builder config() {
        return RotationConfig.builder()
                .strategy(RotationStrategy.ROUND_ROBIN)
                .baseRetryDelay(Duration.ofMillis(1))
                .maxRetries(1);
    }

    private static JsonNode json(FrontendResponse response) throws Exception {
        assertThat(response.headers().get("content-type")).containsExactly("application/json");
        return JSON.readTree(response.body());
    }

    @Test
    void stats_countBackendsIdentitiesAndRateLimit() throws Exception {
        DispatchFrontend frontend = frontend(config().rateLimit(2.0).build(), List.of("a", "b", "c", "d"),
                DispatchFrontend.DEFAULT_MAX_BODY_BYTES, p1, p2, p3);
        engine.getRegistry().markFailure(p3);

        JsonNode stats = json(frontend.statsResponse());

        assertThat(stats.get("total_proxies").asInt()).isEqualTo(3);
        assertThat(stats.get("healthy_proxies").asInt()).isEqualTo(2);
        assertThat(stats.get("total_user_agents").asInt()).isEqualTo(4);
        assertThat(stats.get("rotation_strategy").asText()).isEqualTo("round-robin");
        assertThat(stats.get("rate_limit").asDouble()).isEqualTo(2.0);
    }

    @Test
    void stats_nullRateLimitIsSerializedAsNull() throws Exception {
        DispatchFrontend frontend = frontend(config().rotateBackend(false).build(), List.of("a"), 10);

        JsonNode stats = json(frontend.statsResponse());
        assertThat(stats.get("rate_limit").isNull()).isTrue();
        assertThat(stats.get("total_proxies").asInt()).isZero();
    }

    @Test
    void health_isIndependentOfBackendHealth() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("a"), 10, p1);
        engine.getRegistry().markFailure(p1);

        FrontendResponse response = frontend.healthResponse();
        JsonNode health = json(response);

        assertThat(response.status()).isEqualTo(200);
        assertThat(health.get("status").asText()).isEqualTo("healthy");
        assertThat(health.get("service").asText()).isEqualTo(DispatchFrontend.SERVICE_NAME);
        assertThat(health.get("version").asText()).isEqualTo("1.0.0");
    }

    @Test
    void handle_forwardsAndPassesStatusThrough() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("ua-1"), 1024, p1);
        when(transport.send(any())).thenReturn(new TransportResponse(418,
                Map.of("X-Upstream", List.of("yes"), "Transfer-Encoding", List.of("chunked"),
                        "Content-Length", List.of("5")),
                "teapot".getBytes(StandardCharsets.UTF_8), URI.create("http://example.com/brew")));

        FrontendResponse response = frontend.handle("GET", "/http://example.com/brew?cup=1",
                Map.of("User-Agent", "curl/8.0", "Connection", "keep-alive", "Proxy-Authorization", "Basic x",
                        "X-Custom", "kept"),
                new byte[0]);

        assertThat(response.status()).isEqualTo(418);
        assertThat(response.bodyAsString()).isEqualTo("teapot");
        assertThat(response.headers()).containsKey("X-Upstream").doesNotContainKeys("Transfer-Encoding",
                "Content-Length");
        assertThat(response.identity()).isEqualTo("ua-1");
        assertThat(response.backend()).isEqualTo(p1);
        assertThat(response.attempts()).isEqualTo(1);

        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(captor.capture());
        TransportRequest sent = captor.getValue();
        assertThat(sent.uri()).isEqualTo(URI.create("http://example.com/brew?cup=1"));
        assertThat(sent.headers().get("User-Agent")).isEqualTo("ua-1");
        assertThat(sent.headers()).containsEntry("X-Custom", "kept")
                .doesNotContainKeys("Connection", "Proxy-Authorization");
    }

    @Test
    void handle_keepsCallerUserAgentWhenNotRotating() throws Exception {
        DispatchFrontend frontend = frontend(config().rotateIdentity(false).rotateBackend(false).build(),
                List.of("pool-agent"), 1024);
        when(transport.send(any())).thenReturn(new TransportResponse(200, Map.of(), new byte[0], null));

        frontend.handle("GET", "http://example.com/", Map.of("User-Agent", "curl/8.0"), null);

        ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
        verify(transport).send(captor.capture());
        assertThat(captor.getValue().headers().get("User-Agent")).isEqualTo("curl/8.0");
    }

    @Test
    void handle_internalTargetIs403WithoutDispatch() throws Exception {
        BackendRegistry registry = new BackendRegistry();
        engine = new RotationEngine(config().rotateBackend(false).build(),
                IdentityPool.defaults(RotationStrategy.RANDOM), registry, transport, new SimpleMeterRegistry());
        DispatchFrontend frontend = new DispatchFrontend(engine);

        FrontendResponse response = frontend.handle("GET", "/http://127.0.0.1:8080/admin", Map.of(), null);

        assertThat(response.status()).isEqualTo(403);
        assertThat(json(response).get("error").asText()).isEqualTo("Access to internal networks is forbidden");
        assertThat(response.attempts()).isZero();
        verifyNoInteractions(transport);
    }

    @Test
    void handle_badTargetIs400() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("a"), 1024, p1);

        FrontendResponse response = frontend.handle("GET", "/not-a-url", Map.of(), null);

        assertThat(response.status()).isEqualTo(400);
        JsonNode body = json(response);
        assertThat(body.get("error").asText()).contains("Format: http://proxy-host:port/http://target-url");
        assertThat(body.get("code").asInt()).isEqualTo(400);
        assertThat(body.has("attempts")).isFalse();
        verifyNoInteractions(transport);
    }

    @Test
    void handle_headerNameThatIsNotATokenIs400() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("a"), 1024, p1);

        FrontendResponse response = frontend.handle("GET", "/http://example.test/a", Map.of("X Bad", "v"), null);

        assertThat(response.status()).isEqualTo(400);
        assertThat(json(response).get("error").asText()).contains("Invalid header name");
        verifyNoInteractions(transport);
    }

    @Test
    void handle_headerValueWithLineBreakIs400() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("a"), 1024, p1);

        FrontendResponse response = frontend.handle("GET", "/http://example.test/a",
                Map.of("X-Note", "a\r\nX-Injected: 1"), null);

        assertThat(response.status()).isEqualTo(400);
        assertThat(json(response).get("error").asText()).contains("X-Note");
        verifyNoInteractions(transport);
    }

    @Test
    void handle_oversizeBodyIs413() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("a"), 8, p1);

        FrontendResponse response = frontend.handle("POST", "/http://example.com/upload", Map.of(),
                new byte[9]);

        assertThat(response.status()).isEqualTo(413);
        assertThat(json(response).get("error").asText())
                .isEqualTo("Request body too large. Maximum size: 8 bytes");
        verifyNoInteractions(transport);
    }

    @Test
    void handle_bodyAtLimitIsAccepted() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("a"), 8, p1);
        when(transport.send(any())).thenReturn(new TransportResponse(201, Map.of(), new byte[0], null));

        assertThat(frontend.handle("PUT", "/http://example.com/upload", Map.of(), new byte[8]).status())
                .isEqualTo(201);
    }

    @Test
    void handle_unsupportedMethodIs405() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("a"), 1024, p1);

        assertThat(frontend.handle("TRACE", "/http://example.com/", Map.of(), null).status()).isEqualTo(405);
        verifyNoInteractions(transport);
    }

    @Test
    void handle_noHealthyBackendIs503() throws Exception {
        DispatchFrontend frontend = frontend(config().build(), List.of("a"), 1024, p1);
        engine.getRegistry().markFailure(p1);

        FrontendResponse response = frontend.handle("GET", "/http://example.com/", Map.of(), null);

        assertThat(response.status()).isEqualTo(503);
        assertThat(json(response).get("attempts").asInt()).isZero();
        verifyNoInteractions(transport);
    }

    @Test
    void handle_exhaustedRetriesIs502WithAttempts() throws Exception {
        DispatchFrontend frontend = frontend(config().rotateBackend(false).build(), List.of("a"), 1024);
        when(transport.send(any())).thenThrow(new ConnectException("Connection refused"));

        FrontendResponse response = frontend.handle("GET", "/http://example.com/", Map.of(), null);

        assertThat(response.status()).isEqualTo(502);
        JsonNode body = json(response);
        assertThat(body.get("attempts").asInt()).isEqualTo(2);
        assertThat(body.get("error").asText()).contains("Connection refused");
        assertThat(response.attempts()).isEqualTo(2);
    }

    @Test
    void handle_timeoutIs504() throws Exception {
        DispatchFrontend frontend = frontend(config().rotateBackend(false).maxRetries(0).build(), List.of("a"),
                1024);
        when(transport.send(any())).thenThrow(new SocketTimeoutException("Read timed out"));

        assertThat(frontend.handle("GET", "/http://example.com/", Map.of(), null).status()).isEqualTo(504);
    }

    @Test
    void handle_rateGateTimeoutIs429() throws Exception {
        DispatchFrontend frontend = frontend(config().rotateBackend(false).rateLimit(0.5)
                .rateLimitMaxWait(Duration.ofMillis(20)).build(), List.of("a"), 1024);
        when(transport.send(any())).thenReturn(new TransportResponse(200, Map.of(), new byte[0], null));

        assertThat(frontend.handle("GET", "/http://example.com/", Map.of(), null).status()).isEqualTo(200);
        assertThat(frontend.handle("GET", "/http://example.com/", Map.of(), null).status()).isEqualTo(429);
    }

    @Test
    void errorResponse_isJson() throws Exception {
        FrontendResponse response = DispatchFrontend.errorResponse(400, "Malformed request line");
        JsonNode body = json(response);
        assertThat(body.get("error").asText()).isEqualTo("Malformed request line");
        assertThat(body.get("code").asInt()).isEqualTo(400);
    }

    @Test
    void unresolvableTargetIsLeftToTheBackend() throws Exception {
        BackendRegistry registry = new BackendRegistry();
        engine = new RotationEngine(config().rotateBackend(false).build(),
                IdentityPool.defaults(RotationStrategy.RANDOM), registry, transport, new SimpleMeterRegistry());
        DispatchFrontend frontend = new DispatchFrontend(engine, new AddressPolicy(host -> {
            throw new UnknownHostException(host);
        }, false), 1024);
        when(transport.send(any())).thenReturn(new TransportResponse(200, Map.of(), new byte[0], null));

        assertThat(frontend.handle("GET", "/http://backend-only.invalid/", Map.of(), null).status())
                .isEqualTo(200);
    }
}
