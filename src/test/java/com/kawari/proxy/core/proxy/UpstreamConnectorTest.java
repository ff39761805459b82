package com.kawari.proxy.core.proxy;

import com.kawari.proxy.core.constants.BackendScheme;
import com.kawari.proxy.core.rotation.BackendDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamConnectorTest {

    private ServerSocket server;
    private int port;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws IOException {
        server = new ServerSocket(0);
        port = server.getLocalPort();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (server != null) server.close();
        if (executor != null) executor.shutdownNow();
    }

    /** Reads the CONNECT head, answers with {@code reply} and returns what was read. */
    private Future<String> httpProxyReplying(String reply) {
        return executor.submit(() -> {
            try (Socket s = server.accept();
                 InputStream in = s.getInputStream();
                 OutputStream out = s.getOutputStream()) {
                ByteArrayOutputStream head = new ByteArrayOutputStream();
                while (!head.toString(StandardCharsets.US_ASCII).endsWith("\r\n\r\n")) {
                    int b = in.read();
                    if (b == -1) {
                        break;
                    }
                    head.write(b);
                }
                out.write(reply.getBytes(StandardCharsets.US_ASCII));
                out.flush();
                return head.toString(StandardCharsets.US_ASCII);
            }
        });
    }

    @Test
    void testHttpConnectWithoutAuth() throws Exception {
        Future<String> request = httpProxyReplying("HTTP/1.1 200 Connection established\r\nVia: test\r\n\r\n");
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.HTTP);

        try (Socket s = UpstreamConnector.connect("target", 443, backend, 1000, true)) {
            assertThat(s.isConnected()).isTrue();
        }
        assertThat(request.get(5, TimeUnit.SECONDS))
                .startsWith("CONNECT target:443 HTTP/1.1\r\n")
                .contains("Host: target:443")
                .doesNotContain("Proxy-Authorization");
    }

    @Test
    void testHttpConnectWithAuth() throws Exception {
        Future<String> request = httpProxyReplying("HTTP/1.1 200 OK\r\n\r\n");
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.HTTP, "user", "pass");

        try (Socket s = UpstreamConnector.connect("target", 80, backend, 1000, true)) {
            assertThat(s.isConnected()).isTrue();
        }
        assertThat(request.get(5, TimeUnit.SECONDS)).contains("Proxy-Authorization: Basic "
                + Base64.getEncoder().encodeToString("user:pass".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testHttpConnectIpv6TargetIsBracketed() throws Exception {
        Future<String> request = httpProxyReplying("HTTP/1.1 200 OK\r\n\r\n");
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.HTTP);

        try (Socket s = UpstreamConnector.connect("2001:db8::1", 443, backend, 1000, true)) {
            assertThat(s.isConnected()).isTrue();
        }
        assertThat(request.get(5, TimeUnit.SECONDS)).startsWith("CONNECT [2001:db8::1]:443 HTTP/1.1");
    }

    @Test
    void testHttpConnectError() {
        httpProxyReplying("HTTP/1.1 407 Proxy Authentication Required\r\n\r\n");
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.HTTP);

        assertThatThrownBy(() -> UpstreamConnector.connect("target", 80, backend, 1000, true))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("407");
    }

    @Test
    void testSocks5Connect() throws Exception {
        Future<String> destination = executor.submit(() -> {
            try (Socket s = server.accept();
                 DataInputStream in = new DataInputStream(s.getInputStream());
                 DataOutputStream out = new DataOutputStream(s.getOutputStream())) {
                // greeting: version 5, one method, no auth
                assertThat(in.readByte()).isEqualTo((byte) 5);
                assertThat(in.readByte()).isEqualTo((byte) 1);
                assertThat(in.readByte()).isEqualTo((byte) 0);
                out.write(new byte[] { 5, 0 });
                out.flush();

                in.readFully(new byte[3]); // VER CMD RSV
                assertThat(in.readByte()).isEqualTo((byte) 3); // domain name
                byte[] host = new byte[in.readUnsignedByte()];
                in.readFully(host);
                int targetPort = in.readUnsignedShort();

                out.write(new byte[] { 5, 0, 0, 1, 127, 0, 0, 1 });
                out.writeShort(1234);
                out.flush();
                return new String(host, StandardCharsets.UTF_8) + ":" + targetPort;
            }
        });
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.SOCKS5);

        try (Socket s = UpstreamConnector.connect("target", 80, backend, 1000, true)) {
            assertThat(s.isConnected()).isTrue();
        }
        assertThat(destination.get(5, TimeUnit.SECONDS)).isEqualTo("target:80");
    }

    @Test
    void testSocks5UsernamePasswordAuth() throws Exception {
        Future<String> credentials = executor.submit(() -> {
            try (Socket s = server.accept();
                 DataInputStream in = new DataInputStream(s.getInputStream());
                 DataOutputStream out = new DataOutputStream(s.getOutputStream())) {
                in.readFully(new byte[4]); // 5, 2 methods, 0, 2
                out.write(new byte[] { 5, 2 });
                out.flush();

                assertThat(in.readByte()).isEqualTo((byte) 1);
                String user = new String(in.readNBytes(in.readUnsignedByte()), StandardCharsets.UTF_8);
                String pass = new String(in.readNBytes(in.readUnsignedByte()), StandardCharsets.UTF_8);
                out.write(new byte[] { 1, 0 });
                out.flush();

                in.readFully(new byte[4]);
                in.readFully(new byte[in.readUnsignedByte() + 2]);
                out.write(new byte[] { 5, 0, 0, 3, 1, 'x', 0, 80 });
                out.flush();
                return user + ":" + pass;
            }
        });
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.SOCKS5, "user", "pass");

        try (Socket s = UpstreamConnector.connect("target", 80, backend, 1000, true)) {
            assertThat(s.isConnected()).isTrue();
        }
        assertThat(credentials.get(5, TimeUnit.SECONDS)).isEqualTo("user:pass");
    }

    @Test
    void testSocks5ConnectRefusedByProxy() {
        executor.submit(() -> {
            try (Socket s = server.accept();
                 DataInputStream in = new DataInputStream(s.getInputStream());
                 DataOutputStream out = new DataOutputStream(s.getOutputStream())) {
                in.readFully(new byte[3]);
                out.write(new byte[] { 5, 0 });
                out.flush();
                in.readFully(new byte[4]);
                in.readFully(new byte[in.readUnsignedByte() + 2]);
                out.write(new byte[] { 5, 5, 0, 1, 0, 0, 0, 0, 0, 0 }); // connection refused
                out.flush();
            }
            return null;
        });
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.SOCKS5);

        assertThatThrownBy(() -> UpstreamConnector.connect("target", 80, backend, 1000, true))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("reply 5");
    }

    @Test
    void testSocks5NoAcceptableMethod() {
        executor.submit(() -> {
            try (Socket s = server.accept();
                 DataInputStream in = new DataInputStream(s.getInputStream());
                 DataOutputStream out = new DataOutputStream(s.getOutputStream())) {
                in.readFully(new byte[3]);
                out.write(new byte[] { 5, (byte) 0xFF });
                out.flush();
                in.read();
            }
            return null;
        });
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.SOCKS5);

        assertThatThrownBy(() -> UpstreamConnector.connect("target", 80, backend, 1000, true))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("no acceptable SOCKS5 auth method");
    }

    @Test
    void testSocks4aConnect() throws Exception {
        Future<String> destination = executor.submit(() -> {
            try (Socket s = server.accept();
                 DataInputStream in = new DataInputStream(s.getInputStream());
                 DataOutputStream out = new DataOutputStream(s.getOutputStream())) {
                assertThat(in.readByte()).isEqualTo((byte) 4);
                assertThat(in.readByte()).isEqualTo((byte) 1);
                int targetPort = in.readUnsignedShort();
                byte[] ip = new byte[4];
                in.readFully(ip);
                assertThat(ip).containsExactly(0, 0, 0, 1);
                StringBuilder user = new StringBuilder();
                for (int b = in.read(); b != 0; b = in.read()) {
                    user.append((char) b);
                }
                StringBuilder host = new StringBuilder();
                for (int b = in.read(); b != 0; b = in.read()) {
                    host.append((char) b);
                }
                out.write(new byte[] { 0, 90, 0, 0, 0, 0, 0, 0 });
                out.flush();
                return user + "@" + host + ":" + targetPort;
            }
        });
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.SOCKS4, "ident", null);

        try (Socket s = UpstreamConnector.connect("example.com", 8080, backend, 1000, true)) {
            assertThat(s.isConnected()).isTrue();
        }
        assertThat(destination.get(5, TimeUnit.SECONDS)).isEqualTo("ident@example.com:8080");
    }

    @Test
    void testSocks4Rejected() {
        executor.submit(() -> {
            try (Socket s = server.accept();
                 InputStream in = s.getInputStream();
                 OutputStream out = s.getOutputStream()) {
                in.read(new byte[64]);
                out.write(new byte[] { 0, 91, 0, 0, 0, 0, 0, 0 });
                out.flush();
                in.read();
            }
            return null;
        });
        BackendDescriptor backend = new BackendDescriptor("localhost", port, BackendScheme.SOCKS4);

        assertThatThrownBy(() -> UpstreamConnector.connect("target", 80, backend, 1000, true))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("code 91");
    }

    @Test
    void testBasicCredentials() {
        BackendDescriptor backend = new BackendDescriptor("p", 1, BackendScheme.HTTP, "alice", null);
        assertThat(UpstreamConnector.basicCredentials(backend))
                .isEqualTo("Basic " + Base64.getEncoder().encodeToString("alice:".getBytes(StandardCharsets.UTF_8)));
    }
}
