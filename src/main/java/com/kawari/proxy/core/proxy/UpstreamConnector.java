package com.kawari.proxy.core.proxy;

import com.kawari.proxy.core.rotation.BackendDescriptor;
import com.kawari.proxy.core.utils.IoUtils;
import com.kawari.proxy.core.utils.SslUtils;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility for opening a TCP tunnel to a target through an upstream proxy backend.
 */
public class UpstreamConnector {
    private UpstreamConnector() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(UpstreamConnector.class);

    private static final int SOCKS4_GRANTED = 90;
    private static final int SOCKS5_NO_AUTH = 0x00;
    private static final int SOCKS5_USER_PASS = 0x02;
    private static final int SOCKS5_NO_ACCEPTABLE = 0xFF;

    /**
     * Connects to a target through a backend.
     *
     * @param targetHost Target host.
     * @param targetPort Target port.
     * @param backend    Upstream backend.
     * @param timeout    Connect and handshake timeout in milliseconds.
     * @param verifyTls  Whether an HTTPS backend's certificate is verified.
     * @return Socket whose streams reach the target.
     * @throws IOException If the connection or handshake fails.
     */
    public static Socket connect(String targetHost, int targetPort, BackendDescriptor backend, int timeout,
            boolean verifyTls) throws IOException {
        Socket proxySocket = new Socket();
        Socket tunnel = proxySocket;
        try {
            proxySocket.connect(new InetSocketAddress(backend.host(), backend.port()), timeout);
            proxySocket.setSoTimeout(timeout);

            switch (backend.scheme()) {
                case HTTP -> performHttpHandshake(proxySocket, targetHost, targetPort, backend);
                case HTTPS -> {
                    tunnel = SslUtils.wrapClient(proxySocket, backend.host(), backend.port(), verifyTls);
                    performHttpHandshake(tunnel, targetHost, targetPort, backend);
                }
                case SOCKS4 -> performSocks4Handshake(proxySocket, targetHost, targetPort, backend);
                case SOCKS5 -> performSocks5Handshake(proxySocket, targetHost, targetPort, backend);
                default -> throw new IllegalStateException("Unhandled scheme " + backend.scheme());
            }
            return tunnel;
        } catch (IOException | RuntimeException e) {
            IoUtils.closeQuietly(tunnel);
            IoUtils.closeQuietly(proxySocket);
            throw e;
        }
    }

    /**
     * Performs the HTTP CONNECT handshake with the upstream proxy.
     *
     * @param socket  The socket connected to the proxy.
     * @param host    The target host.
     * @param port    The target port.
     * @param backend The backend, for credentials.
     * @throws IOException If the handshake fails or the proxy returns an error.
     */
    private static void performHttpHandshake(Socket socket, String host, int port, BackendDescriptor backend)
            throws IOException {
        OutputStream out = socket.getOutputStream();
        StringBuilder sb = new StringBuilder();
        String authority = hostForRequest(host) + ":" + port;
        sb.append("CONNECT ").append(authority).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(authority).append("\r\n");

        if (backend.hasCredentials()) {
            sb.append("Proxy-Authorization: ").append(basicCredentials(backend)).append("\r\n");
        }
        sb.append("\r\n");

        out.write(sb.toString().getBytes(StandardCharsets.US_ASCII));
        out.flush();

        InputStream in = socket.getInputStream();
        String line = IoUtils.readLine(in);
        if (line == null || parseStatus(line) != 200) {
            throw new IOException("Backend " + backend + " refused CONNECT to " + authority + ": " + line);
        }
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            log.trace("CONNECT response header: {}", line);
        }
    }

    /**
     * Performs a SOCKS4a CONNECT. The target name is resolved by the proxy.
     */
    private static void performSocks4Handshake(Socket socket, String host, int port, BackendDescriptor backend)
            throws IOException {
        DataOutputStream out = new DataOutputStream(socket.getOutputStream());
        out.writeByte(4);
        out.writeByte(1);
        out.writeShort(port);
        // 0.0.0.1 marks a SOCKS4a request carrying a host name
        out.write(new byte[] { 0, 0, 0, 1 });
        if (backend.username() != null) {
            out.write(backend.username().getBytes(StandardCharsets.UTF_8));
        }
        out.writeByte(0);
        out.write(host.getBytes(StandardCharsets.UTF_8));
        out.writeByte(0);
        out.flush();

        DataInputStream in = new DataInputStream(socket.getInputStream());
        in.readUnsignedByte(); // VN
        int status = in.readUnsignedByte();
        in.readFully(new byte[6]); // DSTPORT + DSTIP
        if (status != SOCKS4_GRANTED) {
            throw new IOException("Backend " + backend + " rejected SOCKS4 connect to " + host + ":" + port
                    + " (code " + status + ")");
        }
    }

    /**
     * Performs the SOCKS5 handshake, with RFC 1929 username/password authentication
     * when the backend has credentials.
     */
    private static void performSocks5Handshake(Socket socket, String host, int port, BackendDescriptor backend)
            throws IOException {
        DataOutputStream out = new DataOutputStream(socket.getOutputStream());
        DataInputStream in = new DataInputStream(socket.getInputStream());

        if (backend.hasCredentials()) {
            out.write(new byte[] { 5, 2, SOCKS5_NO_AUTH, SOCKS5_USER_PASS });
        } else {
            out.write(new byte[] { 5, 1, SOCKS5_NO_AUTH });
        }
        out.flush();

        if (in.readUnsignedByte() != 5) {
            throw new IOException("Backend " + backend + " is not a SOCKS5 proxy");
        }
        int method = in.readUnsignedByte();
        if (method == SOCKS5_USER_PASS && backend.hasCredentials()) {
            authenticateSocks5(out, in, backend);
        } else if (method != SOCKS5_NO_AUTH) {
            throw new IOException("Backend " + backend + " offered no acceptable SOCKS5 auth method"
                    + (method == SOCKS5_NO_ACCEPTABLE ? "" : " (" + method + ")"));
        }

        // Request: CONNECT, Domain name
        byte[] hostBytes = host.getBytes(StandardCharsets.UTF_8);
        if (hostBytes.length > 255) {
            throw new IOException("Target host name too long for SOCKS5: " + host);
        }
        out.writeByte(5);
        out.writeByte(1);
        out.writeByte(0);
        out.writeByte(3);
        out.writeByte(hostBytes.length);
        out.write(hostBytes);
        out.writeShort(port);
        out.flush();

        if (in.readUnsignedByte() != 5) {
            throw new IOException("Malformed SOCKS5 reply from " + backend);
        }
        int reply = in.readUnsignedByte();
        if (reply != 0) {
            throw new IOException("Backend " + backend + " failed SOCKS5 connect to " + host + ":" + port
                    + " (reply " + reply + ")");
        }
        in.readUnsignedByte(); // RSV
        int atyp = in.readUnsignedByte();
        if (atyp == 1) {
            in.readFully(new byte[4]);
        } else if (atyp == 3) {
            in.readFully(new byte[in.readUnsignedByte()]);
        } else if (atyp == 4) {
            in.readFully(new byte[16]);
        } else {
            throw new IOException("Unknown SOCKS5 address type " + atyp + " from " + backend);
        }
        in.readUnsignedShort(); // BND.PORT
    }

    private static void authenticateSocks5(DataOutputStream out, DataInputStream in, BackendDescriptor backend)
            throws IOException {
        byte[] user = backend.username().getBytes(StandardCharsets.UTF_8);
        byte[] pass = backend.password() != null ? backend.password().getBytes(StandardCharsets.UTF_8)
                : new byte[0];
        if (user.length > 255 || pass.length > 255) {
            throw new IOException("SOCKS5 credentials too long for " + backend);
        }
        out.writeByte(1);
        out.writeByte(user.length);
        out.write(user);
        out.writeByte(pass.length);
        out.write(pass);
        out.flush();

        in.readUnsignedByte(); // sub-negotiation version
        if (in.readUnsignedByte() != 0) {
            throw new IOException("SOCKS5 authentication rejected by " + backend);
        }
    }

    /**
     * Builds a {@code Basic} Proxy-Authorization value.
     *
     * @param backend backend with credentials.
     * @return header value.
     */
    public static String basicCredentials(BackendDescriptor backend) {
        String auth = backend.username() + ":" + (backend.password() != null ? backend.password() : "");
        return "Basic " + Base64.getEncoder().encodeToString(auth.getBytes(StandardCharsets.UTF_8));
    }

    private static String hostForRequest(String host) {
        return host.indexOf(':') >= 0 && !host.startsWith("[") ? "[" + host + "]" : host;
    }

    private static int parseStatus(String statusLine) {
        String[] parts = statusLine.split(" ", 3);
        if (parts.length < 2 || !parts[0].startsWith("HTTP/")) {
            return -1;
        }
        try {
            return Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
