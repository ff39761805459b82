package com.kawari.proxy.core.utils;

import com.kawari.proxy.config.ServerConfig;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLServerSocketFactory;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * Provides SSL contexts for the listening server and for outbound connections.
 */
public class SslUtils {

    private SslUtils() {
        // Utility class
    }

    /**
     * Creates an {@link SSLServerSocketFactory} from the server's PKCS12 keystore.
     *
     * @param config           The server configuration.
     * @param certificatesPath Directory that relative keystore paths are resolved against.
     * @return An initialized SSL server socket factory.
     * @throws IOException              If the keystore file cannot be read.
     * @throws GeneralSecurityException If the SSL context or keystore cannot be
     *                                  initialized.
     */
    public static SSLServerSocketFactory createSslFactory(ServerConfig config, String certificatesPath)
            throws IOException, GeneralSecurityException {
        String ksPathStr = config.getKeystorePath();
        if (ksPathStr == null || ksPathStr.isEmpty()) {
            throw new IllegalArgumentException("Keystore path must be specified when TLS is enabled");
        }

        Path ksPath = Paths.get(ksPathStr);
        if (!ksPath.isAbsolute()) {
            ksPath = Paths.get(certificatesPath, ksPathStr);
        }

        char[] password = config.getKeystorePassword() != null ? config.getKeystorePassword().toCharArray()
                : new char[0];

        KeyStore ks = KeyStore.getInstance("PKCS12");
        try (InputStream is = new FileInputStream(ksPath.toFile())) {
            ks.load(is, password);
        }

        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(ks, password);

        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(kmf.getKeyManagers(), null, null);

        return sslContext.getServerSocketFactory();
    }

    /**
     * Client context accepting any certificate for any host name. Only used when
     * TLS verification is switched off.
     *
     * @return an initialized context.
     */
    public static SSLContext insecureClientContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] { new TrustAllManager() }, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS is not available in this runtime", e);
        }
    }

    /**
     * Client context for outbound connections.
     *
     * @param verify whether certificates and host names are checked.
     * @return the default context, or a trust-all one.
     */
    public static SSLContext clientContext(boolean verify) {
        if (!verify) {
            return insecureClientContext();
        }
        try {
            return SSLContext.getDefault();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS is not available in this runtime", e);
        }
    }

    /**
     * Layers TLS over an already connected socket (a tunnel or a proxy connection) and
     * completes the handshake.
     *
     * @param socket connected plain socket; closed with the returned socket.
     * @param host   peer host name, used for SNI and, when verifying, host name checks.
     * @param port   peer port.
     * @param verify whether the peer certificate is verified.
     * @return the handshaken TLS socket.
     * @throws IOException if the handshake fails.
     */
    public static SSLSocket wrapClient(Socket socket, String host, int port, boolean verify) throws IOException {
        SSLSocketFactory factory = clientContext(verify).getSocketFactory();
        SSLSocket tls = (SSLSocket) factory.createSocket(socket, host, port, true);
        if (verify) {
            SSLParameters params = tls.getSSLParameters();
            params.setEndpointIdentificationAlgorithm("HTTPS");
            tls.setSSLParameters(params);
        }
        tls.setUseClientMode(true);
        tls.startHandshake();
        return tls;
    }

    private static final class TrustAllManager extends X509ExtendedTrustManager {
        private static final X509Certificate[] NO_ISSUERS = new X509Certificate[0];

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // trust all
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // trust all
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
            // trust all
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
            // trust all
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
            // trust all
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
            // trust all
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return NO_ISSUERS.clone();
        }
    }
}
