package com.kawari.proxy.spi;

import com.kawari.proxy.core.transport.TransportRequest;
import com.kawari.proxy.core.transport.TransportResponse;
import java.io.IOException;

/**
 * Performs a single HTTP exchange, directly or through one upstream backend.
 * Any received response is a success regardless of its status code; only
 * connection, TLS and timeout problems surface as {@link IOException}.
 */
public interface HttpTransport extends AutoCloseable {

    /**
     * Executes the request.
     *
     * @param request what to send and how to route it.
     * @return the buffered response.
     * @throws IOException          on connection, TLS or timeout failure.
     * @throws InterruptedException if the calling thread is interrupted.
     */
    TransportResponse send(TransportRequest request) throws IOException, InterruptedException;

    /**
     * Releases pooled connections and threads.
     */
    @Override
    void close();
}
