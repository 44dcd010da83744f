package com.mk.fx.qa.kv.bench.wire;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * Long-lived stream connection to one server endpoint. The outbound side is used by the issuer
 * and the inbound side by the response reader, so the two directions are handed out separately.
 * There is no reconnection logic.
 */
@Slf4j
public class KvConnection implements AutoCloseable {

    private static final int BUFFER_BYTES = 64 * 1024;

    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;
    private final String endpoint;
    private volatile boolean closed;

    /**
     * Wraps an already connected socket.
     *
     * @param socket a connected socket
     * @throws IOException if the socket streams cannot be obtained
     */
    public KvConnection(Socket socket) throws IOException {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.socket.setTcpNoDelay(true);
        this.input = new BufferedInputStream(socket.getInputStream(), BUFFER_BYTES);
        this.output = new BufferedOutputStream(socket.getOutputStream(), BUFFER_BYTES);
        this.endpoint = String.valueOf(socket.getRemoteSocketAddress());
    }

    /**
     * Dials the endpoint.
     *
     * @param host server host
     * @param port server port
     * @param connectTimeout how long to wait for the TCP handshake
     * @return the open connection
     * @throws IOException if the endpoint cannot be reached
     */
    public static KvConnection open(String host, int port, Duration connectTimeout) throws IOException {
        var socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            var connection = new KvConnection(socket);
            log.info("Connected to {}:{}", host, port);
            return connection;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    public InputStream input() {
        return input;
    }

    public OutputStream output() {
        return output;
    }

    public String endpoint() {
        return endpoint;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        log.debug("Closing connection to {}", endpoint);
        socket.close();
    }
}
