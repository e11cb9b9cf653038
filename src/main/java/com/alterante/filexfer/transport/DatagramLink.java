package com.alterante.filexfer.transport;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Unreliable datagram channel the ARQ engine runs on.
 *
 * Implementations may lose, duplicate or reorder datagrams.
 */
public interface DatagramLink extends Closeable {

    /** A datagram as it arrived: bytes [0, length) of data, and its source address. */
    record Received(byte[] data, int length, InetSocketAddress source) {}

    void send(byte[] data, int length, InetSocketAddress target) throws IOException;

    /**
     * Wait up to {@code timeoutMillis} for the next datagram.
     *
     * @return the datagram, or null if none arrived in time
     */
    Received receive(int timeoutMillis) throws IOException;

    InetSocketAddress localAddress();

    @Override
    void close();
}
