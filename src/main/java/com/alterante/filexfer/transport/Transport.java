package com.alterante.filexfer.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * Message-oriented view of a connection: newline-delimited control lines plus raw byte runs.
 *
 * Everything above this interface is transport-agnostic. Callers must request exactly the raw
 * byte count the protocol says follows a control line; over- or under-reading desynchronizes
 * the session.
 */
public interface Transport extends Closeable {

    /** Send one control line; the line terminator is added by the transport. */
    void sendMessage(String message) throws IOException;

    /**
     * Receive the next control line without its terminator.
     *
     * @throws ConnectionClosedException if the peer goes away before a full line arrives
     * @throws TransportTimeoutException if a bounded transport gives up waiting
     */
    String receiveLine() throws IOException;

    /** Send raw bytes, unframed. */
    void sendRawData(byte[] data, int offset, int length) throws IOException;

    default void sendRawData(byte[] data) throws IOException {
        sendRawData(data, 0, data.length);
    }

    /**
     * Receive the next raw byte run.
     *
     * @param size exact number of bytes for stream transports; informational for datagram
     *             transports, which return one whole logical unit
     */
    byte[] receiveRawData(int size) throws IOException;

    /**
     * Receive whatever raw bytes have arrived: at least one, at most {@code max}. Blocks only
     * while nothing is buffered. Datagram transports return one whole logical unit.
     */
    byte[] receiveAvailable(int max) throws IOException;

    /** Human-readable peer description for logs. */
    String peerDescription();

    @Override
    void close();
}
