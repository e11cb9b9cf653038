package com.alterante.filexfer.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * {@link Transport} over the reliable datagram engine.
 *
 * Every send is one ARQ blob and every receive is one ARQ receipt, so a control line or a raw
 * chunk always arrives whole. Replies go to the peer of the latest receipt.
 */
public class DatagramTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(DatagramTransport.class);

    private final ReliableDatagram engine;
    private final boolean ownsLink;
    private InetSocketAddress peer;

    /**
     * @param engine   ARQ engine bound to the local socket
     * @param peer     fixed peer (client side), or null to accept the first sender (server side)
     * @param ownsLink whether {@link #close()} closes the underlying socket
     */
    public DatagramTransport(ReliableDatagram engine, InetSocketAddress peer, boolean ownsLink) {
        this.engine = engine;
        this.peer = peer;
        this.ownsLink = ownsLink;
    }

    /** Client-side transport on a fresh ephemeral socket talking to {@code host:port}. */
    public static DatagramTransport connect(String host, int port, ArqConfig config) throws IOException {
        ReliableDatagram engine = new ReliableDatagram(UdpDatagramLink.open(), config);
        return new DatagramTransport(engine, new InetSocketAddress(host, port), true);
    }

    @Override
    public void sendMessage(String message) throws IOException {
        send(message.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String receiveLine() throws IOException {
        String line = new String(receive(), StandardCharsets.UTF_8);
        if (line.endsWith("\n")) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }

    @Override
    public void sendRawData(byte[] data, int offset, int length) throws IOException {
        byte[] blob = new byte[length];
        System.arraycopy(data, offset, blob, 0, length);
        send(blob);
    }

    @Override
    public byte[] receiveRawData(int size) throws IOException {
        return receive();
    }

    @Override
    public byte[] receiveAvailable(int max) throws IOException {
        return receive();
    }

    @Override
    public String peerDescription() {
        return "udp:" + peer;
    }

    /** Current peer: the fixed target, or the sender of the latest receipt. */
    public InetSocketAddress peer() {
        return peer;
    }

    @Override
    public void close() {
        if (ownsLink) {
            engine.link().close();
        }
    }

    private void send(byte[] blob) throws IOException {
        if (peer == null) {
            throw new IllegalStateException("no peer yet: receive before sending");
        }
        engine.send(peer, blob);
    }

    private byte[] receive() throws IOException {
        ReliableDatagram.Delivery delivery = engine.receive(peer);
        if (peer == null) {
            log.debug("Datagram session bound to {}", delivery.peer());
        }
        peer = delivery.peer();
        return delivery.data();
    }
}
