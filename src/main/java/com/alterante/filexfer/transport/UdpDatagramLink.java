package com.alterante.filexfer.transport;

import com.alterante.filexfer.protocol.Packet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Arrays;

/**
 * {@link DatagramLink} backed by a plain {@link DatagramSocket}.
 */
public class UdpDatagramLink implements DatagramLink {

    private static final Logger log = LoggerFactory.getLogger(UdpDatagramLink.class);

    /** Requested OS socket buffer size; the kernel may clamp it. */
    static final int SOCKET_BUFFER_BYTES = 8 * 1024 * 1024;

    private final DatagramSocket socket;
    private final byte[] recvBuf = new byte[Packet.MAX_DATAGRAM];

    public UdpDatagramLink(DatagramSocket socket) {
        this.socket = socket;
        tuneBuffers(socket);
    }

    /** Bind a fresh socket to an ephemeral port (client side). */
    public static UdpDatagramLink open() throws SocketException {
        return new UdpDatagramLink(new DatagramSocket());
    }

    /** Bind a socket to the given port on all interfaces (server side). */
    public static UdpDatagramLink bind(int port) throws SocketException {
        return new UdpDatagramLink(new DatagramSocket(port));
    }

    @Override
    public void send(byte[] data, int length, InetSocketAddress target) throws IOException {
        socket.send(new DatagramPacket(data, 0, length, target.getAddress(), target.getPort()));
    }

    @Override
    public Received receive(int timeoutMillis) throws IOException {
        DatagramPacket dgram = new DatagramPacket(recvBuf, recvBuf.length);
        socket.setSoTimeout(Math.max(1, timeoutMillis));
        try {
            socket.receive(dgram);
        } catch (SocketTimeoutException e) {
            return null;
        }
        InetSocketAddress source = new InetSocketAddress(dgram.getAddress(), dgram.getPort());
        return new Received(Arrays.copyOf(recvBuf, dgram.getLength()), dgram.getLength(), source);
    }

    @Override
    public InetSocketAddress localAddress() {
        return (InetSocketAddress) socket.getLocalSocketAddress();
    }

    public int localPort() {
        return socket.getLocalPort();
    }

    @Override
    public void close() {
        socket.close();
    }

    private static void tuneBuffers(DatagramSocket socket) {
        try {
            socket.setReceiveBufferSize(SOCKET_BUFFER_BYTES);
            socket.setSendBufferSize(SOCKET_BUFFER_BYTES);
        } catch (SocketException e) {
            log.debug("Could not enlarge UDP buffers, keeping OS defaults: {}", e.getMessage());
        }
    }
}
