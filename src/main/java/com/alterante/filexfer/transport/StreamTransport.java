package com.alterante.filexfer.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;

/**
 * {@link Transport} over a connected TCP socket.
 *
 * Lines and raw reads share one {@link LineFramer}; socket reads go into it in pieces of up to 64 KiB.
 */
public class StreamTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(StreamTransport.class);

    private static final int READ_SIZE = 64 * 1024;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final LineFramer framer = new LineFramer();
    private final byte[] readBuf = new byte[READ_SIZE];

    public StreamTransport(Socket socket) throws IOException {
        this.socket = socket;
        configureKeepAlive(socket);
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    /** Connect to a server's stream endpoint. */
    public static StreamTransport connect(String host, int port) throws IOException {
        Socket socket = new Socket();
        socket.connect(new InetSocketAddress(host, port));
        return new StreamTransport(socket);
    }

    @Override
    public void sendMessage(String message) throws IOException {
        byte[] line = (message + "\n").getBytes(StandardCharsets.UTF_8);
        write(line, 0, line.length);
    }

    @Override
    public String receiveLine() throws IOException {
        String line;
        while ((line = framer.pollLine()) == null) {
            fill(READ_SIZE);
        }
        return line;
    }

    @Override
    public void sendRawData(byte[] data, int offset, int length) throws IOException {
        write(data, offset, length);
    }

    @Override
    public byte[] receiveRawData(int size) throws IOException {
        while (framer.buffered() < size) {
            fill(size - framer.buffered());
        }
        return framer.drain(size);
    }

    @Override
    public byte[] receiveAvailable(int max) throws IOException {
        if (framer.buffered() == 0) {
            fill(max);
        }
        return framer.drain(max);
    }

    @Override
    public String peerDescription() {
        return String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket to {}: {}", peerDescription(), e.getMessage());
        }
    }

    private void fill(int wanted) throws IOException {
        int n;
        try {
            n = in.read(readBuf, 0, Math.min(READ_SIZE, Math.max(1, wanted)));
        } catch (SocketException e) {
            throw new ConnectionClosedException("Connection reset by " + peerDescription(), e);
        }
        if (n < 0) {
            throw new ConnectionClosedException("Closed by peer " + peerDescription());
        }
        framer.append(readBuf, 0, n);
    }

    private void write(byte[] data, int offset, int length) throws IOException {
        try {
            out.write(data, offset, length);
            out.flush();
        } catch (SocketException e) {
            throw new ConnectionClosedException("Connection reset by " + peerDescription(), e);
        }
    }

    private static void configureKeepAlive(Socket socket) {
        try {
            socket.setKeepAlive(true);
            socket.setTcpNoDelay(true);
        } catch (SocketException e) {
            log.debug("Could not configure socket options: {}", e.getMessage());
        }
    }
}
