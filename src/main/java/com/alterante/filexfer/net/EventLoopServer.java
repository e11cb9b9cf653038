package com.alterante.filexfer.net;

import com.alterante.filexfer.transfer.FileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Iterator;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-threaded event-loop server: one {@link Selector} thread owns every stream connection
 * and its {@link ConnectionState}. Reads and writes never block; a slow client only delays
 * itself. A connection stops being read while its replies are backed up, so a client that never
 * reads is held to its socket buffers.
 */
public class EventLoopServer implements FileServer {

    private static final Logger log = LoggerFactory.getLogger(EventLoopServer.class);

    private static final int READ_BUFFER_SIZE = 64 * 1024;

    private final ServerConfig config;
    private final FileStore store;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final ByteBuffer readBuffer = ByteBuffer.allocate(READ_BUFFER_SIZE);

    private Selector selector;
    private ServerSocketChannel serverChannel;
    private DatagramService datagrams;
    private Thread loopThread;
    private int port;

    public EventLoopServer(ServerConfig config) {
        this.config = config;
        this.store = new FileStore(config.storageDir());
    }

    @Override
    public void start() throws IOException {
        store.createRoot();
        selector = Selector.open();
        serverChannel = ServerSocketChannel.open();
        serverChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
        serverChannel.bind(new InetSocketAddress(config.port()));
        serverChannel.configureBlocking(false);
        serverChannel.register(selector, SelectionKey.OP_ACCEPT);
        port = ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
        try {
            datagrams = DatagramService.start(port, store, config.arq());
        } catch (IOException e) {
            serverChannel.close();
            selector.close();
            throw e;
        }
        running.set(true);

        loopThread = new Thread(this::loop, "event-loop-" + port);
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Event-loop server listening on TCP port {}, storage {}", port, config.storageDir());
    }

    private void loop() {
        try {
            while (running.get()) {
                selector.select();
                Iterator<SelectionKey> it = selector.selectedKeys().iterator();
                while (it.hasNext()) {
                    SelectionKey key = it.next();
                    it.remove();
                    dispatch(key);
                }
            }
        } catch (IOException | ClosedSelectorException e) {
            if (running.get()) {
                log.error("Event loop failed", e);
            }
        } finally {
            shutdownConnections();
        }
    }

    private void dispatch(SelectionKey key) {
        if (!key.isValid()) {
            return;
        }
        if (key.isAcceptable()) {
            accept();
            return;
        }
        ConnectionState state = (ConnectionState) key.attachment();
        try {
            if (key.isReadable()) {
                onReadable(key, state);
            }
            if (key.isValid() && key.isWritable()) {
                onWritable(key, state);
            }
            if (key.isValid()) {
                updateInterest(key, state);
            }
        } catch (IOException e) {
            log.warn("Connection {} failed: {}", state.peer(), e.getMessage());
            closeConnection(key, state);
        } catch (RuntimeException e) {
            log.error("Connection {} crashed", state.peer(), e);
            closeConnection(key, state);
        }
    }

    private void accept() {
        try {
            SocketChannel channel = serverChannel.accept();
            if (channel == null) {
                return;
            }
            channel.configureBlocking(false);
            channel.setOption(StandardSocketOptions.SO_KEEPALIVE, true);
            channel.setOption(StandardSocketOptions.TCP_NODELAY, true);
            String peer = String.valueOf(channel.getRemoteAddress());
            channel.register(selector, SelectionKey.OP_READ, new ConnectionState(store, peer));
            log.info("Accepted connection from {}", peer);
        } catch (IOException e) {
            log.warn("Accept failed: {}", e.getMessage());
        }
    }

    private void onReadable(SelectionKey key, ConnectionState state) throws IOException {
        SocketChannel channel = (SocketChannel) key.channel();
        readBuffer.clear();
        int n = channel.read(readBuffer);
        if (n < 0) {
            log.info("Client {} disconnected", state.peer());
            closeConnection(key, state);
            return;
        }
        readBuffer.flip();
        state.consume(readBuffer);
    }

    private void onWritable(SelectionKey key, ConnectionState state) throws IOException {
        SocketChannel channel = (SocketChannel) key.channel();
        ByteBuffer out;
        while ((out = state.pendingOutput()) != null) {
            channel.write(out);
            if (out.hasRemaining()) {
                return;
            }
        }
        if (state.isFinished()) {
            closeConnection(key, state);
        }
    }

    private void updateInterest(SelectionKey key, ConnectionState state) {
        int ops = state.wantsRead() ? SelectionKey.OP_READ : 0;
        if (state.wantsWrite() || state.isFinished()) {
            ops |= SelectionKey.OP_WRITE;
        }
        key.interestOps(ops);
    }

    private void closeConnection(SelectionKey key, ConnectionState state) {
        state.release();
        key.cancel();
        try {
            key.channel().close();
        } catch (IOException e) {
            log.debug("Close failed for {}: {}", state.peer(), e.getMessage());
        }
        log.info("Session ended: {}", state.peer());
    }

    private void shutdownConnections() {
        if (!selector.isOpen()) {
            return;
        }
        for (SelectionKey key : selector.keys()) {
            if (key.attachment() instanceof ConnectionState state) {
                closeConnection(key, state);
            }
        }
        try {
            serverChannel.close();
            selector.close();
        } catch (IOException e) {
            log.debug("Selector close failed: {}", e.getMessage());
        }
    }

    @Override
    public int port() {
        return port;
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        selector.wakeup();
        try {
            loopThread.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        datagrams.close();
        terminated.countDown();
        log.info("Event-loop server on port {} stopped", port);
    }
}
