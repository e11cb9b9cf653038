package com.alterante.filexfer.net;

import com.alterante.filexfer.transfer.FileStore;
import com.alterante.filexfer.transfer.ServerSession;
import com.alterante.filexfer.transport.StreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-per-connection server: an acceptor thread hands every accepted socket to its own worker
 * thread running a blocking {@link ServerSession}.
 */
public class ThreadedServer implements FileServer {

    private static final Logger log = LoggerFactory.getLogger(ThreadedServer.class);

    private final ServerConfig config;
    private final FileStore store;
    private final Set<StreamTransport> live = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private ServerSocket serverSocket;
    private DatagramService datagrams;
    private Thread acceptor;

    public ThreadedServer(ServerConfig config) {
        this.config = config;
        this.store = new FileStore(config.storageDir());
    }

    @Override
    public void start() throws IOException {
        store.createRoot();
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(config.port()));
        try {
            datagrams = DatagramService.start(serverSocket.getLocalPort(), store, config.arq());
        } catch (IOException e) {
            serverSocket.close();
            throw e;
        }
        running.set(true);

        acceptor = new Thread(this::acceptLoop, "acceptor-" + port());
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("Threaded server listening on TCP port {}, storage {}", port(), config.storageDir());
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (running.get()) {
                    log.warn("Accept failed: {}", e.getMessage());
                }
                continue;
            }
            try {
                StreamTransport transport = new StreamTransport(socket);
                live.add(transport);
                Thread worker = new Thread(() -> {
                    try {
                        new ServerSession(transport, store).run();
                    } finally {
                        live.remove(transport);
                    }
                }, "session-" + connectionCounter.incrementAndGet());
                worker.setDaemon(true);
                worker.start();
                log.info("Accepted connection from {}", socket.getRemoteSocketAddress());
            } catch (IOException e) {
                log.warn("Could not set up connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
            }
        }
    }

    @Override
    public int port() {
        return serverSocket.getLocalPort();
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
        closeQuietly(serverSocket);
        for (StreamTransport transport : live) {
            transport.close();
        }
        datagrams.close();
        try {
            acceptor.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        terminated.countDown();
        log.info("Threaded server on port {} stopped", port());
    }

    private static void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.getMessage());
        }
    }
}
