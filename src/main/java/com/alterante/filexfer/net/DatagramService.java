package com.alterante.filexfer.net;

import com.alterante.filexfer.transfer.FileStore;
import com.alterante.filexfer.transfer.ServerSession;
import com.alterante.filexfer.transport.ArqConfig;
import com.alterante.filexfer.transport.DatagramLink;
import com.alterante.filexfer.transport.DatagramTransport;
import com.alterante.filexfer.transport.ReliableDatagram;
import com.alterante.filexfer.transport.TransportTimeoutException;
import com.alterante.filexfer.transport.UdpDatagramLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves the session protocol over the reliable datagram engine.
 *
 * One loop thread owns the UDP socket. Each exchange starts with a command blob from any client;
 * the session then binds to that client's address and runs the command to completion (including
 * a whole UPLOAD or DOWNLOAD) before the next client is served.
 */
public class DatagramService implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DatagramService.class);

    private final DatagramLink link;
    private final ReliableDatagram engine;
    private final FileStore store;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread loopThread;
    private long exchanges;

    public DatagramService(DatagramLink link, FileStore store, ArqConfig arq) {
        this.link = link;
        this.engine = new ReliableDatagram(link, arq);
        this.store = store;
    }

    /** Bind the UDP socket on {@code port} and start the loop thread. */
    public static DatagramService start(int port, FileStore store, ArqConfig arq) throws IOException {
        DatagramService service = new DatagramService(UdpDatagramLink.bind(port), store, arq);
        service.start();
        return service;
    }

    public void start() {
        running.set(true);
        loopThread = new Thread(this::loop, "udp-service-" + link.localAddress().getPort());
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Datagram service listening on UDP port {}", link.localAddress().getPort());
    }

    private void loop() {
        while (running.get()) {
            DatagramTransport transport = new DatagramTransport(engine, null, false);
            String line;
            try {
                line = transport.receiveLine();
            } catch (TransportTimeoutException e) {
                continue;
            } catch (IOException e) {
                if (running.get()) {
                    log.warn("Datagram receive failed: {}", e.getMessage());
                }
                continue;
            }

            exchanges++;
            try {
                new ServerSession(transport, store).serveOne(line);
            } catch (IOException e) {
                log.warn("Datagram exchange with {} failed: {}", transport.peerDescription(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Datagram exchange with {} crashed", transport.peerDescription(), e);
            }
        }
        log.info("Datagram service stopped after {} exchanges", exchanges);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        link.close();
        if (loopThread != null) {
            try {
                loopThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
