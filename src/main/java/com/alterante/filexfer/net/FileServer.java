package com.alterante.filexfer.net;

import java.io.Closeable;
import java.io.IOException;

/**
 * A running file-transfer server: stream sessions on a TCP port plus the datagram service on the
 * UDP port of the same number.
 */
public interface FileServer extends Closeable {

    /** Bind both sockets and start serving in background threads. Returns once bound. */
    void start() throws IOException;

    /** The bound port; valid after {@link #start()}. */
    int port();

    /** Block until {@link #close()} has been called. */
    void awaitTermination() throws InterruptedException;

    /** Stop accepting, drop every live connection, release sockets and open files. */
    @Override
    void close();

    static FileServer create(ServerConfig config) {
        switch (config.mode()) {
            case EVENT_LOOP:
                return new EventLoopServer(config);
            case THREADED:
            default:
                return new ThreadedServer(config);
        }
    }
}
