package com.alterante.filexfer.transport;

import java.io.IOException;

/**
 * Which wire a client session runs over.
 */
public enum TransportKind {
    TCP,
    UDP;

    /** Open a client transport to {@code host:port}. */
    public Transport connect(String host, int port, ArqConfig arq) throws IOException {
        switch (this) {
            case TCP:
                return StreamTransport.connect(host, port);
            case UDP:
                return DatagramTransport.connect(host, port, arq);
            default:
                throw new IllegalStateException("unhandled transport " + this);
        }
    }
}
