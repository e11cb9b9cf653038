package com.alterante.filexfer.transport;

import java.io.IOException;

/**
 * The peer closed or reset the connection before the requested data arrived.
 */
public class ConnectionClosedException extends IOException {

    public ConnectionClosedException(String message) {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
