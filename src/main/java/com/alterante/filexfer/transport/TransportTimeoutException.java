package com.alterante.filexfer.transport;

import java.io.IOException;

/**
 * A bounded transport operation made no progress within its deadline or retry budget.
 */
public class TransportTimeoutException extends IOException {

    public TransportTimeoutException(String message) {
        super(message);
    }
}
