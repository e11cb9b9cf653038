package com.alterante.filexfer.transport;

import java.io.IOException;

/**
 * The inbound byte stream cannot be split into control lines (e.g. a line exceeds the limit).
 * The stream is desynchronized and the connection has to be dropped.
 */
public class FramingException extends IOException {

    public FramingException(String message) {
        super(message);
    }
}
