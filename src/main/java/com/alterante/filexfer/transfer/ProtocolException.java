package com.alterante.filexfer.transfer;

/**
 * A malformed or out-of-sequence command or reply.
 * The server answers it with {@code ERROR: <message>} and keeps the session open.
 */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }
}
