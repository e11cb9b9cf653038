package com.alterante.filexfer.transfer;

import java.io.IOException;

/**
 * The server refused a client request with an {@code ERROR:} reply.
 */
public class TransferRefusedException extends IOException {

    private final String reply;

    public TransferRefusedException(String reply) {
        super("Server refused: " + reply);
        this.reply = reply;
    }

    /** The server's reply line, verbatim. */
    public String reply() {
        return reply;
    }
}
