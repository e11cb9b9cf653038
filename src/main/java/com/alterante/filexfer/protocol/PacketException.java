package com.alterante.filexfer.protocol;

/**
 * Thrown when a datagram cannot be decoded into a packet.
 */
public class PacketException extends Exception {

    public PacketException(String message) {
        super(message);
    }
}
