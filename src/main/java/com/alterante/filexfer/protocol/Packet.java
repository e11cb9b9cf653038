package com.alterante.filexfer.protocol;

import java.util.Arrays;

/**
 * Immutable representation of a reliable-datagram packet.
 *
 * Wire format (5-byte header + payload):
 * <pre>
 * Offset  Field      Size
 * 0-3     Sequence   4 bytes (big-endian, unsigned)
 * 4       Type       1 byte ('D', 'F' or 'A')
 * 5+      Payload    segment bytes (DATA), bitmap (ACK), empty (FIN)
 * </pre>
 *
 * For FIN and ACK the sequence field carries the total segment count of the blob.
 */
public final class Packet {

    public static final int HEADER_SIZE = 5;
    /** Largest payload a single IPv4 UDP datagram can carry after our header. */
    public static final int MAX_PAYLOAD = 65_507 - HEADER_SIZE;
    public static final int MAX_DATAGRAM = HEADER_SIZE + MAX_PAYLOAD;

    private final PacketType type;
    private final long sequence;
    private final byte[] payload;

    public Packet(PacketType type, long sequence, byte[] payload) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (sequence < 0 || sequence > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("sequence out of unsigned 32-bit range: " + sequence);
        }
        if (payload != null && payload.length > MAX_PAYLOAD) {
            throw new IllegalArgumentException("payload too large: " + payload.length + " > " + MAX_PAYLOAD);
        }
        this.type = type;
        this.sequence = sequence;
        this.payload = payload != null ? Arrays.copyOf(payload, payload.length) : new byte[0];
    }

    /** Convenience constructor with no payload. */
    public Packet(PacketType type, long sequence) {
        this(type, sequence, null);
    }

    public static Packet data(long sequence, byte[] segment) {
        return new Packet(PacketType.DATA, sequence, segment);
    }

    public static Packet fin(long totalSegments) {
        return new Packet(PacketType.FIN, totalSegments);
    }

    public static Packet ack(long totalSegments, byte[] bitmap) {
        return new Packet(PacketType.ACK, totalSegments, bitmap);
    }

    public PacketType type()        { return type; }
    public long sequence()          { return sequence; }
    public byte[] payload()         { return Arrays.copyOf(payload, payload.length); }
    public int payloadLength()      { return payload.length; }

    @Override
    public String toString() {
        return String.format("Packet[type=%s, seq=%d, payload=%d bytes]", type, sequence, payload.length);
    }
}
