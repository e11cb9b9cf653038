package com.alterante.filexfer.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Encodes and decodes {@link Packet} instances to/from datagram bytes.
 *
 * Wire format (5-byte header):
 * <pre>
 * [0-3]   Sequence (big-endian, unsigned 32-bit)
 * [4]     Type tag: 'D' data, 'F' fin, 'A' ack
 * [5+]    Payload
 * </pre>
 *
 * There is no checksum at this layer; the session protocol detects divergent content.
 */
public final class PacketCodec {

    private static final int HEADER_SIZE = Packet.HEADER_SIZE;

    private PacketCodec() {}

    /**
     * Encode a Packet into a byte array ready for sending as a UDP datagram.
     */
    public static byte[] encode(Packet packet) {
        int payloadLen = packet.payloadLength();
        byte[] out = new byte[HEADER_SIZE + payloadLen];
        ByteBuffer buf = ByteBuffer.wrap(out).order(ByteOrder.BIG_ENDIAN);

        buf.putInt((int) packet.sequence());
        buf.put(packet.type().code());
        if (payloadLen > 0) {
            buf.put(packet.payload());
        }
        return out;
    }

    /**
     * Decode datagram bytes into a Packet.
     *
     * @param data the raw datagram bytes
     * @param length number of bytes in the datagram
     * @return the decoded Packet
     * @throws PacketException if the data is too short or carries an unknown type tag
     */
    public static Packet decode(byte[] data, int length) throws PacketException {
        if (length < HEADER_SIZE) {
            throw new PacketException("datagram too short: " + length + " < " + HEADER_SIZE);
        }

        ByteBuffer buf = ByteBuffer.wrap(data, 0, length).order(ByteOrder.BIG_ENDIAN);
        long sequence = Integer.toUnsignedLong(buf.getInt());

        byte typeCode = buf.get();
        PacketType type = PacketType.fromCode(typeCode);
        if (type == null) {
            throw new PacketException(String.format("unknown type: 0x%02X", typeCode));
        }

        byte[] payload = new byte[length - HEADER_SIZE];
        buf.get(payload);
        return new Packet(type, sequence, payload);
    }
}
