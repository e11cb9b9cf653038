package com.alterante.filexfer.protocol;

/**
 * Datagram packet types of the reliable datagram protocol.
 * Single ASCII tag byte in the packet header.
 */
public enum PacketType {

    DATA ((byte) 'D'),
    FIN  ((byte) 'F'),
    ACK  ((byte) 'A');

    private final byte code;

    PacketType(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    private static final PacketType[] LOOKUP = new PacketType[256];

    static {
        for (PacketType t : values()) {
            LOOKUP[Byte.toUnsignedInt(t.code)] = t;
        }
    }

    /**
     * Look up a PacketType by its wire code.
     * @return the PacketType, or null if unknown
     */
    public static PacketType fromCode(byte code) {
        return LOOKUP[Byte.toUnsignedInt(code)];
    }
}
