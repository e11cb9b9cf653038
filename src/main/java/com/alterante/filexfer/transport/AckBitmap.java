package com.alterante.filexfer.transport;

import java.util.BitSet;

/**
 * Bitmap of received segments carried as ACK payload.
 *
 * <pre>
 * Byte s/8, bit (s % 8), least significant bit first: set when segment s is present.
 * Length: ceil(total / 8) bytes.
 * </pre>
 */
public final class AckBitmap {

    private AckBitmap() {}

    public static int byteLength(int totalSegments) {
        return (totalSegments + 7) / 8;
    }

    /** Encode the first {@code totalSegments} bits of {@code present}. */
    public static byte[] encode(BitSet present, int totalSegments) {
        byte[] out = new byte[byteLength(totalSegments)];
        for (int s = present.nextSetBit(0); s >= 0 && s < totalSegments; s = present.nextSetBit(s + 1)) {
            out[s / 8] |= (byte) (1 << (s % 8));
        }
        return out;
    }

    /** Bitmap with every one of {@code totalSegments} segments marked present. */
    public static byte[] full(int totalSegments) {
        BitSet all = new BitSet(totalSegments);
        all.set(0, totalSegments);
        return encode(all, totalSegments);
    }

    /** Whether the bitmap marks segment {@code seq}; bits beyond the payload read as absent. */
    public static boolean isSet(byte[] bitmap, int seq) {
        int byteIdx = seq / 8;
        return byteIdx < bitmap.length && (bitmap[byteIdx] & (1 << (seq % 8))) != 0;
    }
}
