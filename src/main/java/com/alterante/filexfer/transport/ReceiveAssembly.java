package com.alterante.filexfer.transport;

import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

/**
 * Receiver-side reassembly of one blob from out-of-order, possibly duplicated segments.
 *
 * Thread-safety: owned by the receiving thread.
 */
public class ReceiveAssembly {

    private InetSocketAddress peer;
    private final Map<Integer, byte[]> segments = new HashMap<>();
    private int expectedTotal = -1;
    private int highestSequence = -1;

    /** Bind the assembly to the peer whose blob it collects. */
    public void bind(InetSocketAddress peer) {
        this.peer = peer;
    }

    /** Store a segment; a duplicate replaces the earlier copy. */
    public void store(int seq, byte[] payload) {
        segments.put(seq, payload);
        highestSequence = Math.max(highestSequence, seq);
    }

    /**
     * Record the FIN total.
     *
     * @return true if every segment in [0, total) is present
     */
    public boolean finish(int total) {
        this.expectedTotal = total;
        return isComplete();
    }

    public boolean isComplete() {
        if (expectedTotal < 0) return false;
        for (int s = 0; s < expectedTotal; s++) {
            if (!segments.containsKey(s)) return false;
        }
        return true;
    }

    /** Bitmap of segments present within [0, expectedTotal). */
    public byte[] bitmap() {
        BitSet present = new BitSet(expectedTotal);
        for (int seq : segments.keySet()) {
            if (seq >= 0 && seq < expectedTotal) present.set(seq);
        }
        return AckBitmap.encode(present, expectedTotal);
    }

    /** Concatenate segments [0, expectedTotal) in order. Only valid once complete. */
    public byte[] assemble() {
        if (!isComplete()) {
            throw new IllegalStateException("assembly incomplete: " + segments.size() + "/" + expectedTotal);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int s = 0; s < expectedTotal; s++) {
            out.writeBytes(segments.get(s));
        }
        return out.toByteArray();
    }

    public InetSocketAddress peer() { return peer; }
    public int storedCount() { return segments.size(); }
    public int highestSequence() { return highestSequence; }
}
