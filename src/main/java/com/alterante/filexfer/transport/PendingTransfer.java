package com.alterante.filexfer.transport;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Sender-side state of one blob: its segments and which of them the peer has not confirmed.
 *
 * Thread-safety: owned by the sending thread.
 */
public class PendingTransfer {

    private final InetSocketAddress peer;
    private final List<byte[]> segments;
    private final BitSet unacked;
    private long retransmitDeadlineMs;

    private PendingTransfer(InetSocketAddress peer, List<byte[]> segments) {
        this.peer = peer;
        this.segments = segments;
        this.unacked = new BitSet(segments.size());
        this.unacked.set(0, segments.size());
    }

    /**
     * Split {@code data} into segments of at most {@code segmentSize} bytes.
     * An empty blob still yields one (empty) segment.
     */
    public static PendingTransfer split(InetSocketAddress peer, byte[] data, int segmentSize) {
        List<byte[]> segments = new ArrayList<>();
        for (int off = 0; off < data.length; off += segmentSize) {
            int len = Math.min(segmentSize, data.length - off);
            byte[] seg = new byte[len];
            System.arraycopy(data, off, seg, 0, len);
            segments.add(seg);
        }
        if (segments.isEmpty()) {
            segments.add(new byte[0]);
        }
        return new PendingTransfer(peer, Collections.unmodifiableList(segments));
    }

    /**
     * Apply a bitmap ACK.
     *
     * @return number of segments newly acknowledged by this bitmap
     */
    public int acknowledge(byte[] bitmap) {
        int newlyAcked = 0;
        for (int s = unacked.nextSetBit(0); s >= 0; s = unacked.nextSetBit(s + 1)) {
            if (AckBitmap.isSet(bitmap, s)) {
                unacked.clear(s);
                newlyAcked++;
            }
        }
        return newlyAcked;
    }

    /** Sequence numbers still awaiting acknowledgment, ascending. */
    public int[] unackedSequences() {
        return unacked.stream().toArray();
    }

    public byte[] segment(int seq) {
        return segments.get(seq);
    }

    public boolean isComplete() {
        return unacked.isEmpty();
    }

    public int totalSegments() { return segments.size(); }
    public int unackedCount() { return unacked.cardinality(); }
    public InetSocketAddress peer() { return peer; }

    public long retransmitDeadlineMs() { return retransmitDeadlineMs; }
    public void retransmitDeadlineMs(long deadlineMs) { this.retransmitDeadlineMs = deadlineMs; }
}
