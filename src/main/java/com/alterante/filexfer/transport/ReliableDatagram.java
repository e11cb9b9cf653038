package com.alterante.filexfer.transport;

import com.alterante.filexfer.protocol.Packet;
import com.alterante.filexfer.protocol.PacketCodec;
import com.alterante.filexfer.protocol.PacketException;
import com.alterante.filexfer.protocol.PacketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Reliable, ordered, exactly-once delivery of whole byte blobs over a {@link DatagramLink}.
 *
 * Blast-and-repair with bitmap ACKs:
 * <pre>
 * sender                                   receiver
 *   DATA 0..N-1 (every unacked segment) -->  store by sequence (duplicates overwrite)
 *   FIN N  (x finCopies)                -->  all of [0, N) present?
 *                                       <--    no:  ACK N + bitmap of present segments
 *   resend exactly the missing ones          yes: ACK N + full bitmap (x finalAckCopies), deliver
 * </pre>
 *
 * A sender round that acknowledges nothing new consumes one retry; an exhausted budget fails the
 * send with {@link TransportTimeoutException}. A receive fails the same way after
 * {@link ArqConfig#receiveTimeoutMillis()} without relevant datagrams.
 *
 * There is no transfer id on the wire, so one engine must not run a send and a receive at the
 * same time, and blobs to a given peer must alternate with that peer's blobs or follow each
 * other only after the previous one completed. Consecutive blobs with the same segment count
 * look alike on the wire: if every final ACK of one is lost, the sender repeats it and the
 * receiver's next {@link #receive} delivers the repeat as a new blob. Full-size upload chunks hit
 * this case, so such a loss duplicates a chunk.
 *
 * Thread-safety: one caller at a time.
 */
public class ReliableDatagram {

    private static final Logger log = LoggerFactory.getLogger(ReliableDatagram.class);

    /** Most segments one blob may have: the ACK bitmap must fit in a single datagram. */
    public static final int MAX_SEGMENTS = Packet.MAX_PAYLOAD * 8;

    /** Result of a receive: the reassembled blob and where it came from. */
    public record Delivery(byte[] data, InetSocketAddress peer) {}

    private final DatagramLink link;
    private final ArqConfig config;

    // Last blob this engine finished receiving, to answer straggling FINs while sending.
    private InetSocketAddress lastCompletedPeer;
    private int lastCompletedTotal = -1;

    private long totalRetransmissions;

    public ReliableDatagram(DatagramLink link, ArqConfig config) {
        this.link = link;
        this.config = config;
    }

    /**
     * Deliver {@code data} to {@code peer}. Blocks until every segment is acknowledged.
     *
     * @throws TransportTimeoutException if the retry budget runs out
     */
    public void send(InetSocketAddress peer, byte[] data) throws IOException {
        PendingTransfer pending = PendingTransfer.split(peer, data, config.segmentSize());
        int total = pending.totalSegments();
        if (total > MAX_SEGMENTS) {
            throw new IllegalArgumentException("blob too large: " + total + " segments > " + MAX_SEGMENTS);
        }
        int retriesLeft = config.maxRetries();
        boolean firstRound = true;

        log.debug("Sending {} bytes to {} in {} segments", data.length, peer, total);
        drainStale();

        while (!pending.isComplete()) {
            blast(pending, firstRound);
            firstRound = false;

            int newlyAcked = awaitAcks(pending);
            if (newlyAcked > 0) {
                retriesLeft = config.maxRetries();
            } else if (--retriesLeft <= 0) {
                throw new TransportTimeoutException(String.format(
                        "no acknowledgment from %s after %d rounds (%d/%d segments unacked)",
                        peer, config.maxRetries(), pending.unackedCount(), total));
            }
        }
        log.debug("Blob of {} segments acknowledged by {}", total, peer);
    }

    /** Receive the next blob from any peer. */
    public Delivery receive() throws IOException {
        return receive(null);
    }

    /**
     * Receive the next blob.
     *
     * @param expectedPeer if non-null, datagrams from any other address are discarded;
     *                     otherwise the first DATA/FIN sender binds the assembly
     * @throws TransportTimeoutException after the idle period with no relevant datagrams
     */
    public Delivery receive(InetSocketAddress expectedPeer) throws IOException {
        ReceiveAssembly assembly = new ReceiveAssembly();
        assembly.bind(expectedPeer);
        InetSocketAddress replyTo = expectedPeer;
        long lastActivityMs = System.currentTimeMillis();

        while (true) {
            long idleLeft = config.receiveTimeoutMillis() - (System.currentTimeMillis() - lastActivityMs);
            if (idleLeft <= 0) {
                throw new TransportTimeoutException("no datagrams for " + config.receiveTimeoutMillis() + "ms"
                        + (assembly.peer() != null ? " from " + assembly.peer() : ""));
            }
            DatagramLink.Received dgram = link.receive((int) idleLeft);
            if (dgram == null) {
                continue;
            }
            if (assembly.peer() != null && !assembly.peer().equals(dgram.source())) {
                log.debug("Discarding datagram from {} while receiving from {}", dgram.source(), assembly.peer());
                continue;
            }

            Packet pkt;
            try {
                pkt = PacketCodec.decode(dgram.data(), dgram.length());
            } catch (PacketException e) {
                log.debug("Ignoring malformed datagram from {}: {}", dgram.source(), e.getMessage());
                continue;
            }
            if (pkt.type() == PacketType.ACK) {
                // Leftover from our own previous send.
                continue;
            }
            if (pkt.sequence() > MAX_SEGMENTS || (pkt.type() == PacketType.FIN && pkt.sequence() == 0)) {
                log.debug("Ignoring {} with out-of-range sequence from {}", pkt.type(), dgram.source());
                continue;
            }

            if (assembly.peer() == null) {
                assembly.bind(dgram.source());
            }
            replyTo = dgram.source();
            lastActivityMs = System.currentTimeMillis();

            if (pkt.type() == PacketType.DATA) {
                assembly.store((int) pkt.sequence(), pkt.payload());
                continue;
            }

            // FIN
            int total = (int) pkt.sequence();
            if (assembly.highestSequence() >= total) {
                log.debug("Ignoring FIN {} from {}: segment {} already stored", total, replyTo,
                        assembly.highestSequence());
                continue;
            }
            if (assembly.finish(total)) {
                byte[] ack = PacketCodec.encode(Packet.ack(total, AckBitmap.full(total)));
                for (int i = 0; i < config.finalAckCopies(); i++) {
                    transmit(ack, replyTo);
                }
                lastCompletedPeer = replyTo;
                lastCompletedTotal = total;
                byte[] data = assembly.assemble();
                log.debug("Received {} bytes ({} segments) from {}", data.length, total, replyTo);
                return new Delivery(data, replyTo);
            }
            if (assembly.storedCount() > 0) {
                transmit(PacketCodec.encode(Packet.ack(total, assembly.bitmap())), replyTo);
            }
        }
    }

    // --- Sender internals ---

    /**
     * Discard whatever is already queued before a new blob goes out: nothing queued yet can
     * acknowledge it, and leftover final ACKs of an earlier blob with the same segment count
     * would. Straggling FINs still get their full ACK.
     */
    private void drainStale() throws IOException {
        DatagramLink.Received dgram;
        while ((dgram = link.receive(1)) != null) {
            Packet pkt;
            try {
                pkt = PacketCodec.decode(dgram.data(), dgram.length());
            } catch (PacketException e) {
                continue;
            }
            if (pkt.type() == PacketType.FIN && isStragglerFin(pkt, dgram.source())) {
                transmit(PacketCodec.encode(Packet.ack(lastCompletedTotal, AckBitmap.full(lastCompletedTotal))),
                        dgram.source());
            }
        }
    }

    private void blast(PendingTransfer pending, boolean firstRound) throws IOException {
        for (int seq : pending.unackedSequences()) {
            transmit(PacketCodec.encode(Packet.data(seq, pending.segment(seq))), pending.peer());
            if (!firstRound) {
                totalRetransmissions++;
            }
        }
        byte[] fin = PacketCodec.encode(Packet.fin(pending.totalSegments()));
        for (int i = 0; i < config.finCopies(); i++) {
            transmit(fin, pending.peer());
        }
    }

    /**
     * Wait up to one ACK period for the receiver's bitmap; once one arrives, drain whatever else
     * is already queued so stale copies do not trigger extra rounds.
     *
     * @return number of segments newly acknowledged
     */
    private int awaitAcks(PendingTransfer pending) throws IOException {
        pending.retransmitDeadlineMs(System.currentTimeMillis() + config.ackWaitMillis());
        int newlyAcked = 0;
        boolean gotAck = false;

        while (!pending.isComplete()) {
            long wait = gotAck ? 1 : pending.retransmitDeadlineMs() - System.currentTimeMillis();
            if (wait <= 0) break;
            DatagramLink.Received dgram = link.receive((int) wait);
            if (dgram == null) {
                if (gotAck) break;
                continue;
            }
            if (!pending.peer().equals(dgram.source())) {
                continue;
            }
            Packet pkt;
            try {
                pkt = PacketCodec.decode(dgram.data(), dgram.length());
            } catch (PacketException e) {
                log.debug("Ignoring malformed datagram from {}: {}", dgram.source(), e.getMessage());
                continue;
            }

            if (pkt.type() == PacketType.ACK && pkt.sequence() == pending.totalSegments()) {
                gotAck = true;
                newlyAcked += pending.acknowledge(pkt.payload());
            } else if (pkt.type() == PacketType.FIN && isStragglerFin(pkt, dgram.source())) {
                // The peer never saw our final ACKs for the blob it sent us last.
                transmit(PacketCodec.encode(Packet.ack(lastCompletedTotal, AckBitmap.full(lastCompletedTotal))),
                        dgram.source());
            }
        }
        return newlyAcked;
    }

    private boolean isStragglerFin(Packet fin, InetSocketAddress source) {
        return lastCompletedTotal >= 0
                && fin.sequence() == lastCompletedTotal
                && source.equals(lastCompletedPeer);
    }

    private void transmit(byte[] datagram, InetSocketAddress target) throws IOException {
        link.send(datagram, datagram.length, target);
    }

    // --- Stats ---

    public long totalRetransmissions() { return totalRetransmissions; }
    public DatagramLink link() { return link; }
}
