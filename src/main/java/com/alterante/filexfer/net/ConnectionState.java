package com.alterante.filexfer.net;

import com.alterante.filexfer.transfer.FileStore;
import com.alterante.filexfer.transfer.ProtocolException;
import com.alterante.filexfer.transfer.Request;
import com.alterante.filexfer.transfer.ResumePolicy;
import com.alterante.filexfer.transfer.SimpleCommands;
import com.alterante.filexfer.transfer.StorageException;
import com.alterante.filexfer.transfer.TransferProtocol;
import com.alterante.filexfer.transfer.UploadLocks;
import com.alterante.filexfer.transport.FramingException;
import com.alterante.filexfer.transport.LineFramer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-connection session state for {@link EventLoopServer}.
 *
 * Channel-agnostic: the loop feeds received bytes to {@link #consume(ByteBuffer)} and writes
 * whatever {@link #pendingOutput()} hands back. Owned and mutated only by the loop thread.
 *
 * <pre>
 * IDLE --UPLOAD--> AWAITING_UPLOAD_REPLY --OK/RESTART--> RECEIVING_UPLOAD --remaining==0--> IDLE
 *                                        --ABORT-------------------------------------------> IDLE
 * IDLE --DOWNLOAD--> AWAITING_DOWNLOAD_OFFSET --OK--> SENDING_DOWNLOAD --last chunk queued--> IDLE
 *                                             --ABORT-----------------------------------> IDLE
 * IDLE --CLOSE--> CLOSING (connection closes once BYE is written)
 * </pre>
 *
 * Input is paused while a download or BYE is being written and while more than
 * {@link #OUTPUT_HIGH_WATER} bytes of replies are queued; see {@link #wantsRead()}. Held-back
 * commands run from {@link #pendingOutput()} once the queue drains.
 */
public class ConnectionState {

    private static final Logger log = LoggerFactory.getLogger(ConnectionState.class);

    /** Queued reply bytes above which no further commands are parsed or read. */
    static final int OUTPUT_HIGH_WATER = TransferProtocol.CHUNK_SIZE;
    /** Most unparsed input held while input is paused. */
    static final int PAUSED_INPUT_LIMIT = TransferProtocol.CHUNK_SIZE + LineFramer.MAX_LINE_LENGTH;

    public enum Phase {
        IDLE,
        AWAITING_UPLOAD_REPLY,
        RECEIVING_UPLOAD,
        AWAITING_DOWNLOAD_OFFSET,
        SENDING_DOWNLOAD,
        CLOSING
    }

    private final FileStore store;
    private final String peer;
    private final LineFramer inbound = new LineFramer();
    private final Deque<ByteBuffer> outbound = new ArrayDeque<>();

    private Phase phase = Phase.IDLE;

    // Active transfer
    private String filename;
    private long size;
    private long offset;
    private long remaining;
    private FileChannel file;
    private UploadLocks.Lease lease;

    public ConnectionState(FileStore store, String peer) {
        this.store = store;
        this.peer = peer;
    }

    // --- Input ---

    /**
     * Take bytes read from the connection and advance the state machine as far as they allow.
     *
     * @throws IOException if the connection cannot continue
     */
    public void consume(ByteBuffer data) throws IOException {
        inbound.append(data);
        process();
        if (!wantsRead() && inbound.buffered() > PAUSED_INPUT_LIMIT) {
            throw new FramingException(inbound.buffered() + " bytes pending from a client that is not reading replies");
        }
    }

    private void process() throws IOException {
        while (true) {
            if (phase == Phase.RECEIVING_UPLOAD) {
                if (inbound.buffered() == 0) return;
                byte[] chunk = inbound.drain((int) Math.min(Integer.MAX_VALUE, remaining));
                appendUpload(chunk);
                continue;
            }
            if (phase == Phase.SENDING_DOWNLOAD || phase == Phase.CLOSING) {
                // Anything the client sends now is handled once the download is queued.
                return;
            }
            if (queuedOutput() >= OUTPUT_HIGH_WATER) return;
            String line = inbound.pollLine();
            if (line == null) return;
            handleLine(line);
        }
    }

    private void handleLine(String line) throws IOException {
        try {
            switch (phase) {
                case IDLE -> handleCommand(Request.parse(line));
                case AWAITING_UPLOAD_REPLY -> handleUploadReply(line.strip());
                case AWAITING_DOWNLOAD_OFFSET -> handleDownloadOffset(line.strip());
                default -> throw new IllegalStateException("no line expected in " + phase);
            }
        } catch (ProtocolException e) {
            resetTransfer();
            reply(TransferProtocol.error(e.getMessage()));
        } catch (StorageException e) {
            log.warn("Storage failure for {}: {}", peer, e.getMessage(), e);
            resetTransfer();
            reply(TransferProtocol.error(e.getMessage()));
        }
    }

    private void handleCommand(Request request) throws ProtocolException, StorageException {
        switch (request.type()) {
            case UPLOAD -> startUpload(request.upload());
            case DOWNLOAD -> startDownload(request.downloadName());
            case CLOSE -> {
                reply(SimpleCommands.reply(request, store));
                phase = Phase.CLOSING;
            }
            default -> reply(SimpleCommands.reply(request, store));
        }
    }

    // --- UPLOAD ---

    private void startUpload(Request.Upload upload) throws ProtocolException, StorageException {
        String name = FileStore.sanitize(upload.name());
        lease = store.uploadLocks().tryAcquire(name);
        if (lease == null) {
            throw new ProtocolException("upload already in progress");
        }
        filename = name;
        size = upload.size();
        String offer = ResumePolicy.offerUpload(store, new Request.Upload(name, size));
        offset = TransferProtocol.parseOffset(offer).offset();
        reply(offer);
        phase = Phase.AWAITING_UPLOAD_REPLY;
    }

    private void handleUploadReply(String reply) throws ProtocolException, StorageException {
        if (reply.equalsIgnoreCase(TransferProtocol.ABORT)) {
            log.info("Client {} aborted upload of {}", peer, filename);
            resetTransfer();
            return;
        }
        if (reply.equalsIgnoreCase(TransferProtocol.RESTART)) {
            store.truncate(filename);
            offset = 0;
            reply(TransferProtocol.READY);
            log.info("Checksum mismatch on {}, restarting upload from 0", filename);
        } else if (!reply.equalsIgnoreCase(TransferProtocol.OK)) {
            throw new ProtocolException("expected OK, RESTART or ABORT, got: " + reply);
        }

        remaining = size - offset;
        file = store.openAppend(filename);
        if (remaining == 0) {
            finishUpload();
            return;
        }
        phase = Phase.RECEIVING_UPLOAD;
    }

    private void appendUpload(byte[] chunk) throws IOException {
        try {
            FileStore.writeDurably(file, chunk, 0, chunk.length);
        } catch (StorageException e) {
            throw new IOException("upload of " + filename + " aborted: " + e.getMessage(), e);
        }
        remaining -= chunk.length;
        if (remaining == 0) {
            finishUpload();
        }
    }

    private void finishUpload() {
        log.info("Upload complete: {} ({} bytes, resumed at {})", filename, size, offset);
        resetTransfer();
        reply(TransferProtocol.UPLOAD_COMPLETE);
    }

    // --- DOWNLOAD ---

    private void startDownload(String requested) throws ProtocolException, StorageException {
        String name = FileStore.sanitize(requested);
        if (!store.exists(name)) {
            throw new ProtocolException("not found");
        }
        filename = name;
        size = store.size(name);
        reply(TransferProtocol.size(size));
        phase = Phase.AWAITING_DOWNLOAD_OFFSET;
    }

    private void handleDownloadOffset(String reply) throws ProtocolException, StorageException {
        if (reply.equalsIgnoreCase(TransferProtocol.ABORT)) {
            log.info("Client {} already holds {}, download aborted", peer, filename);
            resetTransfer();
            return;
        }
        TransferProtocol.Offset requested = TransferProtocol.parseOffset(reply);
        if (!ResumePolicy.downloadResumable(store, filename, size, requested)) {
            log.info("Client copy of {} diverges at offset {}, requesting restart", filename, requested.offset());
            reply(TransferProtocol.RESTART);
            return;
        }
        offset = requested.offset();
        remaining = size - offset;
        reply(TransferProtocol.OK);
        if (remaining == 0) {
            log.info("Download sent: {} ({} bytes, resumed at {})", filename, size, offset);
            resetTransfer();
            return;
        }
        file = store.openRead(filename, offset);
        phase = Phase.SENDING_DOWNLOAD;
    }

    /** Queue the next file chunk; finishes the download after the last one. */
    private void queueDownloadChunk() throws IOException {
        ByteBuffer chunk = ByteBuffer.allocate((int) Math.min(TransferProtocol.CHUNK_SIZE, remaining));
        while (chunk.hasRemaining()) {
            if (file.read(chunk) < 0) {
                throw new IOException(filename + " shrank during download");
            }
        }
        chunk.flip();
        outbound.add(chunk);
        remaining -= chunk.remaining();
        if (remaining == 0) {
            log.info("Download sent: {} ({} bytes, resumed at {})", filename, size, offset);
            resetTransfer();
            process();
        }
    }

    // --- Output ---

    /**
     * The buffer to write next, or null if there is nothing to send. A partially written buffer
     * is returned again until drained.
     */
    public ByteBuffer pendingOutput() throws IOException {
        ByteBuffer head = outbound.peekFirst();
        while (head != null && !head.hasRemaining()) {
            outbound.pollFirst();
            head = outbound.peekFirst();
        }
        if (head == null && phase == Phase.SENDING_DOWNLOAD) {
            queueDownloadChunk();
            head = outbound.peekFirst();
        } else if (head == null && inbound.buffered() > 0) {
            // Commands held back while replies were backed up
            process();
            head = outbound.peekFirst();
        }
        return head;
    }

    /**
     * Whether the loop should read more input from the client now: not while a download or BYE
     * is being written, and not while replies or held-back commands are piling up.
     */
    public boolean wantsRead() {
        return phase != Phase.SENDING_DOWNLOAD && phase != Phase.CLOSING
                && queuedOutput() < OUTPUT_HIGH_WATER
                && inbound.buffered() <= LineFramer.MAX_LINE_LENGTH;
    }

    public boolean wantsWrite() {
        return phase == Phase.SENDING_DOWNLOAD || outbound.stream().anyMatch(ByteBuffer::hasRemaining);
    }

    /** Whether the connection should be closed now: CLOSE handled and BYE fully written. */
    public boolean isFinished() {
        return phase == Phase.CLOSING && !wantsWrite();
    }

    /** Release the open file and upload lock; called when the connection goes away. */
    public void release() {
        if (phase == Phase.RECEIVING_UPLOAD) {
            log.info("Upload of {} from {} interrupted with {} bytes outstanding", filename, peer, remaining);
        }
        resetTransfer();
    }

    public Phase phase() { return phase; }
    public String peer() { return peer; }
    public long remaining() { return remaining; }

    // --- Internals ---

    private long queuedOutput() {
        long total = 0;
        for (ByteBuffer b : outbound) {
            total += b.remaining();
        }
        return total;
    }

    private void reply(String line) {
        outbound.add(ByteBuffer.wrap((line + "\n").getBytes(StandardCharsets.UTF_8)));
    }

    private void resetTransfer() {
        if (file != null) {
            try {
                file.close();
            } catch (IOException e) {
                log.warn("Closing {} failed: {}", filename, e.getMessage());
            }
            file = null;
        }
        if (lease != null) {
            lease.close();
            lease = null;
        }
        filename = null;
        size = 0;
        offset = 0;
        remaining = 0;
        phase = Phase.IDLE;
    }
}
