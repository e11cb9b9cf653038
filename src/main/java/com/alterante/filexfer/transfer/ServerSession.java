package com.alterante.filexfer.transfer;

import com.alterante.filexfer.transport.ConnectionClosedException;
import com.alterante.filexfer.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Server half of the session protocol over a blocking {@link Transport}.
 *
 * Flow per command: read line → parse → reply (ECHO/TIME/LIST/CLOSE) or run the UPLOAD /
 * DOWNLOAD negotiation and raw-byte phase. A malformed command or a refused transfer is answered
 * with {@code ERROR: reason} and the session continues; a transport failure, or any failure once
 * raw bytes are flowing, ends it. Partial uploads stay on disk for a later resume.
 */
public class ServerSession implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ServerSession.class);

    private final Transport transport;
    private final FileStore store;

    public ServerSession(Transport transport, FileStore store) {
        this.transport = transport;
        this.store = store;
    }

    /**
     * Serve commands until CLOSE or disconnect. Never throws; failures are logged.
     */
    @Override
    public void run() {
        String peer = transport.peerDescription();
        log.info("Session started: {}", peer);
        try {
            boolean open = true;
            while (open) {
                open = serveOne(transport.receiveLine());
            }
        } catch (ConnectionClosedException e) {
            log.info("Client {} disconnected", peer);
        } catch (IOException e) {
            log.warn("Session with {} failed: {}", peer, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Session with {} crashed", peer, e);
        } finally {
            transport.close();
            log.info("Session ended: {}", peer);
        }
    }

    /**
     * Handle one command line, including its whole negotiation and transfer.
     *
     * @return false once the client asked to close the session
     * @throws IOException if the transport fails or the session cannot continue
     */
    public boolean serveOne(String line) throws IOException {
        try {
            Request request = Request.parse(line);
            log.debug("{} <- {}", transport.peerDescription(), request.type());
            switch (request.type()) {
                case UPLOAD:
                    handleUpload(request.upload());
                    return true;
                case DOWNLOAD:
                    handleDownload(request.downloadName());
                    return true;
                case CLOSE:
                    transport.sendMessage(SimpleCommands.reply(request, store));
                    return false;
                default:
                    transport.sendMessage(SimpleCommands.reply(request, store));
                    return true;
            }
        } catch (ProtocolException e) {
            transport.sendMessage(TransferProtocol.error(e.getMessage()));
            return true;
        } catch (StorageException e) {
            log.warn("Storage failure for {}: {}", transport.peerDescription(), e.getMessage(), e);
            transport.sendMessage(TransferProtocol.error(e.getMessage()));
            return true;
        }
    }

    // --- UPLOAD ---

    private void handleUpload(Request.Upload upload) throws IOException, ProtocolException {
        String name = FileStore.sanitize(upload.name());
        try (UploadLocks.Lease lease = store.uploadLocks().tryAcquire(name)) {
            if (lease == null) {
                throw new ProtocolException("upload already in progress");
            }
            String offer = ResumePolicy.offerUpload(store, new Request.Upload(name, upload.size()));
            long offset = TransferProtocol.parseOffset(offer).offset();
            transport.sendMessage(offer);

            String reply = transport.receiveLine().strip();
            if (reply.equalsIgnoreCase(TransferProtocol.ABORT)) {
                log.info("Client aborted upload of {}", name);
                return;
            } else if (reply.equalsIgnoreCase(TransferProtocol.RESTART)) {
                store.truncate(name);
                offset = 0;
                transport.sendMessage(TransferProtocol.READY);
                log.info("Checksum mismatch on {}, restarting upload from 0", name);
            } else if (!reply.equalsIgnoreCase(TransferProtocol.OK)) {
                throw new ProtocolException("expected OK, RESTART or ABORT, got: " + reply);
            }

            receiveUpload(name, offset, upload.size());
            log.info("Upload complete: {} ({} bytes, resumed at {})", name, upload.size(), offset);
        }
        // Lock released before the reply goes out.
        transport.sendMessage(TransferProtocol.UPLOAD_COMPLETE);
    }

    private void receiveUpload(String name, long offset, long size) throws IOException, ProtocolException {
        long remaining = size - offset;
        // Opened even for zero remaining bytes so an empty upload still creates the file.
        try (FileChannel out = store.openAppend(name)) {
            while (remaining > 0) {
                byte[] chunk = transport.receiveAvailable((int) Math.min(TransferProtocol.CHUNK_SIZE, remaining));
                int usable = (int) Math.min(chunk.length, remaining);
                if (usable < chunk.length) {
                    log.warn("Discarding {} bytes past the announced size of {}", chunk.length - usable, name);
                }
                FileStore.writeDurably(out, chunk, 0, usable);
                remaining -= usable;
            }
        } catch (StorageException e) {
            // The client keeps streaming; the byte stream can no longer be resynchronized.
            throw new IOException("upload of " + name + " aborted: " + e.getMessage(), e);
        }
    }

    // --- DOWNLOAD ---

    private void handleDownload(String requested) throws IOException, ProtocolException {
        String name = FileStore.sanitize(requested);
        if (!store.exists(name)) {
            throw new ProtocolException("not found");
        }
        long size = store.size(name);
        transport.sendMessage(TransferProtocol.size(size));

        long offset;
        while (true) {
            String reply = transport.receiveLine().strip();
            if (reply.equalsIgnoreCase(TransferProtocol.ABORT)) {
                log.info("Client already holds {}, download aborted", name);
                return;
            }
            TransferProtocol.Offset requestedOffset = TransferProtocol.parseOffset(reply);
            if (ResumePolicy.downloadResumable(store, name, size, requestedOffset)) {
                offset = requestedOffset.offset();
                transport.sendMessage(TransferProtocol.OK);
                break;
            }
            log.info("Client copy of {} diverges at offset {}, requesting restart", name, requestedOffset.offset());
            transport.sendMessage(TransferProtocol.RESTART);
        }

        sendDownload(name, offset, size);
        log.info("Download sent: {} ({} bytes, resumed at {})", name, size, offset);
    }

    private void sendDownload(String name, long offset, long size) throws IOException, ProtocolException {
        long remaining = size - offset;
        if (remaining == 0) {
            return;
        }
        try (FileChannel in = store.openRead(name, offset)) {
            ByteBuffer buf = ByteBuffer.allocate(TransferProtocol.CHUNK_SIZE);
            while (remaining > 0) {
                buf.clear();
                buf.limit((int) Math.min(buf.capacity(), remaining));
                while (buf.hasRemaining()) {
                    if (in.read(buf) < 0) {
                        throw new IOException(name + " shrank during download");
                    }
                }
                transport.sendRawData(buf.array(), 0, buf.position());
                remaining -= buf.position();
            }
        } catch (StorageException e) {
            throw new IOException("download of " + name + " aborted: " + e.getMessage(), e);
        }
    }
}
