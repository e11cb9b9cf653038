package com.alterante.filexfer.transfer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Offset and checksum decisions of resume negotiation, shared by the blocking session, the
 * event-loop state machine and the client.
 *
 * A partial copy is trusted only if it is no longer than the other side's copy and its prefix
 * checksum matches; anything else restarts from offset 0.
 */
public final class ResumePolicy {

    private ResumePolicy() {}

    // --- Server side ---

    /**
     * Offer an upload resume point.
     *
     * @param stored bytes already stored under the name
     * @param size   size announced by the client
     * @return the offset to offer
     * @throws ProtocolException if the stored file is already complete (or longer)
     */
    public static long uploadOffset(long stored, long size) throws ProtocolException {
        if (stored > 0 && stored >= size) {
            throw new ProtocolException("file already exists");
        }
        return stored;
    }

    /** Build the OFFSET line answering {@code UPLOAD name size}. */
    public static String offerUpload(FileStore store, Request.Upload upload)
            throws ProtocolException, StorageException {
        long offset = uploadOffset(store.size(upload.name()), upload.size());
        return TransferProtocol.offset(offset, store.checksum(upload.name(), offset));
    }

    /**
     * Whether the client's partial download can be continued.
     *
     * @param size size announced in SIZE
     */
    public static boolean downloadResumable(FileStore store, String name, long size, TransferProtocol.Offset offset)
            throws ProtocolException, StorageException {
        if (offset.offset() > size) {
            return false;
        }
        return store.checksum(name, offset.offset()).equals(offset.checksum());
    }

    // --- Client side ---

    /**
     * Whether the local file agrees with the server's first {@code offered.offset()} bytes.
     */
    public static boolean localPrefixMatches(Path local, TransferProtocol.Offset offered) throws IOException {
        long localSize = Files.isRegularFile(local) ? Files.size(local) : 0;
        if (offered.offset() > localSize) {
            return false;
        }
        return Checksums.prefix(local, offered.offset()).equals(offered.checksum());
    }
}
